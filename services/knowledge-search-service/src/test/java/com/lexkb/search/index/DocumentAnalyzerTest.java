package com.lexkb.search.index;

import static com.lexkb.search.SearchFixture.doc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lexkb.search.SearchFixture;
import com.lexkb.search.analysis.IndexField;
import com.lexkb.search.document.MetadataValue;
import com.lexkb.search.document.SearchDocument;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentAnalyzerTest {

    private DocumentAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = SearchFixture.create().documentAnalyzer;
    }

    @Test
    void eachFieldKeepsItsOwnPositions() {
        AnalyzedDocument analyzed = analyzer.analyze(doc("a", "Contract", "contract clause").build(), IndexOptions.defaults());

        Posting posting = analyzed.postings().get("contract");
        assertThat(posting.frequencyIn(IndexField.TITLE)).isEqualTo(1);
        assertThat(posting.frequencyIn(IndexField.CONTENT)).isEqualTo(1);
        assertThat(posting.getPositions()).containsExactly(IndexField.TITLE.positionBase(), IndexField.CONTENT.positionBase());
        assertThat(analyzed.entry().fieldLength(IndexField.CONTENT)).isEqualTo(2);
    }

    @Test
    void valuesOfMultiValuedFieldsAreNotAdjacent() {
        SearchDocument document = doc("a", "Guide", "").tags(List.of("labor law", "contract")).build();

        AnalyzedDocument analyzed = analyzer.analyze(document, IndexOptions.defaults());

        int law = analyzed.postings().get("law").getPositions()[0];
        int contract = analyzed.postings().get("contract").getPositions()[0];
        assertThat(IndexField.ofPosition(law)).isEqualTo(IndexField.TAGS);
        assertThat(contract - law).isGreaterThan(1);
    }

    @Test
    void stackedCompoundsDoNotCountTowardsLength() {
        AnalyzedDocument analyzed = analyzer.analyze(doc("a", "劳动合同纠纷", "").build(), IndexOptions.defaults());

        assertThat(analyzed.entry().getDocLength()).isEqualTo(3);
        assertThat(analyzed.postings()).containsKeys("劳动", "合同", "劳动合同", "纠纷");
        assertThat(analyzed.entry().getDocument().getLanguage()).isEqualTo("zh");
    }

    @Test
    void summaryIsGeneratedAndIndexedWhenRequested() {
        SearchDocument document = doc("a", "Notice", "Termination requires notice. Severance follows. Details vary.").build();

        AnalyzedDocument analyzed = analyzer.analyze(document, new IndexOptions(true, false));

        assertThat(analyzed.entry().getDocument().getSummary())
            .isEqualTo("Termination requires notice. Severance follows. Details vary.");
        assertThat(analyzed.postings().get("detail").occursIn(IndexField.SUMMARY)).isTrue();
    }

    @Test
    void existingSummaryIsKept() {
        SearchDocument document = doc("a", "Notice", "Long body text.").summary("Given summary").build();

        AnalyzedDocument analyzed = analyzer.analyze(document, new IndexOptions(true, false));

        assertThat(analyzed.entry().getDocument().getSummary()).isEqualTo("Given summary");
    }

    @Test
    void legalEntitiesAreRecordedInMetadata() {
        SearchDocument document = doc("a", "劳动争议", "依据第十二条，赔偿10万元。").build();

        AnalyzedDocument analyzed = analyzer.analyze(document, new IndexOptions(false, true));

        MetadataValue value = analyzed.entry().getDocument().getMetadata().get(DocumentAnalyzer.LEGAL_ENTITIES_KEY);
        assertThat(value).isInstanceOf(MetadataValue.Nested.class);
        MetadataValue.Nested nested = (MetadataValue.Nested) value;
        assertThat(nested.values().get("article")).isEqualTo(MetadataValue.text("第十二条"));
        assertThat(nested.values().get("amount")).isEqualTo(MetadataValue.text("10万元"));
    }

    @Test
    void missingIdIsAnIndexingFailure() {
        assertThatThrownBy(() -> analyzer.analyze(doc(null, "Title", "body").build(), IndexOptions.defaults()))
            .isInstanceOf(DocumentIndexingException.class)
            .hasMessageContaining("document id required");
    }
}
