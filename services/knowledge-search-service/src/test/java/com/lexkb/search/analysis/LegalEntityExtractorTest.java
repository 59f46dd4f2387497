package com.lexkb.search.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LegalEntityExtractorTest {

    private final LegalEntityExtractor extractor =
        new LegalEntityExtractor(new LegalDictionaryLoader().load(new AnalyzerProperties()));

    @Test
    void extractsDatesAmountsArticlesAndCourts() {
        String text = "2024年3月5日，北京市朝阳区人民法院判决被告赔偿10万元，依据第十二条。";

        Map<String, List<String>> grouped = extractor.group(extractor.extract(text));

        assertThat(grouped.get("date")).containsExactly("2024年3月5日");
        assertThat(grouped.get("court")).containsExactly("北京市朝阳区人民法院");
        assertThat(grouped.get("amount")).containsExactly("10万元");
        assertThat(grouped.get("article")).containsExactly("第十二条");
        assertThat(grouped.get("legal_term")).contains("判决", "被告", "赔偿");
    }

    @Test
    void entitiesAreOrderedByOffset() {
        List<LegalEntity> entities = extractor.extract("Filed 2023-11-02 in court, case ABC12345.");

        assertThat(entities).extracting(LegalEntity::start).isSorted();
        assertThat(entities).extracting(LegalEntity::type)
            .containsExactly(LegalEntityType.DATE, LegalEntityType.LEGAL_TERM, LegalEntityType.LEGAL_TERM, LegalEntityType.CASE_NUMBER);
    }

    @Test
    void latinKeywordsMustBeWholeWords() {
        List<LegalEntity> entities = extractor.extract("The contractor signed a subcontract");

        assertThat(entities).noneMatch(entity -> entity.type() == LegalEntityType.LEGAL_TERM);
    }

    @Test
    void blankTextHasNoEntities() {
        assertThat(extractor.extract("  ")).isEmpty();
        assertThat(extractor.group(List.of())).isEmpty();
    }
}
