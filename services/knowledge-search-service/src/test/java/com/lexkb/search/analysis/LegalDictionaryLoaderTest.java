package com.lexkb.search.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LegalDictionaryLoaderTest {

    private final LegalDictionaryLoader loader = new LegalDictionaryLoader();

    @Test
    void bundledDictionaryLoads() {
        LegalDictionary dictionary = loader.load(new AnalyzerProperties());

        assertThat(dictionary.getVersion()).isEqualTo("2024.1");
        assertThat(dictionary.isDroppable("the")).isTrue();
        assertThat(dictionary.isDroppable("shall")).isFalse();
        assertThat(dictionary.isLegalKeyword("合同")).isTrue();
        assertThat(dictionary.isWord("劳动合同")).isTrue();
        assertThat(dictionary.getSynonymGroups()).anySatisfy(group -> assertThat(group).contains("lawyer", "attorney"));
    }

    @Test
    void extraEntriesFromPropertiesAreMerged() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.setExtraStopwords(List.of("Hereby"));
        properties.setExtraWords(List.of("竞业限制"));
        properties.setExtraSynonyms(List.of(List.of("tenant", "lessee")));

        LegalDictionary dictionary = loader.load(properties);

        assertThat(dictionary.isDroppable("hereby")).isTrue();
        assertThat(dictionary.isWord("竞业限制")).isTrue();
        assertThat(dictionary.getSynonymGroups()).anySatisfy(group -> assertThat(group).containsExactly("tenant", "lessee"));
    }

    @Test
    void fileDictionaryIsReadFromDisk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("dictionary.yml");
        Files.writeString(file, "version: test-1\nstopwords: [foo]\nwords: [知识产权]\n");
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.setDictionaryPath(file.toString());

        LegalDictionary dictionary = loader.load(properties);

        assertThat(dictionary.getVersion()).isEqualTo("test-1");
        assertThat(dictionary.isDroppable("foo")).isTrue();
        assertThat(dictionary.isWord("知识产权")).isTrue();
    }

    @Test
    void missingDictionaryIsEmptyUnlessStrict() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.setDictionaryPath("classpath:analysis/missing.yml");

        assertThat(loader.load(properties).getWords()).isEmpty();

        properties.setStrict(true);
        assertThatThrownBy(() -> loader.load(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void malformedDictionaryFailsWhenStrict(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "- just\n- a list\n");
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.setDictionaryPath(file.toString());
        properties.setStrict(true);

        assertThatThrownBy(() -> loader.load(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("malformed");
    }
}
