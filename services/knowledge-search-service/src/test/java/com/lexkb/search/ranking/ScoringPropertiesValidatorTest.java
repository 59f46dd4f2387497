package com.lexkb.search.ranking;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lexkb.search.query.QueryProperties;
import org.junit.jupiter.api.Test;

class ScoringPropertiesValidatorTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> ScoringPropertiesValidator.validate(new ScoringProperties())).doesNotThrowAnyException();
    }

    @Test
    void titleMustOutweighEveryOtherField() {
        ScoringProperties properties = new ScoringProperties();
        properties.setSummaryWeight(3.0);

        assertThatThrownBy(() -> ScoringPropertiesValidator.validate(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("summary");
    }

    @Test
    void rejectsNonPositiveWeights() {
        ScoringProperties properties = new ScoringProperties();
        properties.setContentWeight(0.0);

        assertThatThrownBy(() -> ScoringPropertiesValidator.validate(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("content");
    }

    @Test
    void rejectsOutOfRangeTuning() {
        ScoringProperties damping = new ScoringProperties();
        damping.setLengthDamping(1.0);
        ScoringProperties phrase = new ScoringProperties();
        phrase.setPhraseBonus(1.0);
        ScoringProperties fuzzy = new ScoringProperties();
        fuzzy.setFuzzyWeight(1.0);

        assertThatThrownBy(() -> ScoringPropertiesValidator.validate(damping)).hasMessageContaining("length damping");
        assertThatThrownBy(() -> ScoringPropertiesValidator.validate(phrase)).hasMessageContaining("phrase bonus");
        assertThatThrownBy(() -> ScoringPropertiesValidator.validate(fuzzy)).hasMessageContaining("fuzzy weight");
    }

    @Test
    void scorerRefusesInvalidConfiguration() {
        ScoringProperties properties = new ScoringProperties();
        properties.setTitleWeight(1.0);

        assertThatThrownBy(() -> new RelevanceScorer(properties, new QueryProperties()))
            .isInstanceOf(IllegalStateException.class);
    }
}
