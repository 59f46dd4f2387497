package com.lexkb.search.ranking;

import com.lexkb.search.analysis.IndexField;
import java.util.Locale;

public final class ScoringPropertiesValidator {
    private ScoringPropertiesValidator() {}

    public static void validate(ScoringProperties properties) {
        if (properties == null) {
            throw new IllegalStateException("scoring properties missing");
        }
        for (IndexField field : IndexField.values()) {
            double weight = properties.weight(field);
            if (!(weight > 0.0) || Double.isInfinite(weight)) {
                throw new IllegalStateException("field weight must be positive: " + field.name().toLowerCase(Locale.ROOT));
            }
            if (field != IndexField.TITLE && weight >= properties.getTitleWeight()) {
                throw new IllegalStateException("title weight must be strictly greatest, got "
                    + field.name().toLowerCase(Locale.ROOT) + "=" + weight + " title=" + properties.getTitleWeight());
            }
        }
        double k = properties.getLengthDamping();
        if (!(k >= 0.0 && k < 1.0)) {
            throw new IllegalStateException("length damping must be in [0,1): " + k);
        }
        if (!(properties.getPhraseBonus() > 1.0) || Double.isInfinite(properties.getPhraseBonus())) {
            throw new IllegalStateException("phrase bonus must be > 1: " + properties.getPhraseBonus());
        }
        double fuzzy = properties.getFuzzyWeight();
        if (!(fuzzy > 0.0 && fuzzy < 1.0)) {
            throw new IllegalStateException("fuzzy weight must be in (0,1): " + fuzzy);
        }
    }
}
