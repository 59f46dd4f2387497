package com.lexkb.search.analysis;

import java.util.Locale;

public final class LanguageDetector {
    public static final String CHINESE = "zh";
    public static final String ENGLISH = "en";
    public static final String MIXED = "mixed";

    private LanguageDetector() {
    }

    public static String detect(String text) {
        if (text == null || text.isBlank()) {
            return MIXED;
        }
        int total = text.length();
        int cjk = 0;
        int latin = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (isCjk(cp)) {
                cjk++;
            } else if (Character.isLetter(cp) && Character.UnicodeScript.of(cp) == Character.UnicodeScript.LATIN) {
                latin++;
            }
            i += Character.charCount(cp);
        }
        if ((double) cjk / total > 0.3) {
            return CHINESE;
        }
        if ((double) latin / total > 0.5) {
            return ENGLISH;
        }
        return MIXED;
    }

    public static String resolve(String hint, String text) {
        if (hint != null && !hint.isBlank()) {
            String normalized = hint.trim().toLowerCase(Locale.ROOT);
            int separator = indexOfSeparator(normalized);
            if (separator > 0) {
                normalized = normalized.substring(0, separator);
            }
            if (!normalized.equals("auto")) {
                return normalized;
            }
        }
        return detect(text);
    }

    public static boolean isCjk(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
            || script == Character.UnicodeScript.HIRAGANA
            || script == Character.UnicodeScript.KATAKANA
            || script == Character.UnicodeScript.HANGUL;
    }

    private static int indexOfSeparator(String value) {
        int dash = value.indexOf('-');
        int underscore = value.indexOf('_');
        if (dash < 0) {
            return underscore;
        }
        if (underscore < 0) {
            return dash;
        }
        return Math.min(dash, underscore);
    }
}
