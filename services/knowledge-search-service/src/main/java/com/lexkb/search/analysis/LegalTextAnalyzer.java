package com.lexkb.search.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.tartarus.snowball.SnowballStemmer;
import org.tartarus.snowball.ext.DutchStemmer;
import org.tartarus.snowball.ext.EnglishStemmer;
import org.tartarus.snowball.ext.FrenchStemmer;
import org.tartarus.snowball.ext.GermanStemmer;
import org.tartarus.snowball.ext.ItalianStemmer;
import org.tartarus.snowball.ext.PortugueseStemmer;
import org.tartarus.snowball.ext.SpanishStemmer;

/**
 * Turns mixed Chinese/Latin legal text into normalized tokens.
 *
 * <p>Latin runs are case-folded, split on punctuation (hyphens and apostrophes inside a word are
 * kept), filtered against the stopword list and stemmed with the Snowball stemmer chosen by the
 * language hint. CJK runs are segmented by forward longest match against the legal dictionary;
 * characters no dictionary word covers fall back to overlapping bigrams.
 *
 * <p>Output is a pure function of (text, language hint, mode): the analyzer holds no mutable state
 * and creates a fresh stemmer per call.
 */
public class LegalTextAnalyzer {
    private final LegalDictionary dictionary;

    public LegalTextAnalyzer(LegalDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public LegalDictionary getDictionary() {
        return dictionary;
    }

    public List<Token> analyze(String text, String languageHint, IndexField field, AnalysisMode mode) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String language = LanguageDetector.resolve(languageHint, text);
        Emitter emitter = new Emitter(field, mode, stemmerFor(language));
        int length = text.length();
        int i = 0;
        while (i < length) {
            int cp = text.codePointAt(i);
            if (LanguageDetector.isCjk(cp)) {
                int end = i;
                while (end < length && LanguageDetector.isCjk(text.codePointAt(end))) {
                    end += Character.charCount(text.codePointAt(end));
                }
                segmentCjk(text.substring(i, end), emitter);
                i = end;
            } else if (Character.isLetterOrDigit(cp)) {
                int end = scanWord(text, i);
                emitter.word(text.substring(i, end));
                i = end;
            } else {
                i += Character.charCount(cp);
            }
        }
        return emitter.tokens;
    }

    public List<Token> analyzeQuery(String text, String languageHint) {
        return analyze(text, languageHint, null, AnalysisMode.QUERY);
    }

    /** Normalizes a single dictionary entry the way a query would see it. */
    public List<String> normalizeTerms(String text, String languageHint) {
        List<String> terms = new ArrayList<>();
        for (Token token : analyzeQuery(text, languageHint)) {
            terms.add(token.term());
        }
        return terms;
    }

    private int scanWord(String text, int start) {
        int length = text.length();
        int i = start;
        while (i < length) {
            int cp = text.codePointAt(i);
            if (Character.isLetterOrDigit(cp) && !LanguageDetector.isCjk(cp)) {
                i += Character.charCount(cp);
                continue;
            }
            if (isJoiner(cp) && i > start && i + 1 < length) {
                int next = text.codePointAt(i + 1);
                if (Character.isLetterOrDigit(next) && !LanguageDetector.isCjk(next)) {
                    i += Character.charCount(cp);
                    continue;
                }
            }
            break;
        }
        return i;
    }

    private boolean isJoiner(int cp) {
        return cp == '-' || cp == '\'' || cp == '’';
    }

    private void segmentCjk(String run, Emitter emitter) {
        int[] cps = run.codePoints().toArray();
        int idx = 0;
        int unmatchedStart = -1;
        while (idx < cps.length) {
            int matched = longestMatch(cps, idx, cps.length, dictionary.getMaxWordLength());
            if (matched >= 2) {
                if (unmatchedStart >= 0) {
                    emitUnmatched(cps, unmatchedStart, idx, emitter);
                    unmatchedStart = -1;
                }
                emitDictionaryWord(cps, idx, matched, emitter);
                idx += matched;
            } else {
                if (unmatchedStart < 0) {
                    unmatchedStart = idx;
                }
                idx++;
            }
        }
        if (unmatchedStart >= 0) {
            emitUnmatched(cps, unmatchedStart, cps.length, emitter);
        }
    }

    private int longestMatch(int[] cps, int start, int limit, int maxLength) {
        int longest = Math.min(maxLength, limit - start);
        for (int len = longest; len >= 2; len--) {
            if (dictionary.isWord(new String(cps, start, len))) {
                return len;
            }
        }
        return 0;
    }

    private void emitDictionaryWord(int[] cps, int start, int length, Emitter emitter) {
        String word = new String(cps, start, length);
        List<String> parts = length > 2 ? coverWithParts(cps, start, length) : null;
        if (parts == null) {
            emitter.cjk(word, false);
            return;
        }
        int before = emitter.tokens.size();
        for (String part : parts) {
            emitter.cjk(part, false);
        }
        if (emitter.mode == AnalysisMode.INDEX && !dictionary.isDroppable(word) && emitter.tokens.size() > before) {
            Token first = emitter.tokens.get(before);
            emitter.tokens.add(new Token(word, word, first.position(), emitter.field, true));
        }
    }

    /** Splits a compound into dictionary words that cover it exactly, or returns null. */
    private List<String> coverWithParts(int[] cps, int start, int length) {
        List<String> parts = new ArrayList<>();
        int idx = start;
        int end = start + length;
        while (idx < end) {
            int matched = longestMatch(cps, idx, end, length - 1);
            if (matched < 2) {
                return null;
            }
            parts.add(new String(cps, idx, matched));
            idx += matched;
        }
        return parts;
    }

    private void emitUnmatched(int[] cps, int from, int to, Emitter emitter) {
        int segmentStart = from;
        for (int i = from; i <= to; i++) {
            boolean boundary = i == to || dictionary.isDroppable(new String(cps, i, 1));
            if (!boundary) {
                continue;
            }
            int segmentLength = i - segmentStart;
            if (segmentLength == 1) {
                emitter.cjk(new String(cps, segmentStart, 1), false);
            } else {
                for (int k = segmentStart; k + 2 <= i; k++) {
                    emitter.cjk(new String(cps, k, 2), false);
                }
            }
            segmentStart = i + 1;
        }
    }

    private SnowballStemmer stemmerFor(String language) {
        String key = language == null ? "" : language.toLowerCase(Locale.ROOT);
        return switch (key) {
            case "de" -> new GermanStemmer();
            case "fr" -> new FrenchStemmer();
            case "es" -> new SpanishStemmer();
            case "it" -> new ItalianStemmer();
            case "nl" -> new DutchStemmer();
            case "pt" -> new PortugueseStemmer();
            default -> new EnglishStemmer();
        };
    }

    private final class Emitter {
        private final IndexField field;
        private final AnalysisMode mode;
        private final SnowballStemmer stemmer;
        private final List<Token> tokens = new ArrayList<>();
        private int position;

        private Emitter(IndexField field, AnalysisMode mode, SnowballStemmer stemmer) {
            this.field = field;
            this.mode = mode;
            this.stemmer = stemmer;
        }

        private void word(String raw) {
            String surface = raw.toLowerCase(Locale.ROOT).replace('’', '\'');
            if (dictionary.isDroppable(surface)) {
                return;
            }
            String term = isStemmable(surface) ? stem(surface) : surface;
            tokens.add(new Token(term, surface, position++, field, false));
        }

        private void cjk(String word, boolean stacked) {
            if (dictionary.isDroppable(word)) {
                return;
            }
            tokens.add(new Token(word, word, position++, field, stacked));
        }

        private String stem(String surface) {
            stemmer.setCurrent(surface);
            stemmer.stem();
            String stemmed = stemmer.getCurrent();
            return stemmed == null || stemmed.isEmpty() ? surface : stemmed;
        }

        private boolean isStemmable(String surface) {
            boolean hasLetter = false;
            for (int i = 0; i < surface.length(); ) {
                int cp = surface.codePointAt(i);
                if (Character.isLetter(cp)) {
                    if (Character.UnicodeScript.of(cp) != Character.UnicodeScript.LATIN) {
                        return false;
                    }
                    hasLetter = true;
                } else if (!isJoiner(cp)) {
                    return false;
                }
                i += Character.charCount(cp);
            }
            return hasLetter;
        }
    }
}
