package com.lexkb.search.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LegalEntityExtractor {
    private static final Map<LegalEntityType, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(LegalEntityType.DATE, Pattern.compile("\\d{4}年\\d{1,2}月\\d{1,2}日|\\d{4}-\\d{2}-\\d{2}"));
        PATTERNS.put(LegalEntityType.AMOUNT, Pattern.compile("\\d[\\d,]*(?:\\.\\d+)?\\s*(?:元|万元|万|千元|百万|亿元|亿|人民币|美元|欧元)"));
        PATTERNS.put(LegalEntityType.ARTICLE, Pattern.compile("第[一二三四五六七八九十百千万零\\d]+条"));
        PATTERNS.put(
            LegalEntityType.CASE_NUMBER,
            Pattern.compile("[（(]\\d{4}[）)][\\p{IsHan}\\d]{1,8}?\\d+号|\\b[A-Z]{2,4}\\d{4,6}\\b")
        );
        PATTERNS.put(LegalEntityType.COURT, Pattern.compile("[\\p{IsHan}]{2,12}?人民法院"));
    }

    private final LegalDictionary dictionary;

    public LegalEntityExtractor(LegalDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public List<LegalEntity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<LegalEntity> entities = new ArrayList<>();
        for (Map.Entry<LegalEntityType, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            while (matcher.find()) {
                entities.add(new LegalEntity(entry.getKey(), matcher.group().trim(), matcher.start(), matcher.end()));
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : dictionary.getLegalKeywords()) {
            int from = 0;
            while (true) {
                int found = lower.indexOf(keyword, from);
                if (found < 0) {
                    break;
                }
                int end = found + keyword.length();
                if (isWholeWord(lower, found, end)) {
                    entities.add(new LegalEntity(LegalEntityType.LEGAL_TERM, text.substring(found, end), found, end));
                }
                from = end;
            }
        }
        entities.sort(Comparator.comparingInt(LegalEntity::start).thenComparing(entity -> entity.type().ordinal()));
        return entities;
    }

    public Map<String, List<String>> group(List<LegalEntity> entities) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (LegalEntity entity : entities) {
            List<String> values = grouped.computeIfAbsent(entity.type().key(), key -> new ArrayList<>());
            if (!values.contains(entity.value())) {
                values.add(entity.value());
            }
        }
        return grouped;
    }

    private boolean isWholeWord(String text, int start, int end) {
        if (LanguageDetector.isCjk(text.codePointAt(start))) {
            return true;
        }
        boolean leftOk = start == 0 || !Character.isLetterOrDigit(text.charAt(start - 1));
        boolean rightOk = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
        return leftOk && rightOk;
    }
}
