package com.lexkb.search.analysis;

import java.util.ArrayList;
import java.util.List;

public final class TextSummarizer {
    private static final int MAX_SENTENCES = 3;

    private TextSummarizer() {
    }

    public static String summarize(String content, int maxLength) {
        if (content == null || content.isBlank()) {
            return null;
        }
        List<String> sentences = splitSentences(content);
        if (sentences.isEmpty()) {
            return null;
        }
        String first = sentences.get(0);
        if (first.length() > maxLength) {
            return first.substring(0, maxLength) + "…";
        }
        StringBuilder summary = new StringBuilder(first);
        for (int i = 1; i < Math.min(sentences.size(), MAX_SENTENCES); i++) {
            String sentence = sentences.get(i);
            if (summary.length() + sentence.length() > maxLength) {
                break;
            }
            summary.append(' ').append(sentence);
        }
        return summary.toString();
    }

    private static List<String> splitSentences(String content) {
        List<String> sentences = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < content.length(); i++) {
            char ch = content.charAt(i);
            current.append(ch);
            if (isTerminator(ch)) {
                addSentence(sentences, current);
            }
        }
        addSentence(sentences, current);
        return sentences;
    }

    private static void addSentence(List<String> sentences, StringBuilder current) {
        String sentence = current.toString().trim();
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }
        current.setLength(0);
    }

    private static boolean isTerminator(char ch) {
        return ch == '。' || ch == '！' || ch == '？' || ch == '.' || ch == '!' || ch == '?';
    }
}
