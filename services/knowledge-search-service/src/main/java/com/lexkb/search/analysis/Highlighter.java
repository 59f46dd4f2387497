package com.lexkb.search.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class Highlighter {
    public static final String OPEN = "<em>";
    public static final String CLOSE = "</em>";

    private final int fragmentLength;
    private final int maxFragments;

    public Highlighter(int fragmentLength, int maxFragments) {
        this.fragmentLength = Math.max(20, fragmentLength);
        this.maxFragments = Math.max(1, maxFragments);
    }

    public List<String> highlight(String text, Collection<String> needles) {
        if (text == null || text.isEmpty() || needles == null || needles.isEmpty()) {
            return List.of();
        }
        List<int[]> matches = mergeOverlaps(findMatches(text, needles));
        if (matches.isEmpty()) {
            return List.of();
        }
        List<String> fragments = new ArrayList<>();
        int index = 0;
        while (index < matches.size() && fragments.size() < maxFragments) {
            int[] first = matches.get(index);
            int start = Math.max(0, first[0] - fragmentLength / 3);
            int end = Math.min(text.length(), start + fragmentLength);
            if (end - start < fragmentLength) {
                start = Math.max(0, end - fragmentLength);
            }
            List<int[]> inside = new ArrayList<>();
            while (index < matches.size() && matches.get(index)[1] <= end) {
                inside.add(matches.get(index));
                index++;
            }
            if (inside.isEmpty()) {
                // a single match longer than the window
                inside.add(first);
                end = first[1];
                index++;
            }
            fragments.add(render(text, start, end, inside));
        }
        return fragments;
    }

    private List<int[]> findMatches(String text, Collection<String> needles) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String needle : needles) {
            if (needle != null && !needle.isBlank()) {
                distinct.add(needle);
            }
        }
        List<int[]> matches = new ArrayList<>();
        for (String needle : distinct) {
            boolean latin = !LanguageDetector.isCjk(needle.codePointAt(0));
            int length = needle.length();
            for (int i = 0; i + length <= text.length(); i++) {
                if (!text.regionMatches(true, i, needle, 0, length)) {
                    continue;
                }
                if (latin && i > 0 && Character.isLetterOrDigit(text.charAt(i - 1))) {
                    continue;
                }
                int end = i + length;
                if (latin) {
                    while (end < text.length() && Character.isLetter(text.charAt(end))) {
                        end++;
                    }
                }
                matches.add(new int[] {i, end});
            }
        }
        matches.sort(Comparator.<int[]>comparingInt(range -> range[0]).thenComparingInt(range -> -range[1]));
        return matches;
    }

    private List<int[]> mergeOverlaps(List<int[]> sorted) {
        List<int[]> merged = new ArrayList<>();
        for (int[] range : sorted) {
            if (!merged.isEmpty() && range[0] <= merged.get(merged.size() - 1)[1]) {
                int[] last = merged.get(merged.size() - 1);
                last[1] = Math.max(last[1], range[1]);
            } else {
                merged.add(new int[] {range[0], range[1]});
            }
        }
        return merged;
    }

    private String render(String text, int start, int end, List<int[]> matches) {
        StringBuilder fragment = new StringBuilder();
        if (start > 0) {
            fragment.append("...");
        }
        int cursor = start;
        for (int[] match : matches) {
            fragment.append(text, cursor, match[0]).append(OPEN).append(text, match[0], match[1]).append(CLOSE);
            cursor = match[1];
        }
        if (cursor < end) {
            fragment.append(text, cursor, end);
        }
        if (end < text.length()) {
            fragment.append("...");
        }
        return fragment.toString();
    }
}
