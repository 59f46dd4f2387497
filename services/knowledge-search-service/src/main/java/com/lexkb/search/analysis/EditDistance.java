package com.lexkb.search.analysis;

/** Levenshtein distance over code points, abandoning early once the bound is exceeded. */
public final class EditDistance {
    private EditDistance() {
    }

    /** Returns the distance, or {@code maxDistance + 1} when it is larger than {@code maxDistance}. */
    public static int bounded(String left, String right, int maxDistance) {
        int[] a = left.codePoints().toArray();
        int[] b = right.codePoints().toArray();
        if (Math.abs(a.length - b.length) > maxDistance) {
            return maxDistance + 1;
        }
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            current[0] = i;
            int rowMin = current[0];
            for (int j = 1; j <= b.length; j++) {
                int cost = a[i - 1] == b[j - 1] ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
                rowMin = Math.min(rowMin, current[j]);
            }
            if (rowMin > maxDistance) {
                return maxDistance + 1;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return Math.min(previous[b.length], maxDistance + 1);
    }
}
