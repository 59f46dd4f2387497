package com.lexkb.search.index;

import com.lexkb.search.analysis.IndexField;
import java.util.Arrays;

public final class Posting {
    private final int termFrequency;
    private final int fieldMask;
    private final int[] positions;
    private final int[] fieldFrequencies;

    public Posting(int[] positions) {
        if (positions == null || positions.length == 0) {
            throw new IllegalArgumentException("posting requires at least one position");
        }
        int[] sorted = positions.clone();
        Arrays.sort(sorted);
        int[] perField = new int[IndexField.values().length];
        int mask = 0;
        for (int position : sorted) {
            IndexField field = IndexField.ofPosition(position);
            perField[field.ordinal()]++;
            mask |= field.bit();
        }
        this.positions = sorted;
        this.termFrequency = sorted.length;
        this.fieldMask = mask;
        this.fieldFrequencies = perField;
    }

    public int getTermFrequency() {
        return termFrequency;
    }

    public int getFieldMask() {
        return fieldMask;
    }

    public boolean occursIn(IndexField field) {
        return (fieldMask & field.bit()) != 0;
    }

    public int frequencyIn(IndexField field) {
        return fieldFrequencies[field.ordinal()];
    }

    public int[] getPositions() {
        return positions.clone();
    }

    public boolean hasPosition(int position) {
        return Arrays.binarySearch(positions, position) >= 0;
    }

    int positionCount() {
        return positions.length;
    }

    int positionAt(int index) {
        return positions[index];
    }

    @Override
    public String toString() {
        return "Posting{tf=" + termFrequency + ", fields=" + IndexField.fromMask(fieldMask) + "}";
    }
}
