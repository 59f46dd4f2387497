package com.lexkb.search.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EditDistanceTest {

    @Test
    void computesLevenshteinWithinBound() {
        assertThat(EditDistance.bounded("kitten", "sitting", 3)).isEqualTo(3);
        assertThat(EditDistance.bounded("court", "courx", 1)).isEqualTo(1);
        assertThat(EditDistance.bounded("合同", "合同", 2)).isZero();
    }

    @Test
    void reportsBoundPlusOneWhenExceeded() {
        assertThat(EditDistance.bounded("kitten", "sitting", 2)).isEqualTo(3);
        assertThat(EditDistance.bounded("a", "abcdef", 2)).isEqualTo(3);
    }

    @Test
    void countsCodePointsNotChars() {
        assertThat(EditDistance.bounded("劳动", "劳务", 1)).isEqualTo(1);
    }
}
