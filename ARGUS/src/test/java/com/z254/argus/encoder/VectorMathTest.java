package com.z254.argus.encoder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link VectorMath}.
 */
class VectorMathTest {

    @Test
    @DisplayName("should clip cosine similarity to [0, 1]")
    void cosineClipped() {
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{-1, 0})).isZero();
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 1}, new float[]{2, 2})).isCloseTo(1f, within(1e-6f));
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1})).isZero();
    }

    @Test
    @DisplayName("should treat zero vectors as dissimilar")
    void zeroVector() {
        assertThat(VectorMath.cosineSimilarity(new float[]{0, 0}, new float[]{1, 0})).isZero();
        assertThat(VectorMath.normalize(new float[]{0, 0})).containsExactly(0f, 0f);
    }

    @Test
    @DisplayName("should normalize without mutating the input")
    void normalizeCopies() {
        float[] v = {3, 4};

        float[] unit = VectorMath.normalize(v);

        assertThat(unit).containsExactly(0.6f, 0.8f);
        assertThat(v).containsExactly(3f, 4f);
    }

    @Test
    @DisplayName("should compute squared L2 over a slice")
    void squaredL2Slice() {
        float[] packed = {9, 9, 1, 2};

        assertThat(VectorMath.squaredL2(packed, 2, new float[]{1, 4})).isEqualTo(4f);
        assertThat(VectorMath.squaredL2(new float[]{0, 0}, new float[]{3, 4})).isEqualTo(25f);
    }

    @Test
    @DisplayName("should reject vectors of different length")
    void lengthMismatch() {
        assertThatThrownBy(() -> VectorMath.dot(new float[2], new float[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 vs 3");
    }

    @Test
    @DisplayName("should score candidates in order")
    void batchSimilarity() {
        float[] scores = VectorMath.batchSimilarity(new float[]{1, 0},
                new float[][]{{1, 0}, {0, 1}, {1, 1}});

        assertThat(scores[0]).isCloseTo(1f, within(1e-6f));
        assertThat(scores[1]).isZero();
        assertThat(scores[2]).isCloseTo((float) Math.sqrt(0.5), within(1e-5f));
    }
}
