package com.z254.argus.ranker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StandardScalerTest {

    @Test
    @DisplayName("should standardize columns and leave constant columns unscaled")
    void standardizes() {
        StandardScaler scaler = StandardScaler.fit(new double[][]{{1, 5}, {3, 5}});

        assertThat(scaler.columns()).isEqualTo(2);
        assertThat(scaler.getMean()).containsExactly(2.0, 5.0);
        assertThat(scaler.getScale()).containsExactly(1.0, 1.0);
        double[] out = scaler.transform(new double[]{3, 7});
        assertThat(out[0]).isCloseTo(1.0, within(1e-12));
        assertThat(out[1]).isCloseTo(2.0, within(1e-12));
    }
}
