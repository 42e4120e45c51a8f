package com.example.privacyguard.service.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConfidenceBandTest {

    private final ConfidenceBand band = new ConfidenceBand(0.2, 0.6);

    @Test
    void lowestSensitivityUsesStrictestThreshold() {
        assertThat(band.thresholdFor(0)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void highestSensitivityUsesMostPermissiveThreshold() {
        assertThat(band.thresholdFor(100)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void interpolatesLinearlyAndClampsOutOfRangeSensitivity() {
        assertThat(band.thresholdFor(50)).isCloseTo(0.4, within(1e-9));
        assertThat(band.thresholdFor(-20)).isCloseTo(0.6, within(1e-9));
        assertThat(band.thresholdFor(250)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void rejectsInvertedBand() {
        assertThatThrownBy(() -> new ConfidenceBand(0.7, 0.3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void haarNeighbourScoreGrowsWithNeighbourCount() {
        assertThat(HaarCascadeFaceBackend.score(0)).isZero();
        assertThat(HaarCascadeFaceBackend.score(5)).isCloseTo(0.5, within(1e-9));
        assertThat(HaarCascadeFaceBackend.score(20)).isGreaterThan(HaarCascadeFaceBackend.score(5));
    }
}
