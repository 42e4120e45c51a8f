package com.example.privacyguard.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionOptionsTest {

    @Test
    void clampsPercentagesIntoRange() {
        DetectionOptions options = new DetectionOptions(BlurMode.EMOJI, 140, true, false, -5, "cool");

        assertThat(options.intensity()).isEqualTo(100);
        assertThat(options.sensitivity()).isZero();
        assertThat(options.emojiKey()).isEqualTo("cool");
    }

    @Test
    void missingValuesFallBackToDefaults() {
        DetectionOptions options = new DetectionOptions(null, 50, true, true, 50, "  ");

        assertThat(options.blurMode()).isEqualTo(BlurMode.GAUSSIAN);
        assertThat(options.emojiKey()).isEqualTo(DetectionOptions.DEFAULT_EMOJI_KEY);
        assertThat(DetectionOptions.defaults().intensity()).isEqualTo(80);
        assertThat(DetectionOptions.defaults().sensitivity()).isEqualTo(60);
    }

    @Test
    void blurModeParsingIsLenient() {
        assertThat(BlurMode.fromValue("Pixelation")).isEqualTo(BlurMode.PIXELATION);
        assertThat(BlurMode.fromValue(" emoji ")).isEqualTo(BlurMode.EMOJI);
        assertThat(BlurMode.fromValue("sharpen")).isEqualTo(BlurMode.GAUSSIAN);
        assertThat(BlurMode.fromValue(null)).isEqualTo(BlurMode.GAUSSIAN);
    }

    @Test
    void boundingBoxRejectsDegenerateGeometry() {
        assertThatThrownBy(() -> new BoundingBox(0, 0, 0, 10, 0.5, DetectionCategory.FACE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BoundingBox(0, 0, 10, 10, 1.5, DetectionCategory.FACE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new BoundingBox(0, 0, 10, 10, 0.5, DetectionCategory.FACE).enabled()).isTrue();
    }
}
