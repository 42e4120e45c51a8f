package com.example.privacyguard.service;

import com.example.privacyguard.config.PrivacyGuardProperties;
import com.example.privacyguard.model.BatchResult;
import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionCategory;
import com.example.privacyguard.model.DetectionOptions;
import com.example.privacyguard.model.ImageUpload;
import com.example.privacyguard.model.ProcessedResult;
import com.example.privacyguard.service.detection.DetectionEngine;
import com.example.privacyguard.service.transform.RegionTransformEngine;
import com.example.privacyguard.util.OpenCvRuntime;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchOrchestratorTest {

    private static byte[] png;

    private final PrivacyGuardProperties properties = new PrivacyGuardProperties();
    private final ImageCodec codec = new ImageCodec("png", 95);
    private DetectionEngine detectionEngine;
    private BatchOrchestrator orchestrator;

    @BeforeAll
    static void encodeFixture() {
        OpenCvRuntime.ensureLoaded();
        Mat image = new Mat(120, 160, CvType.CV_8UC3, new Scalar(90, 140, 200));
        try {
            png = new ImageCodec("png", 95).encode(image);
        } finally {
            image.release();
        }
    }

    @BeforeEach
    void setUp() {
        detectionEngine = mock(DetectionEngine.class);
        when(detectionEngine.detect(any(Mat.class), anyBoolean(), anyBoolean(), anyInt()))
                .thenReturn(List.of(new BoundingBox(10, 10, 40, 40, 0.9, DetectionCategory.FACE)));
        orchestrator = new BatchOrchestrator(codec, detectionEngine, new RegionTransformEngine(), properties);
    }

    @Test
    void processesEveryValidImage() {
        BatchResult result = orchestrator.processBatch(List.of(
                new ImageUpload(png, "first.png"),
                new ImageUpload(png, "second.PNG")), DetectionOptions.defaults());

        assertThat(result.results()).extracting(ProcessedResult::originalFilename)
                .containsExactly("first.png", "second.PNG");
        assertThat(result.totalDetections()).isEqualTo(2);
        assertThat(result.skippedImages()).isZero();
        assertThat(result.results()).allSatisfy(processed -> {
            assertThat(processed.imageId()).hasSize(8);
            assertThat(processed.processedImage()).startsWith("data:image/png;base64,");
            assertThat(processed.processingTimeMs()).isGreaterThanOrEqualTo(0.0);
        });
    }

    @Test
    void corruptImageIsSkippedWithoutFailingTheBatch() {
        BatchResult result = orchestrator.processBatch(List.of(
                new ImageUpload(png, "good.png"),
                new ImageUpload("garbage".getBytes(StandardCharsets.UTF_8), "broken.jpg"),
                new ImageUpload(png, "also-good.png")), DetectionOptions.defaults());

        assertThat(result.results()).hasSize(2);
        assertThat(result.skippedImages()).isEqualTo(1);
    }

    @Test
    void unsupportedExtensionIsSkipped() {
        BatchResult result = orchestrator.processBatch(List.of(
                new ImageUpload(png, "animation.gif"),
                new ImageUpload(png, "noextension")), DetectionOptions.defaults());

        assertThat(result.results()).isEmpty();
        assertThat(result.skippedImages()).isEqualTo(2);
    }

    @Test
    void oversizedFileFailsValidation() {
        properties.getUpload().setMaxFileSizeMb(1);
        BatchOrchestrator strict = new BatchOrchestrator(codec, detectionEngine, new RegionTransformEngine(), properties);

        assertThatThrownBy(() -> strict.validate(new ImageUpload(new byte[2 * 1024 * 1024], "huge.jpg")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds maximum");
    }

    @Test
    void unexpectedFailureIsIsolatedToItsImage() {
        when(detectionEngine.detect(any(Mat.class), anyBoolean(), anyBoolean(), anyInt()))
                .thenThrow(new IllegalStateException("detector crashed"))
                .thenReturn(List.of());

        BatchResult result = orchestrator.processBatch(List.of(
                new ImageUpload(png, "first.png"),
                new ImageUpload(png, "second.png")), DetectionOptions.defaults());

        assertThat(result.results()).extracting(ProcessedResult::originalFilename).containsExactly("second.png");
        assertThat(result.skippedImages()).isEqualTo(1);
        assertThat(result.totalDetections()).isZero();
    }
}
