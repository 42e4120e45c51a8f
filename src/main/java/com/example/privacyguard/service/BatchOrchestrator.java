package com.example.privacyguard.service;

import com.example.privacyguard.config.PrivacyGuardProperties;
import com.example.privacyguard.model.BatchResult;
import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionOptions;
import com.example.privacyguard.model.ImageUpload;
import com.example.privacyguard.model.ProcessedResult;
import com.example.privacyguard.service.detection.DetectionEngine;
import com.example.privacyguard.service.transform.RegionTransformEngine;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drives detection and redaction over a batch of uploads. Every image is handled on its own:
 * an image that fails validation, decoding or processing is logged and skipped while the rest of
 * the batch continues.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ImageCodec codec;
    private final DetectionEngine detectionEngine;
    private final RegionTransformEngine transformEngine;
    private final long maxFileSizeBytes;
    private final Set<String> allowedExtensions;

    public BatchOrchestrator(ImageCodec codec, DetectionEngine detectionEngine, RegionTransformEngine transformEngine,
                             PrivacyGuardProperties properties) {
        this.codec = codec;
        this.detectionEngine = detectionEngine;
        this.transformEngine = transformEngine;
        this.maxFileSizeBytes = properties.getUpload().getMaxFileSizeMb() * 1024L * 1024L;
        this.allowedExtensions = properties.getUpload().getAllowedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public BatchResult processBatch(List<ImageUpload> uploads, DetectionOptions options) {
        long batchStart = System.nanoTime();
        List<ProcessedResult> results = new ArrayList<>(uploads.size());
        int totalDetections = 0;
        int skipped = 0;
        for (ImageUpload upload : uploads) {
            try {
                ProcessedResult result = processSingle(upload, options);
                results.add(result);
                totalDetections += result.detections().size();
            } catch (ImageDecodeException | IllegalArgumentException ex) {
                skipped++;
                log.warn("Skipping {}: {}", upload.filename(), ex.getMessage());
            } catch (RuntimeException ex) {
                skipped++;
                log.error("Error processing {}", upload.filename(), ex);
            }
        }
        double totalMs = elapsedMillis(batchStart);
        log.info("Processed {} of {} image(s) with {} detection(s) in {} ms", results.size(), uploads.size(),
                totalDetections, totalMs);
        return new BatchResult(results, totalMs, totalDetections, skipped);
    }

    /**
     * @throws IllegalArgumentException when the upload fails size or extension checks
     * @throws ImageDecodeException     when the bytes cannot be decoded
     */
    public ProcessedResult processSingle(ImageUpload upload, DetectionOptions options) {
        long start = System.nanoTime();
        validate(upload);
        String imageId = UUID.randomUUID().toString().substring(0, 8);
        Mat image = codec.decode(upload.content());
        Mat redacted = null;
        try {
            log.info("Processing image {} ({}x{})", upload.filename(), image.cols(), image.rows());
            List<BoundingBox> detections = detectionEngine.detect(image, options.detectFaces(), options.detectPlates(),
                    options.sensitivity());
            log.info("Found {} detections in {}", detections.size(), upload.filename());
            redacted = transformEngine.redact(image, detections, options);
            String encoded = codec.encodeDataUri(redacted);
            return new ProcessedResult(imageId, upload.filename(), encoded, detections, elapsedMillis(start));
        } finally {
            image.release();
            if (redacted != null) {
                redacted.release();
            }
        }
    }

    void validate(ImageUpload upload) {
        long size = upload.content().length;
        if (size > maxFileSizeBytes) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "File size (%.1fMB) exceeds maximum (%dMB)",
                    size / (1024.0 * 1024.0), maxFileSizeBytes / (1024 * 1024)));
        }
        String filename = upload.filename();
        int dot = filename.lastIndexOf('.');
        String extension = dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (!allowedExtensions.contains(extension)) {
            throw new IllegalArgumentException("File format '" + extension + "' not supported. Allowed: "
                    + allowedExtensions);
        }
    }

    private static double elapsedMillis(long startNanos) {
        double millis = (System.nanoTime() - startNanos) / 1_000_000.0;
        return Math.round(millis * 100.0) / 100.0;
    }
}
