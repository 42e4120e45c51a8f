package com.example.privacyguard.service.detection;

import com.example.privacyguard.config.PrivacyGuardProperties;
import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionCategory;
import com.example.privacyguard.model.DetectionOptions;
import com.example.privacyguard.service.backend.BackendDetections;
import com.example.privacyguard.service.backend.BackendInferenceException;
import com.example.privacyguard.service.backend.ModelBackendAdapter;
import com.example.privacyguard.service.backend.RawDetection;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the enabled capabilities on one image and turns raw backend output into clamped
 * {@link BoundingBox}es. The sensitivity knob is translated with the confidence band of whichever
 * backend actually served the request.
 */
@Service
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final ModelBackendAdapter backends;
    private final PlateFilterPipeline plateFilters;
    private final double facePaddingFraction;

    public DetectionEngine(ModelBackendAdapter backends, PrivacyGuardProperties properties) {
        this.backends = backends;
        this.plateFilters = new PlateFilterPipeline(properties.getPlate().getFilters());
        this.facePaddingFraction = properties.getFace().getPaddingFraction();
    }

    public List<BoundingBox> detect(Mat image, boolean detectFaces, boolean detectPlates, int sensitivity) {
        Objects.requireNonNull(image, "image must not be null");
        int clampedSensitivity = DetectionOptions.clampPercent(sensitivity);
        List<BoundingBox> boxes = new ArrayList<>();
        if (detectFaces) {
            List<BoundingBox> faces = detectFaces(image, clampedSensitivity);
            log.debug("Detected {} faces", faces.size());
            boxes.addAll(faces);
        }
        if (detectPlates) {
            List<BoundingBox> plates = detectPlates(image, clampedSensitivity);
            log.debug("Detected {} license plates", plates.size());
            boxes.addAll(plates);
        }
        return boxes;
    }

    private List<BoundingBox> detectFaces(Mat image, int sensitivity) {
        BackendDetections raw = runBackend(image, DetectionCategory.FACE);
        double threshold = raw.band().thresholdFor(sensitivity);
        int imageWidth = image.cols();
        int imageHeight = image.rows();
        List<BoundingBox> faces = new ArrayList<>();
        for (RawDetection detection : raw.detections()) {
            if (detection.score() < threshold) {
                continue;
            }
            BoxGeometry.clamp(detection.x(), detection.y(), detection.width(), detection.height(), detection.score(),
                            DetectionCategory.FACE, imageWidth, imageHeight)
                    .map(box -> BoxGeometry.pad(box, facePaddingFraction, imageWidth, imageHeight))
                    .ifPresent(faces::add);
        }
        log.debug("Face backend {} kept {}/{} candidates at threshold {}", raw.backendName(), faces.size(),
                raw.detections().size(), threshold);
        return faces;
    }

    private List<BoundingBox> detectPlates(Mat image, int sensitivity) {
        BackendDetections raw = runBackend(image, DetectionCategory.LICENSE_PLATE);
        double threshold = raw.band().thresholdFor(sensitivity);
        int imageWidth = image.cols();
        int imageHeight = image.rows();
        List<BoundingBox> plates = new ArrayList<>();
        for (RawDetection detection : raw.detections()) {
            if (detection.score() < threshold) {
                continue;
            }
            Optional<BoundingBox> clamped = BoxGeometry.clamp(detection.x(), detection.y(), detection.width(),
                    detection.height(), detection.score(), DetectionCategory.LICENSE_PLATE, imageWidth, imageHeight);
            clamped.flatMap(box -> plateFilters.apply(box, imageWidth, imageHeight)).ifPresent(plates::add);
        }
        log.debug("Plate backend {} kept {}/{} candidates at threshold {}", raw.backendName(), plates.size(),
                raw.detections().size(), threshold);
        return plates;
    }

    private BackendDetections runBackend(Mat image, DetectionCategory category) {
        try {
            return backends.detect(image, category);
        } catch (BackendInferenceException ex) {
            log.error("{} detection failed, continuing without {} regions for this image",
                    category.value(), category.value(), ex);
            return BackendDetections.unavailable();
        }
    }
}
