package com.example.privacyguard.config;

import com.example.privacyguard.service.backend.ConfidenceBand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "privacy-guard")
public class PrivacyGuardProperties {

    private String version = "0.1.0";
    private boolean warmUp = false;
    @Valid
    private final Face face = new Face();
    @Valid
    private final Plate plate = new Plate();
    @Valid
    private final Upload upload = new Upload();
    @Valid
    private final Output output = new Output();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public boolean isWarmUp() {
        return warmUp;
    }

    public void setWarmUp(boolean warmUp) {
        this.warmUp = warmUp;
    }

    public Face getFace() {
        return face;
    }

    public Plate getPlate() {
        return plate;
    }

    public Upload getUpload() {
        return upload;
    }

    public Output getOutput() {
        return output;
    }

    /**
     * Confidence band of a single backend. Kept per backend since learned and classical
     * detectors do not share a score scale.
     */
    public static class Band {

        private double min;
        private double max;

        public Band() {
        }

        public Band(double min, double max) {
            this.min = min;
            this.max = max;
        }

        public double getMin() {
            return min;
        }

        public void setMin(double min) {
            this.min = min;
        }

        public double getMax() {
            return max;
        }

        public void setMax(double max) {
            this.max = max;
        }

        public ConfidenceBand toConfidenceBand() {
            return new ConfidenceBand(min, max);
        }
    }

    public static class Face {

        private boolean primaryEnabled = true;
        private boolean fallbackEnabled = true;
        private String ssdConfigPath = "./models/deploy.prototxt";
        private String ssdModelPath = "./models/res10_300x300_ssd_iter_140000.caffemodel";
        private int ssdInputSize = 300;
        private final Band ssdBand = new Band(0.30, 0.80);
        private String cascadePath = "./models/haarcascade_frontalface_default.xml";
        private final Band cascadeBand = new Band(0.20, 0.60);
        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double paddingFraction = 0.1;

        public boolean isPrimaryEnabled() {
            return primaryEnabled;
        }

        public void setPrimaryEnabled(boolean primaryEnabled) {
            this.primaryEnabled = primaryEnabled;
        }

        public boolean isFallbackEnabled() {
            return fallbackEnabled;
        }

        public void setFallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
        }

        public String getSsdConfigPath() {
            return ssdConfigPath;
        }

        public void setSsdConfigPath(String ssdConfigPath) {
            this.ssdConfigPath = ssdConfigPath;
        }

        public String getSsdModelPath() {
            return ssdModelPath;
        }

        public void setSsdModelPath(String ssdModelPath) {
            this.ssdModelPath = ssdModelPath;
        }

        public int getSsdInputSize() {
            return ssdInputSize;
        }

        public void setSsdInputSize(int ssdInputSize) {
            this.ssdInputSize = ssdInputSize;
        }

        public Band getSsdBand() {
            return ssdBand;
        }

        public String getCascadePath() {
            return cascadePath;
        }

        public void setCascadePath(String cascadePath) {
            this.cascadePath = cascadePath;
        }

        public Band getCascadeBand() {
            return cascadeBand;
        }

        public double getPaddingFraction() {
            return paddingFraction;
        }

        public void setPaddingFraction(double paddingFraction) {
            this.paddingFraction = paddingFraction;
        }
    }

    public static class Plate {

        private boolean primaryEnabled = true;
        private boolean fallbackEnabled = true;
        private String yoloModelPath = "./models/yolov8n_plate.onnx";
        private int yoloInputSize = 640;
        private boolean yoloObjectness = false;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double nmsThreshold = 0.45;
        private final Band yoloBand = new Band(0.15, 0.60);
        private final Band contourBand = new Band(0.35, 0.75);
        @Valid
        private final PlateFilters filters = new PlateFilters();

        public boolean isPrimaryEnabled() {
            return primaryEnabled;
        }

        public void setPrimaryEnabled(boolean primaryEnabled) {
            this.primaryEnabled = primaryEnabled;
        }

        public boolean isFallbackEnabled() {
            return fallbackEnabled;
        }

        public void setFallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
        }

        public String getYoloModelPath() {
            return yoloModelPath;
        }

        public void setYoloModelPath(String yoloModelPath) {
            this.yoloModelPath = yoloModelPath;
        }

        public int getYoloInputSize() {
            return yoloInputSize;
        }

        public void setYoloInputSize(int yoloInputSize) {
            this.yoloInputSize = yoloInputSize;
        }

        /**
         * {@code true} for YOLOv5-style heads that emit an objectness column before class scores.
         */
        public boolean isYoloObjectness() {
            return yoloObjectness;
        }

        public void setYoloObjectness(boolean yoloObjectness) {
            this.yoloObjectness = yoloObjectness;
        }

        public double getNmsThreshold() {
            return nmsThreshold;
        }

        public void setNmsThreshold(double nmsThreshold) {
            this.nmsThreshold = nmsThreshold;
        }

        public Band getYoloBand() {
            return yoloBand;
        }

        public Band getContourBand() {
            return contourBand;
        }

        public PlateFilters getFilters() {
            return filters;
        }
    }

    /**
     * Geometric post-filters for plate candidates. Each stage can be switched off on its own;
     * a candidate has to pass every enabled stage.
     */
    public static class PlateFilters {

        private boolean confidenceFloorEnabled = true;
        private double confidenceFloor = 0.25;
        private boolean aspectEnabled = true;
        private double minAspect = 1.5;
        private double maxAspect = 6.5;
        private boolean verticalPositionEnabled = true;
        private double minCenterYFraction = 0.20;
        private boolean sizeEnabled = true;
        private double maxWidthFraction = 0.60;
        private double maxHeightFraction = 0.30;
        private boolean shrinkEnabled = true;
        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double shrinkFraction = 0.05;
        private boolean debugRejections = false;

        public boolean isConfidenceFloorEnabled() {
            return confidenceFloorEnabled;
        }

        public void setConfidenceFloorEnabled(boolean confidenceFloorEnabled) {
            this.confidenceFloorEnabled = confidenceFloorEnabled;
        }

        public double getConfidenceFloor() {
            return confidenceFloor;
        }

        public void setConfidenceFloor(double confidenceFloor) {
            this.confidenceFloor = confidenceFloor;
        }

        public boolean isAspectEnabled() {
            return aspectEnabled;
        }

        public void setAspectEnabled(boolean aspectEnabled) {
            this.aspectEnabled = aspectEnabled;
        }

        public double getMinAspect() {
            return minAspect;
        }

        public void setMinAspect(double minAspect) {
            this.minAspect = minAspect;
        }

        public double getMaxAspect() {
            return maxAspect;
        }

        public void setMaxAspect(double maxAspect) {
            this.maxAspect = maxAspect;
        }

        public boolean isVerticalPositionEnabled() {
            return verticalPositionEnabled;
        }

        public void setVerticalPositionEnabled(boolean verticalPositionEnabled) {
            this.verticalPositionEnabled = verticalPositionEnabled;
        }

        public double getMinCenterYFraction() {
            return minCenterYFraction;
        }

        public void setMinCenterYFraction(double minCenterYFraction) {
            this.minCenterYFraction = minCenterYFraction;
        }

        public boolean isSizeEnabled() {
            return sizeEnabled;
        }

        public void setSizeEnabled(boolean sizeEnabled) {
            this.sizeEnabled = sizeEnabled;
        }

        public double getMaxWidthFraction() {
            return maxWidthFraction;
        }

        public void setMaxWidthFraction(double maxWidthFraction) {
            this.maxWidthFraction = maxWidthFraction;
        }

        public double getMaxHeightFraction() {
            return maxHeightFraction;
        }

        public void setMaxHeightFraction(double maxHeightFraction) {
            this.maxHeightFraction = maxHeightFraction;
        }

        public boolean isShrinkEnabled() {
            return shrinkEnabled;
        }

        public void setShrinkEnabled(boolean shrinkEnabled) {
            this.shrinkEnabled = shrinkEnabled;
        }

        public double getShrinkFraction() {
            return shrinkFraction;
        }

        public void setShrinkFraction(double shrinkFraction) {
            this.shrinkFraction = shrinkFraction;
        }

        /**
         * Promotes per-candidate rejection logs from DEBUG to INFO while tuning thresholds.
         */
        public boolean isDebugRejections() {
            return debugRejections;
        }

        public void setDebugRejections(boolean debugRejections) {
            this.debugRejections = debugRejections;
        }
    }

    public static class Upload {

        @Min(1)
        private int maxBatchSize = 10;
        @Min(1)
        private int maxFileSizeMb = 10;
        @NotEmpty
        private List<String> allowedExtensions = new ArrayList<>(List.of("jpg", "jpeg", "png", "webp"));

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getMaxFileSizeMb() {
            return maxFileSizeMb;
        }

        public void setMaxFileSizeMb(int maxFileSizeMb) {
            this.maxFileSizeMb = maxFileSizeMb;
        }

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }
    }

    public static class Output {

        @NotBlank
        private String format = "png";
        @Min(1)
        @Max(100)
        private int jpegQuality = 95;

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public int getJpegQuality() {
            return jpegQuality;
        }

        public void setJpegQuality(int jpegQuality) {
            this.jpegQuality = jpegQuality;
        }
    }
}
