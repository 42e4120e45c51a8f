package com.example.privacyguard.service.backend;

import com.example.privacyguard.util.OpenCvRuntime;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Face detector based on the ResNet-10 SSD Caffe model shipped with the OpenCV samples
 * ({@code deploy.prototxt} and {@code res10_300x300_ssd_iter_140000.caffemodel}). Each output
 * row has the layout {@code [image, class, confidence, x1, y1, x2, y2]} with relative coordinates.
 */
public class SsdFaceBackend implements DetectorBackend {

    private static final Logger log = LoggerFactory.getLogger(SsdFaceBackend.class);

    private static final Scalar MEAN = new Scalar(104.0, 177.0, 123.0);
    private static final double CANDIDATE_FLOOR = 0.05;

    private final String configPath;
    private final String modelPath;
    private final int inputSize;
    private final ConfidenceBand band;
    private volatile Net network;

    public SsdFaceBackend(String configPath, String modelPath, int inputSize, ConfidenceBand band) {
        this.configPath = configPath;
        this.modelPath = modelPath;
        this.inputSize = inputSize;
        this.band = Objects.requireNonNull(band, "band");
    }

    @Override
    public String name() {
        return "ssd-face";
    }

    @Override
    public ConfidenceBand confidenceBand() {
        return band;
    }

    @Override
    public void load() {
        requireFile(configPath, "SSD face config");
        requireFile(modelPath, "SSD face weights");
        OpenCvRuntime.ensureLoaded();
        log.info("Loading SSD face model from {}", Path.of(modelPath).toAbsolutePath());
        try {
            Net net = Dnn.readNetFromCaffe(configPath, modelPath);
            if (net.empty()) {
                throw new BackendLoadException("SSD face model " + modelPath + " produced an empty network");
            }
            network = net;
        } catch (CvException ex) {
            throw new BackendLoadException("Unable to read SSD face model " + modelPath, ex);
        }
    }

    @Override
    public boolean isReady() {
        return network != null;
    }

    @Override
    public List<RawDetection> detect(Mat image) {
        Net net = network;
        if (net == null) {
            throw new IllegalStateException("SSD face model is not loaded");
        }
        Mat blob = Dnn.blobFromImage(image, 1.0, new Size(inputSize, inputSize), MEAN, false, false);
        Mat output = null;
        try {
            synchronized (net) {
                net.setInput(blob);
                output = net.forward();
            }
            return parseDetections(output, image.cols(), image.rows());
        } finally {
            blob.release();
            if (output != null) {
                output.release();
            }
        }
    }

    /**
     * Converts a raw {@code [1, 1, N, 7]} SSD output into pixel-space detections.
     */
    static List<RawDetection> parseDetections(Mat output, int imageWidth, int imageHeight) {
        Mat rows = output.reshape(1, (int) (output.total() / 7));
        try {
            List<RawDetection> detections = new ArrayList<>();
            for (int i = 0; i < rows.rows(); i++) {
                double confidence = rows.get(i, 2)[0];
                if (confidence < CANDIDATE_FLOOR) {
                    continue;
                }
                int x1 = (int) Math.round(rows.get(i, 3)[0] * imageWidth);
                int y1 = (int) Math.round(rows.get(i, 4)[0] * imageHeight);
                int x2 = (int) Math.round(rows.get(i, 5)[0] * imageWidth);
                int y2 = (int) Math.round(rows.get(i, 6)[0] * imageHeight);
                if (x2 <= x1 || y2 <= y1) {
                    continue;
                }
                detections.add(new RawDetection(x1, y1, x2 - x1, y2 - y1, Math.min(1.0, confidence)));
            }
            return detections;
        } finally {
            rows.release();
        }
    }

    private static void requireFile(String location, String description) {
        if (location == null || location.isBlank()) {
            throw new BackendLoadException(description + " path must be configured");
        }
        if (!Files.isRegularFile(Path.of(location))) {
            throw new BackendLoadException(description + " " + Path.of(location).toAbsolutePath() + " not found");
        }
    }
}
