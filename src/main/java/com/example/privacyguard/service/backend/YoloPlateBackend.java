package com.example.privacyguard.service.backend;

import com.example.privacyguard.util.OpenCvRuntime;
import org.opencv.core.Core;
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
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * License plate detector running a YOLO ONNX export through the OpenCV DNN module. Handles both
 * the YOLOv8 head layout ({@code [1, 4 + classes, N]}) and the YOLOv5 layout with an objectness
 * column ({@code [1, N, 5 + classes]}).
 */
public class YoloPlateBackend implements DetectorBackend {

    private static final Logger log = LoggerFactory.getLogger(YoloPlateBackend.class);

    // Scores below this are noise for every sensitivity setting.
    private static final double CANDIDATE_FLOOR = 0.05;

    private final String modelPath;
    private final int inputSize;
    private final boolean objectness;
    private final double nmsThreshold;
    private final ConfidenceBand band;
    private volatile Net network;

    public YoloPlateBackend(String modelPath, int inputSize, boolean objectness, double nmsThreshold, ConfidenceBand band) {
        this.modelPath = modelPath;
        this.inputSize = inputSize;
        this.objectness = objectness;
        this.nmsThreshold = nmsThreshold;
        this.band = Objects.requireNonNull(band, "band");
    }

    @Override
    public String name() {
        return "yolo-plate";
    }

    @Override
    public ConfidenceBand confidenceBand() {
        return band;
    }

    @Override
    public void load() {
        if (modelPath == null || modelPath.isBlank()) {
            throw new BackendLoadException("Plate model path must be configured");
        }
        Path path = Path.of(modelPath);
        if (!Files.isRegularFile(path)) {
            throw new BackendLoadException("YOLO plate model " + path.toAbsolutePath() + " not found");
        }
        OpenCvRuntime.ensureLoaded();
        log.info("Loading YOLO plate model from {}", path.toAbsolutePath());
        try {
            Net net = Dnn.readNetFromONNX(modelPath);
            if (net.empty()) {
                throw new BackendLoadException("YOLO plate model " + modelPath + " produced an empty network");
            }
            network = net;
        } catch (CvException ex) {
            throw new BackendLoadException("Unable to read YOLO plate model " + modelPath, ex);
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
            throw new IllegalStateException("YOLO plate model is not loaded");
        }
        Size size = new Size(inputSize, inputSize);
        Mat blob = Dnn.blobFromImage(image, 1.0 / 255.0, size, new Scalar(0, 0, 0), true, false);
        Mat rawResult = null;
        try {
            // The network instance is shared; setInput/forward are not thread safe.
            synchronized (net) {
                net.setInput(blob);
                rawResult = net.forward();
            }
            return applyNms(parseOutput(rawResult, image.cols(), image.rows()), nmsThreshold);
        } finally {
            blob.release();
            if (rawResult != null) {
                rawResult.release();
            }
        }
    }

    /**
     * Converts a raw network output into pixel-space candidates, before NMS. A {@code [1, C, N]}
     * output with fewer channels than anchors is the YOLOv8 layout and gets transposed.
     */
    List<RawDetection> parseOutput(Mat rawResult, int imageWidth, int imageHeight) {
        int first = rawResult.size(1);
        int second = rawResult.size(2);
        Mat reshaped = rawResult.reshape(1, first);
        Mat rows = new Mat();
        try {
            if (first < second) {
                Core.transpose(reshaped, rows);
            } else {
                reshaped.copyTo(rows);
            }
            return decode(rows, imageWidth, imageHeight);
        } finally {
            reshaped.release();
            rows.release();
        }
    }

    private List<RawDetection> decode(Mat rows, int imageWidth, int imageHeight) {
        int channels = rows.cols();
        float[] data = new float[(int) (rows.total() * rows.channels())];
        rows.get(0, 0, data);
        float xFactor = imageWidth / (float) inputSize;
        float yFactor = imageHeight / (float) inputSize;
        int classOffset = objectness ? 5 : 4;
        int classCount = channels - classOffset;

        List<RawDetection> detections = new ArrayList<>();
        for (int i = 0; i < rows.rows(); i++) {
            int offset = i * channels;
            float cx = data[offset];
            float cy = data[offset + 1];
            float w = data[offset + 2];
            float h = data[offset + 3];
            float maxClassScore = classCount > 0 ? 0f : 1f;
            for (int c = 0; c < classCount; c++) {
                maxClassScore = Math.max(maxClassScore, data[offset + classOffset + c]);
            }
            float confidence = objectness ? data[offset + 4] * maxClassScore : maxClassScore;
            if (confidence < CANDIDATE_FLOOR) {
                continue;
            }
            int left = Math.round((cx - w / 2f) * xFactor);
            int top = Math.round((cy - h / 2f) * yFactor);
            int width = Math.round(w * xFactor);
            int height = Math.round(h * yFactor);
            if (width <= 0 || height <= 0) {
                continue;
            }
            detections.add(new RawDetection(left, top, width, height, Math.min(1.0, confidence)));
        }
        return detections;
    }

    static List<RawDetection> applyNms(List<RawDetection> detections, double threshold) {
        if (detections.isEmpty()) {
            return List.of();
        }
        List<Integer> order = new ArrayList<>(detections.size());
        for (int i = 0; i < detections.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer idx) -> detections.get(idx).score()).reversed());
        List<RawDetection> kept = new ArrayList<>();
        boolean[] suppressed = new boolean[detections.size()];
        for (int idx : order) {
            if (suppressed[idx]) {
                continue;
            }
            RawDetection current = detections.get(idx);
            kept.add(current);
            for (int j = 0; j < detections.size(); j++) {
                if (suppressed[j] || j == idx) {
                    continue;
                }
                if (intersectionOverUnion(current, detections.get(j)) > threshold) {
                    suppressed[j] = true;
                }
            }
        }
        return kept;
    }

    private static double intersectionOverUnion(RawDetection a, RawDetection b) {
        int x1 = Math.max(a.x(), b.x());
        int y1 = Math.max(a.y(), b.y());
        int x2 = Math.min(a.x() + a.width(), b.x() + b.width());
        int y2 = Math.min(a.y() + a.height(), b.y() + b.height());
        int intersectionArea = Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
        int union = a.width() * a.height() + b.width() * b.height() - intersectionArea;
        if (union <= 0) {
            return 0d;
        }
        return intersectionArea / (double) union;
    }
}
