package com.example.privacyguard.service.backend;

import com.example.privacyguard.util.OpenCvRuntime;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfInt;
import org.opencv.core.MatOfRect;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classical face detector built on an OpenCV Haar cascade. A cascade has no probabilistic output,
 * so the number of merged neighbour hits of each rectangle is squashed into [0,1] and used as
 * its score. That score is not comparable with the SSD confidence, which is why this backend has
 * its own band.
 */
public class HaarCascadeFaceBackend implements DetectorBackend {

    private static final Logger log = LoggerFactory.getLogger(HaarCascadeFaceBackend.class);

    // Neighbour count at which the score reaches 0.5.
    private static final double NEIGHBOUR_MIDPOINT = 5.0;

    private final String cascadePath;
    private final ConfidenceBand band;
    private volatile CascadeClassifier classifier;

    public HaarCascadeFaceBackend(String cascadePath, ConfidenceBand band) {
        this.cascadePath = cascadePath;
        this.band = Objects.requireNonNull(band, "band");
    }

    @Override
    public String name() {
        return "haar-face";
    }

    @Override
    public ConfidenceBand confidenceBand() {
        return band;
    }

    @Override
    public void load() {
        if (cascadePath == null || cascadePath.isBlank()) {
            throw new BackendLoadException("Haar cascade path must be configured");
        }
        Path path = Path.of(cascadePath);
        if (!Files.isRegularFile(path)) {
            throw new BackendLoadException("Haar cascade " + path.toAbsolutePath() + " not found");
        }
        OpenCvRuntime.ensureLoaded();
        CascadeClassifier loaded;
        try {
            loaded = new CascadeClassifier(path.toString());
        } catch (CvException ex) {
            throw new BackendLoadException("Unable to read Haar cascade " + path.toAbsolutePath(), ex);
        }
        if (loaded.empty()) {
            throw new BackendLoadException("Haar cascade " + path.toAbsolutePath() + " could not be parsed");
        }
        log.info("Loaded Haar cascade from {}", path.toAbsolutePath());
        classifier = loaded;
    }

    @Override
    public boolean isReady() {
        return classifier != null;
    }

    @Override
    public List<RawDetection> detect(Mat image) {
        CascadeClassifier current = classifier;
        if (current == null) {
            throw new IllegalStateException("Haar cascade is not loaded");
        }
        Mat gray = new Mat();
        MatOfRect faces = new MatOfRect();
        MatOfInt neighbours = new MatOfInt();
        try {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.equalizeHist(gray, gray);
            int minSide = Math.max(24, Math.min(image.cols(), image.rows()) / 40);
            synchronized (current) {
                current.detectMultiScale2(gray, faces, neighbours, 1.1, 1, 0, new Size(minSide, minSide), new Size());
            }
            Rect[] rects = faces.toArray();
            int[] counts = neighbours.toArray();
            List<RawDetection> detections = new ArrayList<>(rects.length);
            for (int i = 0; i < rects.length; i++) {
                int count = i < counts.length ? counts[i] : 1;
                detections.add(new RawDetection(rects[i].x, rects[i].y, rects[i].width, rects[i].height, score(count)));
            }
            return detections;
        } finally {
            gray.release();
            faces.release();
            neighbours.release();
        }
    }

    static double score(int neighbourCount) {
        if (neighbourCount <= 0) {
            return 0.0;
        }
        return neighbourCount / (neighbourCount + NEIGHBOUR_MIDPOINT);
    }
}
