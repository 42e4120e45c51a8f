package com.example.privacyguard.service.backend;

import com.example.privacyguard.util.OpenCvRuntime;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Weight-free plate finder. Plates show up as dense clusters of vertical strokes, so the
 * horizontal gradient is binarised with Otsu, closed with a wide kernel to merge characters into
 * one blob, and the external contours of plausible size and shape become candidates. The score
 * mixes how well the contour fills its bounding rectangle with the stroke density inside it.
 */
public class ContourPlateBackend implements DetectorBackend {

    private static final Logger log = LoggerFactory.getLogger(ContourPlateBackend.class);

    private static final double MIN_ASPECT = 1.5;
    private static final double MAX_ASPECT = 7.0;
    private static final int MIN_AREA_PIXELS = 300;
    private static final double MIN_AREA_FRACTION = 0.0005;

    private final ConfidenceBand band;
    private volatile boolean ready;

    public ContourPlateBackend(ConfidenceBand band) {
        this.band = Objects.requireNonNull(band, "band");
    }

    @Override
    public String name() {
        return "contour-plate";
    }

    @Override
    public ConfidenceBand confidenceBand() {
        return band;
    }

    @Override
    public void load() {
        OpenCvRuntime.ensureLoaded();
        ready = true;
        log.info("Contour plate finder ready");
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public List<RawDetection> detect(Mat image) {
        if (!ready) {
            throw new IllegalStateException("Contour plate finder is not loaded");
        }
        Mat gray = new Mat();
        Mat filtered = new Mat();
        Mat gradient = new Mat();
        Mat absGradient = new Mat();
        Mat binary = new Mat();
        Mat closed = new Mat();
        Mat hierarchy = new Mat();
        Mat closeKernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(17, 3));
        Mat openKernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.bilateralFilter(gray, filtered, 5, 75, 75);
            Imgproc.Sobel(filtered, gradient, CvType.CV_16S, 1, 0, 3);
            Core.convertScaleAbs(gradient, absGradient);
            Imgproc.threshold(absGradient, binary, 0, 255, Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);
            Imgproc.morphologyEx(binary, closed, Imgproc.MORPH_CLOSE, closeKernel);
            Imgproc.morphologyEx(closed, closed, Imgproc.MORPH_OPEN, openKernel);
            Imgproc.findContours(closed, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

            double minArea = Math.max(MIN_AREA_PIXELS, MIN_AREA_FRACTION * image.cols() * image.rows());
            List<RawDetection> detections = new ArrayList<>();
            for (MatOfPoint contour : contours) {
                Rect rect = Imgproc.boundingRect(contour);
                double area = rect.width * (double) rect.height;
                double aspect = rect.width / (double) rect.height;
                if (area < minArea || aspect < MIN_ASPECT || aspect > MAX_ASPECT) {
                    continue;
                }
                double rectangularity = Imgproc.contourArea(contour) / area;
                Mat strokes = binary.submat(rect);
                double density = Core.countNonZero(strokes) / area;
                strokes.release();
                double score = 0.5 * Math.min(1.0, rectangularity) + 0.5 * Math.min(1.0, density * 2.0);
                detections.add(new RawDetection(rect.x, rect.y, rect.width, rect.height, score));
            }
            log.debug("Contour plate finder produced {} candidates from {} contours", detections.size(), contours.size());
            return detections;
        } finally {
            gray.release();
            filtered.release();
            gradient.release();
            absGradient.release();
            binary.release();
            closed.release();
            hierarchy.release();
            closeKernel.release();
            openKernel.release();
            contours.forEach(Mat::release);
        }
    }
}
