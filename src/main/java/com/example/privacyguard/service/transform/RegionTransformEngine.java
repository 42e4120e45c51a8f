package com.example.privacyguard.service.transform;

import com.example.privacyguard.model.BlurMode;
import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionOptions;
import com.example.privacyguard.service.detection.BoxGeometry;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the selected redaction to every enabled box, in list order, on a copy of the input.
 * Overlapping boxes compose: a later box is transformed on top of the already redacted pixels.
 */
@Service
public class RegionTransformEngine {

    private static final Logger log = LoggerFactory.getLogger(RegionTransformEngine.class);

    /**
     * @return a new image; {@code image} itself is left untouched
     */
    public Mat redact(Mat image, List<BoundingBox> boxes, DetectionOptions options) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Mat result = image.clone();
        int intensity = DetectionOptions.clampPercent(options.intensity());
        EmojiStyle style = EmojiStyle.fromKey(options.emojiKey());
        for (BoundingBox box : boxes) {
            if (!box.enabled()) {
                continue;
            }
            Optional<BoundingBox> clamped = BoxGeometry.clamp(box, result.cols(), result.rows());
            if (clamped.isEmpty()) {
                log.debug("Skipping {} box at ({},{} {}x{}): outside the {}x{} image", box.category().value(),
                        box.x(), box.y(), box.width(), box.height(), result.cols(), result.rows());
                continue;
            }
            BoundingBox region = clamped.get();
            Rect rect = new Rect(region.x(), region.y(), region.width(), region.height());
            applyMode(result, rect, options.blurMode(), intensity, style);
        }
        return result;
    }

    private void applyMode(Mat image, Rect rect, BlurMode mode, int intensity, EmojiStyle style) {
        switch (mode) {
            case GAUSSIAN -> gaussian(image, rect, intensity);
            case PIXELATION -> pixelate(image, rect, intensity);
            case EMOJI -> overlayEmoji(image, rect, intensity, style);
            default -> throw new IllegalArgumentException("Unsupported blur mode " + mode);
        }
    }

    static int gaussianKernelSize(int width, int height, int intensity) {
        int kernel = Math.max(3, (int) Math.floor(Math.min(width, height) * intensity / 100.0));
        return kernel % 2 == 0 ? kernel + 1 : kernel;
    }

    static int extraGaussianPasses(int intensity) {
        return intensity > 50 ? (intensity - 50) / 25 + 1 : 0;
    }

    static int pixelBlockSize(int width, int height, int intensity) {
        return Math.max(2, (int) Math.floor(Math.min(width, height) * intensity / 100.0 / 4.0));
    }

    private void gaussian(Mat image, Rect rect, int intensity) {
        int kernel = gaussianKernelSize(rect.width, rect.height, intensity);
        Size kernelSize = new Size(kernel, kernel);
        // Work on a detached copy so the filter border never samples pixels outside the region.
        Mat region = image.submat(rect).clone();
        Mat blurred = new Mat();
        try {
            Imgproc.GaussianBlur(region, blurred, kernelSize, 0);
            int passes = extraGaussianPasses(intensity);
            for (int i = 0; i < passes; i++) {
                Imgproc.GaussianBlur(blurred, blurred, kernelSize, 0);
            }
            writeBack(image, rect, blurred);
        } finally {
            region.release();
            blurred.release();
        }
    }

    private void pixelate(Mat image, Rect rect, int intensity) {
        int block = pixelBlockSize(rect.width, rect.height, intensity);
        Size reduced = new Size(Math.max(1, rect.width / block), Math.max(1, rect.height / block));
        Mat region = image.submat(rect).clone();
        Mat small = new Mat();
        Mat blocks = new Mat();
        try {
            Imgproc.resize(region, small, reduced, 0, 0, Imgproc.INTER_LINEAR);
            Imgproc.resize(small, blocks, new Size(rect.width, rect.height), 0, 0, Imgproc.INTER_NEAREST);
            writeBack(image, rect, blocks);
        } finally {
            region.release();
            small.release();
            blocks.release();
        }
    }

    private void overlayEmoji(Mat image, Rect rect, int intensity, EmojiStyle style) {
        double alpha = intensity / 100.0;
        if (alpha <= 0.0) {
            return;
        }
        // The glyph is drawn on a box-sized canvas, so strokes past the box edge are clipped.
        Mat region = image.submat(rect);
        Mat overlay = region.clone();
        try {
            int radius = Math.min(rect.width, rect.height) / 2;
            style.draw(overlay, rect.width / 2, rect.height / 2, radius);
            Core.addWeighted(overlay, alpha, region, 1.0 - alpha, 0, region);
        } finally {
            overlay.release();
            region.release();
        }
    }

    private static void writeBack(Mat image, Rect rect, Mat pixels) {
        Mat target = image.submat(rect);
        try {
            pixels.copyTo(target);
        } finally {
            target.release();
        }
    }
}
