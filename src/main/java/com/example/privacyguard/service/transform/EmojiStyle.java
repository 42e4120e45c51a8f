package com.example.privacyguard.service.transform;

import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;
import java.util.Locale;

/**
 * Vector glyphs used by the emoji overlay. Each style draws itself centred on a point with a
 * radius derived from the box; colours are BGR.
 */
public enum EmojiStyle {

    SMILE("smile", "\uD83D\uDE00") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            yellowFace(canvas, cx, cy, radius);
            int eye = Math.max(3, radius / 6);
            Imgproc.circle(canvas, new Point(cx - radius / 3, cy - radius / 4), eye, BLACK, FILLED);
            Imgproc.circle(canvas, new Point(cx + radius / 3, cy - radius / 4), eye, BLACK, FILLED);
            Imgproc.ellipse(canvas, new Point(cx, cy + radius / 6), new Size(radius / 2, radius / 3), 0, 0, 180,
                    BLACK, Math.max(2, radius / 15));
        }
    },
    COOL("cool", "\uD83D\uDE0E") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            yellowFace(canvas, cx, cy, radius);
            int bandY = cy - radius / 4;
            int bandHeight = Math.max(4, radius / 4);
            Imgproc.rectangle(canvas,
                    new Point(cx - radius + radius / 6, bandY - bandHeight / 2),
                    new Point(cx + radius - radius / 6, bandY + bandHeight / 2), BLACK, FILLED);
            Imgproc.ellipse(canvas, new Point(cx, cy + radius / 3), new Size(radius / 3, radius / 6), 0, 0, 180,
                    BLACK, Math.max(2, radius / 15));
        }
    },
    MONKEY("monkey", "\uD83D\uDC35", "\uD83D\uDE48") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            Imgproc.circle(canvas, new Point(cx, cy), radius, new Scalar(80, 130, 200), FILLED);
            Imgproc.circle(canvas, new Point(cx, cy), radius, new Scalar(50, 90, 140), 3);
            Scalar ear = new Scalar(60, 100, 160);
            Imgproc.circle(canvas, new Point(cx - radius, cy - radius / 2), radius / 3, ear, FILLED);
            Imgproc.circle(canvas, new Point(cx + radius, cy - radius / 2), radius / 3, ear, FILLED);
            Scalar hand = new Scalar(100, 160, 220);
            Size handAxes = new Size(radius / 2, radius / 3);
            Imgproc.ellipse(canvas, new Point(cx - radius / 3, cy - radius / 6), handAxes, 0, 0, 360, hand, FILLED);
            Imgproc.ellipse(canvas, new Point(cx + radius / 3, cy - radius / 6), handAxes, 0, 0, 360, hand, FILLED);
        }
    },
    STAR("star", "\u2B50") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            Point[] points = new Point[10];
            for (int i = 0; i < 5; i++) {
                double outer = Math.toRadians(i * 72 - 90);
                double inner = Math.toRadians(i * 72 - 90 + 36);
                points[2 * i] = new Point((int) (cx + radius * 0.95 * Math.cos(outer)),
                        (int) (cy + radius * 0.95 * Math.sin(outer)));
                points[2 * i + 1] = new Point((int) (cx + radius * 0.4 * Math.cos(inner)),
                        (int) (cy + radius * 0.4 * Math.sin(inner)));
            }
            MatOfPoint polygon = new MatOfPoint(points);
            try {
                Imgproc.fillPoly(canvas, List.of(polygon), new Scalar(0, 215, 255));
                Imgproc.polylines(canvas, List.of(polygon), true, new Scalar(0, 165, 200), 2);
            } finally {
                polygon.release();
            }
        }
    },
    HEART("heart", "\u2764") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            Scalar red = new Scalar(0, 0, 220);
            int lobe = radius * 2 / 3;
            Imgproc.circle(canvas, new Point(cx - lobe / 2, cy - lobe / 3), lobe / 2 + 2, red, FILLED);
            Imgproc.circle(canvas, new Point(cx + lobe / 2, cy - lobe / 3), lobe / 2 + 2, red, FILLED);
            MatOfPoint tip = new MatOfPoint(
                    new Point(cx - radius + radius / 6, cy - radius / 6),
                    new Point(cx, cy + radius - radius / 6),
                    new Point(cx + radius - radius / 6, cy - radius / 6));
            try {
                Imgproc.fillPoly(canvas, List.of(tip), red);
            } finally {
                tip.release();
            }
        }
    },
    LOCK("lock", "\uD83D\uDD12") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            int bodyX = cx - radius / 2;
            Point bodyTopLeft = new Point(bodyX, cy);
            Point bodyBottomRight = new Point(bodyX + radius, cy + radius);
            Imgproc.rectangle(canvas, bodyTopLeft, bodyBottomRight, new Scalar(200, 150, 50), FILLED);
            Imgproc.rectangle(canvas, bodyTopLeft, bodyBottomRight, new Scalar(150, 100, 30), 3);
            Imgproc.ellipse(canvas, new Point(cx, cy), new Size(radius / 3, radius / 2), 0, 180, 360,
                    new Scalar(100, 100, 100), Math.max(3, radius / 8));
            Scalar keyhole = new Scalar(50, 50, 50);
            Imgproc.circle(canvas, new Point(cx, cy + radius / 3), Math.max(2, radius / 8), keyhole, FILLED);
            int slot = Math.max(1, radius / 12);
            Imgproc.rectangle(canvas, new Point(cx - slot, cy + radius / 3), new Point(cx + slot, cy + radius * 2 / 3),
                    keyhole, FILLED);
        }
    },
    // No dedicated robot glyph; it renders as the plain disc.
    PLAIN("plain", "robot", "\uD83E\uDD16") {
        @Override
        void draw(Mat canvas, int cx, int cy, int radius) {
            Imgproc.circle(canvas, new Point(cx, cy), radius, new Scalar(0, 200, 255), FILLED);
        }
    };

    private static final int FILLED = -1;
    private static final String VARIATION_SELECTOR = "\uFE0F";
    private static final Scalar BLACK = new Scalar(0, 0, 0);

    private final String key;
    private final List<String> aliases;

    EmojiStyle(String key, String... aliases) {
        this.key = key;
        this.aliases = List.of(aliases);
    }

    public String key() {
        return key;
    }

    abstract void draw(Mat canvas, int cx, int cy, int radius);

    /**
     * Resolves a style key or the emoji character itself (variation selectors ignored). Unknown or
     * missing keys resolve to {@link #PLAIN}.
     */
    public static EmojiStyle fromKey(String key) {
        if (key == null) {
            return PLAIN;
        }
        String normalized = key.replace(VARIATION_SELECTOR, "").trim().toLowerCase(Locale.ROOT);
        for (EmojiStyle style : values()) {
            if (style.key.equals(normalized) || style.aliases.contains(normalized)) {
                return style;
            }
        }
        return PLAIN;
    }

    private static void yellowFace(Mat canvas, int cx, int cy, int radius) {
        Imgproc.circle(canvas, new Point(cx, cy), radius, new Scalar(0, 220, 255), FILLED);
        Imgproc.circle(canvas, new Point(cx, cy), radius, new Scalar(0, 180, 220), 3);
    }
}
