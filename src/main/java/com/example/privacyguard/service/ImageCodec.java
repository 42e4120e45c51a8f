package com.example.privacyguard.service;

import com.example.privacyguard.config.PrivacyGuardProperties;
import com.example.privacyguard.util.OpenCvRuntime;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.Locale;

/**
 * Converts between encoded raster bytes and BGR matrices. Decoding and encoding both go through
 * OpenCV, so the channel order stays BGR from input to output.
 */
@Component
public class ImageCodec {

    private final String format;
    private final int jpegQuality;

    @Autowired
    public ImageCodec(PrivacyGuardProperties properties) {
        this(properties.getOutput().getFormat(), properties.getOutput().getJpegQuality());
    }

    ImageCodec(String format, int jpegQuality) {
        this.format = normalizeFormat(format);
        this.jpegQuality = jpegQuality;
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * @return a 3-channel BGR image owned by the caller
     * @throws ImageDecodeException when the bytes are not a supported raster image
     */
    public Mat decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("Image payload is empty");
        }
        MatOfByte buffer = new MatOfByte(data);
        try {
            Mat image = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
            if (image == null || image.empty()) {
                throw new ImageDecodeException("Failed to decode image");
            }
            return image;
        } catch (CvException ex) {
            throw new ImageDecodeException("Failed to decode image", ex);
        } finally {
            buffer.release();
        }
    }

    public byte[] encode(Mat image) {
        MatOfByte buffer = new MatOfByte();
        MatOfInt params = "jpg".equals(format)
                ? new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, jpegQuality)
                : new MatOfInt();
        try {
            if (!Imgcodecs.imencode("." + format, image, buffer, params)) {
                throw new IllegalStateException("Failed to encode image as " + format);
            }
            return buffer.toArray();
        } finally {
            buffer.release();
            params.release();
        }
    }

    /**
     * @return {@code data:image/<format>;base64,...} ready to embed in HTML or JSON
     */
    public String encodeDataUri(Mat image) {
        String mediaType = "jpg".equals(format) ? "jpeg" : format;
        return "data:image/" + mediaType + ";base64," + Base64.getEncoder().encodeToString(encode(image));
    }

    public String format() {
        return format;
    }

    private static String normalizeFormat(String raw) {
        String normalized = raw == null ? "png" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "jpeg", "jpg" -> "jpg";
            case "png", "webp" -> normalized;
            default -> throw new IllegalArgumentException("Unsupported output format: " + raw);
        };
    }
}
