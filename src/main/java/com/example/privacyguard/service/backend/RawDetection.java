package com.example.privacyguard.service.backend;

/**
 * Unfiltered backend output in source image pixels. Coordinates may lie partially outside the
 * image; the detection engine clamps them.
 */
public record RawDetection(int x, int y, int width, int height, double score) {
}
