package com.example.privacyguard.util;

import nu.pattern.OpenCV;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native libraries bundled with the openpnp distribution exactly once per JVM.
 */
public final class OpenCvRuntime {

    private static final Logger log = LoggerFactory.getLogger(OpenCvRuntime.class);

    private static volatile boolean loaded;

    private OpenCvRuntime() {
    }

    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvRuntime.class) {
            if (!loaded) {
                OpenCV.loadLocally();
                loaded = true;
                log.info("Loaded OpenCV native libraries");
            }
        }
    }
}
