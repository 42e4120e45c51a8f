package com.example.privacyguard.service.backend;

import org.opencv.core.Mat;

import java.util.List;

/**
 * One concrete detector serving a capability. Learned and classical implementations expose the
 * same contract so the adapter can try them in order without knowing which one serves a request.
 */
public interface DetectorBackend {

    /**
     * @return short identifier used in logs and health output
     */
    String name();

    /**
     * @return threshold band this backend's scores are calibrated against
     */
    ConfidenceBand confidenceBand();

    /**
     * Loads model weights. Called at most once by the adapter.
     *
     * @throws BackendLoadException when the weights are missing or unusable
     */
    void load();

    boolean isReady();

    /**
     * @param image BGR image; never modified
     * @return raw candidates with scores in [0,1]
     */
    List<RawDetection> detect(Mat image);
}
