package com.example.privacyguard.service.backend;

import com.example.privacyguard.model.DetectionCategory;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the backend chain of every capability and resolves the serving backend on first use.
 * Each capability is loaded at most once: the first caller loads under a per-capability lock,
 * later callers read the resolved backend without locking. Load failures never escape; a
 * capability whose backends all fail stays {@link CapabilityState#UNAVAILABLE} and yields no
 * detections.
 */
public class ModelBackendAdapter {

    private static final Logger log = LoggerFactory.getLogger(ModelBackendAdapter.class);

    private final Map<DetectionCategory, CapabilitySlot> slots = new EnumMap<>(DetectionCategory.class);

    public ModelBackendAdapter(Map<DetectionCategory, BackendChain> chains) {
        for (DetectionCategory category : DetectionCategory.values()) {
            BackendChain chain = chains.getOrDefault(category, BackendChain.empty());
            slots.put(category, new CapabilitySlot(category, chain));
        }
    }

    public BackendDetections detect(Mat image, DetectionCategory category) {
        Objects.requireNonNull(image, "image must not be null");
        DetectorBackend backend = slot(category).resolve();
        if (backend == null) {
            return BackendDetections.unavailable();
        }
        try {
            List<RawDetection> detections = backend.detect(image);
            return new BackendDetections(backend.name(), backend.confidenceBand(), detections);
        } catch (BackendInferenceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new BackendInferenceException(
                    "Backend " + backend.name() + " failed during " + category.value() + " detection", ex);
        }
    }

    public boolean isReady(DetectionCategory category) {
        DetectorBackend backend = slot(category).resolve();
        return backend != null && backend.isReady();
    }

    /**
     * @return current state without triggering a load
     */
    public CapabilityState capabilityState(DetectionCategory category) {
        return slot(category).state;
    }

    /**
     * @return name of the serving backend, or {@code null} while unloaded or unavailable
     */
    public String activeBackendName(DetectionCategory category) {
        DetectorBackend active = slot(category).active;
        return active != null ? active.name() : null;
    }

    public void warmUp() {
        for (DetectionCategory category : DetectionCategory.values()) {
            slot(category).resolve();
        }
    }

    private CapabilitySlot slot(DetectionCategory category) {
        return slots.get(Objects.requireNonNull(category, "category must not be null"));
    }

    /**
     * Ordered providers for one capability. Either slot may be {@code null} when disabled.
     */
    public record BackendChain(DetectorBackend primary, DetectorBackend fallback) {

        public static BackendChain empty() {
            return new BackendChain(null, null);
        }
    }

    private static final class CapabilitySlot {

        private final DetectionCategory category;
        private final BackendChain chain;
        private final Object lock = new Object();
        private volatile DetectorBackend active;
        private volatile CapabilityState state = CapabilityState.UNLOADED;

        private CapabilitySlot(DetectionCategory category, BackendChain chain) {
            this.category = category;
            this.chain = chain;
        }

        private DetectorBackend resolve() {
            if (state != CapabilityState.UNLOADED) {
                return active;
            }
            synchronized (lock) {
                if (state == CapabilityState.UNLOADED) {
                    load();
                }
                return active;
            }
        }

        private void load() {
            List<DetectorBackend> candidates = new ArrayList<>(2);
            if (chain.primary() != null) {
                candidates.add(chain.primary());
            }
            if (chain.fallback() != null) {
                candidates.add(chain.fallback());
            }
            for (DetectorBackend candidate : candidates) {
                if (tryLoad(candidate)) {
                    active = candidate;
                    state = candidate == chain.primary() ? CapabilityState.LOADED_PRIMARY : CapabilityState.LOADED_FALLBACK;
                    log.info("Capability {} served by {} ({})", category.value(), candidate.name(), state);
                    return;
                }
            }
            state = CapabilityState.UNAVAILABLE;
            log.warn("No backend could be loaded for capability {}. Detection for it will return no regions.",
                    category.value());
        }

        private boolean tryLoad(DetectorBackend candidate) {
            try {
                candidate.load();
                if (!candidate.isReady()) {
                    log.warn("Backend {} for {} reported not ready after loading", candidate.name(), category.value());
                    return false;
                }
                return true;
            } catch (BackendLoadException ex) {
                log.warn("Backend {} for {} failed to load: {}", candidate.name(), category.value(), ex.getMessage());
                return false;
            } catch (RuntimeException ex) {
                log.warn("Backend {} for {} failed to load", candidate.name(), category.value(), ex);
                return false;
            }
        }
    }
}
