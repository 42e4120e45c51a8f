package com.example.privacyguard.config;

import com.example.privacyguard.model.DetectionCategory;
import com.example.privacyguard.service.backend.ContourPlateBackend;
import com.example.privacyguard.service.backend.DetectorBackend;
import com.example.privacyguard.service.backend.HaarCascadeFaceBackend;
import com.example.privacyguard.service.backend.ModelBackendAdapter;
import com.example.privacyguard.service.backend.ModelBackendAdapter.BackendChain;
import com.example.privacyguard.service.backend.SsdFaceBackend;
import com.example.privacyguard.service.backend.YoloPlateBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the backend chain of each capability: a learned primary and a classical fallback. Nothing
 * is loaded here; models are read on first use unless {@code privacy-guard.warm-up} is set.
 */
@Configuration
public class DetectorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfiguration.class);

    @Bean
    public ModelBackendAdapter modelBackendAdapter(PrivacyGuardProperties properties) {
        PrivacyGuardProperties.Face face = properties.getFace();
        PrivacyGuardProperties.Plate plate = properties.getPlate();

        DetectorBackend facePrimary = face.isPrimaryEnabled()
                ? new SsdFaceBackend(face.getSsdConfigPath(), face.getSsdModelPath(), face.getSsdInputSize(),
                face.getSsdBand().toConfidenceBand())
                : null;
        DetectorBackend faceFallback = face.isFallbackEnabled()
                ? new HaarCascadeFaceBackend(face.getCascadePath(), face.getCascadeBand().toConfidenceBand())
                : null;
        DetectorBackend platePrimary = plate.isPrimaryEnabled()
                ? new YoloPlateBackend(plate.getYoloModelPath(), plate.getYoloInputSize(), plate.isYoloObjectness(),
                plate.getNmsThreshold(), plate.getYoloBand().toConfidenceBand())
                : null;
        DetectorBackend plateFallback = plate.isFallbackEnabled()
                ? new ContourPlateBackend(plate.getContourBand().toConfidenceBand())
                : null;

        Map<DetectionCategory, BackendChain> chains = new EnumMap<>(DetectionCategory.class);
        chains.put(DetectionCategory.FACE, new BackendChain(facePrimary, faceFallback));
        chains.put(DetectionCategory.LICENSE_PLATE, new BackendChain(platePrimary, plateFallback));
        log.info("Configured detector chains: face={}/{}, plate={}/{}", describe(facePrimary), describe(faceFallback),
                describe(platePrimary), describe(plateFallback));
        return new ModelBackendAdapter(chains);
    }

    @Bean
    @ConditionalOnProperty(prefix = "privacy-guard", name = "warm-up", havingValue = "true")
    public ApplicationRunner detectorWarmUp(ModelBackendAdapter adapter) {
        return args -> {
            log.info("Warming up detector backends");
            adapter.warmUp();
        };
    }

    private static String describe(DetectorBackend backend) {
        return backend != null ? backend.name() : "disabled";
    }
}
