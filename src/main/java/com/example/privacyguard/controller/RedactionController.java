package com.example.privacyguard.controller;

import com.example.privacyguard.config.PrivacyGuardProperties;
import com.example.privacyguard.model.BatchResult;
import com.example.privacyguard.model.BlurMode;
import com.example.privacyguard.model.DetectionCategory;
import com.example.privacyguard.model.DetectionOptions;
import com.example.privacyguard.model.HealthResponse;
import com.example.privacyguard.model.HealthResponse.CapabilityStatus;
import com.example.privacyguard.model.ImageUpload;
import com.example.privacyguard.model.ProcessingResponse;
import com.example.privacyguard.service.BatchOrchestrator;
import com.example.privacyguard.service.backend.CapabilityState;
import com.example.privacyguard.service.backend.ModelBackendAdapter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Redaction", description = "Face and license plate redaction endpoints")
public class RedactionController {

    private static final Logger log = LoggerFactory.getLogger(RedactionController.class);

    private final BatchOrchestrator orchestrator;
    private final ModelBackendAdapter backends;
    private final PrivacyGuardProperties properties;

    public RedactionController(BatchOrchestrator orchestrator, ModelBackendAdapter backends,
                               PrivacyGuardProperties properties) {
        this.orchestrator = orchestrator;
        this.backends = backends;
        this.properties = properties;
    }

    @Operation(
            summary = "Redact faces and license plates in uploaded images",
            description = "Accepts one or more images, detects privacy-sensitive regions and returns the redacted images.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Images processed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ProcessingResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
    })
    @PostMapping(value = "/redact", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProcessingResponse> redact(
            @Parameter(description = "Images to redact (jpg, jpeg, png, webp)", required = true)
            @RequestPart("files") List<MultipartFile> files,
            @Parameter(description = "gaussian, pixelation or emoji")
            @RequestParam(value = "blurMode", defaultValue = "gaussian") String blurMode,
            @Parameter(description = "Redaction strength, 0-100")
            @RequestParam(value = "blurIntensity", defaultValue = "80") int blurIntensity,
            @RequestParam(value = "detectFaces", defaultValue = "true") boolean detectFaces,
            @RequestParam(value = "detectPlates", defaultValue = "true") boolean detectPlates,
            @Parameter(description = "Detection sensitivity, 0-100; higher finds more regions")
            @RequestParam(value = "sensitivity", defaultValue = "60") int sensitivity,
            @Parameter(description = "Emoji style: smile, cool, robot, monkey, star, heart, lock or plain")
            @RequestParam(value = "emojiKey", required = false) String emojiKey,
            @Parameter(description = "Emoji character, used when emojiKey is absent")
            @RequestParam(value = "emoji", required = false) String emoji) {
        if (CollectionUtils.isEmpty(files)) {
            throw new ResponseStatusException(BAD_REQUEST, "No files provided");
        }
        int maxBatchSize = properties.getUpload().getMaxBatchSize();
        if (files.size() > maxBatchSize) {
            throw new ResponseStatusException(BAD_REQUEST, "Maximum " + maxBatchSize + " images per batch allowed");
        }

        DetectionOptions options = new DetectionOptions(BlurMode.fromValue(blurMode), blurIntensity, detectFaces,
                detectPlates, sensitivity, StringUtils.hasText(emojiKey) ? emojiKey : emoji);
        BatchResult batch = orchestrator.processBatch(readUploads(files), options);
        if (batch.results().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "No valid images to process");
        }
        return ResponseEntity.ok(new ProcessingResponse(
                true,
                "Successfully processed " + batch.results().size() + " image(s)",
                batch.results(),
                batch.totalProcessingTimeMs(),
                batch.results().size(),
                batch.totalDetections()));
    }

    @GetMapping("/health")
    @Operation(summary = "Retrieve service health and detector state")
    public ResponseEntity<HealthResponse> health() {
        List<CapabilityStatus> capabilities = Arrays.stream(DetectionCategory.values())
                .map(category -> new CapabilityStatus(category, backends.capabilityState(category).name(),
                        backends.activeBackendName(category)))
                .collect(Collectors.toList());
        boolean modelsLoaded = Arrays.stream(DetectionCategory.values())
                .map(backends::capabilityState)
                .allMatch(state -> state == CapabilityState.LOADED_PRIMARY || state == CapabilityState.LOADED_FALLBACK);
        return ResponseEntity.ok(new HealthResponse("healthy", properties.getVersion(), modelsLoaded, capabilities));
    }

    private List<ImageUpload> readUploads(List<MultipartFile> files) {
        List<ImageUpload> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            try {
                uploads.add(new ImageUpload(file.getBytes(), file.getOriginalFilename()));
            } catch (IOException ex) {
                log.error("Error reading file {}", file.getOriginalFilename(), ex);
            }
        }
        return uploads;
    }
}
