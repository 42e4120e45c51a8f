package com.example.privacyguard.controller;

import com.example.privacyguard.model.BatchResult;
import com.example.privacyguard.model.BlurMode;
import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionCategory;
import com.example.privacyguard.model.DetectionOptions;
import com.example.privacyguard.model.ProcessedResult;
import com.example.privacyguard.service.BatchOrchestrator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RedactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchOrchestrator orchestrator;

    @Test
    void redactReturnsProcessedImages() throws Exception {
        ProcessedResult processed = new ProcessedResult("3f9a1c2e", "street.jpg", "data:image/png;base64,AAAA",
                List.of(new BoundingBox(10, 20, 100, 40, 0.87, DetectionCategory.LICENSE_PLATE)), 12.5);
        when(orchestrator.processBatch(anyList(), any(DetectionOptions.class)))
                .thenReturn(new BatchResult(List.of(processed), 14.25, 1, 0));

        mockMvc.perform(multipart("/api/v1/redact")
                        .file(image("street.jpg"))
                        .param("blurMode", "pixelation")
                        .param("blurIntensity", "150")
                        .param("sensitivity", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.imagesProcessed").value(1))
                .andExpect(jsonPath("$.totalDetections").value(1))
                .andExpect(jsonPath("$.results[0].imageId").value("3f9a1c2e"))
                .andExpect(jsonPath("$.results[0].detections[0].category").value("license_plate"));

        ArgumentCaptor<DetectionOptions> options = ArgumentCaptor.forClass(DetectionOptions.class);
        verify(orchestrator).processBatch(anyList(), options.capture());
        assertThat(options.getValue().blurMode()).isEqualTo(BlurMode.PIXELATION);
        assertThat(options.getValue().intensity()).isEqualTo(100);
        assertThat(options.getValue().sensitivity()).isEqualTo(30);
        assertThat(options.getValue().emojiKey()).isEqualTo("smile");
    }

    @Test
    void emojiCharacterIsAcceptedWhenNoKeyIsGiven() throws Exception {
        ProcessedResult processed = new ProcessedResult("0a1b2c3d", "face.png", "data:image/png;base64,AAAA",
                List.of(), 4.0);
        when(orchestrator.processBatch(anyList(), any(DetectionOptions.class)))
                .thenReturn(new BatchResult(List.of(processed), 5.0, 0, 0));

        mockMvc.perform(multipart("/api/v1/redact")
                        .file(image("face.png"))
                        .param("blurMode", "emoji")
                        .param("emoji", "\uD83E\uDD16"))
                .andExpect(status().isOk());
        mockMvc.perform(multipart("/api/v1/redact")
                        .file(image("face.png"))
                        .param("blurMode", "emoji")
                        .param("emoji", "\uD83E\uDD16")
                        .param("emojiKey", "lock"))
                .andExpect(status().isOk());

        ArgumentCaptor<DetectionOptions> options = ArgumentCaptor.forClass(DetectionOptions.class);
        verify(orchestrator, times(2)).processBatch(anyList(), options.capture());
        assertThat(options.getAllValues()).extracting(DetectionOptions::emojiKey)
                .containsExactly("\uD83E\uDD16", "lock");
    }

    @Test
    void requestWithoutFilesIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/v1/redact"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void oversizedBatchIsRejected() throws Exception {
        MockMultipartHttpServletRequestBuilder request = multipart("/api/v1/redact");
        for (int i = 0; i < 11; i++) {
            request.file(image("image-" + i + ".png"));
        }

        mockMvc.perform(request)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Maximum 10 images per batch allowed"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void batchWithNoUsableImagesIsRejected() throws Exception {
        when(orchestrator.processBatch(anyList(), any(DetectionOptions.class)))
                .thenReturn(new BatchResult(List.of(), 3.0, 0, 1));

        mockMvc.perform(multipart("/api/v1/redact").file(image("broken.png")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No valid images to process"));
    }

    @Test
    void healthReportsCapabilitiesBeforeFirstUse() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.modelsLoaded").value(false))
                .andExpect(jsonPath("$.capabilities.length()").value(2))
                .andExpect(jsonPath("$.capabilities[0].category").value("face"))
                .andExpect(jsonPath("$.capabilities[0].state").value("UNLOADED"));
    }

    private static MockMultipartFile image(String filename) {
        return new MockMultipartFile("files", filename, MediaType.IMAGE_PNG_VALUE, new byte[]{1, 2, 3});
    }
}
