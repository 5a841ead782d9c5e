package com.intelhub.backend.pipeline;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.ValidationException;
import com.intelhub.backend.vector.EmbeddingIndexer;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StagingService stagingService;

    @MockitoBean
    private ThresholdSettings thresholdSettings;

    @MockitoBean
    private EmbeddingIndexer embeddingIndexer;

    @MockitoBean
    private PipelineStatisticsService statisticsService;

    @MockitoBean
    private PipelineDispatcher pipelineDispatcher;

    private final UUID uuid = UUID.fromString("0f8e2c1a-3b4d-4e5f-8a9b-1c2d3e4f5a6b");

    @Test
    void retry_shouldRequeueFailedItem() throws Exception {
        mockMvc.perform(post("/api/pipeline/items/{uuid}/retry", uuid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(stagingService).operatorRetry(uuid);
    }

    @Test
    void retry_shouldReturnNotFound_whenItemUnknown() throws Exception {
        doThrow(new ItemNotFoundException(uuid)).when(stagingService).operatorRetry(uuid);

        mockMvc.perform(post("/api/pipeline/items/{uuid}/retry", uuid))
                .andExpect(status().isNotFound());
    }

    @Test
    void setThreshold_shouldReturnPreviousAndCurrent() throws Exception {
        when(thresholdSettings.update(7.5)).thenReturn(6.0);
        when(thresholdSettings.current()).thenReturn(7.5);

        mockMvc.perform(put("/api/pipeline/threshold")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"threshold\":7.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previous").value(6.0))
                .andExpect(jsonPath("$.threshold").value(7.5));
    }

    @Test
    void setThreshold_shouldReturnBadRequest_whenMissing() throws Exception {
        mockMvc.perform(put("/api/pipeline/threshold")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(thresholdSettings, never()).update(anyDouble());
    }

    @Test
    void setThreshold_shouldReturnBadRequest_whenOutOfRange() throws Exception {
        when(thresholdSettings.update(12.0))
                .thenThrow(new ValidationException("threshold", 12.0, "Threshold must be greater than 0 and at most 10"));

        mockMvc.perform(put("/api/pipeline/threshold")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"threshold\":12.0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("threshold"));
    }

    @Test
    void stopDispatcher_shouldReportActiveWorkers() throws Exception {
        when(pipelineDispatcher.isRunning()).thenReturn(false);
        when(pipelineDispatcher.getActiveWorkers()).thenReturn(2);

        mockMvc.perform(post("/api/pipeline/dispatcher/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.activeWorkers").value(2));

        verify(pipelineDispatcher).stop();
    }
}
