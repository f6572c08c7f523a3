package com.metrics.anomaly.controller;

import com.metrics.anomaly.service.ReconstructionModelService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconstructionModelService modelService;

    @Test
    void train_success() throws Exception {
        when(modelService.trainNow("latency")).thenReturn(true);
        when(modelService.getModelMetadata("latency"))
                .thenReturn(Map.of("metricName", "latency", "trainingSamples", 120, "featureCount", 3));

        mockMvc.perform(post("/api/v1/models/latency/train"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricName").value("latency"))
                .andExpect(jsonPath("$.trainingSamples").value(120));
    }

    @Test
    void train_insufficientHistory() throws Exception {
        when(modelService.trainNow("latency")).thenReturn(false);

        mockMvc.perform(post("/api/v1/models/latency/train"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void getModelMetadata_found() throws Exception {
        when(modelService.getModelMetadata("latency"))
                .thenReturn(Map.of("metricName", "latency", "threshold", 1.25));

        mockMvc.perform(get("/api/v1/models/latency"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.threshold").value(1.25));
    }

    @Test
    void getModelMetadata_notFound() throws Exception {
        when(modelService.getModelMetadata("missing")).thenReturn(null);

        mockMvc.perform(get("/api/v1/models/missing"))
                .andExpect(status().isNotFound());
    }
}
