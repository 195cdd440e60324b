package com.finreview.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finreview.anomaly.config.DetectionConfig;
import com.finreview.anomaly.config.DetectionSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
@Import(DetectionConfig.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private DetectionConfig detectionConfig;

    @AfterEach
    void resetConfig() {
        detectionConfig.apply(DetectionSettings.defaults());
    }

    @Test
    void getDetectionConfig_returnsDefaults() throws Exception {
        mockMvc.perform(get("/api/v1/config/detection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.zscoreThreshold").value(3.0))
                .andExpect(jsonPath("$.madMinWindow").value(6))
                .andExpect(jsonPath("$.isolationEnabled").value(true))
                .andExpect(jsonPath("$.isolationContamination").value(0.1))
                .andExpect(jsonPath("$.maxContributors").value(5));
    }

    @Test
    void updateDetectionConfig_success() throws Exception {
        mockMvc.perform(put("/api/v1/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "zscoreThreshold", 2.5,
                                "isolationEnabled", false,
                                "minNonZeroPeriods", 4
                        ))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.zscoreThreshold").value(2.5))
                .andExpect(jsonPath("$.isolationEnabled").value(false))
                .andExpect(jsonPath("$.madThreshold").value(3.0));

        assertThat(detectionConfig.getZscore().getThreshold()).isEqualTo(2.5);
        assertThat(detectionConfig.getIsolation().isEnabled()).isFalse();
        assertThat(detectionConfig.getSeries().getMinNonZeroPeriods()).isEqualTo(4);
    }

    @Test
    void updateDetectionConfig_contaminationOutOfRange_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("isolationContamination", 0.9))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("isolation.contamination"));

        assertThat(detectionConfig.getIsolation().getContamination()).isEqualTo(0.10);
    }

    @Test
    void updateDetectionConfig_windowTooSmall_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("zscoreMinWindow", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("zscore.min-window"));
    }

    @Test
    void updateDetectionConfig_negativeThreshold_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("madThreshold", -2))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("mad.threshold"));
    }
}
