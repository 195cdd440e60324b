package com.finreview.anomaly.controller;

import com.finreview.anomaly.config.DetectionConfig;
import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.exception.ConfigurationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify detection thresholds at runtime")
public class ConfigController {

    private final DetectionConfig detectionConfig;

    public ConfigController(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Get detection thresholds and windows")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        DetectionSettings s = detectionConfig.toSettings();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("zscoreThreshold", s.getZScoreThreshold());
        body.put("zscoreMinWindow", s.getZScoreMinWindow());
        body.put("madThreshold", s.getMadThreshold());
        body.put("madMinWindow", s.getMadMinWindow());
        body.put("isolationEnabled", s.isIsolationEnabled());
        body.put("isolationContamination", s.getIsolationContamination());
        body.put("isolationMinPeriods", s.getIsolationMinPeriods());
        body.put("minNonZeroPeriods", s.getMinNonZeroPeriods());
        body.put("maxContributors", s.getMaxContributors());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update detection thresholds and windows",
            description = "Only the supplied fields change. Changes apply to the next run but reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfig(@RequestBody Map<String, Object> body) {
        DetectionSettings current = detectionConfig.toSettings();
        DetectionSettings updated;
        try {
            updated = current.toBuilder()
                    .zScoreThreshold(toDouble(body, "zscoreThreshold", current.getZScoreThreshold()))
                    .zScoreMinWindow(toInt(body, "zscoreMinWindow", current.getZScoreMinWindow()))
                    .madThreshold(toDouble(body, "madThreshold", current.getMadThreshold()))
                    .madMinWindow(toInt(body, "madMinWindow", current.getMadMinWindow()))
                    .isolationEnabled(toBoolean(body, "isolationEnabled", current.isIsolationEnabled()))
                    .isolationContamination(toDouble(body, "isolationContamination", current.getIsolationContamination()))
                    .isolationMinPeriods(toInt(body, "isolationMinPeriods", current.getIsolationMinPeriods()))
                    .minNonZeroPeriods(toInt(body, "minNonZeroPeriods", current.getMinNonZeroPeriods()))
                    .maxContributors(toInt(body, "maxContributors", current.getMaxContributors()))
                    .build()
                    .validate();
        } catch (ConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }

        detectionConfig.apply(updated);
        return getDetectionConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
