package com.finreview.anomaly.controller;

import com.finreview.anomaly.exception.InvalidRequestException;
import com.finreview.anomaly.model.AnalysisRequest;
import com.finreview.anomaly.model.AnomalyReport;
import com.finreview.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Run ensemble anomaly detection over a ledger of bucket/period transactions")
public class AnalysisController {

    private final AnomalyDetectionService detectionService;

    public AnalysisController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Analyze a ledger for anomalous bucket-periods",
            description = "Builds one monthly series per bucket, runs the Z-score, MAD and Isolation Forest " +
                    "detectors on each, merges their findings and attributes every anomaly to the " +
                    "counterparties that drove it. Buckets with too little history are reported separately.")
    @PostMapping("/analyze")
    public ResponseEntity<AnomalyReport> analyze(@RequestBody AnalysisRequest request) {
        if (request.getTransactions() == null || request.getTransactions().isEmpty()) {
            throw new InvalidRequestException("transactions", "transactions must not be empty");
        }
        if (request.getDeadlineMs() != null && request.getDeadlineMs() <= 0) {
            throw new InvalidRequestException("deadlineMs", "deadlineMs must be > 0");
        }

        AnomalyReport report = detectionService.analyze(request);
        return ResponseEntity.ok(report);
    }
}
