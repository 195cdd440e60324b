package com.finreview.anomaly.seeder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finreview.anomaly.config.DetectionConfig;
import com.finreview.anomaly.model.AnomalyRecord;
import com.finreview.anomaly.model.AnomalyReport;
import com.finreview.anomaly.model.LedgerTransaction;
import com.finreview.anomaly.service.AnomalyDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one analysis over a synthetic ledger at startup and logs the report.
 * Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 */
@Component
@Profile("demo")
public class DemoLedgerSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoLedgerSeeder.class);

    private final AnomalyDetectionService detectionService;
    private final DetectionConfig detectionConfig;
    private final ObjectMapper objectMapper;

    public DemoLedgerSeeder(AnomalyDetectionService detectionService,
                            DetectionConfig detectionConfig,
                            ObjectMapper objectMapper) {
        this.detectionService = detectionService;
        this.detectionConfig = detectionConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("=== Generating demo ledger ===");
        List<LedgerTransaction> ledger = new SampleLedgerGenerator().generate();
        log.info("Generated {} ledger rows over {} months", ledger.size(), SampleLedgerGenerator.MONTHS);

        AnomalyReport report = detectionService.analyze(ledger, detectionConfig.toSettings());

        for (AnomalyRecord anomaly : report.getAnomalies()) {
            log.info("[{}|{}] {} {}: {}", anomaly.getSeverity(), anomaly.getConfidence(),
                    anomaly.getBucket(), anomaly.getPeriod(), anomaly.getExplanation());
        }
        log.info("Demo report:\n{}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        log.info("=== Demo analysis complete: {} anomalies, {} buckets excluded ===",
                report.getAnomalies().size(), report.getInsufficientHistory().size());
    }
}
