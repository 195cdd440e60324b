package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Normalized transactions to analyze, with optional period window and entity filter")
public class AnalysisRequest {

    @Schema(description = "Normalized ledger rows")
    private List<LedgerTransaction> transactions;

    @Schema(description = "First period to include (inclusive)", example = "2023-01", type = "string")
    private YearMonth from;

    @Schema(description = "Last period to include (inclusive)", example = "2024-12", type = "string")
    private YearMonth to;

    @Schema(description = "Only analyze rows of this entity", example = "BG01")
    private String entity;

    @Schema(description = "Overall time budget in milliseconds; buckets not started in time are skipped", example = "30000")
    private Long deadlineMs;
}
