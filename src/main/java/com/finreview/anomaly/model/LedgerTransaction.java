package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A normalized ledger row, already currency- and sign-normalized by the loader")
public class LedgerTransaction {

    @Schema(description = "Optional source document or line identifier", example = "FAGL-2024-000123")
    private String transactionId;

    @Schema(description = "Reporting bucket (mapped GL category)", example = "OPEX - Marketing")
    private String bucket;

    @Schema(description = "Legal entity / company code. Only used when entity partitioning is enabled.", example = "BG01")
    private String entity;

    @Schema(description = "Bucket class from the mapping table", example = "opex")
    private String type;

    @Schema(description = "Reporting period (year-month)", example = "2024-03", type = "string", format = "yyyy-MM")
    private YearMonth period;

    @Schema(description = "Signed amount in reporting currency", example = "12500.00")
    private double amount;

    @Schema(description = "Counterparty (vendor/customer) or sub-account. May be absent.", example = "ACME Media Ltd")
    private String counterparty;
}
