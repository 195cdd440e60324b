package com.finreview.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Counterparty or sub-account explaining part of an anomaly's deviation")
public class Contributor {

    @Schema(description = "Counterparty / sub-account, or the synthetic remainder entry", example = "ACME Media Ltd")
    String name;

    @Schema(description = "Part of the deviation attributed to this contributor", example = "2400.0")
    double amount;

    @Schema(description = "Share of the deviation, in percent", example = "60.0")
    double share;

    @JsonIgnore
    boolean unattributed;
}
