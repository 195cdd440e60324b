package com.finreview.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI finReviewAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Financial Review Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Flags reporting periods whose bucket amount deviates from the bucket's own history " +
                                "and explains which counterparties drove the deviation.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit normalized ledger rows via `POST /anomalies/analyze`\n" +
                                "2. Rows are aggregated into one monthly series per bucket (zero months kept explicitly)\n" +
                                "3. Buckets with fewer than 3 active months are reported as insufficient history\n" +
                                "4. Three detectors run per bucket: leave-one-out Z-score, MAD, Isolation Forest\n" +
                                "5. Flags are merged per bucket-period (union), graded for **severity** and **confidence**\n" +
                                "6. The deviation is attributed to the top 5 counterparties plus an `Other` remainder\n\n" +
                                "**Detectors:**\n" +
                                "- `zscore`: |x − mean| / std dev of the other periods\n" +
                                "- `mad`: |x − median| / (1.4826 × MAD) of the other periods\n" +
                                "- `isolation_forest`: joint behavior of amount, count, delta and rolling average")
                        .contact(new Contact().name("Financial Review Team")));
    }
}
