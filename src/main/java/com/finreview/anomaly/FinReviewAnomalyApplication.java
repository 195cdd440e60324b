package com.finreview.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinReviewAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinReviewAnomalyApplication.class, args);
    }
}
