package com.finreview.anomaly.model;

import java.time.YearMonth;

/**
 * One reporting period of a bucket series. Periods without activity are
 * present with amount 0 and count 0.
 */
public record PeriodPoint(YearMonth period, double amount, int transactionCount) {}
