package com.finreview.anomaly.model;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;

@Value
public class SeriesBuildResult {
    List<YearMonth> calendar;
    List<BucketSeries> series;
    List<ExcludedBucket> excluded;
    int droppedRows;
}
