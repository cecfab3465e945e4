package io.statusmvp.pricefeed.model;

public record PolicySummary(
    int thresholdBps,
    int hysteresisBps,
    long minIntervalMs,
    int maxPerMinute,
    String aggregationMethod,
    int minSources,
    boolean requireMajority) {}
