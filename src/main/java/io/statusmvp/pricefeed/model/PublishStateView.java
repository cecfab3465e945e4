package io.statusmvp.pricefeed.model;

import java.time.Instant;

public record PublishStateView(
    String symbol,
    long lastRoundId,
    long lastPublishedPrice,
    Instant lastPublishedAt,
    Instant pendingSince,
    int publishesLastMinute) {}
