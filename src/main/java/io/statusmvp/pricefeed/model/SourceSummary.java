package io.statusmvp.pricefeed.model;

public record SourceSummary(String id, String name, int weight) {}
