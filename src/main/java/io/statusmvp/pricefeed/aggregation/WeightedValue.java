package io.statusmvp.pricefeed.aggregation;

import java.math.BigDecimal;

public record WeightedValue(String sourceId, BigDecimal value, int weight) {}
