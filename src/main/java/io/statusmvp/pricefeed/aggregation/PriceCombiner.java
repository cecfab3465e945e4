package io.statusmvp.pricefeed.aggregation;

import io.statusmvp.pricefeed.feed.AggregationSettings;
import java.math.BigDecimal;
import java.util.List;

/** Combines successful observations of one feed into a single value. Implementations are stateless. */
public interface PriceCombiner {

  /** {@code values} is never empty and every weight is at least 1. */
  BigDecimal combine(List<WeightedValue> values);

  static PriceCombiner forMethod(AggregationSettings.Method method) {
    if (method == AggregationSettings.Method.WEIGHTED_MEDIAN) return new WeightedMedianCombiner();
    return new WeightedMeanCombiner();
  }
}
