package io.statusmvp.pricefeed.aggregation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Median of the observations with each value counted {@code weight} times. An even total weight
 * averages the two middle values.
 */
public class WeightedMedianCombiner implements PriceCombiner {

  @Override
  public BigDecimal combine(List<WeightedValue> values) {
    List<WeightedValue> sorted = new ArrayList<>(values);
    sorted.sort(Comparator.comparing(WeightedValue::value));
    long total = 0;
    for (WeightedValue v : sorted) total += v.weight();

    if (total % 2 == 1) {
      return valueAt(sorted, total / 2);
    }
    BigDecimal lower = valueAt(sorted, total / 2 - 1);
    BigDecimal upper = valueAt(sorted, total / 2);
    return lower.add(upper).divide(BigDecimal.valueOf(2), MathContext.DECIMAL128);
  }

  /** Value at zero-based position {@code k} of the weight-expanded sorted list. */
  private static BigDecimal valueAt(List<WeightedValue> sorted, long k) {
    long cumulative = 0;
    for (WeightedValue v : sorted) {
      cumulative += v.weight();
      if (k < cumulative) return v.value();
    }
    return sorted.get(sorted.size() - 1).value();
  }
}
