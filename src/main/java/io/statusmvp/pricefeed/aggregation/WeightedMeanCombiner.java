package io.statusmvp.pricefeed.aggregation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/** Sum(value * weight) / Sum(weight). */
public class WeightedMeanCombiner implements PriceCombiner {

  @Override
  public BigDecimal combine(List<WeightedValue> values) {
    BigDecimal weighted = BigDecimal.ZERO;
    long totalWeight = 0;
    for (WeightedValue v : values) {
      weighted = weighted.add(v.value().multiply(BigDecimal.valueOf(v.weight())));
      totalWeight += v.weight();
    }
    return weighted.divide(BigDecimal.valueOf(totalWeight), MathContext.DECIMAL128);
  }
}
