package io.statusmvp.pricefeed.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.statusmvp.pricefeed.gating.GateDecision;
import io.statusmvp.pricefeed.gating.GateOutcome;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class FeedMetrics {
  private final MeterRegistry meterRegistry;
  private final boolean enabled;

  public FeedMetrics(
      MeterRegistry meterRegistry, @Value("${app.metrics.enabled:true}") boolean enabled) {
    this.meterRegistry = meterRegistry;
    this.enabled = enabled;
  }

  public void fetchFailure(String source) {
    if (!enabled) return;
    meterRegistry.counter("feed.fetch.failure", "source", source).increment();
  }

  public void insufficientSources(String symbol) {
    if (!enabled) return;
    meterRegistry.counter("feed.aggregate.insufficient", "symbol", symbol).increment();
  }

  public void gateDecision(GateDecision decision) {
    if (!enabled) return;
    String symbol = decision.symbol();
    meterRegistry
        .counter("feed.gate.outcome", "symbol", symbol, "outcome", decision.outcome().name())
        .increment();
    if (decision.outcome() == GateOutcome.PUBLISHED) {
      meterRegistry.counter("feed.publish.success", "symbol", symbol).increment();
    } else if (decision.outcome() == GateOutcome.PUBLISH_FAILED) {
      meterRegistry.counter("feed.publish.failure", "symbol", symbol).increment();
    }
    if (decision.resynced()) {
      meterRegistry.counter("feed.publish.resync", "symbol", symbol).increment();
    }
  }
}
