package io.statusmvp.pricefeed.config;

import io.statusmvp.pricefeed.aggregation.Aggregator;
import io.statusmvp.pricefeed.aggregation.PriceCombiner;
import io.statusmvp.pricefeed.attestation.AttestationProvider;
import io.statusmvp.pricefeed.error.ConfigException;
import io.statusmvp.pricefeed.feed.FeedConfigLoader;
import io.statusmvp.pricefeed.feed.FeedsConfig;
import io.statusmvp.pricefeed.gating.PublishGate;
import io.statusmvp.pricefeed.ledger.LedgerPublishAdapter;
import io.statusmvp.pricefeed.ledger.PriceLedger;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/** Builds the engine from the feed document. An invalid document stops the context from starting. */
@Configuration
public class FeedEngineConfig {
  private static final Logger log = LoggerFactory.getLogger(FeedEngineConfig.class);

  @Bean
  public FeedsConfig feedsConfig(FeedProperties properties, ResourceLoader resources) {
    String location = properties.getConfigLocation();
    Resource resource = resources.getResource(location);
    String raw;
    try (InputStream in = resource.getInputStream()) {
      raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigException("document", -1, "cannot read feed document at " + location, e);
    }
    FeedsConfig config = new FeedConfigLoader().load(raw);
    log.info(
        "loaded feed document {} from {}: {} sources, {} feeds ({} enabled), tick={}",
        config.version(),
        location,
        config.sources().size(),
        config.feeds().size(),
        config.enabledFeeds().size(),
        config.updateInterval());
    return config;
  }

  @Bean
  public Aggregator aggregator(FeedsConfig feedsConfig, Clock clock) {
    return new Aggregator(
        PriceCombiner.forMethod(feedsConfig.aggregation().method()), feedsConfig.aggregation(), clock);
  }

  @Bean
  public LedgerPublishAdapter ledgerPublishAdapter(PriceLedger ledger, AttestationProvider attestation) {
    return new LedgerPublishAdapter(ledger, attestation);
  }

  @Bean
  public PublishGate publishGate(
      FeedsConfig feedsConfig, PriceLedger ledger, LedgerPublishAdapter adapter, Clock clock) {
    return new PublishGate(feedsConfig.publishPolicy(), ledger, adapter, clock);
  }
}
