package io.statusmvp.pricefeed.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Latest aggregated price per feed. Always kept in memory; optionally mirrored into Redis under
 * {@code price:feed:<SYMBOL>} for readers outside this process.
 */
@Component
public class LatestPriceStore {
  private static final Logger log = LoggerFactory.getLogger(LatestPriceStore.class);
  static final String KEY_PREFIX = "price:feed:";

  private final ConcurrentMap<String, AggregatedPrice> latest = new ConcurrentHashMap<>();
  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final long ttlSeconds;

  @Autowired
  public LatestPriceStore(
      ObjectProvider<StringRedisTemplate> redisProvider,
      ObjectMapper mapper,
      @Value("${app.cache.redis-enabled:false}") boolean redisEnabled,
      @Value("${app.cache.latest-price-ttl-seconds:120}") long ttlSeconds) {
    this(redisEnabled ? redisProvider.getIfAvailable() : null, mapper, ttlSeconds);
  }

  LatestPriceStore(StringRedisTemplate redis, ObjectMapper mapper, long ttlSeconds) {
    this.redis = redis;
    this.mapper = mapper;
    this.ttlSeconds = ttlSeconds;
  }

  public void record(AggregatedPrice price) {
    if (price == null) return;
    latest.put(price.symbol(), price);
    if (redis == null) return;
    try {
      redis
          .opsForValue()
          .set(
              KEY_PREFIX + price.symbol(),
              mapper.writeValueAsString(price),
              Duration.ofSeconds(Math.max(1, ttlSeconds)));
    } catch (Exception e) {
      log.debug("redis mirror failed symbol={}: {}", price.symbol(), e.getMessage());
    }
  }

  public Optional<AggregatedPrice> get(String symbol) {
    AggregatedPrice local = latest.get(symbol);
    if (local != null || redis == null) return Optional.ofNullable(local);
    try {
      String raw = redis.opsForValue().get(KEY_PREFIX + symbol);
      if (raw == null || raw.isBlank()) return Optional.empty();
      return Optional.of(mapper.readValue(raw, AggregatedPrice.class));
    } catch (JsonProcessingException e) {
      log.debug("unreadable redis price symbol={}: {}", symbol, e.getMessage());
      return Optional.empty();
    } catch (Exception e) {
      log.debug("redis read failed symbol={}: {}", symbol, e.getMessage());
      return Optional.empty();
    }
  }

  public List<AggregatedPrice> all() {
    return latest.values().stream().sorted(Comparator.comparing(AggregatedPrice::symbol)).toList();
  }
}
