package io.statusmvp.pricefeed.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.statusmvp.pricefeed.feed.DataType;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.SourceSpec;
import io.statusmvp.pricefeed.model.Observation;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class SourceFetcherTest {
  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final FeedSpec BTC =
      new FeedSpec("BTC-USD", "Bitcoin", "", "BTC", "USD", DataType.PRICE, 8, List.of(), true);

  private final Map<String, ClientRequest> requests = new ConcurrentHashMap<>();

  @Test
  void extractsValueFromJsonResponse() {
    SourceFetcher fetcher =
        fetcher(json("{\"symbol\":\"BTCUSDT\",\"price\":\"67012.50000000\"}"), false);
    SourceSpec binance =
        source("binance", "https://api.binance.com/api/v3/ticker/price?symbol={pair}", "price", "{base}{quote}", "USDT");

    Observation o = fetcher.fetch(BTC, binance).block();

    assertTrue(o.isSuccess());
    assertEquals("binance", o.sourceId());
    assertEquals(new BigDecimal("67012.50000000"), o.value());
    assertEquals(NOW, o.fetchedAt());
    assertEquals(
        "https://api.binance.com/api/v3/ticker/price?symbol=BTCUSDT",
        requests.get("binance").url().toString());
  }

  @Test
  void resolvesHeaderValuesFromEnvironment() {
    SourceFetcher fetcher =
        new SourceFetcher(
            client(json("{\"data\":{\"amount\":\"1\"}}")),
            new SourceTargetGuard(false),
            CLOCK,
            4,
            name -> "CB_KEY".equals(name) ? "secret" : null);
    SourceSpec coinbase =
        new SourceSpec(
            "coinbase",
            "Coinbase",
            "https://api.coinbase.com/v2/prices/{base}-{quote}/spot",
            "data.amount",
            1,
            Duration.ofSeconds(5),
            Map.of("X-Api-Key", "${CB_KEY}", "X-Other", "${UNSET}"),
            "",
            "",
            "");

    assertTrue(fetcher.fetch(BTC, coinbase).block().isSuccess());
    HttpHeaders headers = requests.get("coinbase").headers();
    assertEquals("secret", headers.getFirst("X-Api-Key"));
    assertEquals("${UNSET}", headers.getFirst("X-Other"));
  }

  @Test
  void non2xxBecomesFailedObservationWithStatusAndBody() {
    ExchangeFunction exchange =
        request ->
            Mono.just(
                ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                    .body("maintenance")
                    .build());
    SourceFetcher fetcher = fetcher(exchange, false);

    Observation o = fetcher.fetch(BTC, source("okx", "https://www.okx.com/x?instId={pair}", "data.0.last", "", "")).block();

    assertFalse(o.isSuccess());
    assertNull(o.value());
    assertTrue(o.error().contains("HTTP 503"), o.error());
    assertTrue(o.error().contains("maintenance"), o.error());
  }

  @Test
  void timeoutBecomesFailedObservation() {
    SourceFetcher fetcher = fetcher(request -> Mono.never(), false);
    SourceSpec slow =
        new SourceSpec(
            "slow", "slow", "https://slow.example/{pair}", "price", 1, Duration.ofMillis(50), Map.of(), "", "", "");

    Observation o = fetcher.fetch(BTC, slow).block(Duration.ofSeconds(5));

    assertFalse(o.isSuccess());
    assertTrue(o.error().contains("timed out"), o.error());
  }

  @Test
  void missingPathNonNumericAndNonPositiveValuesFail() {
    SourceSpec s = source("s", "https://s.example/{pair}", "price", "", "");

    assertTrue(fetcher(json("{\"other\":1}"), false).fetch(BTC, s).block().error().contains("not found"));
    assertTrue(fetcher(json("{\"price\":\"n/a\"}"), false).fetch(BTC, s).block().error().contains("non-numeric"));
    assertTrue(fetcher(json("{\"price\":\"-1\"}"), false).fetch(BTC, s).block().error().contains("non-positive"));

    FeedSpec funding = new FeedSpec("FUNDING-BTC", "Funding", "", "FUNDING", "BTC", DataType.NUMBER, 8, List.of(), true);
    assertTrue(fetcher(json("{\"price\":\"-0.0001\"}"), false).fetch(funding, s).block().isSuccess());
  }

  @Test
  void strictGuardRejectsPrivateTargetBeforeRequest() {
    SourceFetcher fetcher = fetcher(json("{\"price\":1}"), true);

    Observation o =
        fetcher.fetch(BTC, source("local", "http://127.0.0.1:9000/{pair}", "price", "", "")).block();

    assertFalse(o.isSuccess());
    assertTrue(requests.isEmpty());
  }

  @Test
  void fetchAllKeepsSourceOrderAndIsolatesFailures() {
    ExchangeFunction exchange =
        request -> {
          String host = request.url().getHost();
          if (host.startsWith("b.")) {
            return Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build());
          }
          return Mono.just(
              ClientResponse.create(HttpStatus.OK)
                  .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                  .body("{\"price\":" + (host.startsWith("a.") ? "100" : "102") + "}")
                  .build());
        };
    SourceFetcher fetcher = fetcher(exchange, false);

    List<Observation> observations =
        fetcher
            .fetchAll(
                BTC,
                List.of(
                    source("a", "https://a.example/{pair}", "price", "", ""),
                    source("b", "https://b.example/{pair}", "price", "", ""),
                    source("c", "https://c.example/{pair}", "price", "", "")))
            .block();

    assertEquals(List.of("a", "b", "c"), observations.stream().map(Observation::sourceId).toList());
    assertTrue(observations.get(0).isSuccess());
    assertFalse(observations.get(1).isSuccess());
    assertEquals(new BigDecimal("102"), observations.get(2).value());
  }

  @Test
  void morePassesThanWorkerThreadsAllComplete() throws Exception {
    ExchangeFunction slow =
        request ->
            Mono.delay(Duration.ofMillis(50))
                .map(
                    tick ->
                        ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("{\"price\":100}")
                            .build());
    SourceFetcher fetcher =
        new SourceFetcher(client(slow), new SourceTargetGuard(false), CLOCK, 2, name -> null);
    List<SourceSpec> sources =
        List.of(
            source("a", "https://a.example/{pair}", "price", "", ""),
            source("b", "https://b.example/{pair}", "price", "", ""),
            source("c", "https://c.example/{pair}", "price", "", ""));

    ExecutorService passes = Executors.newFixedThreadPool(4);
    try {
      List<Future<List<Observation>>> results = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        FeedSpec feed =
            new FeedSpec("F" + i + "-USD", "F" + i, "", "F" + i, "USD", DataType.PRICE, 8, List.of(), true);
        results.add(passes.submit(() -> fetcher.fetchAll(feed, sources).block(Duration.ofSeconds(10))));
      }
      for (Future<List<Observation>> result : results) {
        List<Observation> observations = result.get(15, TimeUnit.SECONDS);
        assertEquals(3, observations.size());
        assertTrue(observations.stream().allMatch(Observation::isSuccess), observations.toString());
      }
    } finally {
      passes.shutdownNow();
      fetcher.destroy();
    }
  }

  @Test
  void waitingForAFreeSlotCountsAgainstTheTimeout() {
    SourceFetcher fetcher =
        new SourceFetcher(client(request -> Mono.never()), new SourceTargetGuard(false), CLOCK, 1, name -> null);
    SourceSpec hung =
        new SourceSpec(
            "hung", "hung", "https://hung.example/{pair}", "price", 1, Duration.ofSeconds(2), Map.of(), "", "", "");
    SourceSpec queued =
        new SourceSpec(
            "queued", "queued", "https://queued.example/{pair}", "price", 1, Duration.ofMillis(100), Map.of(), "", "", "");

    fetcher.fetch(BTC, hung).subscribe();
    Observation o = fetcher.fetch(BTC, queued).block(Duration.ofSeconds(1));

    assertFalse(o.isSuccess());
    assertTrue(o.error().contains("timed out"), o.error());
    fetcher.destroy();
  }

  private SourceFetcher fetcher(ExchangeFunction exchange, boolean strict) {
    return new SourceFetcher(client(exchange), new SourceTargetGuard(strict), CLOCK, 4, name -> null);
  }

  private WebClient client(ExchangeFunction exchange) {
    return WebClient.builder()
        .exchangeFunction(
            request -> {
              requests.put(sourceOf(request), request);
              return exchange.exchange(request);
            })
        .build();
  }

  private static String sourceOf(ClientRequest request) {
    String host = request.url().getHost();
    if (host.contains("binance")) return "binance";
    if (host.contains("coinbase")) return "coinbase";
    return host;
  }

  private static ExchangeFunction json(String body) {
    return request ->
        Mono.just(
            ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
  }

  private static SourceSpec source(
      String id, String url, String path, String pairTemplate, String quoteOverride) {
    return new SourceSpec(
        id, id, url, path, 1, Duration.ofSeconds(5), Map.of(), pairTemplate, "", quoteOverride);
  }
}
