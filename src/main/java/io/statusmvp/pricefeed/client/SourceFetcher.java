package io.statusmvp.pricefeed.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.statusmvp.pricefeed.config.FeedProperties;
import io.statusmvp.pricefeed.error.FetchException;
import io.statusmvp.pricefeed.feed.DataType;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.SourceSpec;
import io.statusmvp.pricefeed.model.Observation;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Fetches one scalar from one source. Never errors: transport, timeout and extraction failures
 * come back as a failed {@link Observation}. There is no inline retry; the next tick retries.
 */
@Component
public class SourceFetcher implements DisposableBean {
  private static final Logger log = LoggerFactory.getLogger(SourceFetcher.class);
  private static final int MAX_ERROR_BODY = 256;

  private final WebClient webClient;
  private final SourceTargetGuard guard;
  private final Clock clock;
  private final UnaryOperator<String> env;
  private final Sinks.Many<FetchJob> queue = Sinks.many().unicast().onBackpressureBuffer();
  private final Disposable drain;

  @Autowired
  public SourceFetcher(
      WebClient webClient, SourceTargetGuard guard, Clock clock, FeedProperties properties) {
    this(webClient, guard, clock, properties.getMaxConcurrentFetches(), System::getenv);
  }

  SourceFetcher(
      WebClient webClient,
      SourceTargetGuard guard,
      Clock clock,
      int maxConcurrentFetches,
      UnaryOperator<String> env) {
    this.webClient = webClient;
    this.guard = guard;
    this.clock = clock;
    this.env = env;
    // At most maxConcurrentFetches requests are in flight across all feeds; the rest wait here
    // without holding a thread.
    this.drain = queue.asFlux().flatMap(FetchJob::run, Math.max(1, maxConcurrentFetches)).subscribe();
  }

  /** Fetches every source concurrently; results keep the order of {@code sources}. */
  public Mono<List<Observation>> fetchAll(FeedSpec feed, List<SourceSpec> sources) {
    if (sources.isEmpty()) return Mono.just(List.of());
    return Flux.fromIterable(sources)
        .flatMapSequential(source -> fetch(feed, source), sources.size())
        .collectList();
  }

  /** The source timeout covers the whole fetch, time spent waiting for a free slot included. */
  public Mono<Observation> fetch(FeedSpec feed, SourceSpec source) {
    SymbolParams params = SymbolParams.resolve(feed, source);
    String path = params.expandPath(source.extractionPath());
    URI uri;
    try {
      uri = URI.create(params.expandUrl(source.urlTemplate()));
    } catch (IllegalArgumentException e) {
      return Mono.just(failed(feed, source, "invalid url: " + e.getMessage()));
    }

    return Mono.defer(
            () -> {
              FetchJob job =
                  new FetchJob(
                      Mono.defer(() -> request(source, uri))
                          .subscribeOn(Schedulers.boundedElastic())
                          .timeout(source.timeout()));
              submit(source, job);
              return job.result().doOnCancel(job::abandon);
            })
        .timeout(source.timeout())
        .map(root -> Observation.success(source.id(), extract(feed, source, root, path), clock.instant()))
        .onErrorResume(e -> Mono.just(failed(feed, source, describe(source, e))));
  }

  @Override
  public void destroy() {
    drain.dispose();
  }

  private void submit(SourceSpec source, FetchJob job) {
    Sinks.EmitResult result;
    synchronized (queue) {
      result = queue.tryEmitNext(job);
    }
    if (result.isFailure()) {
      job.reject(new FetchException(source.id(), "fetch queue unavailable: " + result));
    }
  }

  private Mono<JsonNode> request(SourceSpec source, URI uri) {
    // The guard may resolve DNS; callers subscribe on a bounded-elastic thread.
    guard.check(source.id(), uri);
    return webClient
        .get()
        .uri(uri)
        .headers(h -> source.headers().forEach((k, v) -> h.set(k, resolveEnv(v))))
        .retrieve()
        .onStatus(
            HttpStatusCode::isError,
            resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(
                        body ->
                            new FetchException(
                                source.id(),
                                "source returned HTTP " + resp.statusCode().value() + ": " + truncate(body))))
        .bodyToMono(JsonNode.class)
        .switchIfEmpty(Mono.error(() -> new FetchException(source.id(), "empty response body")));
  }

  private BigDecimal extract(FeedSpec feed, SourceSpec source, JsonNode root, String path) {
    JsonNode node =
        JsonPathExtractor.find(root, path)
            .orElseThrow(() -> new FetchException(source.id(), "value not found at '" + path + "'"));
    BigDecimal value =
        JsonPathExtractor.toDecimal(node)
            .orElseThrow(
                () -> new FetchException(source.id(), "non-numeric value at '" + path + "': " + node));
    if (feed.dataType() == DataType.PRICE && value.signum() <= 0) {
      throw new FetchException(source.id(), "non-positive price " + value.toPlainString());
    }
    return value;
  }

  private Observation failed(FeedSpec feed, SourceSpec source, String message) {
    log.debug("fetch failed feed={} source={}: {}", feed.id(), source.id(), message);
    return Observation.failed(source.id(), message, clock.instant());
  }

  private static String describe(SourceSpec source, Throwable e) {
    if (e instanceof TimeoutException) {
      return "timed out after " + source.timeout().toMillis() + "ms";
    }
    if (e instanceof FetchException) return e.getMessage();
    String msg = e.getMessage();
    return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
  }

  /** Resolves {@code ${NAME}} from the environment; unset variables are left as written. */
  String resolveEnv(String value) {
    if (value == null) return "";
    if (value.startsWith("${") && value.endsWith("}") && value.length() > 3) {
      String resolved = env.apply(value.substring(2, value.length() - 1));
      if (resolved != null && !resolved.isEmpty()) return resolved;
    }
    return value;
  }

  /** One queued request. A job whose caller has gone away is skipped when its turn comes. */
  private static final class FetchJob {
    private final Mono<JsonNode> work;
    private final Sinks.One<JsonNode> result = Sinks.one();
    private volatile boolean abandoned;

    FetchJob(Mono<JsonNode> work) {
      this.work = work;
    }

    Mono<JsonNode> result() {
      return result.asMono();
    }

    void abandon() {
      abandoned = true;
    }

    void reject(Throwable error) {
      result.tryEmitError(error);
    }

    Mono<Void> run() {
      if (abandoned) return Mono.empty();
      return work.doOnNext(result::tryEmitValue)
          .switchIfEmpty(Mono.fromRunnable(result::tryEmitEmpty))
          .doOnError(result::tryEmitError)
          .onErrorResume(e -> Mono.empty())
          .then();
    }
  }

  private static String truncate(String body) {
    String trimmed = body == null ? "" : body.trim();
    if (trimmed.length() <= MAX_ERROR_BODY) return trimmed;
    return trimmed.substring(0, MAX_ERROR_BODY) + "...(truncated)";
  }
}
