package io.statusmvp.pricefeed.controller;

import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.PolicySummary;
import io.statusmvp.pricefeed.model.PublishStateView;
import io.statusmvp.pricefeed.model.ServiceInfo;
import io.statusmvp.pricefeed.model.SourceSummary;
import io.statusmvp.pricefeed.service.FeedEvaluation;
import io.statusmvp.pricefeed.service.FeedQueryService;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class FeedController {
  private final FeedQueryService feeds;

  public FeedController(FeedQueryService feeds) {
    this.feeds = feeds;
  }

  @GetMapping("/info")
  public Mono<ServiceInfo> info() {
    return Mono.fromCallable(feeds::info);
  }

  @GetMapping("/feeds")
  public Mono<List<FeedSpec>> listFeeds() {
    return Mono.fromCallable(feeds::feeds);
  }

  @GetMapping("/sources")
  public Mono<List<SourceSummary>> listSources() {
    return Mono.fromCallable(feeds::sources);
  }

  @GetMapping("/policy")
  public Mono<PolicySummary> policy() {
    return Mono.fromCallable(feeds::policy);
  }

  @GetMapping("/prices")
  public Mono<List<AggregatedPrice>> prices() {
    return Mono.fromCallable(feeds::prices).subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/prices/{symbol}")
  public Mono<AggregatedPrice> price(@PathVariable("symbol") @NotBlank String symbol) {
    return Mono.fromCallable(() -> feeds.price(symbol)).subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/feeds/{symbol}/state")
  public Mono<PublishStateView> state(@PathVariable("symbol") @NotBlank String symbol) {
    return Mono.fromCallable(() -> feeds.state(symbol));
  }

  // Runs a full fetch and may publish; blocking, so keep it off the event loop.
  @PostMapping("/feeds/{symbol}/evaluate")
  public Mono<FeedEvaluation> evaluate(@PathVariable("symbol") @NotBlank String symbol) {
    return Mono.fromCallable(() -> feeds.evaluate(symbol)).subscribeOn(Schedulers.boundedElastic());
  }
}
