package io.statusmvp.pricefeed.feed;

import java.time.Duration;
import java.util.Map;

/**
 * One external price source.
 *
 * <p>{@code urlTemplate} may contain {@code {base}}, {@code {quote}} and {@code {pair}}
 * placeholders. {@code extractionPath} is a dot path into the JSON response ({@code data.0.last});
 * it may reference {@code {base}} and {@code {quote}} too.
 */
public record SourceSpec(
    String id,
    String name,
    String urlTemplate,
    String extractionPath,
    int weight,
    Duration timeout,
    Map<String, String> headers,
    String pairTemplate,
    String baseOverride,
    String quoteOverride) {

  public SourceSpec {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
