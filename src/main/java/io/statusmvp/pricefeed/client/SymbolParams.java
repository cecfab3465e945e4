package io.statusmvp.pricefeed.client;

import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.PairSymbols;
import io.statusmvp.pricefeed.feed.SourceSpec;
import java.util.Locale;

/** Placeholder values for one (feed, source) combination, after the source's own remapping. */
public record SymbolParams(String base, String quote, String pair) {

  public static SymbolParams resolve(FeedSpec feed, SourceSpec source) {
    String base = feed.base() == null ? "" : feed.base();
    String quote = feed.quote() == null ? "" : feed.quote();
    if (base.isBlank() || quote.isBlank()) {
      String[] parsed = PairSymbols.baseQuote(feed.id());
      if (base.isBlank()) base = parsed[0];
      if (quote.isBlank()) quote = parsed[1];
    }
    if (source.baseOverride() != null && !source.baseOverride().isBlank()) {
      base = source.baseOverride();
    }
    if (source.quoteOverride() != null && !source.quoteOverride().isBlank()) {
      quote = source.quoteOverride();
    }
    base = base.trim().toUpperCase(Locale.ROOT);
    quote = quote.trim().toUpperCase(Locale.ROOT);

    String pair = feed.id();
    if (feed.pair() != null && !feed.pair().isBlank()) pair = feed.pair();
    if (source.pairTemplate() != null && !source.pairTemplate().isBlank()) {
      pair = source.pairTemplate().replace("{base}", base).replace("{quote}", quote);
    }
    return new SymbolParams(base, quote, pair);
  }

  public String expandUrl(String template) {
    return template.replace("{pair}", pair).replace("{base}", base).replace("{quote}", quote);
  }

  /** Extraction paths only know {base}/{quote}; blank values leave the placeholder in place. */
  public String expandPath(String template) {
    String path = template;
    if (!base.isBlank()) path = path.replace("{base}", base);
    if (!quote.isBlank()) path = path.replace("{quote}", quote);
    return path;
  }
}
