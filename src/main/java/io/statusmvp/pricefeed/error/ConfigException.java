package io.statusmvp.pricefeed.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Invalid feed document. Raised while the application context starts, so a misconfigured feed
 * never runs with partial coverage.
 */
public class ConfigException extends FeedException {
  private final String field;
  private final int index;

  public ConfigException(String field, int index, String message) {
    this(field, index, message, null);
  }

  public ConfigException(String field, int index, String message, Throwable cause) {
    super(
        FeedErrorCode.CONFIG_INVALID,
        describe(field, index) + ": " + message,
        500,
        details(field, index),
        cause);
    this.field = field;
    this.index = index;
  }

  /** Path of the offending field, e.g. {@code feeds.sources}. */
  public String getField() {
    return field;
  }

  /** Index of the offending list element, or -1 for document-level fields. */
  public int getIndex() {
    return index;
  }

  private static String describe(String field, int index) {
    if (index < 0) return field;
    int dot = field.indexOf('.');
    if (dot < 0) return field + "[" + index + "]";
    return field.substring(0, dot) + "[" + index + "]" + field.substring(dot);
  }

  private static Map<String, Object> details(String field, int index) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("field", field);
    out.put("index", index);
    return out;
  }
}
