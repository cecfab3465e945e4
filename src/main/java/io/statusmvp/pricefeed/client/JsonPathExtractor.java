package io.statusmvp.pricefeed.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Dot-path lookup into a JSON tree: {@code price}, {@code data.amount}, {@code data.0.last}.
 * Numeric segments index into arrays.
 */
public final class JsonPathExtractor {
  private JsonPathExtractor() {}

  public static Optional<JsonNode> find(JsonNode root, String path) {
    if (root == null || path == null || path.isBlank()) return Optional.empty();
    JsonNode node = root;
    for (String segment : path.trim().split("\\.")) {
      if (segment.isEmpty()) return Optional.empty();
      if (node.isArray() && isIndex(segment)) {
        node = node.path(Integer.parseInt(segment));
      } else {
        node = node.path(segment);
      }
      if (node.isMissingNode() || node.isNull()) return Optional.empty();
    }
    return Optional.of(node);
  }

  /** Numbers and numeric strings ("67012.5") convert; anything else is empty. */
  public static Optional<BigDecimal> toDecimal(JsonNode node) {
    if (node == null) return Optional.empty();
    if (node.isNumber()) return Optional.of(node.decimalValue());
    if (node.isTextual()) {
      String text = node.asText().trim();
      if (text.isEmpty()) return Optional.empty();
      try {
        return Optional.of(new BigDecimal(text));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static boolean isIndex(String segment) {
    for (int i = 0; i < segment.length(); i++) {
      if (!Character.isDigit(segment.charAt(i))) return false;
    }
    return segment.length() < 10;
  }
}
