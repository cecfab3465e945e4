package io.statusmvp.pricefeed.feed;

import java.util.Locale;

public enum DataType {
  PRICE,
  NUMBER,
  STRING;

  public boolean isNumeric() {
    return this != STRING;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns null for unrecognised names. */
  public static DataType fromWireName(String raw) {
    if (raw == null || raw.isBlank()) return PRICE;
    for (DataType t : values()) {
      if (t.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) return t;
    }
    return null;
  }
}
