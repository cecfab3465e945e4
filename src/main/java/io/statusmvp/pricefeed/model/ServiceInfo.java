package io.statusmvp.pricefeed.model;

import java.util.List;

public record ServiceInfo(
    String status,
    String version,
    List<String> feeds,
    long tickIntervalMs,
    String ledgerMode,
    String attestationSource,
    String attestationHash) {}
