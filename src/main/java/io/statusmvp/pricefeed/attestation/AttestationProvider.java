package io.statusmvp.pricefeed.attestation;

/** Identity of the execution context that signs publishes. */
public interface AttestationProvider {

  enum Source {
    REPORT,
    CERTIFICATE,
    INSTANCE,
    FALLBACK
  }

  /** Stable 32-byte hash for this process lifetime; never empty. */
  byte[] hash();

  /** Which evidence the hash was derived from. */
  Source source();
}
