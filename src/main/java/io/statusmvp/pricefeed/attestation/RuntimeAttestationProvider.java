package io.statusmvp.pricefeed.attestation;

import io.statusmvp.pricefeed.config.AttestationProperties;
import io.statusmvp.pricefeed.util.Hashing;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives the attestation hash once, at construction, preferring in order:
 *
 * <ol>
 *   <li>the attestation report, only when the runtime declares itself isolated;
 *   <li>the execution-identity certificate (hash of its DER encoding);
 *   <li>{@code runtime-type:instance-id};
 *   <li>a constant, so the hash is never empty.
 * </ol>
 */
@Component
public class RuntimeAttestationProvider implements AttestationProvider {
  private static final Logger log = LoggerFactory.getLogger(RuntimeAttestationProvider.class);
  static final String FALLBACK_IDENTITY = "pricefeed:unattested";

  private final byte[] hash;
  private final Source source;

  public RuntimeAttestationProvider(AttestationProperties properties) {
    Optional<byte[]> report =
        properties.isIsolated() ? readNonEmpty(properties.getReportPath()) : Optional.empty();
    Optional<byte[]> certificate =
        report.isPresent() ? Optional.empty() : certificateEncoding(properties.getCertificatePath());
    String instance = instanceIdentity(properties);

    if (report.isPresent()) {
      this.hash = Hashing.sha256(report.get());
      this.source = Source.REPORT;
    } else if (certificate.isPresent()) {
      this.hash = Hashing.sha256(certificate.get());
      this.source = Source.CERTIFICATE;
    } else if (!instance.isEmpty()) {
      this.hash = Hashing.sha256(instance);
      this.source = Source.INSTANCE;
    } else {
      this.hash = Hashing.sha256(FALLBACK_IDENTITY);
      this.source = Source.FALLBACK;
    }

    if (source == Source.REPORT) {
      log.info("attestation hash derived from {} hash={}", source, Hashing.hex(hash));
    } else {
      log.warn("runtime not verifiably isolated; attestation hash derived from {} hash={}", source, Hashing.hex(hash));
    }
  }

  @Override
  public byte[] hash() {
    return hash.clone();
  }

  @Override
  public Source source() {
    return source;
  }

  private static Optional<byte[]> readNonEmpty(String location) {
    if (location == null || location.isBlank()) return Optional.empty();
    Path path = Path.of(location.trim());
    try {
      if (!Files.isRegularFile(path)) return Optional.empty();
      byte[] bytes = Files.readAllBytes(path);
      return bytes.length == 0 ? Optional.empty() : Optional.of(bytes);
    } catch (IOException e) {
      log.warn("cannot read attestation evidence at {}", path, e);
      return Optional.empty();
    }
  }

  private static Optional<byte[]> certificateEncoding(String location) {
    Optional<byte[]> raw = readNonEmpty(location);
    if (raw.isEmpty()) return Optional.empty();
    try {
      Certificate cert =
          CertificateFactory.getInstance("X.509").generateCertificate(new ByteArrayInputStream(raw.get()));
      return Optional.of(cert.getEncoded());
    } catch (CertificateException e) {
      log.warn("identity certificate at {} is not a valid X.509 certificate", location, e);
      return Optional.empty();
    }
  }

  private static String instanceIdentity(AttestationProperties properties) {
    String type = properties.getRuntimeType() == null ? "" : properties.getRuntimeType().trim();
    String instance = properties.getInstanceId() == null ? "" : properties.getInstanceId().trim();
    if (type.isEmpty() && instance.isEmpty()) return "";
    return type + ":" + instance;
  }
}
