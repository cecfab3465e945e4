package io.statusmvp.pricefeed.attestation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import io.statusmvp.pricefeed.config.AttestationProperties;
import io.statusmvp.pricefeed.util.Hashing;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RuntimeAttestationProviderTest {
  @TempDir Path dir;

  @Test
  void reportWinsWhenIsolated() throws Exception {
    Path report = Files.write(dir.resolve("report.bin"), "quote-bytes".getBytes(StandardCharsets.UTF_8));
    AttestationProperties props = new AttestationProperties();
    props.setIsolated(true);
    props.setReportPath(report.toString());
    props.setRuntimeType("enclave");
    props.setInstanceId("node-1");

    RuntimeAttestationProvider provider = new RuntimeAttestationProvider(props);

    assertEquals(AttestationProvider.Source.REPORT, provider.source());
    assertArrayEquals(Hashing.sha256("quote-bytes"), provider.hash());
  }

  @Test
  void reportIgnoredWhenNotIsolated() throws Exception {
    Path report = Files.write(dir.resolve("report.bin"), "quote-bytes".getBytes(StandardCharsets.UTF_8));
    AttestationProperties props = new AttestationProperties();
    props.setIsolated(false);
    props.setReportPath(report.toString());
    props.setRuntimeType("container");
    props.setInstanceId("pod-7");

    RuntimeAttestationProvider provider = new RuntimeAttestationProvider(props);

    assertEquals(AttestationProvider.Source.INSTANCE, provider.source());
    assertArrayEquals(Hashing.sha256("container:pod-7"), provider.hash());
  }

  @Test
  void invalidCertificateFallsThroughToInstance() throws Exception {
    Path cert = Files.write(dir.resolve("id.pem"), "not a certificate".getBytes(StandardCharsets.UTF_8));
    AttestationProperties props = new AttestationProperties();
    props.setCertificatePath(cert.toString());
    props.setInstanceId("host-a");

    RuntimeAttestationProvider provider = new RuntimeAttestationProvider(props);

    assertEquals(AttestationProvider.Source.INSTANCE, provider.source());
    assertArrayEquals(Hashing.sha256(":host-a"), provider.hash());
  }

  @Test
  void fallbackIsNeverEmpty() {
    AttestationProperties props = new AttestationProperties();
    props.setIsolated(true);
    props.setReportPath(dir.resolve("missing.bin").toString());

    RuntimeAttestationProvider provider = new RuntimeAttestationProvider(props);

    assertEquals(AttestationProvider.Source.FALLBACK, provider.source());
    assertEquals(32, provider.hash().length);
    assertArrayEquals(Hashing.sha256(RuntimeAttestationProvider.FALLBACK_IDENTITY), provider.hash());
  }

  @Test
  void hashIsStableAndDefensivelyCopied() {
    AttestationProperties props = new AttestationProperties();
    props.setRuntimeType("vm");
    RuntimeAttestationProvider provider = new RuntimeAttestationProvider(props);

    byte[] first = provider.hash();
    first[0] ^= 0x1;
    assertNotSame(first, provider.hash());
    assertArrayEquals(Hashing.sha256("vm:"), provider.hash());
  }
}
