package io.statusmvp.pricefeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.attestation")
public class AttestationProperties {
  /** Set by the hosting runtime when the process runs inside a verified enclave. */
  private boolean isolated = false;

  private String reportPath = "";
  private String certificatePath = "";
  private String runtimeType = "";
  private String instanceId = "";

  public boolean isIsolated() {
    return isolated;
  }

  public void setIsolated(boolean isolated) {
    this.isolated = isolated;
  }

  public String getReportPath() {
    return reportPath;
  }

  public void setReportPath(String reportPath) {
    this.reportPath = reportPath;
  }

  public String getCertificatePath() {
    return certificatePath;
  }

  public void setCertificatePath(String certificatePath) {
    this.certificatePath = certificatePath;
  }

  public String getRuntimeType() {
    return runtimeType;
  }

  public void setRuntimeType(String runtimeType) {
    this.runtimeType = runtimeType;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public void setInstanceId(String instanceId) {
    this.instanceId = instanceId;
  }
}
