package io.statusmvp.pricefeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.ledger")
public class LedgerProperties {
  /** {@code memory} (default) or {@code web3}. */
  private String mode = "memory";

  private String rpcUrl = "";
  private String contractAddress = "";
  private String privateKey = "";
  private long chainId = 1;
  private long gasLimit = 300_000;
  private boolean awaitReceipt = true;
  private long receiptPollMs = 1000;
  private int receiptAttempts = 30;

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public String getRpcUrl() {
    return rpcUrl;
  }

  public void setRpcUrl(String rpcUrl) {
    this.rpcUrl = rpcUrl;
  }

  public String getContractAddress() {
    return contractAddress;
  }

  public void setContractAddress(String contractAddress) {
    this.contractAddress = contractAddress;
  }

  public String getPrivateKey() {
    return privateKey;
  }

  public void setPrivateKey(String privateKey) {
    this.privateKey = privateKey;
  }

  public long getChainId() {
    return chainId;
  }

  public void setChainId(long chainId) {
    this.chainId = chainId;
  }

  public long getGasLimit() {
    return gasLimit;
  }

  public void setGasLimit(long gasLimit) {
    this.gasLimit = gasLimit;
  }

  public boolean isAwaitReceipt() {
    return awaitReceipt;
  }

  public void setAwaitReceipt(boolean awaitReceipt) {
    this.awaitReceipt = awaitReceipt;
  }

  public long getReceiptPollMs() {
    return receiptPollMs;
  }

  public void setReceiptPollMs(long receiptPollMs) {
    this.receiptPollMs = receiptPollMs;
  }

  public int getReceiptAttempts() {
    return receiptAttempts;
  }

  public void setReceiptAttempts(int receiptAttempts) {
    this.receiptAttempts = receiptAttempts;
  }
}
