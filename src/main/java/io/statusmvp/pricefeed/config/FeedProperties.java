package io.statusmvp.pricefeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.feeds")
public class FeedProperties {
  private String configLocation = "classpath:feeds/default-feeds.yml";
  private boolean schedulerEnabled = true;
  private int maxConcurrentFetches = 16;
  private int workerThreads = 8;
  private boolean strictSourceTargets = false;
  private boolean allowPrivateTargets = false;

  public String getConfigLocation() {
    return configLocation;
  }

  public void setConfigLocation(String configLocation) {
    this.configLocation = configLocation;
  }

  public boolean isSchedulerEnabled() {
    return schedulerEnabled;
  }

  public void setSchedulerEnabled(boolean schedulerEnabled) {
    this.schedulerEnabled = schedulerEnabled;
  }

  public int getMaxConcurrentFetches() {
    return maxConcurrentFetches;
  }

  public void setMaxConcurrentFetches(int maxConcurrentFetches) {
    this.maxConcurrentFetches = maxConcurrentFetches;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public boolean isStrictSourceTargets() {
    return strictSourceTargets;
  }

  public void setStrictSourceTargets(boolean strictSourceTargets) {
    this.strictSourceTargets = strictSourceTargets;
  }

  public boolean isAllowPrivateTargets() {
    return allowPrivateTargets;
  }

  public void setAllowPrivateTargets(boolean allowPrivateTargets) {
    this.allowPrivateTargets = allowPrivateTargets;
  }
}
