package com.ospicorp.dataapi.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the response cache and its coordination protocol.
 */
@ConfigurationProperties(prefix = "dataapi.cache")
public class CacheProperties {

  /** Backing store: {@code s3} or {@code local}. */
  private String store = "s3";

  /** Container (bucket) holding cached responses. */
  private String container = "apiv2cache";

  /** Base of the public download URL; the container and cache path are appended. */
  private String publicBaseUrl = "http://localhost:8080/downloads";

  /** Lease taken by a producer; renewed after every chunk. */
  private Duration leaseDuration = Duration.ofSeconds(60);

  /** Delay between two polls of an entry that is being produced elsewhere. */
  private Duration pollInterval = Duration.ofSeconds(10);

  /** Number of polls before a waiter gives up and computes the response itself. */
  private int maxWaitCycles = 29;

  /** Formats downloaded and served inline on a hit; every other format is redirected. */
  private List<String> inlineFormats = new ArrayList<>();

  /** Relay bytes to the producing request while caching them, rather than redirecting after. */
  private boolean streamWhileCaching = true;

  /** Threads used to poll in-progress entries. */
  private int pollThreads = 2;

  /** Chunks buffered for the producing request's client before the cache write waits on it. */
  private int clientBufferChunks = 64;

  /** How long a cache write waits on a client that stopped reading before detaching it. */
  private Duration clientStallTimeout = Duration.ofSeconds(30);

  public String getStore() {
    return store;
  }

  public void setStore(String store) {
    this.store = store;
  }

  public String getContainer() {
    return container;
  }

  public void setContainer(String container) {
    this.container = container;
  }

  public String getPublicBaseUrl() {
    return publicBaseUrl;
  }

  public void setPublicBaseUrl(String publicBaseUrl) {
    this.publicBaseUrl = publicBaseUrl;
  }

  public Duration getLeaseDuration() {
    return leaseDuration;
  }

  public void setLeaseDuration(Duration leaseDuration) {
    this.leaseDuration = leaseDuration;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public int getMaxWaitCycles() {
    return maxWaitCycles;
  }

  public void setMaxWaitCycles(int maxWaitCycles) {
    this.maxWaitCycles = maxWaitCycles;
  }

  public List<String> getInlineFormats() {
    return inlineFormats;
  }

  public void setInlineFormats(List<String> inlineFormats) {
    this.inlineFormats = inlineFormats;
  }

  public boolean isStreamWhileCaching() {
    return streamWhileCaching;
  }

  public void setStreamWhileCaching(boolean streamWhileCaching) {
    this.streamWhileCaching = streamWhileCaching;
  }

  public int getPollThreads() {
    return pollThreads;
  }

  public void setPollThreads(int pollThreads) {
    this.pollThreads = pollThreads;
  }

  public int getClientBufferChunks() {
    return clientBufferChunks;
  }

  public void setClientBufferChunks(int clientBufferChunks) {
    this.clientBufferChunks = clientBufferChunks;
  }

  public Duration getClientStallTimeout() {
    return clientStallTimeout;
  }

  public void setClientStallTimeout(Duration clientStallTimeout) {
    this.clientStallTimeout = clientStallTimeout;
  }

  public String publicLocation(String key) {
    String base = publicBaseUrl.endsWith("/")
        ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
        : publicBaseUrl;
    return base + '/' + container + '/' + key;
  }
}
