package com.ospicorp.dataapi.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tag names and values marking the progress of a cache entry.
 */
public final class CacheTags {

  public static final String IN_PROGRESS = "in_progress";
  public static final String DONE = "done";
  public static final String METRICS = "metrics";

  private static final String TRUE = "1";
  private static final String FALSE = "0";

  private CacheTags() {
  }

  public static Map<String, String> inProgress() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put(IN_PROGRESS, TRUE);
    tags.put(DONE, FALSE);
    return tags;
  }

  public static Map<String, String> completed(Map<String, String> extra) {
    Map<String, String> tags = new LinkedHashMap<>(extra);
    tags.put(DONE, TRUE);
    tags.put(IN_PROGRESS, FALSE);
    return tags;
  }

  public static Map<String, String> metrics(String metricTag) {
    return Map.of(METRICS, metricTag);
  }

  public static boolean isDone(Map<String, String> tags) {
    return TRUE.equals(tags.get(DONE));
  }
}
