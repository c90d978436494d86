package com.ospicorp.dataapi.data;

import com.ospicorp.dataapi.cache.CacheKey;
import com.ospicorp.dataapi.format.MetricCatalog;
import com.ospicorp.dataapi.format.ResponseFormat;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Validated, normalised view of a data request and everything derived from it.
 */
public final class RequestDescriptor {

  public static final String GET = "GET";
  public static final String HEAD = "HEAD";

  /** Identity columns that may be requested as metrics but are never queried. */
  public static final Set<String> IDENTITY_COLUMNS = Set.of("areaType", "areaCode", "areaName", "date");

  private static final Set<String> OWN_PARTITION_TYPES = Set.of("utla", "ltla", "nhstrust", "msoa");
  private static final String DEFAULT_PARTITION = "other";

  private static final DateTimeFormatter HASH_KEY_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
  private static final DateTimeFormatter PARTITION_DATE = DateTimeFormatter.ofPattern("yyyy_M_d");
  private static final int HASH_BYTES = 5;

  private final String areaType;
  private final LocalDate release;
  private final ResponseFormat format;
  private final List<String> metrics;
  private final String areaCode;
  private final String method;
  private final List<String> nestedMetrics;

  private RequestDescriptor(String areaType, LocalDate release, ResponseFormat format,
      List<String> metrics, String areaCode, String method, List<String> nestedMetrics) {
    this.areaType = areaType;
    this.release = release;
    this.format = format;
    this.metrics = List.copyOf(metrics);
    this.areaCode = areaCode;
    this.method = method;
    this.nestedMetrics = List.copyOf(nestedMetrics);
  }

  /**
   * Parses request parameters whose shape has already been checked at the HTTP boundary.
   *
   * @param metricParams every {@code metric} parameter; each may be a comma separated list
   * @throws InvalidParameterException when a parameter is malformed
   * @throws RequestTooLargeException when more metrics are requested than allowed
   * @throws InvalidQueryException when a nested metric is combined with other metrics
   */
  public static RequestDescriptor of(String areaType, String release, String format,
      List<String> metricParams, String areaCode, String method, MetricCatalog catalog,
      RequestProperties properties) {
    String docs = properties.errorDocsBase();
    if (areaType == null || areaType.isBlank()) {
      throw new InvalidParameterException("Invalid areaType parameter.", 1001, docs + 1001);
    }
    LocalDate releaseDate = parseRelease(release, docs);
    ResponseFormat responseFormat = ResponseFormat.fromExtension(format)
        .orElseThrow(() -> new InvalidParameterException(
            "Invalid format value. Supported values: csv,json,jsonl,xml.", 1003, docs + 1003));
    String code = areaCode == null || areaCode.isBlank() ? null : areaCode.trim();

    List<String> metrics = splitMetrics(metricParams);
    if (metrics.isEmpty()) {
      throw new InvalidParameterException("At least one metric is required.", 1005, docs + 1005);
    }
    if (metrics.size() > properties.maxMetrics()) {
      throw new RequestTooLargeException(metrics.size(), properties.maxMetrics());
    }

    List<String> nested = metrics.stream().filter(catalog::isNested).toList();
    if (!nested.isEmpty() && metrics.size() > 1) {
      List<String> others = new ArrayList<>(metrics);
      others.removeAll(nested);
      throw new InvalidQueryException("Nested metrics - e.g. " + nested
          + " - cannot be requested alongside other metrics. Remove " + others
          + " and try again.");
    }

    String httpMethod = method == null ? GET : method.toUpperCase(Locale.ROOT);
    return new RequestDescriptor(areaType, releaseDate, responseFormat, metrics, code, httpMethod,
        nested);
  }

  private static LocalDate parseRelease(String release, String docs) {
    if (release == null || release.length() < 10) {
      throw new InvalidParameterException("Invalid release parameter. Expected YYYY-MM-DD.", 1002,
          docs + 1002);
    }
    try {
      return LocalDate.parse(release.substring(0, 10));
    } catch (DateTimeParseException e) {
      throw new InvalidParameterException("Invalid release parameter. Expected YYYY-MM-DD.", 1002,
          docs + 1002);
    }
  }

  private static List<String> splitMetrics(List<String> metricParams) {
    Set<String> metrics = new LinkedHashSet<>();
    if (metricParams != null) {
      for (String param : metricParams) {
        if (param == null) {
          continue;
        }
        Arrays.stream(param.split(","))
            .map(String::trim)
            .filter(metric -> !metric.isEmpty())
            .forEach(metrics::add);
      }
    }
    return new ArrayList<>(metrics);
  }

  /**
   * Cache location: {@code release/areaType/areaCode-or-complete/hash.format}. The hash covers
   * the sorted metric names, so the same metrics in any order share an entry.
   */
  public CacheKey cacheKey() {
    String scope = areaCode == null ? "complete" : areaCode;
    String path = release + "/" + areaType + "/" + scope + "/" + metricHash() + "." + format.extension();
    return new CacheKey(path, format.extension());
  }

  String metricHash() {
    String joined = String.join("&", metrics.stream().sorted().toList());
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      byte[] key = HASH_KEY_DATE.format(release).getBytes(StandardCharsets.US_ASCII);
      mac.init(new SecretKeySpec(key, "HmacSHA256"));
      byte[] digest = mac.doFinal(joined.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest, 0, HASH_BYTES);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }

  /** Database partition: release date plus the area type, or {@code other} for shared ones. */
  public String partitionId() {
    String type = areaType.toLowerCase(Locale.ROOT);
    String suffix = OWN_PARTITION_TYPES.contains(type) ? type : DEFAULT_PARTITION;
    return PARTITION_DATE.format(release) + "_" + suffix;
  }

  /** Requested metrics that are actually stored, in request order. */
  public List<String> dbMetrics() {
    return metrics.stream().filter(metric -> !IDENTITY_COLUMNS.contains(metric)).toList();
  }

  public List<String> nestedMetrics() {
    return nestedMetrics;
  }

  public boolean isNested() {
    return !nestedMetrics.isEmpty();
  }

  /** Value of the {@code metrics} tag on the cache entry. */
  public String metricTag() {
    return String.join(":", metrics);
  }

  public QueryPlan queryPlan(boolean releasedMetricsOnly) {
    QueryPlan.Template template;
    if (HEAD.equals(method)) {
      template = QueryPlan.Template.EXISTS;
    } else if (isNested()) {
      template = QueryPlan.Template.NESTED;
    } else {
      template = QueryPlan.Template.MAIN;
    }
    return new QueryPlan(template, partitionId(), dbMetrics(), areaType, areaCode,
        releasedMetricsOnly);
  }

  public String areaType() {
    return areaType;
  }

  public LocalDate release() {
    return release;
  }

  public ResponseFormat format() {
    return format;
  }

  public List<String> metrics() {
    return metrics;
  }

  public String areaCode() {
    return areaCode;
  }

  public String method() {
    return method;
  }

  /** Download file name, e.g. {@code nation_2021-03-01.csv}. */
  public String fileName() {
    return areaType + "_" + release + "." + format.extension();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RequestDescriptor that)) {
      return false;
    }
    return areaType.equals(that.areaType) && release.equals(that.release)
        && format == that.format && metrics.equals(that.metrics)
        && Objects.equals(areaCode, that.areaCode) && method.equals(that.method);
  }

  @Override
  public int hashCode() {
    return Objects.hash(areaType, release, format, metrics, areaCode, method);
  }

  @Override
  public String toString() {
    return method + " " + areaType + "/" + release + "/" + (areaCode == null ? "complete" : areaCode)
        + " " + metrics + " as " + format.extension();
  }
}
