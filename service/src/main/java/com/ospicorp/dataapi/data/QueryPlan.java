package com.ospicorp.dataapi.data;

import java.util.List;

/**
 * Partition query for one request: which template to run, against which partition, with which
 * arguments.
 */
public record QueryPlan(
    Template template,
    String partitionId,
    List<String> metrics,
    String areaType,
    String areaCode,
    boolean releasedMetricsOnly) {

  public enum Template { MAIN, NESTED, EXISTS }

  private static final String FROM = """
      FROM covid19.time_series_p%s AS ts
        JOIN covid19.metric_reference AS mr ON mr.id = ts.metric_id
        JOIN covid19.release_reference AS rr ON rr.id = ts.release_id
        JOIN covid19.area_reference AS ar ON ar.id = ts.area_id
      """;

  private static final String SELECT = """
      SELECT ar.area_type AS area_type,
             ar.area_code AS area_code,
             ar.area_name AS area_name,
             ts.date::VARCHAR AS date,
             mr.metric AS metric,
             %s AS value
      """;

  private static final String MAIN_VALUE = "COALESCE(ts.payload -> 'value', ts.payload)::TEXT";
  private static final String NESTED_VALUE = "ts.payload::TEXT";

  private static final String BATCH_WHERE = """
      WHERE mr.metric = ANY(?::VARCHAR[])
        AND rr.released IS TRUE
        AND ar.area_type = ?
        AND ts.area_id = ANY(?::INT[])
      """;

  public QueryPlan {
    metrics = List.copyOf(metrics);
  }

  public boolean isSingleArea() {
    return areaCode != null;
  }

  /** Rows of one batch of areas; arguments: metrics, area type, area ids. */
  public String batchSql() {
    return select() + BATCH_WHERE + filters() + "ORDER BY ts.date DESC";
  }

  /**
   * One keyset page of a single area, newest first; arguments: metrics, area type, area ids, then
   * the last seen date and metric when continuing, then the page size.
   */
  public String pageSql(boolean continuation) {
    String keyset = continuation ? "  AND (ts.date, mr.metric) < (?::DATE, ?)\n" : "";
    return select() + BATCH_WHERE + filters() + keyset
        + "ORDER BY ts.date DESC, mr.metric DESC\nLIMIT ?";
  }

  /** Whether any released row matches; arguments: metrics, area type[, area code]. */
  public String existsSql() {
    StringBuilder sql = new StringBuilder("SELECT 1\n")
        .append(FROM.formatted(partitionId))
        .append("WHERE mr.metric = ANY(?::VARCHAR[])\n")
        .append("  AND rr.released IS TRUE\n")
        .append("  AND ar.area_type = ?\n");
    if (isSingleArea()) {
      sql.append("  AND ar.area_code = ?\n");
    }
    return sql.append(filters()).append("FETCH FIRST 1 ROW ONLY").toString();
  }

  private String select() {
    String value = template == Template.NESTED ? NESTED_VALUE : MAIN_VALUE;
    return SELECT.formatted(value) + FROM.formatted(partitionId);
  }

  private String filters() {
    return releasedMetricsOnly ? "  AND mr.released IS TRUE\n" : "";
  }
}
