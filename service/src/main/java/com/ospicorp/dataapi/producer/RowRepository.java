package com.ospicorp.dataapi.producer;

import com.ospicorp.dataapi.data.QueryPlan;
import com.ospicorp.dataapi.trace.DependencyTracer;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class RowRepository {

  private static final String AREA_IDS_BY_TYPE = """
      SELECT MIN(id) AS id
      FROM covid19.area_reference
      WHERE area_type = ?
      GROUP BY area_code
      ORDER BY MIN(id)""";

  private static final String AREA_IDS_BY_CODE = """
      SELECT MIN(id) AS id
      FROM covid19.area_reference
      WHERE area_code = ?
        AND area_type = ?
      GROUP BY area_code""";

  private static final RowMapper<MetricRow> ROW_MAPPER = (rs, i) -> new MetricRow(
      rs.getString("area_type"),
      rs.getString("area_code"),
      rs.getString("area_name"),
      rs.getString("date"),
      rs.getString("metric"),
      rs.getString("value"));

  private final JdbcTemplate jdbc;
  private final DependencyTracer tracer;

  public RowRepository(JdbcTemplate jdbc, DependencyTracer tracer) {
    this.jdbc = jdbc;
    this.tracer = tracer;
  }

  public List<Integer> areaIdsByType(String areaType) {
    return tracer.trace(DependencyTracer.POSTGRES, "areaIdsByType",
        () -> jdbc.queryForList(AREA_IDS_BY_TYPE, Integer.class, areaType));
  }

  public List<Integer> areaIdsByCode(String areaType, String areaCode) {
    return tracer.trace(DependencyTracer.POSTGRES, "areaIdsByCode",
        () -> jdbc.queryForList(AREA_IDS_BY_CODE, Integer.class, areaCode, areaType));
  }

  public List<MetricRow> fetchBatch(QueryPlan plan, List<Integer> areaIds) {
    return tracer.trace(DependencyTracer.POSTGRES, "fetchBatch",
        () -> jdbc.query(plan.batchSql(), ROW_MAPPER, metricArray(plan), plan.areaType(),
            areaIds.toArray(new Integer[0])));
  }

  /**
   * Next page of a single-area query, newest first.
   *
   * @param after last row of the previous page, or {@code null} for the first page
   */
  public List<MetricRow> fetchPage(QueryPlan plan, List<Integer> areaIds, MetricRow after,
      int limit) {
    List<Object> args = new ArrayList<>();
    args.add(metricArray(plan));
    args.add(plan.areaType());
    args.add(areaIds.toArray(new Integer[0]));
    if (after != null) {
      args.add(after.date());
      args.add(after.metric());
    }
    args.add(limit);
    return tracer.trace(DependencyTracer.POSTGRES, "fetchPage",
        () -> jdbc.query(plan.pageSql(after != null), ROW_MAPPER, args.toArray()));
  }

  public boolean exists(QueryPlan plan) {
    List<Object> args = new ArrayList<>();
    args.add(metricArray(plan));
    args.add(plan.areaType());
    if (plan.isSingleArea()) {
      args.add(plan.areaCode());
    }
    return tracer.trace(DependencyTracer.POSTGRES, "exists",
        () -> !jdbc.queryForList(plan.existsSql(), Integer.class, args.toArray()).isEmpty());
  }

  private static String[] metricArray(QueryPlan plan) {
    return plan.metrics().toArray(new String[0]);
  }
}
