package com.ospicorp.dataapi.producer;

import com.ospicorp.dataapi.data.QueryPlan;
import com.ospicorp.dataapi.data.RequestDescriptor;
import com.ospicorp.dataapi.data.RequestProperties;
import com.ospicorp.dataapi.format.MetricCatalog;
import com.ospicorp.dataapi.format.ResponseFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a request into a lazily produced, formatted response.
 *
 * <p>A whole area type is read in batches of areas. A single area is read in keyset pages; the
 * rows of the oldest date on a page are held back until the next page so that one date is never
 * split across two records.
 */
@Service
public class ResultProducer {

  private static final Logger log = LoggerFactory.getLogger(ResultProducer.class);

  static final Comparator<Map<String, Object>> RECORD_ORDER =
      Comparator.<Map<String, Object>, String>comparing(row -> (String) row.get("date"))
          .reversed()
          .thenComparing(row -> (String) row.get("areaCode"),
              Comparator.nullsLast(Comparator.<String>naturalOrder()));

  private final RowRepository rows;
  private final ResponseFormatter formatter;
  private final MetricCatalog catalog;
  private final ProducerProperties properties;
  private final RequestProperties requestProperties;

  public ResultProducer(RowRepository rows, ResponseFormatter formatter, MetricCatalog catalog,
      ProducerProperties properties, RequestProperties requestProperties) {
    this.rows = rows;
    this.formatter = formatter;
    this.catalog = catalog;
    this.properties = properties;
    this.requestProperties = requestProperties;
  }

  public ChunkStream produce(RequestDescriptor descriptor) {
    QueryPlan plan = descriptor.queryPlan(requestProperties.releasedMetricsOnly());
    List<String> metrics = plan.metrics();
    ChunkStream.BatchSource source = plan.isSingleArea()
        ? new PagedSource(plan, metrics)
        : new BatchedSource(plan, metrics);
    ChunkStream.BatchRenderer renderer =
        (batch, first) -> formatter.format(batch, descriptor.format(), metrics, first);
    return new ChunkStream(source, renderer, descriptor.format().isEnveloped(),
        descriptor.toString());
  }

  /** Whether the query of a HEAD request would return anything. */
  public boolean exists(RequestDescriptor descriptor) {
    return rows.exists(descriptor.queryPlan(requestProperties.releasedMetricsOnly()));
  }

  /**
   * Folds long rows into one record per area and date, newest date first, then by area code.
   */
  List<Map<String, Object>> pivot(List<MetricRow> longRows, List<String> metrics) {
    Map<String, Map<String, Object>> records = new LinkedHashMap<>();
    for (MetricRow row : longRows) {
      String key = row.areaType() + '|' + row.areaCode() + '|' + row.areaName() + '|' + row.date();
      Map<String, Object> record = records.computeIfAbsent(key, k -> newRecord(row, metrics));
      record.put(row.metric(), catalog.convert(row.metric(), row.value()));
    }
    List<Map<String, Object>> sorted = new ArrayList<>(records.values());
    sorted.sort(RECORD_ORDER);
    return sorted;
  }

  private static Map<String, Object> newRecord(MetricRow row, List<String> metrics) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("areaType", row.areaType());
    record.put("areaCode", row.areaCode());
    record.put("areaName", row.areaName());
    record.put("date", row.date());
    for (String metric : metrics) {
      record.put(metric, null);
    }
    return record;
  }

  private final class BatchedSource implements ChunkStream.BatchSource {
    private final QueryPlan plan;
    private final List<String> metrics;
    private List<Integer> areaIds;
    private int offset;

    BatchedSource(QueryPlan plan, List<String> metrics) {
      this.plan = plan;
      this.metrics = metrics;
    }

    @Override
    public List<Map<String, Object>> nextBatch() {
      if (areaIds == null) {
        areaIds = rows.areaIdsByType(plan.areaType());
        log.debug("{} areas of type {} in partition {}", areaIds.size(), plan.areaType(),
            plan.partitionId());
      }
      if (offset >= areaIds.size()) {
        return null;
      }
      int end = Math.min(offset + properties.batchSize(), areaIds.size());
      List<Integer> batch = areaIds.subList(offset, end);
      offset = end;
      return pivot(rows.fetchBatch(plan, batch), metrics);
    }
  }

  private final class PagedSource implements ChunkStream.BatchSource {
    private final QueryPlan plan;
    private final List<String> metrics;
    private List<Integer> areaIds;
    private List<MetricRow> heldBack = new ArrayList<>();
    private MetricRow after;
    private boolean exhausted;

    PagedSource(QueryPlan plan, List<String> metrics) {
      this.plan = plan;
      this.metrics = metrics;
    }

    @Override
    public List<Map<String, Object>> nextBatch() {
      if (areaIds == null) {
        areaIds = rows.areaIdsByCode(plan.areaType(), plan.areaCode());
        exhausted = areaIds.isEmpty();
      }
      int pageSize = properties.pageSize();
      while (!exhausted) {
        List<MetricRow> page = rows.fetchPage(plan, areaIds, after, pageSize);
        exhausted = page.size() < pageSize;
        if (page.isEmpty()) {
          continue;
        }
        after = page.get(page.size() - 1);
        List<MetricRow> pending = new ArrayList<>(heldBack);
        pending.addAll(page);
        if (exhausted) {
          heldBack = new ArrayList<>();
          return pivot(pending, metrics);
        }
        int split = pending.size();
        while (split > 0 && pending.get(split - 1).date().equals(after.date())) {
          split--;
        }
        heldBack = new ArrayList<>(pending.subList(split, pending.size()));
        if (split > 0) {
          return pivot(pending.subList(0, split), metrics);
        }
      }
      if (!heldBack.isEmpty()) {
        List<MetricRow> last = heldBack;
        heldBack = new ArrayList<>();
        return pivot(last, metrics);
      }
      return null;
    }
  }
}
