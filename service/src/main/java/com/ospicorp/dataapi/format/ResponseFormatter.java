package com.ospicorp.dataapi.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders one batch of records in a response format.
 *
 * <p>JSON output is the bare, comma separated list of objects; the enclosing envelope and the
 * separators between batches belong to the caller.
 */
@Component
public class ResponseFormatter {

  /** Identity columns leading every CSV line. */
  public static final List<String> CSV_BASE_COLUMNS = List.of("areaCode", "areaName", "areaType", "date");

  /** Identity keys leading every JSON object. */
  public static final List<String> JSON_BASE_KEYS = List.of("areaType", "areaCode", "areaName", "date");

  // Quote only fields holding a separator, a quote or a line break.
  private final CsvMapper csvMapper = CsvMapper.builder()
      .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
      .build();
  private final ObjectMapper jsonMapper = new ObjectMapper();
  private final MetricCatalog catalog;

  public ResponseFormatter(MetricCatalog catalog) {
    this.catalog = catalog;
  }

  /**
   * @param rows one map per record, keyed by identity column and metric name
   * @param metrics requested metrics in request order, identity columns excluded
   * @param includeHeader whether a CSV header line is written
   */
  public byte[] format(List<Map<String, Object>> rows, ResponseFormat format, List<String> metrics,
      boolean includeHeader) {
    try {
      switch (format) {
        case CSV:
          return csv(rows, metrics, includeHeader);
        case JSONL:
          return jsonLines(rows, metrics);
        default:
          return jsonList(rows, metrics);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to render " + format.extension() + " response", e);
    }
  }

  /** CSV column order: identity columns, then the metrics alphabetically or the nested fields. */
  public List<String> csvColumns(List<String> metrics) {
    List<String> columns = new ArrayList<>(CSV_BASE_COLUMNS);
    String nested = nestedMetric(metrics);
    if (nested != null) {
      columns.addAll(catalog.structureOf(nested));
    } else {
      metrics.stream().sorted().forEach(columns::add);
    }
    return columns;
  }

  private byte[] csv(List<Map<String, Object>> rows, List<String> metrics, boolean includeHeader)
      throws IOException {
    List<String> columns = csvColumns(metrics);
    CsvSchema.Builder builder = CsvSchema.builder();
    columns.forEach(builder::addColumn);
    CsvSchema schema = builder.setUseHeader(includeHeader).build();

    String nested = nestedMetric(metrics);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
      for (Map<String, Object> row : rows) {
        if (nested == null) {
          writer.write(project(row, columns));
        } else {
          for (Map<String, Object> element : elements(row.get(nested))) {
            Map<String, Object> line = new LinkedHashMap<>(row);
            line.putAll(element);
            writer.write(project(line, columns));
          }
        }
      }
    }
    return out.toByteArray();
  }

  private byte[] jsonList(List<Map<String, Object>> rows, List<String> metrics)
      throws JsonProcessingException {
    ObjectWriter writer = jsonMapper.writer();
    StringBuilder body = new StringBuilder();
    for (Map<String, Object> row : rows) {
      if (body.length() > 0) {
        body.append(',');
      }
      body.append(writer.writeValueAsString(jsonObject(row, metrics)));
    }
    return body.toString().getBytes(StandardCharsets.UTF_8);
  }

  private byte[] jsonLines(List<Map<String, Object>> rows, List<String> metrics)
      throws JsonProcessingException {
    ObjectWriter writer = jsonMapper.writer();
    StringBuilder body = new StringBuilder();
    for (Map<String, Object> row : rows) {
      body.append(writer.writeValueAsString(jsonObject(row, metrics))).append('\n');
    }
    return body.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static Map<String, Object> jsonObject(Map<String, Object> row, List<String> metrics) {
    Map<String, Object> object = new LinkedHashMap<>();
    for (String key : JSON_BASE_KEYS) {
      object.put(key, row.get(key));
    }
    for (String metric : metrics) {
      object.put(metric, row.get(metric));
    }
    return object;
  }

  private static Map<String, Object> project(Map<String, Object> row, List<String> columns) {
    Map<String, Object> projected = new LinkedHashMap<>();
    for (String column : columns) {
      projected.put(column, row.get(column));
    }
    return projected;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> elements(Object value) {
    if (value instanceof List<?> list) {
      List<Map<String, Object>> elements = new ArrayList<>(list.size());
      for (Object element : list) {
        if (element instanceof Map<?, ?> map) {
          elements.add((Map<String, Object>) map);
        }
      }
      return elements;
    }
    return List.of();
  }

  private String nestedMetric(List<String> metrics) {
    if (metrics.size() == 1 && catalog.isNested(metrics.get(0))) {
      return metrics.get(0);
    }
    return null;
  }
}
