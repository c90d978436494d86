package com.ospicorp.dataapi.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Value types of the published metrics, loaded from {@code metric-catalog.json}.
 *
 * <p>Nested metrics also carry the field names of their array elements, which become the CSV
 * columns of a nested response.
 */
@Component
public class MetricCatalog {

  private static final Logger log = LoggerFactory.getLogger(MetricCatalog.class);
  private static final String DEFAULT_LOCATION = "metric-catalog.json";

  private final ObjectMapper mapper;
  private final Map<String, MetricType> types = new HashMap<>();
  private final Map<String, List<String>> structures = new HashMap<>();

  public MetricCatalog() {
    this(new ClassPathResource(DEFAULT_LOCATION), new ObjectMapper());
  }

  public MetricCatalog(Resource resource, ObjectMapper mapper) {
    this.mapper = mapper;
    try (InputStream in = resource.getInputStream()) {
      JsonNode root = mapper.readTree(in);
      register(root.path("integer"), MetricType.INTEGER);
      register(root.path("float"), MetricType.FLOAT);
      register(root.path("string"), MetricType.STRING);
      root.path("nested").fields().forEachRemaining(entry -> {
        types.put(entry.getKey(), MetricType.NESTED);
        List<String> fields = mapper.convertValue(entry.getValue(),
            new TypeReference<List<String>>() {});
        structures.put(entry.getKey(), List.copyOf(fields));
      });
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to load metric catalog " + resource, e);
    }
    log.info("Loaded {} metrics ({} nested) from {}", types.size(), structures.size(),
        resource.getDescription());
  }

  public MetricType typeOf(String metric) {
    return types.getOrDefault(metric, MetricType.UNKNOWN);
  }

  public boolean isNested(String metric) {
    return typeOf(metric) == MetricType.NESTED;
  }

  /** Element fields of a nested metric, empty for any other metric. */
  public List<String> structureOf(String metric) {
    return structures.getOrDefault(metric, List.of());
  }

  /**
   * Converts a raw JSON value as stored in the database to the metric's value type. Integer
   * metrics become {@link Long} so they never render with a fractional part.
   */
  public Object convert(String metric, String rawJson) {
    if (rawJson == null) {
      return null;
    }
    JsonNode node;
    try {
      node = mapper.readTree(rawJson);
    } catch (JsonProcessingException e) {
      // Plain text that was stored unquoted.
      return typeOf(metric) == MetricType.STRING ? rawJson : null;
    }
    if (node == null || node.isNull() || isNullText(node)) {
      return null;
    }
    switch (typeOf(metric)) {
      case INTEGER: {
        Double number = numberOf(metric, node);
        return number == null ? null : (Object) Math.round(number);
      }
      case FLOAT:
        return numberOf(metric, node);
      case STRING:
        return node.asText();
      case NESTED:
        return mapper.convertValue(node, new TypeReference<List<LinkedHashMap<String, Object>>>() {});
      default:
        return mapper.convertValue(node, Object.class);
    }
  }

  /** The finite numeric value of a number or numeric text, otherwise {@code null}. */
  private static Double numberOf(String metric, JsonNode node) {
    double value;
    if (node.isNumber()) {
      value = node.doubleValue();
    } else if (node.isTextual()) {
      try {
        value = Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        log.debug("Non-numeric value {} for {} treated as missing", node, metric);
        return null;
      }
    } else {
      return null;
    }
    return Double.isFinite(value) ? value : null;
  }

  private static boolean isNullText(JsonNode node) {
    return node.isTextual() && "null".equals(node.asText());
  }

  private void register(JsonNode names, MetricType type) {
    names.forEach(name -> types.put(name.asText(), type));
  }
}
