package com.ospicorp.dataapi.format;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricCatalogTest {

  private final MetricCatalog catalog = new MetricCatalog();

  @Test
  void integersLoseTheirFraction() {
    assertThat(catalog.typeOf("newCasesByPublishDate")).isEqualTo(MetricType.INTEGER);
    assertThat(catalog.convert("newCasesByPublishDate", "6040.0")).isEqualTo(6040L);
    assertThat(catalog.convert("newCasesByPublishDate", "\"12\"")).isEqualTo(12L);
  }

  @Test
  void floatsStayFloats() {
    assertThat(catalog.typeOf("transmissionRateMin")).isEqualTo(MetricType.FLOAT);
    assertThat(catalog.convert("transmissionRateMin", "0.7")).isEqualTo(0.7);
  }

  @Test
  void nullsAreNull() {
    assertThat(catalog.convert("newCasesByPublishDate", null)).isNull();
    assertThat(catalog.convert("newCasesByPublishDate", "null")).isNull();
    assertThat(catalog.convert("newCasesByPublishDate", "\"null\"")).isNull();
  }

  @Test
  void nonNumericTextIsMissingRatherThanZero() {
    assertThat(catalog.convert("newCasesByPublishDate", "\"\"")).isNull();
    assertThat(catalog.convert("newCasesByPublishDate", "\"n/a\"")).isNull();
    assertThat(catalog.convert("transmissionRateMin", "\"NaN\"")).isNull();
    assertThat(catalog.convert("newCasesByPublishDate", "\" 7 \"")).isEqualTo(7L);
  }

  @Test
  void stringsAreText() {
    assertThat(catalog.convert("newCasesByPublishDateDirection", "\"UP\"")).isEqualTo("UP");
    assertThat(catalog.convert("newCasesByPublishDateDirection", "DOWN")).isEqualTo("DOWN");
  }

  @Test
  void nestedMetricsBecomeElementMaps() {
    Object value = catalog.convert("maleCases", "[{\"age\":\"0_to_4\",\"value\":12}]");

    assertThat(catalog.isNested("maleCases")).isTrue();
    assertThat(catalog.structureOf("maleCases")).containsExactly("age", "rate", "value");
    assertThat(value).isEqualTo(List.of(Map.of("age", "0_to_4", "value", 12)));
  }

  @Test
  void unknownMetricsKeepTheirJsonType() {
    assertThat(catalog.typeOf("notAMetric")).isEqualTo(MetricType.UNKNOWN);
    assertThat(catalog.convert("notAMetric", "true")).isEqualTo(true);
  }
}
