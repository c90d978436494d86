package com.ospicorp.dataapi.producer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.dataapi.data.NotAvailableException;
import com.ospicorp.dataapi.data.QueryPlan;
import com.ospicorp.dataapi.data.RequestDescriptor;
import com.ospicorp.dataapi.data.RequestProperties;
import com.ospicorp.dataapi.format.MetricCatalog;
import com.ospicorp.dataapi.format.ResponseFormatter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResultProducerTest {

  private static final String NEW_CASES = "newCasesByPublishDate";

  @Mock
  private RowRepository rows;

  private final MetricCatalog catalog = new MetricCatalog();
  private ResultProducer producer;

  @BeforeEach
  void setUp() {
    producer = new ResultProducer(rows, new ResponseFormatter(catalog), catalog,
        new ProducerProperties(15, 4, 2), RequestProperties.defaults());
  }

  @Test
  void areaTypeIsReadInBatchesOfFifteen() {
    List<Integer> ids = IntStream.rangeClosed(1, 20).boxed().collect(Collectors.toList());
    when(rows.areaIdsByType("ltla")).thenReturn(ids);
    when(rows.fetchBatch(any(QueryPlan.class), eq(ids.subList(0, 15))))
        .thenReturn(List.of(row("ltla", "E06000001", "2021-03-01", NEW_CASES, "12")));
    when(rows.fetchBatch(any(QueryPlan.class), eq(ids.subList(15, 20))))
        .thenReturn(List.of(row("ltla", "E06000002", "2021-03-01", NEW_CASES, "7")));

    String csv = drain(producer.produce(describe("ltla", "csv", null)).prime());

    assertThat(csv.split("\n")).containsExactly(
        "areaCode,areaName,areaType,date,newCasesByPublishDate",
        "E06000001,Area E06000001,ltla,2021-03-01,12",
        "E06000002,Area E06000002,ltla,2021-03-01,7");

    ArgumentCaptor<QueryPlan> plan = ArgumentCaptor.forClass(QueryPlan.class);
    verify(rows, times(2)).fetchBatch(plan.capture(), any());
    assertThat(plan.getValue().partitionId()).isEqualTo("2021_3_1_ltla");
    assertThat(plan.getValue().metrics()).containsExactly(NEW_CASES);
  }

  @Test
  void emptyBatchesAreSkippedInsideTheEnvelope() {
    List<Integer> ids = IntStream.rangeClosed(1, 30).boxed().collect(Collectors.toList());
    when(rows.areaIdsByType("nation")).thenReturn(ids);
    when(rows.fetchBatch(any(QueryPlan.class), eq(ids.subList(0, 15)))).thenReturn(List.of());
    when(rows.fetchBatch(any(QueryPlan.class), eq(ids.subList(15, 30))))
        .thenReturn(List.of(row("nation", "E92000001", "2021-03-01", NEW_CASES, "6040")));

    String json = drain(producer.produce(describe("nation", "json", null)).prime());

    assertThat(json).isEqualTo("{\"body\":[{\"areaType\":\"nation\",\"areaCode\":\"E92000001\","
        + "\"areaName\":\"Area E92000001\",\"date\":\"2021-03-01\",\"newCasesByPublishDate\":6040}]}");
  }

  @Test
  void noRowsMeansNotAvailable() {
    when(rows.areaIdsByType("nation")).thenReturn(List.of(1));
    when(rows.fetchBatch(any(QueryPlan.class), any())).thenReturn(List.of());

    ChunkStream stream = producer.produce(describe("nation", "csv", null));

    assertThatThrownBy(stream::prime).isInstanceOf(NotAvailableException.class);
  }

  @Test
  void unknownAreaCodeMeansNotAvailable() {
    when(rows.areaIdsByCode("utla", "E99999999")).thenReturn(List.of());

    ChunkStream stream = producer.produce(describe("utla", "csv", "E99999999"));

    assertThatThrownBy(stream::prime).isInstanceOf(NotAvailableException.class);
    verify(rows, never()).fetchPage(any(), any(), any(), anyInt());
  }

  @Test
  void pagesNeverSplitADate() {
    when(rows.areaIdsByCode("utla", "E06000001")).thenReturn(List.of(7));
    MetricRow a = row("utla", "E06000001", "2021-03-03", NEW_CASES, "3");
    MetricRow b = row("utla", "E06000001", "2021-03-03", "cumCasesByPublishDate", "30");
    MetricRow c = row("utla", "E06000001", "2021-03-02", NEW_CASES, "2");
    MetricRow d = row("utla", "E06000001", "2021-03-02", "cumCasesByPublishDate", "27");
    MetricRow e = row("utla", "E06000001", "2021-03-01", NEW_CASES, "1");
    MetricRow lastOfFirstPage = row("utla", "E06000001", "2021-03-02", "hospitalCases", "9");
    // a page size of 4 cuts 2021-03-02 in half
    when(rows.fetchPage(any(QueryPlan.class), eq(List.of(7)), isNull(), eq(4)))
        .thenReturn(List.of(a, b, c, lastOfFirstPage));
    when(rows.fetchPage(any(QueryPlan.class), eq(List.of(7)), eq(lastOfFirstPage), eq(4)))
        .thenReturn(List.of(d, e));

    ChunkStream stream = producer.produce(describe("utla", "csv", "E06000001",
        NEW_CASES + ",cumCasesByPublishDate,hospitalCases")).prime();
    List<String> chunks = new ArrayList<>();
    stream.forEachRemaining(chunk -> chunks.add(new String(chunk.bytes(), StandardCharsets.UTF_8)));

    assertThat(chunks).hasSize(2);
    assertThat(chunks.get(0)).isEqualTo(
        "areaCode,areaName,areaType,date,cumCasesByPublishDate,hospitalCases,newCasesByPublishDate\n"
            + "E06000001,Area E06000001,utla,2021-03-03,30,,3\n");
    assertThat(chunks.get(1)).isEqualTo(
        "E06000001,Area E06000001,utla,2021-03-02,27,9,2\n"
            + "E06000001,Area E06000001,utla,2021-03-01,,,1\n");
  }

  @Test
  void pivotOrdersByDateThenAreaCode() {
    List<Map<String, Object>> records = producer.pivot(List.of(
        row("ltla", "E2", "2021-03-01", NEW_CASES, "1"),
        row("ltla", "E1", "2021-03-01", NEW_CASES, "2"),
        row("ltla", "E1", "2021-03-02", NEW_CASES, "3"),
        row("ltla", "E1", "2021-03-02", "cumCasesByPublishDate", "10")),
        List.of(NEW_CASES, "cumCasesByPublishDate"));

    assertThat(records).extracting(record -> record.get("areaCode") + "@" + record.get("date"))
        .containsExactly("E1@2021-03-02", "E1@2021-03-01", "E2@2021-03-01");
    assertThat(records.get(0)).containsEntry(NEW_CASES, 3L)
        .containsEntry("cumCasesByPublishDate", 10L);
    assertThat(records.get(1)).containsEntry("cumCasesByPublishDate", null);
  }

  @Test
  void existenceProbeUsesExistsTemplate() {
    when(rows.exists(any(QueryPlan.class))).thenReturn(true);
    RequestDescriptor head = RequestDescriptor.of("nation", "2021-03-01", "csv",
        List.of(NEW_CASES), null, RequestDescriptor.HEAD, catalog, RequestProperties.defaults());

    assertThat(producer.exists(head)).isTrue();

    ArgumentCaptor<QueryPlan> plan = ArgumentCaptor.forClass(QueryPlan.class);
    verify(rows).exists(plan.capture());
    assertThat(plan.getValue().template()).isEqualTo(QueryPlan.Template.EXISTS);
  }

  private RequestDescriptor describe(String areaType, String format, String areaCode) {
    return describe(areaType, format, areaCode, NEW_CASES);
  }

  private RequestDescriptor describe(String areaType, String format, String areaCode,
      String metrics) {
    return RequestDescriptor.of(areaType, "2021-03-01", format, List.of(metrics), areaCode,
        RequestDescriptor.GET, catalog, RequestProperties.defaults());
  }

  private static String drain(ChunkStream stream) {
    StringBuilder out = new StringBuilder();
    stream.forEachRemaining(chunk -> out.append(new String(chunk.bytes(), StandardCharsets.UTF_8)));
    return out.toString();
  }

  private static MetricRow row(String areaType, String areaCode, String date, String metric,
      String value) {
    return new MetricRow(areaType, areaCode, "Area " + areaCode, date, metric, value);
  }
}
