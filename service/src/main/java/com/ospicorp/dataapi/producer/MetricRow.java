package com.ospicorp.dataapi.producer;

/**
 * One long-format row: a single metric value of one area on one date. {@code value} is the raw
 * JSON text stored in the database.
 */
public record MetricRow(
    String areaType,
    String areaCode,
    String areaName,
    String date,
    String metric,
    String value) {
}
