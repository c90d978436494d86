package com.ospicorp.dataapi.format;

public enum MetricType {
  INTEGER,
  FLOAT,
  STRING,
  /** Array of objects, e.g. age demographics. */
  NESTED,
  /** Not in the catalog; values keep their JSON type. */
  UNKNOWN
}
