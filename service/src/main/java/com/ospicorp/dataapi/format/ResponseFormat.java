package com.ospicorp.dataapi.format;

import java.util.Locale;
import java.util.Optional;

public enum ResponseFormat {
  CSV("csv", "text/csv; charset=utf-8"),
  JSON("json", "application/vnd.PHE-COVID19.v2+json; charset=utf-8"),
  JSONL("jsonl", "application/vnd.PHE-COVID19.v2+jsonl; charset=utf-8"),
  /** Legacy name kept for old clients; rendered as JSON. */
  XML("xml", "application/vnd.PHE-COVID19.v1+json; charset=utf-8");

  private final String extension;
  private final String contentType;

  ResponseFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  /** JSON and its legacy alias are wrapped in a {@code {"body":[...]}} envelope. */
  public boolean isEnveloped() {
    return this == JSON || this == XML;
  }

  public static Optional<ResponseFormat> fromExtension(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalised = value.trim().toLowerCase(Locale.ROOT);
    for (ResponseFormat format : values()) {
      if (format.extension.equals(normalised)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
