package com.ospicorp.dataapi.web;

import java.net.URI;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * How a data request is answered: a redirect to the cached file, bytes read from the cache, a
 * body produced while the client waits, or nothing at all.
 */
public record DataResponse(Kind kind, URI location, byte[] body, StreamingResponseBody stream) {

  public enum Kind { REDIRECT, INLINE, STREAM, EXISTS, NO_CONTENT }

  public static DataResponse redirect(URI location) {
    return new DataResponse(Kind.REDIRECT, location, null, null);
  }

  public static DataResponse inline(byte[] body) {
    return new DataResponse(Kind.INLINE, null, body, null);
  }

  public static DataResponse stream(StreamingResponseBody stream) {
    return new DataResponse(Kind.STREAM, null, null, stream);
  }

  public static DataResponse exists() {
    return new DataResponse(Kind.EXISTS, null, null, null);
  }

  public static DataResponse noContent() {
    return new DataResponse(Kind.NO_CONTENT, null, null, null);
  }
}
