package com.ospicorp.dataapi.producer;

import com.ospicorp.dataapi.data.NotAvailableException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazily rendered response: every non-empty batch of records becomes one chunk.
 *
 * <p>Enveloped formats get the opening {@code {"body":[} on the first chunk, a comma before every
 * later batch and a closing chunk. The stream can be consumed once.
 */
public class ChunkStream implements Iterator<Chunk>, AutoCloseable {

  private static final byte[] ENVELOPE_OPEN = "{\"body\":[".getBytes(StandardCharsets.UTF_8);
  private static final byte[] SEPARATOR = ",".getBytes(StandardCharsets.UTF_8);
  private static final byte[] ENVELOPE_CLOSE = "]}".getBytes(StandardCharsets.UTF_8);

  /** Supplies record batches; {@code null} once exhausted. */
  @FunctionalInterface
  public interface BatchSource {
    List<Map<String, Object>> nextBatch();
  }

  @FunctionalInterface
  public interface BatchRenderer {
    byte[] render(List<Map<String, Object>> rows, boolean firstBatch);
  }

  private final BatchSource source;
  private final BatchRenderer renderer;
  private final boolean enveloped;
  private final String description;

  private Chunk lookahead;
  private int nextIndex;
  private boolean emittedData;
  private boolean sourceDone;
  private boolean closingEmitted;
  private boolean closed;

  public ChunkStream(BatchSource source, BatchRenderer renderer, boolean enveloped,
      String description) {
    this.source = source;
    this.renderer = renderer;
    this.enveloped = enveloped;
    this.description = description;
  }

  /**
   * Produces the first chunk ahead of time.
   *
   * @throws NotAvailableException when there is no data at all
   */
  public ChunkStream prime() {
    if (!hasNext()) {
      throw new NotAvailableException("No data available for " + description);
    }
    return this;
  }

  @Override
  public boolean hasNext() {
    if (lookahead == null) {
      lookahead = advance();
    }
    return lookahead != null;
  }

  @Override
  public Chunk next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Chunk chunk = lookahead;
    lookahead = null;
    return chunk;
  }

  private Chunk advance() {
    if (closed) {
      return null;
    }
    while (!sourceDone) {
      List<Map<String, Object>> rows = source.nextBatch();
      if (rows == null) {
        sourceDone = true;
      } else if (!rows.isEmpty()) {
        byte[] body = renderer.render(rows, !emittedData);
        byte[] prefix = !enveloped ? new byte[0] : emittedData ? SEPARATOR : ENVELOPE_OPEN;
        emittedData = true;
        return new Chunk(nextIndex++, concat(prefix, body));
      }
    }
    if (enveloped && emittedData && !closingEmitted) {
      closingEmitted = true;
      return new Chunk(nextIndex++, ENVELOPE_CLOSE.clone());
    }
    return null;
  }

  @Override
  public void close() {
    closed = true;
    lookahead = null;
  }

  private static byte[] concat(byte[] prefix, byte[] body) {
    if (prefix.length == 0) {
      return body;
    }
    byte[] joined = new byte[prefix.length + body.length];
    System.arraycopy(prefix, 0, joined, 0, prefix.length);
    System.arraycopy(body, 0, joined, prefix.length, body.length);
    return joined;
  }
}
