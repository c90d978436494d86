package com.ospicorp.dataapi.web;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between a cache write and the response body of the request that started it.
 *
 * <p>The cache write owns the writing side and never shares its thread with the request. When
 * the reader stops (the client disconnects, the request times out or the body task is
 * cancelled), further writes fail with an {@link IOException} so the writer detaches from the
 * client and carries on caching.
 */
class BodyPipe extends OutputStream {

  private static final long POLL_MILLIS = 100;

  private final BlockingQueue<byte[]> queue;
  private final Duration stallTimeout;
  private volatile boolean readerGone;
  private volatile boolean finished;
  private volatile Throwable failure;

  BodyPipe(int capacity, Duration stallTimeout) {
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.stallTimeout = stallTimeout;
  }

  @Override
  public void write(int b) throws IOException {
    write(new byte[] {(byte) b}, 0, 1);
  }

  @Override
  public void write(byte[] bytes, int offset, int length) throws IOException {
    if (readerGone) {
      throw new IOException("Response body is no longer being read");
    }
    try {
      if (!queue.offer(Arrays.copyOfRange(bytes, offset, offset + length),
          stallTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        readerGone = true;
        throw new IOException("Client has not read for " + stallTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while relaying to client");
    }
  }

  /** Marks the end of the content; {@code cause} is non-null when producing it failed. */
  void finish(Throwable cause) {
    failure = cause;
    finished = true;
  }

  /**
   * Copies everything written to {@code out} until the writer finishes.
   *
   * @throws IOException when {@code out} fails, the reading thread is interrupted or the writer
   *     failed
   */
  void drainTo(OutputStream out) throws IOException {
    try {
      while (true) {
        byte[] bytes = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (bytes != null) {
          out.write(bytes);
          if (queue.isEmpty()) {
            out.flush();
          }
        } else if (finished && queue.isEmpty()) {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Response body cancelled");
    } finally {
      readerGone = true;
      queue.clear();
    }
    out.flush();
    if (failure != null) {
      throw new IOException("Response could not be produced", failure);
    }
  }
}
