package com.ospicorp.dataapi.cache;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temporary file collecting the chunks of one response.
 *
 * <p>Chunks are appended in arrival order and remembered by index; {@link #openStream()} yields
 * them in index order. Writes are serialised with a lock.
 */
class ScratchBuffer implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(ScratchBuffer.class);

  private record Segment(long offset, int length) {
  }

  private final ReentrantLock lock = new ReentrantLock();
  private final TreeMap<Integer, Segment> segments = new TreeMap<>();
  private final Path file;
  private final FileChannel channel;
  private Path assembled;
  private long size;
  private boolean inFileOrder = true;

  ScratchBuffer() throws IOException {
    this.file = Files.createTempFile("dataapi-", ".part");
    this.channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
  }

  void write(int index, byte[] bytes) throws IOException {
    lock.lock();
    try {
      if (segments.containsKey(index)) {
        throw new IllegalStateException("Chunk " + index + " was already written");
      }
      long offset = size;
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      while (buffer.hasRemaining()) {
        channel.write(buffer, offset + buffer.position());
      }
      Map.Entry<Integer, Segment> last = segments.lastEntry();
      if (last != null && last.getKey() > index) {
        inFileOrder = false;
      }
      segments.put(index, new Segment(offset, bytes.length));
      size += bytes.length;
    } finally {
      lock.unlock();
    }
  }

  long size() {
    lock.lock();
    try {
      return size;
    } finally {
      lock.unlock();
    }
  }

  /** True when indexes form the run {@code 0..n-1} with no gaps. */
  boolean isContiguous() {
    lock.lock();
    try {
      return segments.isEmpty() || segments.lastKey() == segments.size() - 1;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Content in index order. When chunks arrived out of order they are first copied into a second
   * file in the right order.
   */
  InputStream openStream() throws IOException {
    lock.lock();
    try {
      channel.force(false);
      if (inFileOrder) {
        return Files.newInputStream(file);
      }
      assembled = Files.createTempFile("dataapi-", ".assembled");
      try (OutputStream out = Files.newOutputStream(assembled)) {
        for (Segment segment : segments.values()) {
          ByteBuffer buffer = ByteBuffer.allocate(segment.length());
          while (buffer.hasRemaining()) {
            int read = channel.read(buffer, segment.offset() + buffer.position());
            if (read < 0) {
              throw new IOException("Scratch file truncated at offset " + segment.offset());
            }
          }
          out.write(buffer.array());
        }
      }
      return Channels.newInputStream(FileChannel.open(assembled, StandardOpenOption.READ));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      channel.close();
      Files.deleteIfExists(file);
      if (assembled != null) {
        Files.deleteIfExists(assembled);
      }
    } catch (IOException e) {
      log.warn("Unable to remove scratch file {}: {}", file, e.getMessage());
    } finally {
      lock.unlock();
    }
  }
}
