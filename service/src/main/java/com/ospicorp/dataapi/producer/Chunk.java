package com.ospicorp.dataapi.producer;

import java.nio.charset.StandardCharsets;

/**
 * A piece of a rendered response. Indexes start at zero and are contiguous within one response.
 */
public record Chunk(int index, byte[] bytes) {

  public Chunk {
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index must not be negative: " + index);
    }
    if (bytes == null) {
      throw new IllegalArgumentException("Chunk bytes must not be null");
    }
  }

  public static Chunk of(int index, String text) {
    return new Chunk(index, text.getBytes(StandardCharsets.UTF_8));
  }
}
