package com.ospicorp.dataapi.cache;

import com.ospicorp.dataapi.producer.Chunk;
import java.io.IOException;
import java.io.OutputStream;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards chunks to the requesting client in index order.
 *
 * <p>A chunk that arrives ahead of its predecessors is held back until the gap closes. Once the
 * client goes away the relay detaches and drops everything it is given.
 */
class ClientRelay {

  private static final Logger log = LoggerFactory.getLogger(ClientRelay.class);

  private final OutputStream client;
  private final TreeMap<Integer, byte[]> pending = new TreeMap<>();
  private int next;
  private boolean detached;

  ClientRelay(OutputStream client) {
    this.client = client;
    this.detached = client == null;
  }

  void offer(Chunk chunk) {
    if (detached) {
      return;
    }
    pending.put(chunk.index(), chunk.bytes());
    try {
      boolean wrote = false;
      while (!pending.isEmpty() && pending.firstKey() == next) {
        client.write(pending.pollFirstEntry().getValue());
        next++;
        wrote = true;
      }
      if (wrote) {
        client.flush();
      }
    } catch (IOException e) {
      log.info("Client went away after {} chunks, caching continues: {}", next, e.getMessage());
      detach();
    }
  }

  boolean isDetached() {
    return detached;
  }

  private void detach() {
    detached = true;
    pending.clear();
  }
}
