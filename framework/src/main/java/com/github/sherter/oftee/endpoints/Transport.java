package com.github.sherter.oftee.endpoints;

import java.io.Closeable;
import java.io.IOException;

/**
 * Something a complete OpenFlow message can be written to.
 *
 * <p>A write is a single best-effort attempt. Implementations neither retry nor reconnect, a
 * broken destination keeps failing until it is closed.
 */
public interface Transport extends Closeable {

  /**
   * Writes {@code message} to the destination. Concurrent calls must not interleave the bytes of
   * different messages.
   */
  void write(byte[] message) throws IOException;
}
