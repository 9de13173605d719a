package com.github.sherter.oftee.endpoints;

import com.github.sherter.oftee.criteria.Criteria;
import com.google.common.collect.ImmutableList;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered, immutable set of tee end points. Safe to share between sessions, writes are
 * serialized by the individual transports.
 */
public class TeeMultiplexer implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(TeeMultiplexer.class);

  private final ImmutableList<Endpoint> endpoints;

  public TeeMultiplexer(List<Endpoint> endpoints) {
    this.endpoints = ImmutableList.copyOf(endpoints);
  }

  public ImmutableList<Endpoint> endpoints() {
    return endpoints;
  }

  /**
   * Writes {@code message} to every end point whose rule matches {@code state}, in registration
   * order. A failing end point is logged and skipped.
   */
  public void conditionalWrite(byte[] message, Criteria state) {
    for (Endpoint endpoint : endpoints) {
      if (!endpoint.rule().matches(state)) {
        continue;
      }
      try {
        endpoint.transport().write(message);
      } catch (IOException e) {
        log.warn("failed to tee message to {}: {}", endpoint.destination(), e.getMessage());
      }
    }
  }

  @Override
  public void close() {
    for (Endpoint endpoint : endpoints) {
      try {
        endpoint.transport().close();
      } catch (IOException e) {
        log.warn("failed to close end point {}", endpoint.destination(), e);
      }
    }
  }

  @Override
  public String toString() {
    return "TeeMultiplexer" + endpoints;
  }
}
