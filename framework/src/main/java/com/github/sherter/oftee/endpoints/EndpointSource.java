package com.github.sherter.oftee.endpoints;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Decides whether sessions share one set of end points or get their own. */
public interface EndpointSource {

  /** Returns the end points for a newly accepted device connection. */
  TeeMultiplexer acquire() throws EndpointConfigurationException;

  /** Called once the session that acquired {@code endpoints} has ended. */
  void release(TeeMultiplexer endpoints);

  /** Every session uses {@code endpoints}; they are never closed by a session. */
  static EndpointSource shared(TeeMultiplexer endpoints) {
    return new EndpointSource() {
      @Override
      public TeeMultiplexer acquire() {
        return endpoints;
      }

      @Override
      public void release(TeeMultiplexer released) {}
    };
  }

  /** Every session establishes its own connections, closed when the session ends. */
  static EndpointSource dedicated(EndpointRegistry registry, List<String> specs) {
    ImmutableList<String> copy = ImmutableList.copyOf(specs);
    return new EndpointSource() {
      @Override
      public TeeMultiplexer acquire() throws EndpointConfigurationException {
        return registry.establish(copy);
      }

      @Override
      public void release(TeeMultiplexer released) {
        released.close();
      }
    };
  }
}
