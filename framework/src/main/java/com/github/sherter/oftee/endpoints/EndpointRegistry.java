package com.github.sherter.oftee.endpoints;

import com.google.common.base.Strings;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns end point specifications into live end points. */
public class EndpointRegistry {

  private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

  private final TransportFactory transports;

  public EndpointRegistry(TransportFactory transports) {
    this.transports = transports;
  }

  /**
   * Parses every non-empty specification and opens its transport. The returned multiplexer keeps
   * the order of {@code specs}. If any specification fails, the transports opened so far are
   * closed again.
   */
  public TeeMultiplexer establish(List<String> specs) throws EndpointConfigurationException {
    List<Endpoint> endpoints = new ArrayList<>(specs.size());
    try {
      for (String spec : specs) {
        if (Strings.isNullOrEmpty(spec) || spec.trim().isEmpty()) {
          continue;
        }
        endpoints.add(open(EndpointSpec.parse(spec)));
      }
    } catch (EndpointConfigurationException e) {
      log.error("unable to establish outbound end points: {}", e.getMessage());
      new TeeMultiplexer(endpoints).close();
      throw e;
    }
    return new TeeMultiplexer(endpoints);
  }

  private Endpoint open(EndpointSpec spec) throws EndpointConfigurationException {
    Destination destination = Destination.parse(spec.destination());
    Transport transport;
    try {
      transport = transports.open(destination);
    } catch (IOException e) {
      throw new EndpointConfigurationException(
          "unable to connect to outbound end point '" + spec.destination() + "'", e);
    }
    log.info("created outbound end point connection {} with rule {}", destination, spec.rule());
    return new Endpoint(destination, spec.rule(), transport);
  }
}
