package com.github.sherter.oftee.endpoints;

import java.io.Closeable;
import java.io.IOException;
import javax.ws.rs.client.Client;
import javax.ws.rs.client.ClientBuilder;

/**
 * Opens TCP connections for {@link Destination.Kind#TCP} destinations and hands out HTTP
 * transports sharing a single JAX-RS client for {@link Destination.Kind#HTTP} destinations.
 */
public class DefaultTransportFactory implements TransportFactory, Closeable {

  private final Client client;

  public DefaultTransportFactory() {
    this(ClientBuilder.newClient());
  }

  public DefaultTransportFactory(Client client) {
    this.client = client;
  }

  @Override
  public Transport open(Destination destination) throws IOException {
    switch (destination.kind()) {
      case TCP:
        return TcpTransport.connect(destination.hostAndPort());
      case HTTP:
        return new HttpTransport(client, destination.uri());
      default:
        throw new AssertionError("unhandled destination kind " + destination.kind());
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
