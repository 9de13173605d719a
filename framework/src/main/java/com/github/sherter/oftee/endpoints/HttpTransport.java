package com.github.sherter.oftee.endpoints;

import java.io.IOException;
import java.net.URI;
import javax.ws.rs.ProcessingException;
import javax.ws.rs.client.Client;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

/**
 * Delivers every message with its own HTTP POST request. The request body is the raw OpenFlow
 * message.
 */
public class HttpTransport implements Transport {

  private final URI uri;
  private final WebTarget target;

  HttpTransport(Client client, URI uri) {
    this.uri = uri;
    this.target = client.target(uri);
  }

  @Override
  public void write(byte[] message) throws IOException {
    Response response;
    try {
      response =
          target
              .request()
              .post(Entity.entity(message, MediaType.APPLICATION_OCTET_STREAM_TYPE));
    } catch (ProcessingException e) {
      throw new IOException("POST to " + uri + " failed", e);
    }
    try {
      if (response.getStatusInfo().getFamily() != Response.Status.Family.SUCCESSFUL) {
        throw new IOException(
            "POST to " + uri + " was answered with status " + response.getStatus());
      }
    } finally {
      response.close();
    }
  }

  /** Nothing to release, the HTTP client belongs to the {@link TransportFactory}. */
  @Override
  public void close() {}

  @Override
  public String toString() {
    return "HttpTransport{" + uri + "}";
  }
}
