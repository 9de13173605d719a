package com.github.sherter.oftee.api;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import javax.ws.rs.core.UriBuilder;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.hk2.utilities.binding.AbstractBinder;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** HTTP API for listing connected devices and injecting messages into them. */
public class ApiServer {

  private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

  private final HttpServer server;

  private ApiServer(HttpServer server) {
    this.server = server;
  }

  public static ApiServer start(InetSocketAddress listenAddress, DeviceRegistry registry)
      throws IOException {
    String host =
        listenAddress.getAddress() == null || listenAddress.getAddress().isAnyLocalAddress()
            ? "0.0.0.0"
            : listenAddress.getHostString();
    URI baseUri = UriBuilder.fromUri("http://" + host + "/").port(listenAddress.getPort()).build();

    ResourceConfig config = new ResourceConfig(DevicesResource.class);
    config.register(JacksonFeature.class);
    config.register(JacksonConfiguration.class);
    config.register(
        new AbstractBinder() {
          @Override
          protected void configure() {
            bind(registry).to(DeviceRegistry.class);
          }
        });

    HttpServer server = GrizzlyHttpServerFactory.createHttpServer(baseUri, config, false);
    server.start();
    log.info("listening for REST API requests on {}", baseUri);
    return new ApiServer(server);
  }

  public void stop() {
    server.shutdownNow();
  }
}
