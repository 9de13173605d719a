package com.github.sherter.oftee.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.sherter.oftee.device.DpidMapping;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.ws.rs.client.Client;
import javax.ws.rs.client.ClientBuilder;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.projectfloodlight.openflow.types.DatapathId;

class ApiServerTest {

  private final DeviceRegistry registry = new DeviceRegistry();
  private final List<byte[]> injected = new CopyOnWriteArrayList<>();

  private ApiServer server;
  private Client client;
  private WebTarget base;

  @BeforeEach
  void setUp() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    server =
        ApiServer.start(new InetSocketAddress("127.0.0.1", port), registry);
    client = ClientBuilder.newClient();
    base = client.target("http://127.0.0.1:" + port).path("oftee");

    registry.accept(DpidMapping.add(DatapathId.of(0x2aL), injected::add));
    long deadline = System.currentTimeMillis() + 5000;
    while (registry.devices().isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.stop();
    registry.close();
  }

  @Test
  void listsDevicesAsJson() throws Exception {
    Response response = base.request(MediaType.APPLICATION_JSON).get();

    assertEquals(200, response.getStatus());
    JsonNode body = new ObjectMapper().readTree(response.readEntity(String.class));
    assertEquals(1, body.get("devices").size());
    assertEquals("of:0x000000000000002a", body.get("devices").get(0).asText());
  }

  @Test
  void postInjectsMessage() {
    byte[] message = {4, 13, 0, 10, 0, 0, 0, 5, 1, 2};

    Response response =
        base.path("of:0x000000000000002a")
            .request()
            .post(Entity.entity(message, MediaType.APPLICATION_OCTET_STREAM_TYPE));

    assertEquals(200, response.getStatus());
    assertEquals(1, injected.size());
    assertArrayEquals(message, injected.get(0));
  }

  @Test
  void postToUnknownDeviceIsNotFound() {
    Response response =
        base.path("0x99")
            .request()
            .post(Entity.entity(new byte[] {1}, MediaType.APPLICATION_OCTET_STREAM_TYPE));

    assertEquals(404, response.getStatus());
  }
}
