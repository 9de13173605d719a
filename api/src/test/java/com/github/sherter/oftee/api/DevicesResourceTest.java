package com.github.sherter.oftee.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.github.sherter.oftee.device.DpidMapping;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.projectfloodlight.openflow.types.DatapathId;

class DevicesResourceTest {

  private final DeviceRegistry registry = new DeviceRegistry();
  private final DevicesResource resource = new DevicesResource();
  private final List<byte[]> injected = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    resource.registry = registry;
    registry.accept(DpidMapping.add(DatapathId.of(0xabL), message -> injected.add(message)));
    registry.accept(
        DpidMapping.add(
            DatapathId.of(0xcdL),
            message -> {
              throw new IOException("device went away");
            }));
    long deadline = System.currentTimeMillis() + 5000;
    while (registry.devices().size() < 2 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  @AfterEach
  void tearDown() {
    registry.close();
  }

  @Test
  void listsDevicesInDisplayForm() {
    assertEquals(
        ImmutableList.of("of:0x00000000000000ab", "of:0x00000000000000cd"),
        resource.listDevices().getDevices());
  }

  @Test
  void injectsIntoKnownDevice() {
    byte[] message = {4, 13, 0, 8, 0, 0, 0, 1};

    Response response = resource.packetOut("of:0x00000000000000ab", message);

    assertEquals(200, response.getStatus());
    assertEquals(1, injected.size());
    assertArrayEquals(message, injected.get(0));
  }

  @Test
  void acceptsDpidWithoutPrefix() {
    assertEquals(200, resource.packetOut("0xab", new byte[] {1}).getStatus());
    assertEquals(200, resource.packetOut("171", new byte[] {1}).getStatus());
  }

  @Test
  void unknownDeviceIsNotFound() {
    assertEquals(404, resource.packetOut("of:0x0000000000000001", new byte[] {1}).getStatus());
  }

  @Test
  void malformedDpidIsNotFound() {
    assertEquals(404, resource.packetOut("of:switch-1", new byte[] {1}).getStatus());
  }

  @Test
  void injectionFailureIsServerError() {
    assertEquals(500, resource.packetOut("of:0xcd", new byte[] {1}).getStatus());
  }

  @Test
  void dpidFormatting() {
    assertEquals("of:0xffffffffffffffff", DevicesResource.format(DatapathId.of(-1L)));
    assertEquals(Optional.of(DatapathId.of(-1L)), DevicesResource.parse("of:0xffffffffffffffff"));
    assertFalse(DevicesResource.parse("").isPresent());
  }
}
