package com.github.sherter.oftee;

import com.github.sherter.oftee.device.DpidMapping;
import com.github.sherter.oftee.endpoints.TeeMultiplexer;
import com.github.sherter.oftee.networking.Connection;
import java.io.IOException;
import java.net.SocketAddress;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connected device: a connection to the controller is opened for it, messages from the
 * device are handled by a {@link DeviceMessageLoop} on the calling thread and messages from the
 * controller are relayed back on a thread of {@code relayExecutor}. When either direction fails
 * or is closed, both connections are closed.
 */
class TeeSession implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(TeeSession.class);

  private final Connection device;
  private final SocketAddress controllerAddress;
  private final TeeMultiplexer endpoints;
  private final Consumer<? super DpidMapping> mappings;
  private final Executor relayExecutor;
  private final Runnable closedCallback;

  TeeSession(
      Connection device,
      SocketAddress controllerAddress,
      TeeMultiplexer endpoints,
      Consumer<? super DpidMapping> mappings,
      Executor relayExecutor,
      Runnable closedCallback) {
    this.device = device;
    this.controllerAddress = controllerAddress;
    this.endpoints = endpoints;
    this.mappings = mappings;
    this.relayExecutor = relayExecutor;
    this.closedCallback = closedCallback;
  }

  @Override
  public void run() {
    log.info("switch connected from {}", device.remoteAddress());
    Connection controller;
    try {
      controller = Connection.establish(controllerAddress);
    } catch (IOException e) {
      log.error("couldn't establish a connection with controller {}", controllerAddress, e);
      device.close();
      closedCallback.run();
      return;
    }
    log.info("established connection {} with controller", controller);

    relayExecutor.execute(() -> relay(controller));

    DeviceMessageLoop loop =
        new DeviceMessageLoop(device.in(), controller.out(), endpoints, device::send, mappings);
    try {
      loop.run();
      log.info("switch {} disconnected", device.remoteAddress());
    } catch (IOException e) {
      log.info(
          "switch connection broke (remote address: {}); cause: {}",
          device.remoteAddress(),
          e.getMessage());
    } finally {
      controller.close();
      device.close();
      if (loop.dpid() != null) {
        mappings.accept(DpidMapping.delete(loop.dpid(), loop.deviceInjector()));
      }
      closedCallback.run();
    }
  }

  private void relay(Connection controller) {
    try {
      new ControllerRelay(controller.in(), device).run();
      log.info("controller closed connection {}", controller);
    } catch (IOException e) {
      log.debug(
          "controller connection broke (local address: {}); cause: {}",
          controller.localAddress(),
          e.getMessage());
    } finally {
      device.close();
      controller.close();
    }
  }
}
