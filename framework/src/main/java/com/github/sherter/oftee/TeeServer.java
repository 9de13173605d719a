package com.github.sherter.oftee;

import static com.google.common.base.Preconditions.checkState;

import com.github.sherter.oftee.device.DpidMapping;
import com.github.sherter.oftee.endpoints.EndpointConfigurationException;
import com.github.sherter.oftee.endpoints.EndpointSource;
import com.github.sherter.oftee.endpoints.TeeMultiplexer;
import com.github.sherter.oftee.networking.Acceptor;
import com.github.sherter.oftee.networking.Connection;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts connections from OpenFlow devices and runs a {@link TeeSession} for each of them on its
 * own thread.
 *
 * <p>Call {@link #listenOn} and then {@link #loop()} to get this going.
 */
public class TeeServer implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(TeeServer.class);

  private final InetSocketAddress controllerAddress;
  private final EndpointSource endpointSource;
  private final Consumer<? super DpidMapping> mappings;
  private final ExecutorService executor =
      Executors.newCachedThreadPool(
          new ThreadFactoryBuilder().setNameFormat("oftee-session-%d").setDaemon(true).build());

  private volatile Acceptor acceptor;

  TeeServer(
      InetSocketAddress controllerAddress,
      EndpointSource endpointSource,
      Consumer<? super DpidMapping> mappings) {
    this.controllerAddress = controllerAddress;
    this.endpointSource = endpointSource;
    this.mappings = mappings;
  }

  /**
   * Binds the server socket.
   *
   * @param listenAddress the address on which to accept device connections. If {@code null}, an
   *     ephemeral port on a local address is picked.
   * @return the address actually bound
   */
  public InetSocketAddress listenOn(@Nullable InetSocketAddress listenAddress) throws IOException {
    checkState(acceptor == null, "already listening");
    ServerSocket serverSocket = new ServerSocket();
    serverSocket.setReuseAddress(true);
    serverSocket.bind(listenAddress);
    acceptor = new Acceptor(serverSocket, this::acceptConnectionFromSwitch);
    log.info("listening for OpenFlow devices on {}", serverSocket.getLocalSocketAddress());
    return (InetSocketAddress) serverSocket.getLocalSocketAddress();
  }

  /** Accepts device connections on the calling thread until {@link #close()} is called. */
  public void loop() {
    checkState(acceptor != null, "listenOn must be called first");
    acceptor.loop();
  }

  void acceptConnectionFromSwitch(Socket socket) {
    Connection device;
    try {
      device = new Connection(socket);
    } catch (IOException e) {
      log.error("failed to set up connection from {}", socket.getRemoteSocketAddress(), e);
      closeSocket(socket);
      return;
    }

    TeeMultiplexer endpoints;
    try {
      endpoints = endpointSource.acquire();
    } catch (EndpointConfigurationException e) {
      log.error(
          "unable to establish non-shared outbound end point connections, dropping {}",
          device.remoteAddress(),
          e);
      device.close();
      return;
    }

    executor.execute(
        new TeeSession(
            device,
            controllerAddress,
            endpoints,
            mappings,
            executor,
            () -> endpointSource.release(endpoints)));
  }

  private static void closeSocket(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("closing socket failed", e);
    }
  }

  /**
   * Stops accepting new devices. Sessions that are already running are not interrupted; they end
   * when their connections break.
   */
  @Override
  public void close() throws IOException {
    if (acceptor != null) {
      acceptor.close();
    }
  }

  public static class Builder {
    private final InetSocketAddress controllerAddress;
    private EndpointSource endpointSource;
    private Consumer<? super DpidMapping> mappings = mapping -> {};

    /**
     * @param controllerAddress required builder parameter: address to connect to when a device
     *     connects
     */
    public Builder(InetSocketAddress controllerAddress) {
      this.controllerAddress = controllerAddress;
    }

    public Builder endpoints(EndpointSource endpointSource) {
      this.endpointSource = endpointSource;
      return this;
    }

    /** Receives an event whenever a device announces its datapath id or disconnects. */
    public Builder mappings(Consumer<? super DpidMapping> mappings) {
      this.mappings = mappings;
      return this;
    }

    public TeeServer build() {
      checkState(endpointSource != null, "no end point source configured");
      return new TeeServer(controllerAddress, endpointSource, mappings);
    }
  }
}
