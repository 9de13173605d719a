package com.github.sherter.oftee.networking;

import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Accepts connections on a server socket until it is closed. */
public class Acceptor implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(Acceptor.class);

  private final ServerSocket serverSocket;
  private final Consumer<? super Socket> connectedCallback;

  public Acceptor(ServerSocket serverSocket, Consumer<? super Socket> connectedCallback) {
    this.serverSocket = serverSocket;
    this.connectedCallback = connectedCallback;
  }

  /**
   * Blocks the calling thread. A failed accept is logged and the loop goes on; the loop only ends
   * when the server socket is closed.
   */
  public void loop() {
    while (!serverSocket.isClosed()) {
      Socket socket;
      try {
        socket = serverSocket.accept();
      } catch (IOException e) {
        if (serverSocket.isClosed()) {
          break;
        }
        log.error("error while accepting connection", e);
        continue;
      }
      log.debug("received connection from {}", socket.getRemoteSocketAddress());
      try {
        connectedCallback.accept(socket);
      } catch (RuntimeException e) {
        log.error("error while handling connection from {}", socket.getRemoteSocketAddress(), e);
        closeQuietly(socket);
      }
    }
    log.debug("stopped accepting connections on {}", serverSocket.getLocalSocketAddress());
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("closing socket failed", e);
    }
  }

  @Override
  public void close() throws IOException {
    serverSocket.close();
  }
}
