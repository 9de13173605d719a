package com.github.sherter.oftee.networking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AcceptorTest {

  @Test
  void failingCallbackDoesNotStopTheLoop() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    BlockingQueue<Socket> handled = new LinkedBlockingQueue<>();
    ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    Acceptor acceptor =
        new Acceptor(
            server,
            socket -> {
              if (calls.getAndIncrement() == 0) {
                throw new IllegalStateException("broken handler");
              }
              handled.add(socket);
            });
    Thread loop = new Thread(acceptor::loop, "test-acceptor");
    loop.setDaemon(true);
    loop.start();
    try (Socket first = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
        Socket second = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort())) {
      first.setSoTimeout(5000);

      try {
        assertEquals(-1, first.getInputStream().read());
      } catch (SocketException e) {
        // a reset is a close as well
      }
      Socket accepted = handled.poll(5, TimeUnit.SECONDS);
      assertNotNull(accepted);
      assertEquals(second.getLocalPort(), accepted.getPort());
      accepted.close();
    } finally {
      acceptor.close();
      loop.join(5000);
    }
    assertEquals(2, calls.get());
  }

  @Test
  void closingEndsTheLoop() throws Exception {
    ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    Acceptor acceptor = new Acceptor(server, socket -> {});
    Thread loop = new Thread(acceptor::loop, "test-acceptor");
    loop.start();

    acceptor.close();
    loop.join(5000);

    assertFalse(loop.isAlive());
  }
}
