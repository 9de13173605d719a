package com.github.sherter.oftee.networking;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.io.ByteStreams;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import org.junit.jupiter.api.Test;

class ConnectionTest {

  @Test
  void sendWritesWholeMessage() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Connection connection = Connection.establish(server.getLocalSocketAddress());
      try (Socket peer = server.accept()) {
        peer.setSoTimeout(5000);
        byte[] message = {1, 2, 3, 4, 5};

        connection.send(message);
        connection.out().write(new byte[] {6, 7}, 0, 2);
        connection.out().flush();

        byte[] received = new byte[7];
        ByteStreams.readFully(peer.getInputStream(), received);
        assertArrayEquals(new byte[] {1, 2, 3, 4, 5, 6, 7}, received);
      } finally {
        connection.close();
      }
    }
  }

  @Test
  void closeIsIdempotentAndEndsPeerStream() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Connection connection = Connection.establish(server.getLocalSocketAddress());
      try (Socket peer = server.accept()) {
        peer.setSoTimeout(5000);

        connection.close();
        connection.close();

        assertTrue(connection.isClosed());
        assertEquals(-1, peer.getInputStream().read());
      }
    }
  }
}
