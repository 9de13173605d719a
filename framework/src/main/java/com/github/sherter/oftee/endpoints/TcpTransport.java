package com.github.sherter.oftee.endpoints;

import com.github.sherter.oftee.networking.Addresses;
import com.google.common.net.HostAndPort;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

/** Forwards messages over a TCP connection that is opened once and kept for its lifetime. */
public class TcpTransport implements Transport {

  private final Socket socket;
  private final OutputStream out;
  // one writer at a time, sessions sharing this end point must not interleave messages
  private final Object writeLock = new Object();

  TcpTransport(Socket socket) throws IOException {
    this.socket = socket;
    this.out = socket.getOutputStream();
  }

  public static TcpTransport connect(HostAndPort hostAndPort) throws IOException {
    Socket socket = new Socket();
    try {
      socket.connect(Addresses.forConnecting(hostAndPort));
      socket.setTcpNoDelay(true);
      return new TcpTransport(socket);
    } catch (IOException e) {
      socket.close();
      throw e;
    }
  }

  @Override
  public void write(byte[] message) throws IOException {
    synchronized (writeLock) {
      out.write(message);
      out.flush();
    }
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }

  @Override
  public String toString() {
    return "TcpTransport{" + socket.getRemoteSocketAddress() + "}";
  }
}
