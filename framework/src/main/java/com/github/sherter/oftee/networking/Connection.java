package com.github.sherter.oftee.networking;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A blocking TCP connection. Reading is left to a single owner of {@link #in()}, while {@link
 * #send(byte[])} may be called from any thread and writes each call as a whole.
 */
public class Connection {

  private static final Logger log = LoggerFactory.getLogger(Connection.class);

  private final Socket socket;
  private final InputStream in;
  private final OutputStream out;

  private final Object sendLock = new Object();
  // guards close() to make sure the socket is only closed once
  private final Object closeLock = new Object();
  private boolean closed;

  public Connection(Socket socket) throws IOException {
    this.socket = socket;
    this.in = socket.getInputStream();
    this.out = socket.getOutputStream();
  }

  public static Connection establish(SocketAddress remoteAddress) throws IOException {
    Socket socket = new Socket();
    try {
      socket.connect(remoteAddress);
      socket.setTcpNoDelay(true);
      return new Connection(socket);
    } catch (IOException e) {
      socket.close();
      throw e;
    }
  }

  public InputStream in() {
    return in;
  }

  /** An output stream whose every {@code write} call goes through {@link #send(byte[])}. */
  public OutputStream out() {
    return new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        send(new byte[] {(byte) b});
      }

      @Override
      public void write(byte[] b, int off, int len) throws IOException {
        synchronized (sendLock) {
          out.write(b, off, len);
        }
      }
    };
  }

  public void send(byte[] data) throws IOException {
    send(data, 0, data.length);
  }

  public void send(byte[] data, int offset, int length) throws IOException {
    synchronized (sendLock) {
      out.write(data, offset, length);
      out.flush();
    }
  }

  /** Closes this connection; a thread blocked on reading from it will fail. Idempotent. */
  public void close() {
    synchronized (closeLock) {
      if (closed) {
        return;
      }
      closed = true;
      try {
        socket.close();
      } catch (IOException e) {
        log.debug("closing connection to {} failed", remoteAddress(), e);
      }
    }
  }

  public boolean isClosed() {
    synchronized (closeLock) {
      return closed;
    }
  }

  @Nullable
  public SocketAddress remoteAddress() {
    return socket.getRemoteSocketAddress();
  }

  @Nullable
  public SocketAddress localAddress() {
    return socket.getLocalSocketAddress();
  }

  @Override
  public String toString() {
    return "Connection{" + localAddress() + " -> " + remoteAddress() + "}";
  }
}
