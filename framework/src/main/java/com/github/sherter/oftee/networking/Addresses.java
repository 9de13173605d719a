package com.github.sherter.oftee.networking;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.net.HostAndPort;
import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Conversions for addresses of the form {@code host:port}. The host may be omitted ({@code
 * :8000}), meaning all interfaces when listening and the local host when connecting.
 */
public final class Addresses {

  private Addresses() {}

  /** @throws IllegalArgumentException if {@code hostPort} is malformed or lacks a port */
  public static HostAndPort parseHostAndPort(String hostPort) {
    HostAndPort parsed = HostAndPort.fromString(hostPort.trim());
    checkArgument(parsed.hasPort(), "no port in address '%s'", hostPort);
    return parsed;
  }

  public static InetSocketAddress forListening(String hostPort) {
    HostAndPort parsed = parseHostAndPort(hostPort);
    if (parsed.getHost().isEmpty()) {
      return new InetSocketAddress(parsed.getPort());
    }
    return new InetSocketAddress(parsed.getHost(), parsed.getPort());
  }

  public static InetSocketAddress forConnecting(String hostPort) {
    return forConnecting(parseHostAndPort(hostPort));
  }

  public static InetSocketAddress forConnecting(HostAndPort hostAndPort) {
    if (hostAndPort.getHost().isEmpty()) {
      return new InetSocketAddress(InetAddress.getLoopbackAddress(), hostAndPort.getPort());
    }
    return new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort());
  }
}
