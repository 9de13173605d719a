package com.github.sherter.oftee.endpoints;

import com.github.sherter.oftee.networking.Addresses;
import com.google.common.base.MoreObjects;
import com.google.common.net.HostAndPort;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The resolved address of a tee end point together with the kind of transport it needs. */
public final class Destination {

  private static final Logger log = LoggerFactory.getLogger(Destination.class);

  public static final String SCHEME_TCP = "tcp";
  public static final String SCHEME_HTTP = "http";

  public enum Kind {
    TCP,
    HTTP
  }

  private final Kind kind;
  private final String address;
  @Nullable private final HostAndPort hostAndPort;
  @Nullable private final URI uri;

  private Destination(
      Kind kind, String address, @Nullable HostAndPort hostAndPort, @Nullable URI uri) {
    this.kind = kind;
    this.address = address;
    this.hostAndPort = hostAndPort;
    this.uri = uri;
  }

  /**
   * Parses an end point address. {@code http} URLs become HTTP destinations; {@code tcp} URLs,
   * addresses without a scheme and addresses with an unknown scheme become TCP destinations.
   */
  public static Destination parse(String address) throws EndpointConfigurationException {
    int schemeEnd = address.indexOf("://");
    String scheme = schemeEnd < 0 ? "" : address.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
    switch (scheme) {
      case SCHEME_HTTP:
        URI uri = toUri(address);
        if (uri.getHost() == null) {
          throw new EndpointConfigurationException(
              "no host in end point address '" + address + "'");
        }
        return new Destination(Kind.HTTP, address, null, uri);
      case SCHEME_TCP:
        return tcp(address, authority(address, schemeEnd));
      case "":
        return tcp(address, address);
      default:
        log.warn(
            "unknown scheme '{}' in end point address '{}', treating it as host:port",
            scheme,
            address);
        return tcp(address, authority(address, schemeEnd));
    }
  }

  private static URI toUri(String address) throws EndpointConfigurationException {
    try {
      return new URI(address);
    } catch (URISyntaxException e) {
      throw new EndpointConfigurationException(
          "unable to parse end point address '" + address + "'", e);
    }
  }

  private static String authority(String address, int schemeEnd) {
    String rest = address.substring(schemeEnd + 3);
    int slash = rest.indexOf('/');
    return slash < 0 ? rest : rest.substring(0, slash);
  }

  private static Destination tcp(String address, String hostPort)
      throws EndpointConfigurationException {
    try {
      return new Destination(Kind.TCP, address, Addresses.parseHostAndPort(hostPort), null);
    } catch (IllegalArgumentException e) {
      throw new EndpointConfigurationException(
          "unable to parse end point address '" + address + "'", e);
    }
  }

  public Kind kind() {
    return kind;
  }

  /** The address as it was configured. */
  public String address() {
    return address;
  }

  /** Host and port of a {@link Kind#TCP} destination, {@code null} otherwise. */
  @Nullable
  public HostAndPort hostAndPort() {
    return hostAndPort;
  }

  /** URL of a {@link Kind#HTTP} destination, {@code null} otherwise. */
  @Nullable
  public URI uri() {
    return uri;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("address", kind == Kind.TCP ? hostAndPort : uri)
        .toString();
  }
}
