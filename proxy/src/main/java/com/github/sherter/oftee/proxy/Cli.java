package com.github.sherter.oftee.proxy;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.github.sherter.oftee.TeeServer;
import com.github.sherter.oftee.api.ApiServer;
import com.github.sherter.oftee.api.DeviceRegistry;
import com.github.sherter.oftee.endpoints.DefaultTransportFactory;
import com.github.sherter.oftee.endpoints.EndpointConfigurationException;
import com.github.sherter.oftee.endpoints.EndpointRegistry;
import com.github.sherter.oftee.endpoints.EndpointSource;
import com.github.sherter.oftee.networking.Addresses;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the OpenFlow tee proxy. Every option can also be given as an environment variable named
 * after the option, e.g. {@code TEE_TO} for {@code --tee-to}.
 */
public class Cli {

  private static final Logger log = LoggerFactory.getLogger(Cli.class);

  static final Map<String, String> DEFAULTS =
      ImmutableMap.<String, String>builder()
          .put("HELP", "false")
          .put("LISTEN_ON", ":8000")
          .put("PROXY_TO", ":8001")
          .put("TEE_TO", ":8002")
          .put("SHARE_CONNECTIONS", "true")
          .put("LOG_LEVEL", "debug")
          .put("API_ON", ":8080")
          .build();

  public static void main(String[] args) {
    Args parsedArgs = new Args();
    JCommander commander = parse(args, System.getenv(), parsedArgs);
    if (commander == null) {
      System.exit(1);
      return;
    }

    LoggingConfigurator.setLevel(parsedArgs.logLevel);

    if (parsedArgs.help) {
      commander.usage();
      return;
    }

    try {
      run(parsedArgs);
    } catch (EndpointConfigurationException e) {
      log.error(
          "unable to establish connections to outbound end points, terminating: {}",
          e.getMessage(),
          e);
      System.exit(1);
    } catch (IOException e) {
      log.error("unable to start, terminating: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  /** Returns {@code null} after printing the usage if {@code args} cannot be parsed. */
  static JCommander parse(String[] args, Map<String, String> environment, Args parsedArgs) {
    JCommander commander =
        JCommander.newBuilder()
            .programName("oftee")
            .addObject(parsedArgs)
            .defaultProvider(new EnvironmentDefaultProvider(environment, DEFAULTS))
            .build();
    try {
      commander.parse(args);
      return commander;
    } catch (ParameterException e) {
      System.err.println(e.getMessage());
      commander.usage();
      return null;
    }
  }

  static void run(Args parsedArgs) throws EndpointConfigurationException, IOException {
    EndpointRegistry registry = new EndpointRegistry(new DefaultTransportFactory());
    EndpointSource endpoints;
    if (parsedArgs.shareConnections) {
      endpoints = EndpointSource.shared(registry.establish(parsedArgs.teeTo));
    } else {
      endpoints = EndpointSource.dedicated(registry, parsedArgs.teeTo);
    }

    DeviceRegistry devices = new DeviceRegistry();
    if (!parsedArgs.apiOn.trim().isEmpty()) {
      ApiServer.start(Addresses.forListening(parsedArgs.apiOn), devices);
    }

    TeeServer server =
        new TeeServer.Builder(parsedArgs.proxyTo).endpoints(endpoints).mappings(devices).build();
    InetSocketAddress bound = server.listenOn(parsedArgs.listenOn);
    log.info("listening on {} and forwarding to {} ...", bound, parsedArgs.proxyTo);
    server.loop();
  }

  static class Args {
    @Parameter(
      names = {"-h", "--help"},
      help = true,
      description = "show this message"
    )
    boolean help;

    @Parameter(
      names = {"--listen-on"},
      converter = ListenAddressConverter.class,
      description =
          "format: 'host:port'; connection on which to listen for an open flow device (default ':8000')"
    )
    InetSocketAddress listenOn;

    @Parameter(
      names = {"--proxy-to"},
      converter = ConnectAddressConverter.class,
      description =
          "format: 'host:port'; connection on which to attach to an SDN controller (default ':8001')"
    )
    InetSocketAddress proxyTo;

    @Parameter(
      names = {"--tee-to"},
      description =
          "comma separated list of end points to which packet in messages are tee-ed, each either"
              + " an address or 'dl_type=<type>;action=<address>' (default ':8002')"
    )
    List<String> teeTo;

    @Parameter(
      names = {"--share-connections"},
      arity = 1,
      description = "use shared connections to outbound end points (default true)"
    )
    boolean shareConnections;

    @Parameter(
      names = {"--log-level"},
      description = "logging level: trace, debug, info, warn or error (default 'debug')"
    )
    String logLevel;

    @Parameter(
      names = {"--api-on"},
      description =
          "format: 'host:port'; connection on which to serve the REST API, empty to disable"
              + " (default ':8080')"
    )
    String apiOn;
  }

  static class ListenAddressConverter implements IStringConverter<InetSocketAddress> {
    @Override
    public InetSocketAddress convert(String value) {
      try {
        return Addresses.forListening(value);
      } catch (IllegalArgumentException e) {
        throw new ParameterException("invalid listen address '" + value + "': " + e.getMessage());
      }
    }
  }

  static class ConnectAddressConverter implements IStringConverter<InetSocketAddress> {
    @Override
    public InetSocketAddress convert(String value) {
      try {
        return Addresses.forConnecting(value);
      } catch (IllegalArgumentException e) {
        throw new ParameterException(
            "invalid controller address '" + value + "': " + e.getMessage());
      }
    }
  }
}
