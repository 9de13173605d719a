package com.github.sherter.oftee.api;

import com.github.sherter.oftee.device.Injector;
import com.google.common.primitives.UnsignedLongs;
import java.io.IOException;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import javax.ws.rs.Consumes;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import org.projectfloodlight.openflow.types.DatapathId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Path("oftee")
@Singleton
public class DevicesResource {

  private static final Logger log = LoggerFactory.getLogger(DevicesResource.class);

  private static final String DEVICE_PREFIX = "of:";

  @Inject DeviceRegistry registry;

  /** Lists the datapath ids of all connected devices. */
  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public DevicesResponse listDevices() {
    return new DevicesResponse(
        registry.devices().stream().map(DevicesResource::format).collect(Collectors.toList()));
  }

  /**
   * Sends an OpenFlow message to a device. The body must be the complete serialized message, e.g.
   * a packet out including the OpenFlow header.
   */
  @POST
  @Path("{dpid}")
  @Consumes(MediaType.APPLICATION_OCTET_STREAM)
  public Response packetOut(@PathParam("dpid") String dpid, byte[] message) {
    log.debug("packet out request received for {}", dpid);
    Optional<DatapathId> parsed = parse(dpid);
    if (!parsed.isPresent()) {
      log.warn("unable to parse given DPID '{}'", dpid);
      return notFound("DPID doesn't reference a device, '" + dpid + "'");
    }
    Optional<Injector> injector = registry.injector(parsed.get());
    if (!injector.isPresent()) {
      log.warn("unable to find packet injector for DPID '{}', unknown device", dpid);
      return notFound("DPID not found, '" + dpid + "'");
    }
    try {
      injector.get().inject(message);
    } catch (IOException e) {
      log.error("unable to inject message into device {}", dpid, e);
      return Response.serverError().entity(e.getMessage()).type(MediaType.TEXT_PLAIN).build();
    }
    return Response.ok().build();
  }

  static String format(DatapathId dpid) {
    return String.format("%s0x%016x", DEVICE_PREFIX, dpid.getLong());
  }

  static Optional<DatapathId> parse(String dpid) {
    String value = dpid.startsWith(DEVICE_PREFIX) ? dpid.substring(DEVICE_PREFIX.length()) : dpid;
    try {
      return Optional.of(DatapathId.of(UnsignedLongs.decode(value)));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static Response notFound(String message) {
    return Response.status(Response.Status.NOT_FOUND)
        .entity(message)
        .type(MediaType.TEXT_PLAIN)
        .build();
  }
}
