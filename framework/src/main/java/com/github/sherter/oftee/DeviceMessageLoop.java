package com.github.sherter.oftee;

import com.github.sherter.oftee.criteria.Criteria;
import com.github.sherter.oftee.device.DpidMapping;
import com.github.sherter.oftee.device.Injector;
import com.github.sherter.oftee.endpoints.TeeMultiplexer;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.projectfloodlight.openflow.types.DatapathId;
import org.projectfloodlight.openflow.types.EthType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards the messages a device sends to the controller. Packet-In messages are buffered in full
 * and additionally written to every tee end point whose rule matches the encapsulated frame; all
 * other messages are streamed through without buffering.
 */
class DeviceMessageLoop {

  private static final Logger log = LoggerFactory.getLogger(DeviceMessageLoop.class);

  private static final int INITIAL_MESSAGE_BUFFER_SIZE = OFMessageReader.BUFFER_SIZE;

  private final OFMessageReader reader;
  private final OutputStream toController;
  private final TeeMultiplexer endpoints;
  private final Injector deviceInjector;
  private final Consumer<? super DpidMapping> mappings;

  @Nullable private DatapathId dpid;

  DeviceMessageLoop(
      InputStream fromDevice,
      OutputStream toController,
      TeeMultiplexer endpoints,
      Injector deviceInjector,
      Consumer<? super DpidMapping> mappings) {
    this.reader = new OFMessageReader(fromDevice);
    this.toController = toController;
    this.endpoints = endpoints;
    this.deviceInjector = deviceInjector;
    this.mappings = mappings;
  }

  /**
   * Runs until the device closes the stream. Any read or write error and any malformed message
   * ends the loop with an exception.
   */
  void run() throws IOException {
    ByteBuf message = Unpooled.buffer(INITIAL_MESSAGE_BUFFER_SIZE);
    try {
      OFHeader header;
      while ((header = reader.readHeader()) != null) {
        switch (header.type()) {
          case OFHeader.TYPE_PACKET_IN:
            log.debug("{}: sending to controller and matching end points", header);
            message.clear();
            teePacketIn(header, message);
            break;
          case OFHeader.TYPE_FEATURES_REPLY:
            log.debug("{}: sending to controller", header);
            learnDatapathId(header);
            break;
          default:
            log.debug("{}: sending to controller", header);
            toController.write(header.toBytes());
            reader.transfer(header.bodyLength(), toController);
        }
      }
    } finally {
      message.release();
    }
  }

  private void teePacketIn(OFHeader header, ByteBuf message) throws IOException {
    header.writeTo(message);
    int subHeaderLength = PacketInHeader.readFrom(reader, header, message);
    int payloadLength = header.length() - message.writerIndex();
    reader.transfer(payloadLength, message);

    byte[] data = new byte[message.readableBytes()];
    message.getBytes(message.readerIndex(), data);

    Criteria match = Criteria.WILDCARD;
    if (subHeaderLength == PacketInHeader.UNKNOWN) {
      log.debug("unknown protocol version {}, cannot locate packet", header.version());
    } else {
      Optional<EthType> ethType =
          EthernetFrames.ethType(message, OFHeader.LENGTH + subHeaderLength);
      if (ethType.isPresent()) {
        match = Criteria.dlType(ethType.get());
      } else {
        log.debug("packet of {} bytes is too short to carry an ether type", payloadLength);
      }
    }

    toController.write(data);
    endpoints.conditionalWrite(data, match);
  }

  private void learnDatapathId(OFHeader header) throws IOException {
    byte[] data = reader.readMessage(header);
    toController.write(data);
    Optional<DatapathId> announced = FeaturesReplies.datapathId(data);
    if (announced.isPresent() && !announced.get().equals(dpid)) {
      if (dpid != null) {
        mappings.accept(DpidMapping.delete(dpid, deviceInjector));
      }
      dpid = announced.get();
      log.info("device identified as {}", dpid);
      mappings.accept(DpidMapping.add(dpid, deviceInjector));
    }
  }

  /** The datapath id the device announced, {@code null} if it has not done so yet. */
  @Nullable
  DatapathId dpid() {
    return dpid;
  }

  Injector deviceInjector() {
    return deviceInjector;
  }
}
