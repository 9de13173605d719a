package com.github.sherter.oftee;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.util.Optional;
import org.projectfloodlight.openflow.exceptions.OFParseError;
import org.projectfloodlight.openflow.protocol.OFFactories;
import org.projectfloodlight.openflow.protocol.OFFeaturesReply;
import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.types.DatapathId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class FeaturesReplies {

  private static final Logger log = LoggerFactory.getLogger(FeaturesReplies.class);

  private FeaturesReplies() {}

  /** The datapath id announced in a serialized Features-Reply, if it can be parsed. */
  static Optional<DatapathId> datapathId(byte[] data) {
    ByteBuf buffer = Unpooled.wrappedBuffer(data);
    try {
      OFMessage message = OFFactories.getGenericReader().readFrom(buffer);
      if (message instanceof OFFeaturesReply) {
        return Optional.of(((OFFeaturesReply) message).getDatapathId());
      }
      log.warn("expected a features reply, got {}", message);
    } catch (OFParseError | RuntimeException e) {
      log.warn("unable to parse features reply: {}", e.toString());
    } finally {
      buffer.release();
    }
    return Optional.empty();
  }
}
