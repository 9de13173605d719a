package com.github.sherter.oftee;

import io.netty.buffer.ByteBuf;
import java.util.Optional;
import org.projectfloodlight.openflow.types.EthType;

/** Just enough Ethernet decoding to find out what a frame carries. */
final class EthernetFrames {

  // destination and source MAC address precede the ether type
  private static final int ETH_TYPE_OFFSET = 12;

  private EthernetFrames() {}

  /**
   * Returns the ether type of the frame starting at {@code frameOffset} of {@code message}, or
   * nothing if the frame is too short to carry one.
   */
  static Optional<EthType> ethType(ByteBuf message, int frameOffset) {
    int typeOffset = frameOffset + ETH_TYPE_OFFSET;
    if (frameOffset < 0 || message.writerIndex() < typeOffset + 2) {
      return Optional.empty();
    }
    return Optional.of(EthType.of(message.getUnsignedShort(typeOffset)));
  }
}
