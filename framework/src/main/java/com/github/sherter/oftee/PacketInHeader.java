package com.github.sherter.oftee;

import io.netty.buffer.ByteBuf;
import java.io.IOException;
import org.projectfloodlight.openflow.protocol.OFVersion;

/**
 * Reads the part of a Packet-In message between the OpenFlow header and the encapsulated frame.
 * Its layout depends on the protocol version:
 *
 * <ul>
 *   <li>1.0: buffer id, total length, in port, reason, pad
 *   <li>1.1: buffer id, in port, in phy port, total length, reason, table id
 *   <li>1.2: buffer id, total length, reason, table id, match, pad
 *   <li>1.3 and later: buffer id, total length, reason, table id, cookie, match, pad
 * </ul>
 */
final class PacketInHeader {

  /** Returned by {@link #readFrom} when the version is unknown and nothing was read. */
  static final int UNKNOWN = -1;

  private static final int OF10_LENGTH = 10;
  private static final int OF11_LENGTH = 16;
  private static final int OF12_FIXED_LENGTH = 8;
  private static final int OF13_FIXED_LENGTH = 16;
  private static final int MATCH_HEADER_LENGTH = 4;
  private static final int MATCH_ALIGNMENT = 8;
  private static final int PAD_LENGTH = 2;

  private PacketInHeader() {}

  /**
   * Moves the sub-header of the Packet-In message described by {@code header} from {@code
   * reader} to the end of {@code message}.
   *
   * @return the number of bytes read, or {@link #UNKNOWN} for an unknown protocol version
   * @throws OFFramingException if the sub-header does not fit into the declared message length
   */
  static int readFrom(OFMessageReader reader, OFHeader header, ByteBuf message)
      throws IOException {
    OFVersion version = versionOf(header.version());
    if (version == null) {
      return UNKNOWN;
    }
    int available = header.bodyLength();
    switch (version) {
      case OF_10:
        return readFixed(reader, OF10_LENGTH, available, message);
      case OF_11:
        return readFixed(reader, OF11_LENGTH, available, message);
      case OF_12:
        return readWithMatch(reader, OF12_FIXED_LENGTH, available, message);
      default:
        return readWithMatch(reader, OF13_FIXED_LENGTH, available, message);
    }
  }

  private static int readFixed(OFMessageReader reader, int length, int available, ByteBuf message)
      throws IOException {
    checkFits(length, available);
    reader.transfer(length, message);
    return length;
  }

  private static int readWithMatch(
      OFMessageReader reader, int fixedLength, int available, ByteBuf message) throws IOException {
    checkFits(fixedLength + MATCH_HEADER_LENGTH, available);
    int matchStart = message.writerIndex() + fixedLength;
    reader.transfer(fixedLength + MATCH_HEADER_LENGTH, message);

    int matchLength = message.getUnsignedShort(matchStart + 2);
    if (matchLength < MATCH_HEADER_LENGTH) {
      throw new OFFramingException("Packet-In match length " + matchLength + " is too small");
    }
    int paddedMatchLength = (matchLength + MATCH_ALIGNMENT - 1) / MATCH_ALIGNMENT * MATCH_ALIGNMENT;
    int length = fixedLength + paddedMatchLength + PAD_LENGTH;
    checkFits(length, available);
    reader.transfer(length - fixedLength - MATCH_HEADER_LENGTH, message);
    return length;
  }

  private static void checkFits(int length, int available) throws OFFramingException {
    if (length > available) {
      throw new OFFramingException(
          "Packet-In header needs " + length + " bytes, message only has " + available);
    }
  }

  private static OFVersion versionOf(int wireVersion) {
    for (OFVersion version : OFVersion.values()) {
      if (version.getWireVersion() == wireVersion) {
        return version;
      }
    }
    return null;
  }
}
