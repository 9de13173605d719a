package com.github.sherter.oftee;

import com.google.common.base.MoreObjects;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * The fixed part every OpenFlow message starts with: version, type, total length (including this
 * header) and transaction id, all in network byte order.
 */
public final class OFHeader {

  public static final int LENGTH = 8;

  // the numeric values are the same in all protocol versions from 1.0 to 1.5
  public static final int TYPE_FEATURES_REPLY = 6;
  public static final int TYPE_PACKET_IN = 10;

  private final int version;
  private final int type;
  private final int length;
  private final long xid;

  public OFHeader(int version, int type, int length, long xid) {
    this.version = version;
    this.type = type;
    this.length = length;
    this.xid = xid;
  }

  /** Decodes the first {@link #LENGTH} bytes of {@code data}. */
  public static OFHeader parse(byte[] data) throws OFFramingException {
    if (data.length < LENGTH) {
      throw new OFFramingException("header needs " + LENGTH + " bytes, got " + data.length);
    }
    ByteBuf buffer = Unpooled.wrappedBuffer(data);
    OFHeader header =
        new OFHeader(
            buffer.getUnsignedByte(0),
            buffer.getUnsignedByte(1),
            buffer.getUnsignedShort(2),
            buffer.getUnsignedInt(4));
    if (header.length < LENGTH) {
      throw new OFFramingException("declared message length " + header.length + " is too small");
    }
    return header;
  }

  public void writeTo(ByteBuf buffer) {
    buffer.writeByte(version);
    buffer.writeByte(type);
    buffer.writeShort(length);
    buffer.writeInt((int) xid);
  }

  public byte[] toBytes() {
    ByteBuf buffer = Unpooled.buffer(LENGTH);
    try {
      writeTo(buffer);
      byte[] data = new byte[LENGTH];
      buffer.readBytes(data);
      return data;
    } finally {
      buffer.release();
    }
  }

  public int version() {
    return version;
  }

  public int type() {
    return type;
  }

  /** Total length of the message in bytes, header included. */
  public int length() {
    return length;
  }

  /** Number of bytes following the header. */
  public int bodyLength() {
    return length - LENGTH;
  }

  public long xid() {
    return xid;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("version", version)
        .add("type", type)
        .add("length", length)
        .add("xid", xid)
        .toString();
  }
}
