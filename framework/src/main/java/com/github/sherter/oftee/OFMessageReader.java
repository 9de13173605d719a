package com.github.sherter.oftee;

import com.google.common.io.ByteStreams;
import io.netty.buffer.ByteBuf;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import javax.annotation.Nullable;

/**
 * Splits a blocking byte stream into OpenFlow messages. Bodies are moved through a reusable
 * scratch buffer of {@link #BUFFER_SIZE} bytes, so a message may arrive in any number of reads.
 *
 * <p>Not thread safe, there must be exactly one reader per stream.
 */
public class OFMessageReader {

  public static final int BUFFER_SIZE = 2048;

  private final InputStream in;
  private final byte[] scratch = new byte[BUFFER_SIZE];
  private final byte[] headerBytes = new byte[OFHeader.LENGTH];

  public OFMessageReader(InputStream in) {
    this.in = in;
  }

  /**
   * Reads the next message header.
   *
   * @return {@code null} if the stream ended cleanly before the first byte of a message
   * @throws OFFramingException if the stream ends within the header or the header is invalid
   */
  @Nullable
  public OFHeader readHeader() throws IOException {
    int first = in.read();
    if (first < 0) {
      return null;
    }
    headerBytes[0] = (byte) first;
    int read = ByteStreams.read(in, headerBytes, 1, OFHeader.LENGTH - 1);
    if (read != OFHeader.LENGTH - 1) {
      throw new OFFramingException("stream ended within a message header");
    }
    return OFHeader.parse(headerBytes);
  }

  /** Copies the next {@code count} bytes of the stream to {@code out}. */
  public void transfer(int count, OutputStream out) throws IOException {
    int left = count;
    while (left > 0) {
      int read = in.read(scratch, 0, Math.min(left, BUFFER_SIZE));
      if (read < 0) {
        throw new EOFException("stream ended with " + left + " bytes of the message missing");
      }
      out.write(scratch, 0, read);
      left -= read;
    }
  }

  /** Appends the next {@code count} bytes of the stream to {@code buffer}. */
  public void transfer(int count, ByteBuf buffer) throws IOException {
    int left = count;
    while (left > 0) {
      int read = in.read(scratch, 0, Math.min(left, BUFFER_SIZE));
      if (read < 0) {
        throw new EOFException("stream ended with " + left + " bytes of the message missing");
      }
      buffer.writeBytes(scratch, 0, read);
      left -= read;
    }
  }

  /** Reads the body following {@code header} and returns the complete message. */
  public byte[] readMessage(OFHeader header) throws IOException {
    byte[] message = new byte[header.length()];
    System.arraycopy(headerBytes, 0, message, 0, OFHeader.LENGTH);
    try {
      ByteStreams.readFully(in, message, OFHeader.LENGTH, header.bodyLength());
    } catch (EOFException e) {
      throw new EOFException("stream ended within a message of " + header.length() + " bytes");
    }
    return message;
  }
}
