package com.github.sherter.oftee;

import java.io.IOException;

/** The byte stream does not contain a well-formed sequence of OpenFlow messages. */
public class OFFramingException extends IOException {

  public OFFramingException(String message) {
    super(message);
  }
}
