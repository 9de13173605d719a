package com.github.sherter.oftee.device;

import java.io.IOException;

/** Sends externally created OpenFlow messages to a connected device. */
@FunctionalInterface
public interface Injector {

  void inject(byte[] message) throws IOException;
}
