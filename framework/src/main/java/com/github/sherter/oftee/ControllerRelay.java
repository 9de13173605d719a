package com.github.sherter.oftee;

import com.github.sherter.oftee.networking.Connection;
import java.io.IOException;
import java.io.InputStream;

/**
 * Copies everything the controller sends to the device, unfiltered and without looking at
 * message boundaries. Each chunk is handed to {@link Connection#send(byte[], int, int)}, so a chunk
 * never interleaves with a message injected into the same device.
 */
class ControllerRelay {

  private final InputStream fromController;
  private final Connection device;
  private final byte[] scratch = new byte[OFMessageReader.BUFFER_SIZE];

  ControllerRelay(InputStream fromController, Connection device) {
    this.fromController = fromController;
    this.device = device;
  }

  /** Runs until the controller closes the stream or an error occurs. */
  void run() throws IOException {
    int read;
    while ((read = fromController.read(scratch)) >= 0) {
      device.send(scratch, 0, read);
    }
  }
}
