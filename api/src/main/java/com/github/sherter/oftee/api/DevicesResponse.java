package com.github.sherter.oftee.api;

import java.util.List;

/** Body of the answer to a device listing. */
public class DevicesResponse {
  private final List<String> devices;

  DevicesResponse(List<String> devices) {
    this.devices = devices;
  }

  public List<String> getDevices() {
    return devices;
  }
}
