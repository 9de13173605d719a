package com.github.sherter.oftee.endpoints;

/** Thrown when a tee end point specification cannot be turned into a live end point. */
public class EndpointConfigurationException extends Exception {

  public EndpointConfigurationException(String message) {
    super(message);
  }

  public EndpointConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
