package com.github.sherter.oftee.endpoints;

import com.github.sherter.oftee.criteria.Criteria;
import com.google.common.base.MoreObjects;

/** A tee destination: where to send a copy, and the rule a message has to satisfy. */
public final class Endpoint {

  private final Destination destination;
  private final Criteria rule;
  private final Transport transport;

  public Endpoint(Destination destination, Criteria rule, Transport transport) {
    this.destination = destination;
    this.rule = rule;
    this.transport = transport;
  }

  public Destination destination() {
    return destination;
  }

  public Criteria rule() {
    return rule;
  }

  public Transport transport() {
    return transport;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("destination", destination)
        .add("rule", rule)
        .toString();
  }
}
