package com.github.sherter.oftee.device;

import com.google.common.base.MoreObjects;
import org.projectfloodlight.openflow.types.DatapathId;

/** Announces that a device with a datapath id has connected (ADD) or gone away (DELETE). */
public final class DpidMapping {

  public enum Action {
    ADD,
    DELETE
  }

  private final Action action;
  private final DatapathId dpid;
  private final Injector injector;

  private DpidMapping(Action action, DatapathId dpid, Injector injector) {
    this.action = action;
    this.dpid = dpid;
    this.injector = injector;
  }

  public static DpidMapping add(DatapathId dpid, Injector injector) {
    return new DpidMapping(Action.ADD, dpid, injector);
  }

  /**
   * Withdraws the mapping previously added with {@code injector}. A newer mapping of the same
   * datapath id, e.g. after the device reconnected, is left alone.
   */
  public static DpidMapping delete(DatapathId dpid, Injector injector) {
    return new DpidMapping(Action.DELETE, dpid, injector);
  }

  public Action action() {
    return action;
  }

  public DatapathId dpid() {
    return dpid;
  }

  public Injector injector() {
    return injector;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("action", action).add("dpid", dpid).toString();
  }
}
