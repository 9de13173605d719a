package com.github.sherter.oftee.endpoints;

import com.github.sherter.oftee.criteria.Criteria;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.primitives.UnsignedInts;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed end point specification. The specification is either a bare destination address
 * ({@code tcp://host:port}, {@code host:port}, {@code http://host/path}) or a list of terms
 * separated by {@code ;}, e.g. {@code dl_type=0x0806;action=tcp://host:9}.
 */
public final class EndpointSpec {

  private static final Logger log = LoggerFactory.getLogger(EndpointSpec.class);

  public static final String TERM_ACTION = "action";
  public static final String TERM_DL_TYPE = "dl_type";

  private static final Splitter TERM_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter KEY_VALUE_SPLITTER = Splitter.on('=').limit(2).trimResults();

  private final String spec;
  private final String destination;
  private final Criteria rule;

  private EndpointSpec(String spec, String destination, Criteria rule) {
    this.spec = spec;
    this.destination = destination;
    this.rule = rule;
  }

  public static EndpointSpec parse(String spec) throws EndpointConfigurationException {
    if (spec.indexOf(';') < 0 && !isTerm(spec)) {
      return new EndpointSpec(spec, spec.trim(), Criteria.WILDCARD);
    }

    String destination = null;
    Criteria rule = Criteria.WILDCARD;
    for (String term : TERM_SPLITTER.split(spec)) {
      List<String> keyValue = KEY_VALUE_SPLITTER.splitToList(term);
      if (keyValue.size() != 2) {
        throw new EndpointConfigurationException(
            "end point term '" + term + "' is not of the form key=value");
      }
      String key = keyValue.get(0);
      String value = keyValue.get(1);
      switch (key.toLowerCase(Locale.ROOT)) {
        case TERM_ACTION:
          destination = value;
          break;
        case TERM_DL_TYPE:
          rule = Criteria.dlType(parseUint16(key, value));
          log.debug("found condition {}={}", key, value);
          break;
        default:
          throw new EndpointConfigurationException("unknown end point term '" + key + "'");
      }
    }
    if (destination == null || destination.isEmpty()) {
      throw new EndpointConfigurationException(
          "end point specification '" + spec + "' has no '" + TERM_ACTION + "' term");
    }
    return new EndpointSpec(spec, destination, rule);
  }

  // "key=value" as opposed to an address, which may carry a '=' in its query string
  private static boolean isTerm(String segment) {
    int equals = segment.indexOf('=');
    int schemeEnd = segment.indexOf("://");
    return equals >= 0 && (schemeEnd < 0 || equals < schemeEnd);
  }

  private static int parseUint16(String key, String value) throws EndpointConfigurationException {
    int parsed;
    try {
      parsed = UnsignedInts.decode(value);
    } catch (NumberFormatException e) {
      throw new EndpointConfigurationException(
          "unable to convert term '" + key + "' value '" + value + "' to uint16", e);
    }
    if (parsed > 0xFFFF) {
      throw new EndpointConfigurationException(
          "value '" + value + "' of term '" + key + "' is out of uint16 range");
    }
    return parsed;
  }

  /** The specification text this instance was parsed from. */
  public String spec() {
    return spec;
  }

  /** The destination address, not yet resolved. */
  public String destination() {
    return destination;
  }

  public Criteria rule() {
    return rule;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("destination", destination)
        .add("rule", rule)
        .toString();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof EndpointSpec)) {
      return false;
    }
    EndpointSpec other = (EndpointSpec) o;
    return destination.equals(other.destination) && rule.equals(other.rule);
  }

  @Override
  public int hashCode() {
    return 31 * destination.hashCode() + rule.hashCode();
  }
}
