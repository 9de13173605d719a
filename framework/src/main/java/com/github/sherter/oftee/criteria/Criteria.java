package com.github.sherter.oftee.criteria;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;
import org.projectfloodlight.openflow.types.EthType;

/**
 * Match criteria on a network packet: a bit set telling which fields are constrained, plus the
 * values of those fields. The fields follow the naming used by {@code ovs-ofctl} match
 * expressions.
 *
 * <p>Instances are immutable. A criteria without any bit set is a wildcard and matches every
 * state.
 */
public final class Criteria {

  public static final long BIT_EMPTY = 0x0;
  public static final long BIT_DL_TYPE = 1 << 0;

  public static final Criteria WILDCARD = new Criteria(BIT_EMPTY, null);

  private final long set;
  @Nullable private final EthType dlType;

  private Criteria(long set, @Nullable EthType dlType) {
    this.set = set;
    this.dlType = dlType;
  }

  public static Criteria dlType(EthType dlType) {
    return new Criteria(BIT_DL_TYPE, Objects.requireNonNull(dlType));
  }

  public static Criteria dlType(int dlType) {
    return dlType(EthType.of(dlType));
  }

  public long set() {
    return set;
  }

  public boolean isSet(long bit) {
    return (set & bit) != 0;
  }

  public boolean isWildcard() {
    return set == BIT_EMPTY;
  }

  /** Value of the data link type field, {@code null} if the field is not constrained. */
  @Nullable
  public EthType dlType() {
    return dlType;
  }

  /**
   * Returns {@code true} if every field set in this criteria is also set in {@code state} with an
   * equal value. Fields only present in {@code state} are ignored.
   */
  public boolean matches(Criteria state) {
    if (isSet(BIT_DL_TYPE)
        && (!state.isSet(BIT_DL_TYPE) || !dlType.equals(state.dlType))) {
      return false;
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Criteria)) {
      return false;
    }
    Criteria other = (Criteria) o;
    return set == other.set && Objects.equals(dlType, other.dlType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(set, dlType);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("dl_type", dlType)
        .toString();
  }
}
