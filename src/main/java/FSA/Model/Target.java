package FSA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Right-hand side of a transition: a single state (DFA shape) or a set of states (NFA shape).
 * A set target keeps its shape even with one member; {@link #single()} resolves it.
 */
public final class Target {
  private final List<String> states;
  private final boolean multi;

  private Target(List<String> states, boolean multi) {
    this.states = states;
    this.multi = multi;
  }

  public static Target of(String state) {
    return new Target(List.of(Objects.requireNonNull(state, "target state")), false);
  }

  /**
   * Set-valued target. Duplicates are dropped, first-occurrence order is kept.
   */
  public static Target ofSet(Collection<String> states) {
    if (states.isEmpty()) {
      throw new IllegalArgumentException("Target set must not be empty");
    }
    List<String> unique = new ArrayList<>(new LinkedHashSet<>(states));
    for (String s : unique) {
      Objects.requireNonNull(s, "target state");
    }
    return new Target(Collections.unmodifiableList(unique), true);
  }

  public static Target ofSet(String... states) {
    return ofSet(List.of(states));
  }

  /**
   * Union of targets: collapses to a single state when exactly one remains, otherwise a sorted set.
   */
  public static Target union(Collection<String> states) {
    TreeSet<String> sorted = new TreeSet<>(states);
    if (sorted.size() == 1) {
      return of(sorted.first());
    }
    return ofSet(sorted);
  }

  public boolean isSet() {
    return multi;
  }

  public List<String> states() {
    return states;
  }

  public int size() {
    return states.size();
  }

  /**
   * @return the sole state, or null if more than one state is targeted
   */
  public String single() {
    return states.size() == 1 ? states.get(0) : null;
  }

  public Target rename(UnaryOperator<String> mapping) {
    if (!multi) {
      return of(mapping.apply(states.get(0)));
    }
    List<String> renamed = new ArrayList<>(states.size());
    for (String s : states) {
      renamed.add(mapping.apply(s));
    }
    return ofSet(renamed);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Target)) {
      return false;
    }
    Target other = (Target) o;
    return multi == other.multi && states.equals(other.states);
  }

  @Override
  public int hashCode() {
    return states.hashCode() * 2 + (multi ? 1 : 0);
  }

  @Override
  public String toString() {
    return multi ? states.toString() : states.get(0);
  }
}
