package FSA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * One row of a transition table: symbol-to-target transitions plus the start and accept flags.
 * Rows are immutable. Flags may be absent on rows that have not been validated yet.
 */
public final class StateDefinition {
  private final SortedMap<Symbol, Target> transitions;
  private final Boolean start;
  private final Boolean accept;

  private StateDefinition(SortedMap<Symbol, Target> transitions, Boolean start, Boolean accept) {
    this.transitions = Collections.unmodifiableSortedMap(transitions);
    this.start = start;
    this.accept = accept;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static StateDefinition of(Map<Symbol, Target> transitions, boolean start, boolean accept) {
    return new StateDefinition(new TreeMap<>(transitions), start, accept);
  }

  public boolean hasStartFlag() {
    return start != null;
  }

  public boolean hasAcceptFlag() {
    return accept != null;
  }

  public boolean isStart() {
    return Boolean.TRUE.equals(start);
  }

  public boolean isAccept() {
    return Boolean.TRUE.equals(accept);
  }

  /**
   * Transitions sorted by symbol.
   */
  public SortedMap<Symbol, Target> getTransitions() {
    return transitions;
  }

  public Target getTarget(Symbol symbol) {
    return transitions.get(symbol);
  }

  public StateDefinition renameTargets(UnaryOperator<String> mapping) {
    TreeMap<Symbol, Target> renamed = new TreeMap<>();
    for (Map.Entry<Symbol, Target> e : transitions.entrySet()) {
      renamed.put(e.getKey(), e.getValue().rename(mapping));
    }
    return new StateDefinition(renamed, start, accept);
  }

  public StateDefinition withStart(boolean newStart) {
    return new StateDefinition(new TreeMap<>(transitions), newStart, accept);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StateDefinition)) {
      return false;
    }
    StateDefinition other = (StateDefinition) o;
    return transitions.equals(other.transitions)
        && Objects.equals(start, other.start)
        && Objects.equals(accept, other.accept);
  }

  @Override
  public int hashCode() {
    return Objects.hash(transitions, start, accept);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Symbol, Target> e : transitions.entrySet()) {
      sb.append(e.getKey()).append(": ").append(e.getValue()).append(", ");
    }
    sb.append("start: ").append(start).append(", accept: ").append(accept);
    return sb.toString();
  }

  public static final class Builder {
    private final TreeMap<Symbol, Target> transitions = new TreeMap<>();
    private Boolean start;
    private Boolean accept;

    private Builder() {}

    public Builder on(Object symbol, String target) {
      return on(Symbol.of(symbol), Target.of(target));
    }

    public Builder onAny(Object symbol, String... targets) {
      return onAny(symbol, List.of(targets));
    }

    public Builder onAny(Object symbol, Collection<String> targets) {
      return on(Symbol.of(symbol), Target.ofSet(targets));
    }

    /**
     * @throws IllegalArgumentException if the row already has a transition on this symbol, e.g. {@code 1}
     *     after {@code "1"}
     */
    public Builder on(Symbol symbol, Target target) {
      if (transitions.putIfAbsent(symbol, target) != null) {
        throw new IllegalArgumentException("Duplicate transition on symbol '" + symbol + "'");
      }
      return this;
    }

    public boolean hasTransition(Symbol symbol) {
      return transitions.containsKey(symbol);
    }

    public Builder start(boolean start) {
      this.start = start;
      return this;
    }

    public Builder accept(boolean accept) {
      this.accept = accept;
      return this;
    }

    public StateDefinition build() {
      return new StateDefinition(new TreeMap<>(transitions), start, accept);
    }
  }
}
