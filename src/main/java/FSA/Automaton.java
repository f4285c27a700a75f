package FSA;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Errors.AmbiguousTransitionException;
import FSA.Errors.InvalidDefinitionException;
import FSA.Errors.InvalidStateException;
import FSA.Errors.InvalidTransitionException;
import FSA.Errors.MinimizationFailedException;
import FSA.Model.CompactedRow;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A finite state automaton over a transition table of named states.
 * <p>
 * Rows may be deterministic (one target per symbol) or non-deterministic (a set of targets). The automaton
 * is validated and normalized to S0..S(n-1) on construction. It also carries a simulation pointer: the current
 * state and whether it accepts. {@link #process(Object...)} moves the pointer; it is not restarted between
 * calls, use {@link #reset()} for that.
 * <p>
 * Instances are not thread-safe. Use {@link #copy()} to simulate from several threads.
 */
public final class Automaton {
    private static final Logger LOGGER = LoggerFactory.getLogger(Automaton.class);

    private LinkedHashMap<String, StateDefinition> table;
    private String state;
    private boolean accept;
    private boolean minimized;

    /**
     * @param definition - state name to row; copied, later changes to the map do not affect this automaton
     * @throws InvalidDefinitionException if the definition is structurally invalid
     * @throws InvalidStateException if a transition targets an undefined state
     */
    public Automaton(Map<String, StateDefinition> definition) {
        final String start = DefinitionValidator.validate(definition);
        this.table = new LinkedHashMap<>(definition);
        this.state = start;
        this.accept = table.get(start).isAccept();
        this.minimized = false;
        normalize();
    }

    private Automaton(Automaton other) {
        this.table = new LinkedHashMap<>(other.table);
        this.state = other.state;
        this.accept = other.accept;
        this.minimized = other.minimized;
    }

    /**
     * DFA reading base-{@code base} digits most significant first, accepting iff the number read is divisible
     * by {@code divisor}. State S<i>k</i> holds remainder k.
     */
    public static Automaton createDivisibilityChecker(int base, int divisor) {
        if (base < 2) {
            throw new IllegalArgumentException("Base must be at least 2, got " + base);
        }
        if (divisor < 1) {
            throw new IllegalArgumentException("Divisor must be at least 1, got " + divisor);
        }
        final Map<String, StateDefinition> definition = new LinkedHashMap<>();
        for (int remainder = 0; remainder < divisor; remainder++) {
            StateDefinition.Builder row = StateDefinition.builder()
                .start(remainder == 0)
                .accept(remainder == 0);
            for (int digit = 0; digit < base; digit++) {
                long next = ((long) base * remainder + digit) % divisor;
                row.on(Symbol.of(digit), Target.of(Normalizer.stateName((int) next)));
            }
            definition.put(Normalizer.stateName(remainder), row.build());
        }
        return new Automaton(definition);
    }

    // ---- simulation ----

    /**
     * Feed input symbols. Arguments may be symbols, iterables or arrays of symbols; nested ones are flattened.
     * Each symbol is coerced with {@link Symbol#of(Object)}.
     * <p>
     * On failure the pointer stays where the failing symbol found it; earlier symbols of this call have
     * already moved it.
     * @return this automaton
     * @throws InvalidTransitionException if the current state has no transition on a symbol
     * @throws AmbiguousTransitionException if the current state has several targets for a symbol
     */
    public Automaton process(Object... inputs) {
        final List<Symbol> symbols = new ArrayList<>();
        flatten(Arrays.asList(inputs), symbols);
        for (Symbol symbol : symbols) {
            step(symbol);
        }
        return this;
    }

    private void step(Symbol symbol) {
        final Target target = table.get(state).getTarget(symbol);
        if (target == null) {
            throw new InvalidTransitionException(state, symbol);
        }
        final String next = target.single();
        if (next == null) {
            throw new AmbiguousTransitionException(state, symbol, target.states());
        }
        state = next;
        accept = table.get(next).isAccept();
    }

    private static void flatten(Iterable<?> inputs, List<Symbol> out) {
        for (Object input : inputs) {
            if (input instanceof Iterable) {
                flatten((Iterable<?>) input, out);
            } else if (input instanceof Object[]) {
                flatten(Arrays.asList((Object[]) input), out);
            } else if (input instanceof int[]) {
                for (int i : (int[]) input) {
                    out.add(Symbol.of(i));
                }
            } else {
                out.add(Symbol.of(input));
            }
        }
    }

    /**
     * Move the pointer back to the start state.
     */
    public Automaton reset() {
        state = getStartState();
        accept = table.get(state).isAccept();
        return this;
    }

    /**
     * Run the input from the start state on a copy; this automaton's pointer does not move.
     * @return whether the input ends in an accepting state; false if some symbol has no transition
     * @throws AmbiguousTransitionException if the run reaches a non-deterministic row
     */
    public boolean accepts(Object... inputs) {
        try {
            return copy().reset().process(inputs).isAccepting();
        } catch (InvalidTransitionException e) {
            return false;
        }
    }

    // ---- structural operations ----

    /**
     * Rename states to S0..S(n-1), numbered states first in numeric order. Idempotent.
     */
    public Automaton normalize() {
        final Map<String, String> mapping = Normalizer.renameMap(table.keySet());
        table = Normalizer.rename(table, mapping);
        state = mapping.get(state);
        LOGGER.debug("Normalized {} states to S0..S{}", table.size(), table.size() - 1);
        return this;
    }

    /**
     * Delete every state that is not reachable from the start state. Remaining names are kept.
     */
    public Automaton removeUnreachableStates() {
        final int before = table.size();
        table = ReachabilityTrim.trim(table, getStartState());
        if (table.size() < before) {
            LOGGER.debug("Removed {} unreachable states, {} left", before - table.size(), table.size());
        }
        return this;
    }

    /**
     * Merge equivalent states with the table-filling algorithm. A no-op on an already minimized automaton.
     * The result is normalized; the pointer moves to the class of the state it was on.
     * @return this automaton
     * @throws MinimizationFailedException if the table cannot be minimized, e.g. a row is non-deterministic;
     *     the automaton is left unchanged
     */
    public Automaton minimize() {
        if (minimized) {
            return this;
        }
        final int before = table.size();
        final LinkedHashMap<String, StateDefinition> result;
        final String newState;
        try {
            LinkedHashMap<String, StateDefinition> trimmed = ReachabilityTrim.trim(table, getStartState());
            Map<String, String> toIndexed = Normalizer.renameMap(trimmed.keySet());
            TableFillingMinimizer.Quotient quotient =
                TableFillingMinimizer.minimize(Normalizer.rename(trimmed, toIndexed));
            Map<String, String> compacted = Normalizer.renameMap(quotient.table().keySet());
            result = Normalizer.rename(quotient.table(), compacted);

            String indexed = toIndexed.get(state);
            if (indexed == null) {
                throw new IllegalStateException("Current state " + state + " is not reachable from the start state");
            }
            newState = compacted.get(quotient.representatives().get(indexed));
        } catch (RuntimeException e) {
            throw new MinimizationFailedException(e);
        }

        table = result;
        state = newState;
        accept = table.get(state).isAccept();
        minimized = true;
        LOGGER.debug("Minimized {} states to {}", before, table.size());
        return this;
    }

    /**
     * Build the union of the given states without modifying this automaton.
     * @see StateCombiner#combine(Map, Collection)
     */
    public Map<String, StateDefinition> combineStates(String... states) {
        return combineStates(Arrays.asList(states));
    }

    public Map<String, StateDefinition> combineStates(Collection<String> states) {
        return StateCombiner.combine(table, states);
    }

    /**
     * Transition table with symbols grouped by target, the input for diagram renderers.
     */
    public Map<String, CompactedRow> compactTransitions(boolean addSpaces) {
        return ArrowCompactor.compact(table, addSpaces);
    }

    public Map<String, CompactedRow> compactTransitions() {
        return compactTransitions(false);
    }

    /**
     * Independent copy with the same table, pointer and minimized flag.
     */
    public Automaton copy() {
        return new Automaton(this);
    }

    // ---- queries ----

    public String getState() {
        return state;
    }

    public boolean isAccepting() {
        return accept;
    }

    public boolean isMinimized() {
        return minimized;
    }

    public int size() {
        return table.size();
    }

    public List<String> getStates() {
        return List.copyOf(table.keySet());
    }

    public String getStartState() {
        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            if (e.getValue().isStart()) {
                return e.getKey();
            }
        }
        throw new IllegalStateException("No start state");
    }

    /**
     * @return unmodifiable view of the transition table, in state order
     */
    public Map<String, StateDefinition> getDefinition() {
        return Collections.unmodifiableMap(table);
    }

    /**
     * @return every symbol used by some row, sorted
     */
    public SortedSet<Symbol> getAlphabet() {
        final SortedSet<Symbol> symbols = new TreeSet<>();
        for (StateDefinition row : table.values()) {
            symbols.addAll(row.getTransitions().keySet());
        }
        return symbols;
    }

    /**
     * @return whether no row has a set target with more than one state
     */
    public boolean isDeterministic() {
        for (StateDefinition row : table.values()) {
            for (Target t : row.getTransitions().values()) {
                if (t.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Automata are equal when their transition tables are equal, state order included.
     * The simulation pointer and the minimized flag are not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        return table.equals(((Automaton) o).table);
    }

    @Override
    public int hashCode() {
        return table.hashCode();
    }

    /**
     * One line per state: {@code S0: | 0: S0, 1: S1, start: true , accept: true  |}.
     */
    @Override
    public String toString() {
        final List<String> lines = new ArrayList<>(table.size());
        for (Map.Entry<String, StateDefinition> e : table.entrySet()) {
            StateDefinition row = e.getValue();
            StringBuilder line = new StringBuilder(e.getKey()).append(": | ");
            for (Map.Entry<Symbol, Target> t : row.getTransitions().entrySet()) {
                line.append(t.getKey()).append(": ").append(t.getValue()).append(", ");
            }
            line.append("start: ").append(row.isStart() ? "true " : "false")
                .append(", accept: ").append(row.isAccept() ? "true " : "false")
                .append(" |");
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }
}
