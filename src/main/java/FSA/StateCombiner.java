package FSA;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import FSA.Errors.InvalidStateException;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;

/**
 * Union of several states into one composite state, as used when reducing an NFA by hand.
 */
public final class StateCombiner {
    private StateCombiner() {}

    /**
     * Name of the composite state: member names sorted and braced, e.g. {S1,S2}.
     */
    public static String combinedName(Collection<String> states) {
        return "{" + String.join(",", new TreeSet<>(states)) + "}";
    }

    /**
     * Build the composite row. Start and accept are OR-ed; each symbol targets the union of the members' targets,
     * collapsed to a single state when the union has one member.
     * The table is not modified.
     * @param table - transition table holding the states
     * @param states - states to combine, at least one
     * @return detached single-entry map from composite name to composite row
     * @throws InvalidStateException if a state is not in the table
     */
    public static Map<String, StateDefinition> combine(Map<String, StateDefinition> table, Collection<String> states) {
        if (states.isEmpty()) {
            throw new IllegalArgumentException("At least one state is required for combination");
        }
        for (String state : states) {
            if (!table.containsKey(state)) {
                throw new InvalidStateException(state);
            }
        }

        final Map<Symbol, Set<String>> unions = new TreeMap<>();
        boolean start = false;
        boolean accept = false;
        for (String state : states) {
            StateDefinition row = table.get(state);
            start |= row.isStart();
            accept |= row.isAccept();
            for (Map.Entry<Symbol, Target> e : row.getTransitions().entrySet()) {
                unions.computeIfAbsent(e.getKey(), k -> new TreeSet<>()).addAll(e.getValue().states());
            }
        }

        final Map<Symbol, Target> transitions = new TreeMap<>();
        for (Map.Entry<Symbol, Set<String>> e : unions.entrySet()) {
            transitions.put(e.getKey(), Target.union(e.getValue()));
        }
        return Map.of(combinedName(states), StateDefinition.of(transitions, start, accept));
    }
}
