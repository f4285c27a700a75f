package FSA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FSA.Errors.InvalidDefinitionException;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;

/**
 * Reads the loose mapping form of a definition:
 * {@code state -> {symbol -> target | collection of targets, "start" -> Boolean, "accept" -> Boolean}}.
 */
public final class Definitions {
    public static final String START = "start";
    public static final String ACCEPT = "accept";

    private Definitions() {}

    /**
     * Convert the mapping into typed rows. Only the shape of each value is checked here;
     * the result still goes through {@link DefinitionValidator} when an {@link Automaton} is built from it.
     * @throws InvalidDefinitionException if a flag is not a Boolean, a symbol is unusable, or a target is not
     *     a state name or a non-empty collection of state names
     */
    public static Map<String, StateDefinition> fromMap(Map<String, ? extends Map<?, ?>> raw) {
        final Map<String, StateDefinition> definition = new LinkedHashMap<>();
        if (raw == null) {
            return definition;
        }
        for (Map.Entry<String, ? extends Map<?, ?>> entry : raw.entrySet()) {
            definition.put(entry.getKey(), parseRow(entry.getKey(), entry.getValue()));
        }
        return definition;
    }

    public static Automaton toAutomaton(Map<String, ? extends Map<?, ?>> raw) {
        return new Automaton(fromMap(raw));
    }

    private static StateDefinition parseRow(String state, Map<?, ?> row) {
        if (row == null) {
            throw new InvalidDefinitionException("state definition must be a mapping", state);
        }
        final StateDefinition.Builder builder = StateDefinition.builder();
        for (Map.Entry<?, ?> e : row.entrySet()) {
            Object key = e.getKey();
            Object value = e.getValue();
            if (START.equals(key)) {
                builder.start(flag(state, START, value));
            } else if (ACCEPT.equals(key)) {
                builder.accept(flag(state, ACCEPT, value));
            } else {
                Symbol symbol = symbol(state, key);
                if (builder.hasTransition(symbol)) {
                    throw new InvalidDefinitionException("duplicate symbol " + symbol + " (key " + key + ")", state);
                }
                builder.on(symbol, target(state, key, value));
            }
        }
        return builder.build();
    }

    private static boolean flag(String state, String name, Object value) {
        if (!(value instanceof Boolean)) {
            throw new InvalidDefinitionException("'" + name + "' must be a boolean, got " + value, state);
        }
        return (Boolean) value;
    }

    private static Symbol symbol(String state, Object key) {
        try {
            return Symbol.of(key);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidDefinitionException("unusable symbol " + key + ": " + e.getMessage(), state);
        }
    }

    private static Target target(String state, Object key, Object value) {
        if (value instanceof String) {
            return Target.of((String) value);
        }
        if (value instanceof Collection && !((Collection<?>) value).isEmpty()) {
            List<String> targets = new ArrayList<>();
            for (Object t : (Collection<?>) value) {
                if (!(t instanceof String)) {
                    throw new InvalidDefinitionException("target of '" + key + "' must be state names, got " + t, state);
                }
                targets.add((String) t);
            }
            return Target.ofSet(targets);
        }
        throw new InvalidDefinitionException("target of '" + key + "' must be a state or a non-empty collection of states, got "
            + value, state);
    }
}
