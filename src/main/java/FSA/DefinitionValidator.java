package FSA;

import java.util.Map;

import FSA.Errors.InvalidDefinitionException;
import FSA.Errors.InvalidStateException;
import FSA.Model.StateDefinition;
import FSA.Model.Symbol;
import FSA.Model.Target;

/**
 * Rejects malformed definitions before any automaton is created.
 */
public final class DefinitionValidator {
    private DefinitionValidator() {}

    /**
     * Validate a candidate definition.
     * @param definition - state name to row
     * @return name of the unique start state
     * @throws InvalidDefinitionException if the definition is empty, a row lacks a flag, or the start count is not 1
     * @throws InvalidStateException if a transition targets an undefined state
     */
    public static String validate(Map<String, StateDefinition> definition) {
        if (definition == null || definition.isEmpty()) {
            throw new InvalidDefinitionException("FSA definition cannot be empty");
        }

        for (Map.Entry<String, StateDefinition> entry : definition.entrySet()) {
            String state = entry.getKey();
            StateDefinition row = entry.getValue();
            if (state == null) {
                throw new InvalidDefinitionException("state names must not be null");
            }
            if (row == null) {
                throw new InvalidDefinitionException("missing row", state);
            }
            if (!row.hasStartFlag() || !row.hasAcceptFlag()) {
                throw new InvalidDefinitionException("missing start/accept field", state);
            }
            for (Map.Entry<Symbol, Target> t : row.getTransitions().entrySet()) {
                for (String target : t.getValue().states()) {
                    if (!definition.containsKey(target)) {
                        throw new InvalidStateException(target,
                            "Transition from '" + state + "' on '" + t.getKey()
                                + "' references non-existent state '" + target + "'");
                    }
                }
            }
        }

        String start = null;
        int startCount = 0;
        for (Map.Entry<String, StateDefinition> entry : definition.entrySet()) {
            if (entry.getValue().isStart()) {
                start = entry.getKey();
                startCount++;
            }
        }
        if (startCount != 1) {
            throw new InvalidDefinitionException("expected exactly one start state, found " + startCount);
        }
        return start;
    }
}
