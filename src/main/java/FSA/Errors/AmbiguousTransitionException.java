package FSA.Errors;

import java.util.List;

import FSA.Model.Symbol;

/**
 * Deterministic simulation reached a row with several targets for one symbol.
 */
public class AmbiguousTransitionException extends FSAException {
    private final String state;
    private final Symbol symbol;
    private final List<String> targets;

    public AmbiguousTransitionException(String state, Symbol symbol, List<String> targets) {
        super("State '" + state + "' has " + targets.size() + " possible transitions on input '" + symbol
            + "'; deterministic simulation needs exactly one");
        this.state = state;
        this.symbol = symbol;
        this.targets = List.copyOf(targets);
    }

    public String getState() {
        return state;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public List<String> getTargets() {
        return targets;
    }
}
