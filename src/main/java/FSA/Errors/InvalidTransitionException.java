package FSA.Errors;

import FSA.Model.Symbol;

public class InvalidTransitionException extends FSAException {
    private final String state;
    private final Symbol symbol;

    public InvalidTransitionException(String state, Symbol symbol) {
        super("No transition defined from '" + state + "' on input '" + symbol + "'");
        this.state = state;
        this.symbol = symbol;
    }

    public String getState() {
        return state;
    }

    public Symbol getSymbol() {
        return symbol;
    }
}
