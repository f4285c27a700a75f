package FSA.Errors;

/**
 * Structural problem with a candidate definition: empty, missing flags, wrong start-state count, malformed values.
 */
public class InvalidDefinitionException extends FSAException {
    private final String state;

    public InvalidDefinitionException(String message) {
        this(message, null);
    }

    public InvalidDefinitionException(String message, String state) {
        super(state == null
            ? "Invalid FSA definition: " + message
            : "Invalid FSA definition: " + message + " (state '" + state + "')");
        this.state = state;
    }

    /**
     * @return offending state, or null when the problem is not tied to one state
     */
    public String getState() {
        return state;
    }
}
