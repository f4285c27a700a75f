package FSA.Errors;

public class InvalidStateException extends FSAException {
    private final String state;

    public InvalidStateException(String state) {
        this(state, "Invalid state '" + state + "' referenced in FSA");
    }

    public InvalidStateException(String state, String message) {
        super(message);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
