package FSA.Errors;

/**
 * Base class of all automaton errors. Unchecked: every failure is a deterministic logic error in the caller's input.
 */
public class FSAException extends RuntimeException {
    public FSAException(String message) {
        super(message);
    }

    public FSAException(String message, Throwable cause) {
        super(message, cause);
    }
}
