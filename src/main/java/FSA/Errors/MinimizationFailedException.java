package FSA.Errors;

public class MinimizationFailedException extends FSAException {
    public MinimizationFailedException(Throwable cause) {
        super("FSA minimization failed: " + cause.getMessage(), cause);
    }
}
