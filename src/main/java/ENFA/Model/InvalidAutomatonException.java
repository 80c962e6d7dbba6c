package ENFA.Model;

/**
 * Input automaton is not well-formed. Raised before any conversion work starts.
 */
public class InvalidAutomatonException extends IllegalArgumentException {

    public enum Kind {
        UNKNOWN_INITIAL_STATE,
        UNKNOWN_FINAL_STATE,
        DANGLING_TRANSITION_ENDPOINT,
        UNDECLARED_SYMBOL
    }

    private final Kind kind;

    public InvalidAutomatonException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
