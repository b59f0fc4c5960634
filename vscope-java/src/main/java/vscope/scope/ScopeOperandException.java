package vscope.scope;

/** Raised when a chain is concatenated with something that is neither a label nor a chain. */
public class ScopeOperandException extends RuntimeException {
    public ScopeOperandException(String message) {
        super(message);
    }
}
