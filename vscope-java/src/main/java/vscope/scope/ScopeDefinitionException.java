package vscope.scope;

public class ScopeDefinitionException extends RuntimeException {
    public ScopeDefinitionException(String message) {
        super(message);
    }
}
