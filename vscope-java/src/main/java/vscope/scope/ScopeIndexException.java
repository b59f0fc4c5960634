package vscope.scope;

public class ScopeIndexException extends IndexOutOfBoundsException {
    public ScopeIndexException(String message) {
        super(message);
    }
}
