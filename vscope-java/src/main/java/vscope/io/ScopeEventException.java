package vscope.io;

public class ScopeEventException extends RuntimeException {
    private final int line;

    public ScopeEventException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    public ScopeEventException(String message, int line, Throwable cause) {
        super(message + " at line " + line, cause);
        this.line = line;
    }

    public int line() { return line; }
}
