package com.sift.query;

/**
 * Exception thrown when an expression cannot be compiled into a query or aggregation
 * Carries the error classification and the expression fragment that caused it
 */
public class QueryCompilationException extends RuntimeException {

    private final CompilationError error;
    private final String fragment;

    public QueryCompilationException(CompilationError error, String message) {
        super(message);
        this.error = error;
        this.fragment = null;
    }

    public QueryCompilationException(CompilationError error, String message, Object fragment) {
        super(message);
        this.error = error;
        this.fragment = fragment != null ? fragment.toString() : null;
    }

    public QueryCompilationException(CompilationError error, String message, Object fragment, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.fragment = fragment != null ? fragment.toString() : null;
    }

    public CompilationError getError() {
        return error;
    }

    public String getFragment() {
        return fragment;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" [Error: ").append(error).append("]");
        if (fragment != null) {
            sb.append(" [Expression: ").append(fragment).append("]");
        }
        return sb.toString();
    }
}
