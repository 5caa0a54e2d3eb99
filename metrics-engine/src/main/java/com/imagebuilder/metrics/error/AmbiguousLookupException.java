package com.imagebuilder.metrics.error;

/**
 * Raised when more than one org directory entry maps to the same identifier.
 */
public class AmbiguousLookupException extends MetricsException {
    private static final long serialVersionUID = 1L;

    private final String identifier;
    private final int matches;

    public AmbiguousLookupException(String identifier, int matches) {
        super("Multiple (" + matches + ") entries with same account_number (" + identifier + ") in user data");
        this.identifier = identifier;
        this.matches = matches;
    }

    public String identifier() {
        return identifier;
    }

    public int matches() {
        return matches;
    }
}
