package org.dbos.dgraph.result;

/**
 * A reason a {@link Result} failed. Errors are values: they are returned, never thrown.
 */
public abstract class DgraphError {
    private final String message;

    protected DgraphError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + message;
    }
}
