package org.dbos.dgraph.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result stores the outcome of a client operation: an optional value and the errors that made it fail.
 * A result is successful exactly when it carries no errors. A failed result may still carry a value.
 * @param <T>   the type of the value.
 */
public final class Result<T> {
    private final T value;
    private final List<DgraphError> errors;

    private Result(T value, List<DgraphError> errors) {
        this.value = value;
        this.errors = Collections.unmodifiableList(errors);
    }

    public static Result<Void> ok() {
        return new Result<>(null, List.of());
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, List.of());
    }

    public static <T> Result<T> fail(DgraphError error) {
        if (error == null) {
            throw new NullPointerException("error");
        }
        return new Result<>(null, List.of(error));
    }

    /**
     * Return a result with the same value and the given errors appended. A successful result becomes failed.
     * @param moreErrors    errors to append.
     * @return              a new {@link Result}.
     */
    public Result<T> withErrors(List<DgraphError> moreErrors) {
        List<DgraphError> all = new ArrayList<>(errors);
        all.addAll(moreErrors);
        return new Result<>(value, all);
    }

    /**
     * Re-type this result, dropping the value and keeping the errors.
     * @param <U>   the new value type.
     * @return      a {@link Result} with no value.
     */
    public <U> Result<U> toResult() {
        return new Result<>(null, errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean isFailed() {
        return !errors.isEmpty();
    }

    /**
     * Return the value, or <code>null</code> if the operation produced none.
     * @return the value.
     */
    public T getValue() {
        return value;
    }

    public List<DgraphError> getErrors() {
        return errors;
    }

    /**
     * Return the first error, or <code>null</code> if the result is successful.
     * @return the first {@link DgraphError}.
     */
    public DgraphError getError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    public <E extends DgraphError> boolean hasError(Class<E> type) {
        for (DgraphError e : errors) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Result{ok}" : "Result{failed: " + errors + "}";
    }
}
