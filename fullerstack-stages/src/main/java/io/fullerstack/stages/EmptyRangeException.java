package io.fullerstack.stages;

/**
 * Thrown when an operation that needs at least one element runs over an empty range.
 *
 * <p>Raised by {@link Stage#reduce(java.util.function.BinaryOperator)} and {@link Stage#first()}.
 */
public class EmptyRangeException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyRangeException(String operation) {
        super(operation + " requires a non-empty range");
    }
}
