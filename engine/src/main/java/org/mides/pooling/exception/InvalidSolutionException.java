package org.mides.pooling.exception;

import lombok.Getter;
import org.mides.pooling.model.ValidationResult;

/**
 * Raised when a solution produced by an engine breaks a route or coverage
 * invariant. Signals an engine defect, never a data condition.
 */
@Getter
public class InvalidSolutionException extends RuntimeException {

    private final transient ValidationResult violation;

    public InvalidSolutionException(String stage, ValidationResult violation) {
        super(String.format("Invalid solution after %s: %s", stage, violation));
        this.violation = violation;
    }
}
