package org.mides.pooling.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(null, null);

    ViolationKind kind;
    String detail;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult violation(ViolationKind kind, String detail) {
        return new ValidationResult(kind, detail);
    }

    public boolean isValid() {
        return kind == null;
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : kind + ": " + detail;
    }
}
