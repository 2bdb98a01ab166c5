package cz.cas.jhinst.qsource3.validation;

import cz.cas.jhinst.qsource3.api.ValidationFailure;

import java.util.Objects;

/**
 * Outcome of validating a candidate value: either the normalized value or a
 * classified failure. Validation never throws for bad input.
 */
public sealed interface ValidationResult
        permits ValidationResult.Valid, ValidationResult.Invalid
{
    boolean isValid();

    /**
     * @param value the candidate converted to its canonical representation
     */
    record Valid(Object value) implements ValidationResult {
        public Valid {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    record Invalid(ValidationFailure failure) implements ValidationResult {
        public Invalid {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
