package com.pingidentity.scim2.exceptions;

/**
 * Thrown when an attribute value breaks a schema rule.
 */
public class FieldViolationException extends ScimModelException {

    private static final long serialVersionUID = 1L;

    /**
     * The rule that was broken.
     */
    public enum Violation {
        REQUIRED,
        CARDINALITY,
        MULTIPLE_PRIMARY,
        CANONICAL_VALUE,
        INCONSISTENT,
        MUTABILITY
    }

    private final Violation violation;

    public FieldViolationException(Violation violation, String attributePath, String message) {
        super(ErrorKind.FIELD, attributePath, message,
                violation == Violation.MUTABILITY ? MUTABILITY : INVALID_VALUE);
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }

    public static FieldViolationException required(String attributePath) {
        return new FieldViolationException(Violation.REQUIRED, attributePath,
                String.format("Required attribute '%s' is missing or empty", attributePath));
    }

    public static FieldViolationException multiplePrimary(String attributePath) {
        return new FieldViolationException(Violation.MULTIPLE_PRIMARY, attributePath,
                String.format("More than one value of '%s' is marked primary", attributePath));
    }

    public static FieldViolationException readOnly(String attributePath) {
        return new FieldViolationException(Violation.MUTABILITY, attributePath,
                String.format("Attribute '%s' is read-only and cannot be supplied", attributePath));
    }
}
