package com.pingidentity.scim2.exceptions;

/**
 * Thrown when a JSON value does not have the shape its attribute needs, for example an
 * array given for a singular attribute or a string given for a boolean.
 * Values are never coerced.
 */
public class TypeMismatchException extends ScimModelException {

    private static final long serialVersionUID = 1L;

    private final String expectedType;
    private final String actualType;

    public TypeMismatchException(String attributePath, String expectedType, String actualType) {
        super(ErrorKind.TYPE_MISMATCH, attributePath,
                String.format("Attribute '%s' must be %s but was %s", attributePath, expectedType, actualType),
                INVALID_VALUE);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public TypeMismatchException(String attributePath, String expectedType, String actualType, Throwable cause) {
        super(ErrorKind.TYPE_MISMATCH, attributePath,
                String.format("Attribute '%s' must be %s but was %s", attributePath, expectedType, actualType),
                INVALID_VALUE, cause);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }
}
