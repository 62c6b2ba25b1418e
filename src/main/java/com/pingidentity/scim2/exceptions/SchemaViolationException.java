package com.pingidentity.scim2.exceptions;

/**
 * Thrown when {@code schemas} does not fit the resource: the base URN is missing, an
 * extension is declared without data or attached without being declared, or a top-level
 * attribute belongs to no schema and unknown attributes are rejected.
 */
public class SchemaViolationException extends ScimModelException {

    private static final long serialVersionUID = 1L;

    public SchemaViolationException(String attributePath, String message) {
        super(ErrorKind.SCHEMA, attributePath, message, INVALID_VALUE);
    }
}
