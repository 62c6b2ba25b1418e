package com.pingidentity.scim2.exceptions;

/**
 * Category of a decoding or validation failure.
 */
public enum ErrorKind {
    /** The input is not well-formed JSON. */
    SYNTAX,
    /** {@code schemas} is missing the base URN, or declared and attached extensions disagree. */
    SCHEMA,
    /** An attribute breaks a rule: required, cardinality, canonical value, primary, mutability. */
    FIELD,
    /** A JSON value has the wrong shape for its attribute. */
    TYPE_MISMATCH
}
