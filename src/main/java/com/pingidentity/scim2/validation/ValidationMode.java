package com.pingidentity.scim2.validation;

/**
 * What the validated payload is for.
 */
public enum ValidationMode {

    /** Any protocol payload; mutability is not checked. */
    STANDARD,

    /** A payload built by a client to create a resource: read-only attributes must not be supplied. */
    CREATE
}
