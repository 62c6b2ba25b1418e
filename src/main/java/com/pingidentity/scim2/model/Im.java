package com.pingidentity.scim2.model;

/**
 * Instant messaging address of a User.
 */
public class Im extends MultiValuedAttribute {

    public Im() {
    }

    public Im(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
