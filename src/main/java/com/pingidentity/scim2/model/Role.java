package com.pingidentity.scim2.model;

/**
 * Role held by a User.
 */
public class Role extends MultiValuedAttribute {

    public Role() {
    }

    public Role(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
