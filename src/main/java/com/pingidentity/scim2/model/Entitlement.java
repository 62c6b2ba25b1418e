package com.pingidentity.scim2.model;

/**
 * Entitlement held by a User.
 */
public class Entitlement extends MultiValuedAttribute {

    public Entitlement() {
    }

    public Entitlement(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
