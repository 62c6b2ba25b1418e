package com.pingidentity.scim2.model;

/**
 * Email address of a User (canonical types: work, home, other).
 */
public class Email extends MultiValuedAttribute {

    public Email() {
    }

    public Email(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
