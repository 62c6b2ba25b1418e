package com.pingidentity.scim2.model;

/**
 * Entry of a User's read-only {@code groups} attribute; {@code type} is direct or indirect.
 */
public class GroupMembership extends ResourceReference {

    public GroupMembership() {
    }

    public GroupMembership(String value, String ref, String display) {
        super(value, ref, display);
    }
}
