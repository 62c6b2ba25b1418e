package com.pingidentity.scim2.model;

/**
 * Member of a Group. The {@code type} names the kind of resource the member is,
 * {@code User} or {@code Group}.
 */
public class Member extends ResourceReference {

    public Member() {
    }

    public Member(String value, String ref, String display) {
        super(value, ref, display);
    }
}
