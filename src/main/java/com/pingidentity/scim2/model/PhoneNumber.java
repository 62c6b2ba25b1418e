package com.pingidentity.scim2.model;

/**
 * Phone number of a User (canonical types: work, home, mobile, fax, pager, other).
 */
public class PhoneNumber extends MultiValuedAttribute {

    public PhoneNumber() {
    }

    public PhoneNumber(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
