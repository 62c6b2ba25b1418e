package com.pingidentity.scim2.model;

/**
 * URL of a photo of a User (canonical types: photo, thumbnail).
 */
public class Photo extends MultiValuedAttribute {

    public Photo() {
    }

    public Photo(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
