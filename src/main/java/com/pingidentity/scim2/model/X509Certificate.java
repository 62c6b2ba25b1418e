package com.pingidentity.scim2.model;

/**
 * DER-encoded X.509 certificate of a User, base64 in {@code value}.
 */
public class X509Certificate extends MultiValuedAttribute {

    public X509Certificate() {
    }

    public X509Certificate(String value, String type, boolean primary) {
        super(value, type, primary);
    }
}
