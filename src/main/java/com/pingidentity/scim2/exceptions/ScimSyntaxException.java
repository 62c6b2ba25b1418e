package com.pingidentity.scim2.exceptions;

/**
 * Thrown when the input is not a well-formed JSON document.
 */
public class ScimSyntaxException extends ScimModelException {

    private static final long serialVersionUID = 1L;

    public ScimSyntaxException(String message) {
        super(ErrorKind.SYNTAX, "", message, INVALID_SYNTAX);
    }

    public ScimSyntaxException(String attributePath, String message) {
        super(ErrorKind.SYNTAX, attributePath, message, INVALID_SYNTAX);
    }

    public ScimSyntaxException(String message, Throwable cause) {
        super(ErrorKind.SYNTAX, "", message, INVALID_SYNTAX, cause);
    }
}
