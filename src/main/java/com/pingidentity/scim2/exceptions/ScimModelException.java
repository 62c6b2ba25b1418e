package com.pingidentity.scim2.exceptions;

import com.unboundid.scim2.common.exceptions.BadRequestException;

/**
 * Base class for failures reported by the codec and the validator.
 *
 * <p>Every failure is a 400 Bad Request in SCIM terms and carries the SCIM
 * {@code scimType}, an {@link ErrorKind} and the path of the offending attribute
 * (for example {@code emails[1].type}; empty for the document itself).</p>
 */
public abstract class ScimModelException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String attributePath;

    protected ScimModelException(ErrorKind kind, String attributePath, String message, String scimType) {
        super(message, scimType);
        this.kind = kind;
        this.attributePath = attributePath == null ? "" : attributePath;
    }

    protected ScimModelException(ErrorKind kind, String attributePath, String message, String scimType,
                                 Throwable cause) {
        super(message, scimType, cause);
        this.kind = kind;
        this.attributePath = attributePath == null ? "" : attributePath;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the path of the offending attribute, or an empty string for the whole document
     */
    public String getAttributePath() {
        return attributePath;
    }
}
