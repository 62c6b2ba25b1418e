package com.pingidentity.scim2.exceptions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.schema.ScimSchemaUrns;
import com.unboundid.scim2.common.exceptions.ScimException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builder for SCIM-compliant error messages.
 *
 * SCIM error responses follow the format defined in RFC 7644 Section 3.12:
 * {
 *   "schemas": ["urn:ietf:params:scim:api:messages:2.0:Error"],
 *   "status": "400",
 *   "scimType": "invalidValue",
 *   "detail": "Required attribute 'userName' is missing or empty"
 * }
 */
public class ScimErrorResponseBuilder {

    private static final Logger LOGGER = Logger.getLogger(ScimErrorResponseBuilder.class.getName());

    private static final int MAX_DETAIL_LENGTH = 500;

    private final ObjectMapper objectMapper;

    public ScimErrorResponseBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Build the SCIM error message for an exception.
     *
     * @param exception the SCIM exception, typically a {@link ScimModelException}
     * @return JSON string representing the SCIM error message
     */
    public String buildErrorResponse(ScimException exception) {
        return buildErrorResponse(getStatusCode(exception), exception.getMessage(), getScimType(exception));
    }

    /**
     * Build a SCIM error message with status code, detail message, and SCIM type.
     *
     * @param statusCode the HTTP status code
     * @param detail the error detail message
     * @param scimType the SCIM error type (optional, can be null)
     * @return JSON string representing the SCIM error message
     */
    public String buildErrorResponse(int statusCode, String detail, String scimType) {
        try {
            return objectMapper.writeValueAsString(buildErrorResponseNode(statusCode, detail, scimType));
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.SEVERE, "Failed to build SCIM error response", e);
            return buildFallbackErrorResponse(statusCode, detail);
        }
    }

    /**
     * Build an error message object node (for programmatic use).
     */
    public ObjectNode buildErrorResponseNode(int statusCode, String detail, String scimType) {
        ObjectNode errorNode = objectMapper.createObjectNode();

        ArrayNode schemas = objectMapper.createArrayNode();
        schemas.add(ScimSchemaUrns.ERROR);
        errorNode.set("schemas", schemas);

        // status is a string per RFC 7644
        errorNode.put("status", String.valueOf(statusCode));

        if (scimType != null && !scimType.trim().isEmpty()) {
            errorNode.put("scimType", scimType);
        }

        if (detail != null && !detail.trim().isEmpty()) {
            errorNode.put("detail", sanitizeDetail(detail));
        } else {
            errorNode.put("detail", getDefaultDetailForStatus(statusCode));
        }

        return errorNode;
    }

    private int getStatusCode(ScimException exception) {
        if (exception.getScimError() != null) {
            return exception.getScimError().getStatus();
        }
        return 400;
    }

    private String getScimType(ScimException exception) {
        if (exception.getScimError() != null) {
            return exception.getScimError().getScimType();
        }
        return null;
    }

    /**
     * Removes control characters and caps the length of the detail text.
     */
    private String sanitizeDetail(String detail) {
        String sanitized = detail.replaceAll("[\\p{Cntrl}&&[^\r\n\t]]", "");
        if (sanitized.length() > MAX_DETAIL_LENGTH) {
            sanitized = sanitized.substring(0, MAX_DETAIL_LENGTH - 3) + "...";
        }
        return sanitized;
    }

    private String getDefaultDetailForStatus(int statusCode) {
        return switch (statusCode) {
            case 400 -> "Bad Request: The request is malformed or contains invalid data";
            case 409 -> "Conflict: The request could not be completed due to a conflict with the current state of the resource";
            case 500 -> "Internal Server Error: An unexpected error occurred on the server";
            default -> "An error occurred while processing the request";
        };
    }

    /**
     * Hand-built response for when Jackson itself fails, so a caller always gets valid JSON.
     */
    private String buildFallbackErrorResponse(int statusCode, String detail) {
        String safeDetail = detail != null ? escapeJson(detail) : "An error occurred";

        return String.format(
                "{\"schemas\":[\"" + ScimSchemaUrns.ERROR + "\"]," +
                        "\"status\":\"%d\"," +
                        "\"detail\":\"%s\"}",
                statusCode,
                safeDetail
        );
    }

    private String escapeJson(String input) {
        return input.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t")
                .replace("\b", "\\b")
                .replace("\f", "\\f");
    }
}
