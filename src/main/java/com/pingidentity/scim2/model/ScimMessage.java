package com.pingidentity.scim2.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for SCIM protocol messages (RFC 7644). Messages carry {@code schemas} but,
 * unlike resources, no {@code id}, {@code meta} or extensions.
 */
public abstract class ScimMessage {

    private AttributeValue<List<String>> schemas = AttributeValue.absent();
    private final Map<String, JsonNode> unknownAttributes = new LinkedHashMap<>();

    /**
     * @return the URN identifying this message type
     */
    public abstract String getMessageSchemaUrn();

    public AttributeValue<List<String>> getSchemas() { return schemas; }
    public void setSchemas(AttributeValue<List<String>> schemas) { this.schemas = schemas; }

    public List<String> getSchemaUrns() {
        return schemas.orElse(Collections.emptyList());
    }

    public Map<String, JsonNode> getUnknownAttributes() {
        return Collections.unmodifiableMap(unknownAttributes);
    }

    public void putUnknownAttribute(String name, JsonNode value) {
        unknownAttributes.put(Objects.requireNonNull(name, "name"), value);
    }

    protected boolean commonAttributesEqual(ScimMessage other) {
        return schemas.equals(other.schemas) && unknownAttributes.equals(other.unknownAttributes);
    }

    protected int commonAttributesHash() {
        return Objects.hash(schemas, unknownAttributes);
    }
}
