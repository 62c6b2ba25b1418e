package com.pingidentity.scim2.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Extension payload for a schema this library has no typed model for.
 *
 * <p>The attributes are kept verbatim as a JSON object so they survive a round trip.</p>
 */
public class GenericExtension implements ScimExtension {

    private final String schemaUrn;
    private final ObjectNode attributes;

    public GenericExtension(String schemaUrn) {
        this(schemaUrn, JsonNodeFactory.instance.objectNode());
    }

    public GenericExtension(String schemaUrn, ObjectNode attributes) {
        this.schemaUrn = Objects.requireNonNull(schemaUrn, "schemaUrn");
        this.attributes = Objects.requireNonNull(attributes, "attributes").deepCopy();
    }

    @Override
    public String getSchemaUrn() {
        return schemaUrn;
    }

    /**
     * @return a copy of the extension attributes
     */
    public ObjectNode getAttributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericExtension)) return false;
        GenericExtension that = (GenericExtension) o;
        return schemaUrn.equals(that.schemaUrn) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaUrn, attributes);
    }

    @Override
    public String toString() {
        return "GenericExtension{" + schemaUrn + "=" + attributes + '}';
    }
}
