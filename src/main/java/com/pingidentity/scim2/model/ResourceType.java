package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.List;
import java.util.Objects;

/**
 * Descriptor of a resource type a service provider exposes (RFC 7643 Section 6).
 */
public class ResourceType extends ScimResource {

    private AttributeValue<String> name = AttributeValue.absent();
    private AttributeValue<String> description = AttributeValue.absent();
    private AttributeValue<String> endpoint = AttributeValue.absent();
    private AttributeValue<String> schema = AttributeValue.absent();
    private AttributeValue<List<SchemaExtension>> schemaExtensions = AttributeValue.absent();

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.RESOURCE_TYPE;
    }

    public AttributeValue<String> getName() { return name; }
    public void setName(AttributeValue<String> name) { this.name = name; }

    public AttributeValue<String> getDescription() { return description; }
    public void setDescription(AttributeValue<String> description) { this.description = description; }

    /** Endpoint path relative to the service provider base URL, e.g. {@code /Users}. */
    public AttributeValue<String> getEndpoint() { return endpoint; }
    public void setEndpoint(AttributeValue<String> endpoint) { this.endpoint = endpoint; }

    /** URN of the resource type's base schema. */
    public AttributeValue<String> getSchema() { return schema; }
    public void setSchema(AttributeValue<String> schema) { this.schema = schema; }

    public AttributeValue<List<SchemaExtension>> getSchemaExtensions() { return schemaExtensions; }
    public void setSchemaExtensions(AttributeValue<List<SchemaExtension>> schemaExtensions) { this.schemaExtensions = schemaExtensions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceType)) return false;
        ResourceType that = (ResourceType) o;
        return commonAttributesEqual(that)
                && name.equals(that.name)
                && description.equals(that.description)
                && endpoint.equals(that.endpoint)
                && schema.equals(that.schema)
                && schemaExtensions.equals(that.schemaExtensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonAttributesHash(), name, description, endpoint, schema, schemaExtensions);
    }

    @Override
    public String toString() {
        return "ResourceType{name=" + name + ", endpoint=" + endpoint + ", schema=" + schema + '}';
    }
}
