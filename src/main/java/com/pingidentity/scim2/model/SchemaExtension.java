package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Extension schema a resource type supports, and whether resources must carry it.
 */
public class SchemaExtension {

    private AttributeValue<String> schema = AttributeValue.absent();
    private AttributeValue<Boolean> required = AttributeValue.absent();

    public SchemaExtension() {
    }

    public SchemaExtension(String schema, boolean required) {
        this.schema = AttributeValue.ofOptional(schema);
        this.required = AttributeValue.of(required);
    }

    public AttributeValue<String> getSchema() { return schema; }
    public void setSchema(AttributeValue<String> schema) { this.schema = schema; }

    public AttributeValue<Boolean> getRequired() { return required; }
    public void setRequired(AttributeValue<Boolean> required) { this.required = required; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaExtension)) return false;
        SchemaExtension that = (SchemaExtension) o;
        return schema.equals(that.schema) && required.equals(that.required);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, required);
    }

    @Override
    public String toString() {
        return "SchemaExtension{schema=" + schema + ", required=" + required + '}';
    }
}
