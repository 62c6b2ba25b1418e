package com.pingidentity.scim2.validation;

import com.unboundid.scim2.common.types.SchemaResource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the generic validator needs to know about one resource or message type:
 * its base schema, the extension schemas it knows, its cross-field rules and, for
 * container messages, the attribute that embeds other resources.
 */
public final class ValidationProfile {

    private final String name;
    private final SchemaResource baseSchema;
    private final boolean schemaDeclarationRequired;
    private final List<SchemaResource> extensionSchemas;
    private final List<ConsistencyRule> consistencyRules;
    private final String embeddedResourcesAttribute;

    private ValidationProfile(Builder builder) {
        this.name = builder.name;
        this.baseSchema = builder.baseSchema;
        this.schemaDeclarationRequired = builder.schemaDeclarationRequired;
        this.extensionSchemas = Collections.unmodifiableList(new ArrayList<>(builder.extensionSchemas));
        this.consistencyRules = Collections.unmodifiableList(new ArrayList<>(builder.consistencyRules));
        this.embeddedResourcesAttribute = builder.embeddedResourcesAttribute;
    }

    public static Builder builder(String name, SchemaResource baseSchema) {
        return new Builder(name, baseSchema);
    }

    public String getName() {
        return name;
    }

    public SchemaResource getBaseSchema() {
        return baseSchema;
    }

    public String getBaseSchemaUrn() {
        return baseSchema.getId();
    }

    /**
     * False for payloads validated without a {@code schemas} attribute, such as a
     * stand-alone extension object.
     */
    public boolean isSchemaDeclarationRequired() {
        return schemaDeclarationRequired;
    }

    public Optional<SchemaResource> getExtensionSchema(String urn) {
        return extensionSchemas.stream().filter(s -> s.getId().equalsIgnoreCase(urn)).findFirst();
    }

    public List<ConsistencyRule> getConsistencyRules() {
        return consistencyRules;
    }

    public Optional<String> getEmbeddedResourcesAttribute() {
        return Optional.ofNullable(embeddedResourcesAttribute);
    }

    @Override
    public String toString() {
        return "ValidationProfile{" + name + '}';
    }

    public static final class Builder {

        private final String name;
        private final SchemaResource baseSchema;
        private boolean schemaDeclarationRequired = true;
        private final List<SchemaResource> extensionSchemas = new ArrayList<>();
        private final List<ConsistencyRule> consistencyRules = new ArrayList<>();
        private String embeddedResourcesAttribute;

        private Builder(String name, SchemaResource baseSchema) {
            this.name = Objects.requireNonNull(name, "name");
            this.baseSchema = Objects.requireNonNull(baseSchema, "baseSchema");
        }

        public Builder withoutSchemaDeclaration() {
            this.schemaDeclarationRequired = false;
            return this;
        }

        public Builder extensionSchema(SchemaResource schema) {
            this.extensionSchemas.add(schema);
            return this;
        }

        public Builder consistencyRule(ConsistencyRule rule) {
            this.consistencyRules.add(rule);
            return this;
        }

        public Builder embeddedResources(String attributeName) {
            this.embeddedResourcesAttribute = attributeName;
            return this;
        }

        public ValidationProfile build() {
            return new ValidationProfile(this);
        }
    }
}
