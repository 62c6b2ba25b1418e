package com.pingidentity.scim2.schema;

import com.unboundid.scim2.common.types.AttributeDefinition;
import com.unboundid.scim2.common.types.SchemaResource;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Optional;

/**
 * Lookups over UnboundID attribute definitions that treat attribute names and
 * canonical values the way SCIM compares them.
 */
public final class AttributeDefinitions {

    private AttributeDefinitions() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * Find a top-level attribute of a schema, matching the name case-insensitively.
     */
    public static Optional<AttributeDefinition> find(SchemaResource schema, String name) {
        return find(schema.getAttributes(), name);
    }

    /**
     * Find a sub-attribute of a complex attribute, matching the name case-insensitively.
     */
    public static Optional<AttributeDefinition> findSubAttribute(AttributeDefinition attribute, String name) {
        return find(subAttributes(attribute), name);
    }

    public static Collection<AttributeDefinition> subAttributes(AttributeDefinition attribute) {
        Collection<AttributeDefinition> subAttributes = attribute.getSubAttributes();
        return subAttributes == null ? Collections.emptyList() : subAttributes;
    }

    public static Collection<String> canonicalValues(AttributeDefinition attribute) {
        Collection<String> values = attribute.getCanonicalValues();
        return values == null ? Collections.emptyList() : values;
    }

    public static boolean isComplex(AttributeDefinition attribute) {
        return attribute.getType() == AttributeDefinition.Type.COMPLEX;
    }

    public static boolean isReadOnly(AttributeDefinition attribute) {
        return attribute.getMutability() == AttributeDefinition.Mutability.READ_ONLY;
    }

    /**
     * Check a value against the canonical set of an attribute. Attributes without a set
     * accept any value. Comparison ignores case unless the attribute is case-exact.
     */
    public static boolean isCanonical(AttributeDefinition attribute, String value) {
        Collection<String> values = canonicalValues(attribute);
        if (values.isEmpty()) {
            return true;
        }
        if (value == null) {
            return false;
        }
        if (attribute.isCaseExact()) {
            return values.contains(value);
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return values.stream().anyMatch(c -> c.toLowerCase(Locale.ROOT).equals(lower));
    }

    private static Optional<AttributeDefinition> find(Collection<AttributeDefinition> attributes, String name) {
        if (attributes == null) {
            return Optional.empty();
        }
        return attributes.stream().filter(a -> a.getName().equalsIgnoreCase(name)).findFirst();
    }
}
