package com.pingidentity.scim2.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.exceptions.FieldViolationException;
import com.pingidentity.scim2.exceptions.FieldViolationException.Violation;
import com.pingidentity.scim2.exceptions.SchemaViolationException;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.schema.AttributeDefinitions;
import com.pingidentity.scim2.schema.ScimSchemaUrns;
import com.unboundid.scim2.common.types.AttributeDefinition;
import com.unboundid.scim2.common.types.SchemaResource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static com.pingidentity.scim2.validation.JsonTree.field;
import static com.pingidentity.scim2.validation.JsonTree.isEmpty;
import static com.pingidentity.scim2.validation.JsonTree.isPresent;

/**
 * Evaluates a {@link ValidationProfile} against the JSON form of a resource or message.
 *
 * <p>Checks run in a fixed order and stop at the first violation:</p>
 * <ol>
 *   <li>{@code schemas} is a non-empty list containing the base schema URN</li>
 *   <li>declared extension URNs and attached extension objects match one to one</li>
 *   <li>required attributes are present and non-empty, and values have the declared cardinality</li>
 *   <li>at most one value of a multi-valued attribute is primary</li>
 *   <li>values of attributes with a canonical set are in that set</li>
 *   <li>the profile's cross-field rules hold, and embedded resources are valid under their own profile</li>
 *   <li>in {@link ValidationMode#CREATE}, no read-only attribute is supplied</li>
 * </ol>
 *
 * <p>The validator never modifies the tree it is given and keeps no state between calls.</p>
 */
public class ScimResourceValidator {

    private static final Logger LOGGER = Logger.getLogger(ScimResourceValidator.class.getName());

    /**
     * Validate a resource tree.
     *
     * @param resource the JSON object form of the resource
     * @param profile the profile of the resource type
     * @param mode what the payload is for
     * @throws ScimModelException describing the first violation found
     */
    public void validate(ObjectNode resource, ValidationProfile profile, ValidationMode mode)
            throws ScimModelException {
        validate(resource, profile, mode, "");
        LOGGER.fine(() -> profile.getName() + " passed validation in " + mode + " mode");
    }

    private void validate(ObjectNode resource, ValidationProfile profile, ValidationMode mode, String prefix)
            throws ScimModelException {
        List<Scope> scopes = new ArrayList<>();
        scopes.add(new Scope(resource, profile.getBaseSchema(), prefix));

        if (profile.isSchemaDeclarationRequired()) {
            List<String> declared = checkSchemas(resource, profile, prefix);
            for (String urn : checkExtensions(resource, profile, declared, prefix)) {
                Optional<SchemaResource> extensionSchema = profile.getExtensionSchema(urn);
                if (extensionSchema.isPresent()) {
                    scopes.add(new Scope((ObjectNode) field(resource, urn), extensionSchema.get(),
                            prefix + urn + ":"));
                }
            }
        }

        for (Scope scope : scopes) {
            visit(scope.node, scope.schema.getAttributes(), scope.prefix, this::checkPresence);
        }
        for (Scope scope : scopes) {
            visit(scope.node, scope.schema.getAttributes(), scope.prefix, this::checkPrimary);
        }
        for (Scope scope : scopes) {
            visit(scope.node, scope.schema.getAttributes(), scope.prefix, this::checkCanonical);
        }

        for (ConsistencyRule rule : profile.getConsistencyRules()) {
            rule.check(resource, prefix);
        }
        if (profile.getEmbeddedResourcesAttribute().isPresent()) {
            validateEmbedded(resource, profile.getEmbeddedResourcesAttribute().get(), mode, prefix);
        }

        if (mode == ValidationMode.CREATE) {
            for (Scope scope : scopes) {
                visit(scope.node, scope.schema.getAttributes(), scope.prefix, this::checkMutability);
            }
        }
    }

    /**
     * @return the declared URNs
     */
    private List<String> checkSchemas(ObjectNode resource, ValidationProfile profile, String prefix)
            throws SchemaViolationException {
        String path = prefix + "schemas";
        JsonNode schemas = field(resource, "schemas");
        if (schemas == null || !schemas.isArray() || schemas.isEmpty()) {
            throw new SchemaViolationException(path, "Attribute 'schemas' must be a non-empty list of schema URNs");
        }

        List<String> declared = new ArrayList<>();
        for (JsonNode urn : schemas) {
            if (!urn.isTextual() || urn.asText().isBlank()) {
                throw new SchemaViolationException(path, "Attribute 'schemas' must only contain schema URNs");
            }
            declared.add(urn.asText());
        }

        if (declared.stream().noneMatch(urn -> urn.equalsIgnoreCase(profile.getBaseSchemaUrn()))) {
            throw new SchemaViolationException(path,
                    String.format("Attribute 'schemas' must contain the %s schema '%s'",
                            profile.getName(), profile.getBaseSchemaUrn()));
        }
        return declared;
    }

    /**
     * @return the URNs of the attached extensions
     */
    private List<String> checkExtensions(ObjectNode resource, ValidationProfile profile, List<String> declared,
                                         String prefix) throws SchemaViolationException {
        List<String> attached = new ArrayList<>();
        for (String urn : declared) {
            if (urn.equalsIgnoreCase(profile.getBaseSchemaUrn())) {
                continue;
            }
            JsonNode payload = field(resource, urn);
            if (payload == null || !payload.isObject()) {
                throw new SchemaViolationException(prefix + urn,
                        String.format("Extension schema '%s' is declared in 'schemas' but no extension object is attached", urn));
            }
            attached.add(urn);
        }

        Iterator<String> names = resource.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (ScimSchemaUrns.isUrn(name) && declared.stream().noneMatch(name::equalsIgnoreCase)) {
                throw new SchemaViolationException(prefix + name,
                        String.format("Extension attributes are attached under '%s' but the schema is not declared in 'schemas'", name));
            }
        }
        return attached;
    }

    private boolean checkPresence(AttributeDefinition rule, JsonNode value, String path) throws FieldViolationException {
        if (rule.isRequired() && isEmpty(value)) {
            throw FieldViolationException.required(path);
        }
        if (!isPresent(value)) {
            return false;
        }
        if (rule.isMultiValued()) {
            if (!value.isArray()) {
                throw new FieldViolationException(Violation.CARDINALITY, path,
                        String.format("Attribute '%s' is multi-valued and must be a list", path));
            }
            if (AttributeDefinitions.isComplex(rule)) {
                for (int i = 0; i < value.size(); i++) {
                    if (!value.get(i).isObject()) {
                        throw new FieldViolationException(Violation.CARDINALITY, path + "[" + i + "]",
                                String.format("Values of '%s' must be complex objects", path));
                    }
                }
            }
        } else if (value.isArray()) {
            throw new FieldViolationException(Violation.CARDINALITY, path,
                    String.format("Attribute '%s' is single-valued and must not be a list", path));
        } else if (AttributeDefinitions.isComplex(rule) && !value.isObject()) {
            throw new FieldViolationException(Violation.CARDINALITY, path,
                    String.format("Attribute '%s' must be a complex object", path));
        }
        return true;
    }

    private boolean checkPrimary(AttributeDefinition rule, JsonNode value, String path) throws FieldViolationException {
        if (rule.isMultiValued() && AttributeDefinitions.isComplex(rule) && value != null && value.isArray()) {
            int primaries = 0;
            for (JsonNode element : value) {
                JsonNode primary = field(element, "primary");
                if (primary != null && primary.isBoolean() && primary.booleanValue()) {
                    primaries++;
                }
            }
            if (primaries > 1) {
                throw FieldViolationException.multiplePrimary(path);
            }
        }
        return true;
    }

    private boolean checkCanonical(AttributeDefinition rule, JsonNode value, String path) throws FieldViolationException {
        if (AttributeDefinitions.canonicalValues(rule).isEmpty() || !isPresent(value)) {
            return true;
        }
        if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                requireCanonical(rule, value.get(i), path + "[" + i + "]");
            }
        } else {
            requireCanonical(rule, value, path);
        }
        return true;
    }

    private void requireCanonical(AttributeDefinition rule, JsonNode value, String path) throws FieldViolationException {
        if (value.isTextual() && !AttributeDefinitions.isCanonical(rule, value.asText())) {
            throw new FieldViolationException(Violation.CANONICAL_VALUE, path,
                    String.format("Attribute '%s' has value '%s' which is not one of %s",
                            path, value.asText(), AttributeDefinitions.canonicalValues(rule)));
        }
    }

    private boolean checkMutability(AttributeDefinition rule, JsonNode value, String path) throws FieldViolationException {
        // an explicit null leaves the attribute unassigned (RFC 7643 Section 2.5)
        if (AttributeDefinitions.isReadOnly(rule) && isPresent(value)) {
            throw FieldViolationException.readOnly(path);
        }
        return true;
    }

    private void validateEmbedded(ObjectNode container, String attribute, ValidationMode mode, String prefix)
            throws ScimModelException {
        JsonNode resources = field(container, attribute);
        if (resources == null || !resources.isArray()) {
            return;
        }
        for (int i = 0; i < resources.size(); i++) {
            String elementPrefix = prefix + attribute + "[" + i + "].";
            ObjectNode element = (ObjectNode) resources.get(i);
            ValidationProfile elementProfile = ValidationProfiles.forResource(element)
                    .orElseThrow(() -> new SchemaViolationException(elementPrefix + "schemas",
                            "Attribute 'schemas' names no supported resource type"));
            validate(element, elementProfile, mode, elementPrefix);
        }
    }

    /**
     * Walk the attributes of a node, descending into complex values while the visitor returns true.
     */
    private void visit(JsonNode node, Collection<AttributeDefinition> rules, String prefix, AttributeVisitor visitor)
            throws FieldViolationException {
        for (AttributeDefinition rule : rules) {
            JsonNode value = field(node, rule.getName());
            String path = prefix + rule.getName();
            if (!visitor.visit(rule, value, path) || !AttributeDefinitions.isComplex(rule) || !isPresent(value)) {
                continue;
            }
            if (value.isArray()) {
                for (int i = 0; i < value.size(); i++) {
                    if (value.get(i).isObject()) {
                        visit(value.get(i), AttributeDefinitions.subAttributes(rule), path + "[" + i + "].", visitor);
                    }
                }
            } else if (value.isObject()) {
                visit(value, AttributeDefinitions.subAttributes(rule), path + ".", visitor);
            }
        }
    }

    @FunctionalInterface
    private interface AttributeVisitor {
        boolean visit(AttributeDefinition rule, JsonNode value, String path) throws FieldViolationException;
    }

    private static final class Scope {
        private final ObjectNode node;
        private final SchemaResource schema;
        private final String prefix;

        private Scope(ObjectNode node, SchemaResource schema, String prefix) {
            this.node = node;
            this.schema = schema;
            this.prefix = prefix;
        }
    }
}
