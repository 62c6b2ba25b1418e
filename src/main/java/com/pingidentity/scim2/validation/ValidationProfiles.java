package com.pingidentity.scim2.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.exceptions.FieldViolationException;
import com.pingidentity.scim2.exceptions.FieldViolationException.Violation;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.schema.SchemaDefinitions;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.pingidentity.scim2.validation.JsonTree.field;
import static com.pingidentity.scim2.validation.JsonTree.longField;
import static com.pingidentity.scim2.validation.JsonTree.isEmpty;
import static com.pingidentity.scim2.validation.JsonTree.isPresent;
import static com.pingidentity.scim2.validation.JsonTree.objectField;
import static com.pingidentity.scim2.validation.JsonTree.textField;

/**
 * Validation profiles of the supported resource and message types, with their cross-field rules.
 */
public final class ValidationProfiles {

    public static final ValidationProfile USER = ValidationProfile
            .builder("User", SchemaDefinitions.USER)
            .extensionSchema(SchemaDefinitions.ENTERPRISE_USER)
            .build();

    public static final ValidationProfile GROUP = ValidationProfile
            .builder("Group", SchemaDefinitions.GROUP)
            .consistencyRule(ValidationProfiles::checkGroupMembers)
            .build();

    public static final ValidationProfile RESOURCE_TYPE = ValidationProfile
            .builder("ResourceType", SchemaDefinitions.RESOURCE_TYPE)
            .consistencyRule(ValidationProfiles::checkSchemaExtensions)
            .build();

    public static final ValidationProfile SERVICE_PROVIDER_CONFIG = ValidationProfile
            .builder("ServiceProviderConfig", SchemaDefinitions.SERVICE_PROVIDER_CONFIG)
            .consistencyRule(ValidationProfiles::checkServiceProviderLimits)
            .build();

    /**
     * Stand-alone Enterprise User payload, checked as a complete employee record.
     */
    public static final ValidationProfile ENTERPRISE_USER_RECORD = ValidationProfile
            .builder("EnterpriseUser", SchemaDefinitions.ENTERPRISE_USER_RECORD)
            .withoutSchemaDeclaration()
            .build();

    public static final ValidationProfile LIST_RESPONSE = ValidationProfile
            .builder("ListResponse", SchemaDefinitions.LIST_RESPONSE)
            .consistencyRule(ValidationProfiles::checkListResponseCounts)
            .embeddedResources("Resources")
            .build();

    public static final ValidationProfile SEARCH_REQUEST = ValidationProfile
            .builder("SearchRequest", SchemaDefinitions.SEARCH_REQUEST)
            .consistencyRule(ValidationProfiles::checkSearchRequest)
            .build();

    private static final List<ValidationProfile> RESOURCE_PROFILES =
            Arrays.asList(USER, GROUP, RESOURCE_TYPE, SERVICE_PROVIDER_CONFIG);

    private ValidationProfiles() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    /**
     * Pick the resource profile whose base schema URN the tree declares in {@code schemas}.
     */
    public static Optional<ValidationProfile> forResource(JsonNode resource) {
        JsonNode schemas = field(resource, "schemas");
        if (schemas == null || !schemas.isArray()) {
            return Optional.empty();
        }
        for (ValidationProfile profile : RESOURCE_PROFILES) {
            for (JsonNode urn : schemas) {
                if (urn.isTextual() && urn.asText().equalsIgnoreCase(profile.getBaseSchemaUrn())) {
                    return Optional.of(profile);
                }
            }
        }
        return Optional.empty();
    }

    static void checkGroupMembers(ObjectNode group, String prefix) throws ScimModelException {
        JsonNode members = field(group, "members");
        if (members == null || !members.isArray()) {
            return;
        }
        for (int i = 0; i < members.size(); i++) {
            JsonNode member = members.get(i);
            String path = prefix + "members[" + i + "]";

            String type = textField(member, "type");
            if (type != null && Arrays.stream(SchemaDefinitions.MEMBER_TYPES).noneMatch(type::equalsIgnoreCase)) {
                throw new FieldViolationException(Violation.INCONSISTENT, path + ".type",
                        String.format("Member type '%s' must be one of %s", type,
                                Arrays.toString(SchemaDefinitions.MEMBER_TYPES)));
            }
            if (isPresent(field(member, "$ref")) && isEmpty(field(member, "value"))) {
                throw new FieldViolationException(Violation.INCONSISTENT, path + ".value",
                        "A member carrying '$ref' must also carry 'value'");
            }
        }
    }

    static void checkSchemaExtensions(ObjectNode resourceType, String prefix) throws ScimModelException {
        JsonNode extensions = field(resourceType, "schemaExtensions");
        if (extensions == null || !extensions.isArray()) {
            return;
        }
        String baseSchema = textField(resourceType, "schema");
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < extensions.size(); i++) {
            String schema = textField(extensions.get(i), "schema");
            if (schema == null) {
                continue;
            }
            String path = prefix + "schemaExtensions[" + i + "].schema";
            if (schema.equals(baseSchema)) {
                throw new FieldViolationException(Violation.INCONSISTENT, path,
                        String.format("Schema extension '%s' repeats the base schema", schema));
            }
            if (!seen.add(schema)) {
                throw new FieldViolationException(Violation.INCONSISTENT, path,
                        String.format("Schema extension '%s' is listed more than once", schema));
            }
        }
    }

    static void checkServiceProviderLimits(ObjectNode config, String prefix) throws ScimModelException {
        ObjectNode bulk = objectField(config, "bulk");
        requireNonNegative(longField(bulk, "maxOperations"), prefix + "bulk.maxOperations");
        requireNonNegative(longField(bulk, "maxPayloadSize"), prefix + "bulk.maxPayloadSize");
        ObjectNode filter = objectField(config, "filter");
        requireNonNegative(longField(filter, "maxResults"), prefix + "filter.maxResults");
    }

    static void checkListResponseCounts(ObjectNode listResponse, String prefix) throws ScimModelException {
        requireNonNegative(longField(listResponse, "totalResults"), prefix + "totalResults");
        requireNonNegative(longField(listResponse, "itemsPerPage"), prefix + "itemsPerPage");
        requireAtLeastOne(longField(listResponse, "startIndex"), prefix + "startIndex");
    }

    static void checkSearchRequest(ObjectNode request, String prefix) throws ScimModelException {
        if (!isEmpty(field(request, "attributes")) && !isEmpty(field(request, "excludedAttributes"))) {
            throw new FieldViolationException(Violation.INCONSISTENT, prefix + "excludedAttributes",
                    "'attributes' and 'excludedAttributes' cannot both be supplied");
        }
        requireAtLeastOne(longField(request, "startIndex"), prefix + "startIndex");
        requireNonNegative(longField(request, "count"), prefix + "count");
    }

    private static void requireNonNegative(Long value, String path) throws FieldViolationException {
        if (value != null && value < 0) {
            throw new FieldViolationException(Violation.INCONSISTENT, path,
                    String.format("Attribute '%s' must not be negative but was %d", path, value));
        }
    }

    private static void requireAtLeastOne(Long value, String path) throws FieldViolationException {
        if (value != null && value < 1) {
            throw new FieldViolationException(Violation.INCONSISTENT, path,
                    String.format("Attribute '%s' is 1-based and must be at least 1 but was %d", path, value));
        }
    }
}
