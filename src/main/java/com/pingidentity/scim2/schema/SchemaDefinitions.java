package com.pingidentity.scim2.schema;

import com.unboundid.scim2.common.types.AttributeDefinition;
import com.unboundid.scim2.common.types.SchemaResource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.unboundid.scim2.common.types.AttributeDefinition.Mutability.IMMUTABLE;
import static com.unboundid.scim2.common.types.AttributeDefinition.Mutability.READ_ONLY;
import static com.unboundid.scim2.common.types.AttributeDefinition.Mutability.WRITE_ONLY;
import static com.unboundid.scim2.common.types.AttributeDefinition.Type.BOOLEAN;
import static com.unboundid.scim2.common.types.AttributeDefinition.Type.COMPLEX;
import static com.unboundid.scim2.common.types.AttributeDefinition.Type.DATETIME;
import static com.unboundid.scim2.common.types.AttributeDefinition.Type.INTEGER;
import static com.unboundid.scim2.common.types.AttributeDefinition.Type.REFERENCE;
import static com.unboundid.scim2.common.types.AttributeDefinition.Type.STRING;

/**
 * Attribute tables for the SCIM core schemas, the Enterprise User extension
 * and the protocol messages, following RFC 7643 Sections 3, 4, 5 and 6 and RFC 7644 Section 3.4.
 */
public final class SchemaDefinitions {

    public static final String[] EMAIL_TYPES = {"work", "home", "other"};
    public static final String[] ADDRESS_TYPES = {"work", "home", "other"};
    public static final String[] PHONE_NUMBER_TYPES = {"work", "home", "mobile", "fax", "pager", "other"};
    public static final String[] IM_TYPES = {"aim", "gtalk", "icq", "xmpp", "msn", "skype", "qq", "yahoo"};
    public static final String[] PHOTO_TYPES = {"photo", "thumbnail"};
    public static final String[] GROUP_MEMBERSHIP_TYPES = {"direct", "indirect"};
    public static final String[] AUTHENTICATION_SCHEME_TYPES =
            {"oauth", "oauth2", "oauthbearertoken", "httpbasic", "httpdigest"};
    public static final String[] SORT_ORDERS = {"ascending", "descending"};

    /** Member kinds a Group may reference. */
    public static final String[] MEMBER_TYPES = {"User", "Group"};

    public static final SchemaResource USER = new SchemaResource(
            ScimSchemaUrns.CORE_USER_SCHEMA, "User", "User Account", withCommonAttributes(
                    attr("userName", STRING).setRequired(true).build(),
                    attr("name", COMPLEX).addSubAttributes(
                            attr("formatted", STRING).build(),
                            attr("familyName", STRING).build(),
                            attr("givenName", STRING).build(),
                            attr("middleName", STRING).build(),
                            attr("honorificPrefix", STRING).build(),
                            attr("honorificSuffix", STRING).build()).build(),
                    attr("displayName", STRING).build(),
                    attr("nickName", STRING).build(),
                    attr("profileUrl", REFERENCE).build(),
                    attr("title", STRING).build(),
                    attr("userType", STRING).build(),
                    attr("preferredLanguage", STRING).build(),
                    attr("locale", STRING).build(),
                    attr("timezone", STRING).build(),
                    attr("active", BOOLEAN).build(),
                    attr("password", STRING).setMutability(WRITE_ONLY).build(),
                    multiValued("emails", STRING, EMAIL_TYPES),
                    multiValued("phoneNumbers", STRING, PHONE_NUMBER_TYPES),
                    multiValued("ims", STRING, IM_TYPES),
                    multiValued("photos", REFERENCE, PHOTO_TYPES),
                    attr("addresses", COMPLEX).setMultiValued(true).addSubAttributes(
                            attr("formatted", STRING).build(),
                            attr("streetAddress", STRING).build(),
                            attr("locality", STRING).build(),
                            attr("region", STRING).build(),
                            attr("postalCode", STRING).build(),
                            attr("country", STRING).build(),
                            attr("type", STRING).addCanonicalValues(ADDRESS_TYPES).build(),
                            attr("primary", BOOLEAN).build()).build(),
                    attr("groups", COMPLEX).setMultiValued(true).setMutability(READ_ONLY).addSubAttributes(
                            attr("value", STRING).setMutability(READ_ONLY).build(),
                            attr("$ref", REFERENCE).setMutability(READ_ONLY).build(),
                            attr("display", STRING).setMutability(READ_ONLY).build(),
                            attr("type", STRING).setMutability(READ_ONLY)
                                    .addCanonicalValues(GROUP_MEMBERSHIP_TYPES).build()).build(),
                    multiValued("entitlements", STRING),
                    multiValued("roles", STRING),
                    multiValued("x509Certificates", STRING)));

    public static final SchemaResource ENTERPRISE_USER = new SchemaResource(
            ScimSchemaUrns.ENTERPRISE_USER_SCHEMA, "EnterpriseUser", "Enterprise User",
            enterpriseAttributes(false));

    /**
     * Enterprise User payload validated on its own as a complete employee record:
     * every attribute must be supplied.
     */
    public static final SchemaResource ENTERPRISE_USER_RECORD = new SchemaResource(
            ScimSchemaUrns.ENTERPRISE_USER_SCHEMA, "EnterpriseUser", "Enterprise User record",
            enterpriseAttributes(true));

    public static final SchemaResource GROUP = new SchemaResource(
            ScimSchemaUrns.CORE_GROUP_SCHEMA, "Group", "Group", withCommonAttributes(
                    attr("displayName", STRING).setRequired(true).build(),
                    attr("members", COMPLEX).setMultiValued(true).addSubAttributes(
                            attr("value", STRING).setMutability(IMMUTABLE).build(),
                            attr("$ref", REFERENCE).setMutability(IMMUTABLE).build(),
                            attr("display", STRING).build(),
                            attr("type", STRING).setMutability(IMMUTABLE).build()).build()));

    public static final SchemaResource RESOURCE_TYPE = new SchemaResource(
            ScimSchemaUrns.RESOURCE_TYPE, "ResourceType", "Resource Type", withCommonAttributes(
                    attr("name", STRING).setRequired(true).build(),
                    attr("description", STRING).build(),
                    attr("endpoint", REFERENCE).setRequired(true).build(),
                    attr("schema", REFERENCE).setRequired(true).setCaseExact(true).build(),
                    attr("schemaExtensions", COMPLEX).setMultiValued(true).addSubAttributes(
                            attr("schema", REFERENCE).setRequired(true).setCaseExact(true).build(),
                            attr("required", BOOLEAN).setRequired(true).build()).build()));

    public static final SchemaResource SERVICE_PROVIDER_CONFIG = new SchemaResource(
            ScimSchemaUrns.SERVICE_PROVIDER_CONFIG, "Service Provider Configuration",
            "Service Provider Configuration", withCommonAttributes(
                    attr("documentationUri", REFERENCE).build(),
                    feature("patch"),
                    attr("bulk", COMPLEX).setRequired(true).addSubAttributes(
                            attr("supported", BOOLEAN).setRequired(true).build(),
                            attr("maxOperations", INTEGER).setRequired(true).build(),
                            attr("maxPayloadSize", INTEGER).setRequired(true).build()).build(),
                    attr("filter", COMPLEX).setRequired(true).addSubAttributes(
                            attr("supported", BOOLEAN).setRequired(true).build(),
                            attr("maxResults", INTEGER).setRequired(true).build()).build(),
                    feature("changePassword"),
                    feature("sort"),
                    feature("etag"),
                    attr("authenticationSchemes", COMPLEX).setMultiValued(true).setRequired(true).addSubAttributes(
                            attr("type", STRING).addCanonicalValues(AUTHENTICATION_SCHEME_TYPES).build(),
                            attr("name", STRING).setRequired(true).build(),
                            attr("description", STRING).setRequired(true).build(),
                            attr("specUri", REFERENCE).build(),
                            attr("documentationUri", REFERENCE).build(),
                            attr("primary", BOOLEAN).build()).build()));

    public static final SchemaResource LIST_RESPONSE = new SchemaResource(
            ScimSchemaUrns.LIST_RESPONSE, "ListResponse", "List Response", Arrays.asList(
                    attr("totalResults", INTEGER).setRequired(true).build(),
                    attr("startIndex", INTEGER).build(),
                    attr("itemsPerPage", INTEGER).build(),
                    attr("Resources", COMPLEX).setMultiValued(true).build()));

    public static final SchemaResource SEARCH_REQUEST = new SchemaResource(
            ScimSchemaUrns.SEARCH_REQUEST, "SearchRequest", "Search Request", Arrays.asList(
                    attr("attributes", STRING).setMultiValued(true).build(),
                    attr("excludedAttributes", STRING).setMultiValued(true).build(),
                    attr("filter", STRING).build(),
                    attr("sortBy", STRING).build(),
                    attr("sortOrder", STRING).addCanonicalValues(SORT_ORDERS).build(),
                    attr("startIndex", INTEGER).build(),
                    attr("count", INTEGER).build()));

    private SchemaDefinitions() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    /**
     * Look up the attribute table of a core schema, extension or message by URN.
     * The stand-alone enterprise record table is never returned here.
     */
    public static Optional<SchemaResource> forUrn(String urn) {
        if (urn == null) {
            return Optional.empty();
        }
        for (SchemaResource schema : Arrays.asList(USER, ENTERPRISE_USER, GROUP, RESOURCE_TYPE,
                SERVICE_PROVIDER_CONFIG, LIST_RESPONSE, SEARCH_REQUEST)) {
            if (schema.getId().equalsIgnoreCase(urn)) {
                return Optional.of(schema);
            }
        }
        return Optional.empty();
    }

    private static AttributeDefinition.Builder attr(String name, AttributeDefinition.Type type) {
        return new AttributeDefinition.Builder().setName(name).setType(type);
    }

    /**
     * The value/display/type/primary shape shared by emails, phoneNumbers and friends.
     */
    private static AttributeDefinition multiValued(String name, AttributeDefinition.Type valueType,
                                                   String... typeValues) {
        return attr(name, COMPLEX).setMultiValued(true).addSubAttributes(
                attr("value", valueType).build(),
                attr("display", STRING).build(),
                attr("type", STRING).addCanonicalValues(typeValues).build(),
                attr("primary", BOOLEAN).build()).build();
    }

    private static AttributeDefinition feature(String name) {
        return attr(name, COMPLEX).setRequired(true).addSubAttributes(
                attr("supported", BOOLEAN).setRequired(true).build()).build();
    }

    private static List<AttributeDefinition> enterpriseAttributes(boolean allRequired) {
        List<AttributeDefinition> attributes = new ArrayList<>();
        for (String name : new String[]{"employeeNumber", "costCenter", "organization", "division", "department"}) {
            attributes.add(attr(name, STRING).setRequired(allRequired).build());
        }
        attributes.add(attr("manager", COMPLEX).setRequired(allRequired).addSubAttributes(
                attr("value", STRING).build(),
                attr("$ref", REFERENCE).build(),
                attr("displayName", STRING).setMutability(READ_ONLY).build()).build());
        return attributes;
    }

    private static List<AttributeDefinition> withCommonAttributes(AttributeDefinition... typeAttributes) {
        List<AttributeDefinition> attributes = new ArrayList<>();
        attributes.add(attr("id", STRING).setCaseExact(true).setMutability(READ_ONLY).build());
        attributes.add(attr("externalId", STRING).setCaseExact(true).build());
        attributes.add(attr("meta", COMPLEX).setMutability(READ_ONLY).addSubAttributes(
                attr("resourceType", STRING).setCaseExact(true).setMutability(READ_ONLY).build(),
                attr("created", DATETIME).setMutability(READ_ONLY).build(),
                attr("lastModified", DATETIME).setMutability(READ_ONLY).build(),
                attr("location", REFERENCE).setMutability(READ_ONLY).build(),
                attr("version", STRING).setCaseExact(true).setMutability(READ_ONLY).build()).build());
        attributes.addAll(Arrays.asList(typeAttributes));
        return attributes;
    }
}
