package com.pingidentity.scim2.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.exceptions.ErrorKind;
import com.pingidentity.scim2.exceptions.FieldViolationException;
import com.pingidentity.scim2.exceptions.FieldViolationException.Violation;
import com.pingidentity.scim2.exceptions.SchemaViolationException;
import com.pingidentity.scim2.exceptions.ScimModelException;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.pingidentity.scim2.TestResources.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ScimResourceValidator.
 *
 * Each test feeds a JSON tree straight to the validator, so the checks are exercised
 * independently of the codec.
 */
class ScimResourceValidatorTest {

    private static final String USER = "urn:ietf:params:scim:schemas:core:2.0:User";
    private static final String ENTERPRISE = "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScimResourceValidator validator = new ScimResourceValidator();

    private ObjectNode json(String text) {
        try {
            return (ObjectNode) mapper.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad test JSON: " + text, e);
        }
    }

    private void assertField(ThrowingCallable call, Violation violation, String path) {
        assertThatThrownBy(call).isInstanceOfSatisfying(FieldViolationException.class, e -> {
            assertThat(e.getViolation()).isEqualTo(violation);
            assertThat(e.getKind()).isEqualTo(ErrorKind.FIELD);
            assertThat(e.getAttributePath()).isEqualTo(path);
        });
    }

    private void assertSchema(ThrowingCallable call, String path) {
        assertThatThrownBy(call).isInstanceOfSatisfying(SchemaViolationException.class, e -> {
            assertThat(e.getKind()).isEqualTo(ErrorKind.SCHEMA);
            assertThat(e.getAttributePath()).isEqualTo(path);
        });
    }

    @Nested
    @DisplayName("schemas declaration")
    class Schemas {

        @Test
        @DisplayName("Should reject a resource without schemas")
        void testMissingSchemas() {
            ObjectNode user = json("{\"userName\":\"jdoe\"}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), "schemas");
        }

        @Test
        @DisplayName("Should reject an empty schemas list")
        void testEmptySchemas() {
            ObjectNode user = json("{\"schemas\":[],\"userName\":\"jdoe\"}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), "schemas");
        }

        @Test
        @DisplayName("Should reject schemas that omit the base schema")
        void testBaseSchemaMissing() {
            ObjectNode user = json("{\"schemas\":[\"urn:ietf:params:scim:schemas:core:2.0:Group\"],\"userName\":\"jdoe\"}");

            assertThatThrownBy(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessage("Attribute 'schemas' must contain the User schema '" + USER + "'");
        }

        @Test
        @DisplayName("Should reject non-string entries in schemas")
        void testNonStringSchema() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\", 7],\"userName\":\"jdoe\"}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), "schemas");
        }

        @Test
        @DisplayName("Should match the base schema URN regardless of case")
        void testBaseSchemaCaseInsensitive() {
            ObjectNode user = json("{\"schemas\":[\"" + USER.toUpperCase() + "\"],\"userName\":\"jdoe\"}");

            assertThatCode(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should check schemas before required attributes")
        void testSchemasCheckedFirst() {
            ObjectNode user = json("{}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), "schemas");
        }
    }

    @Nested
    @DisplayName("extension consistency")
    class Extensions {

        @Test
        @DisplayName("Should reject a declared extension that is not attached")
        void testDeclaredNotAttached() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],\"userName\":\"jdoe\"}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), ENTERPRISE);
        }

        @Test
        @DisplayName("Should reject a declared extension attached as a non-object")
        void testDeclaredAttachedAsString() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],"
                    + "\"userName\":\"jdoe\",\"" + ENTERPRISE + "\":\"701984\"}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), ENTERPRISE);
        }

        @Test
        @DisplayName("Should reject an attached extension that is not declared")
        void testAttachedNotDeclared() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\","
                    + "\"" + ENTERPRISE + "\":{\"employeeNumber\":\"701984\"}}");

            assertSchema(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD), ENTERPRISE);
        }

        @Test
        @DisplayName("Should accept an unknown extension that is declared and attached")
        void testUnknownExtensionDeclaredAndAttached() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\",\"urn:example:params:scim:schemas:Badge\"],"
                    + "\"userName\":\"jdoe\",\"urn:example:params:scim:schemas:Badge\":{\"badge\":\"gold\"}}");

            assertThatCode(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should report enterprise attribute paths under the extension URN")
        void testExtensionAttributePath() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],\"userName\":\"jdoe\","
                    + "\"" + ENTERPRISE + "\":{\"manager\":[{\"value\":\"26118915\"}]}}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.CARDINALITY, ENTERPRISE + ":manager");
        }

        @Test
        @DisplayName("Should apply enterprise user rules to users only")
        void testEnterpriseRulesOnGroup() {
            // Arrange
            String extension = "\"" + ENTERPRISE + "\":{\"manager\":[{\"value\":\"26118915\"}]}";
            ObjectNode group = json("{\"schemas\":[\"urn:ietf:params:scim:schemas:core:2.0:Group\",\"" + ENTERPRISE
                    + "\"],\"displayName\":\"Tour Guides\"," + extension + "}");
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],\"userName\":\"jdoe\","
                    + extension + "}");

            // Act & Assert
            assertThatCode(() -> validator.validate(group, ValidationProfiles.GROUP, ValidationMode.STANDARD))
                    .doesNotThrowAnyException();
            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.CARDINALITY, ENTERPRISE + ":manager");
            assertThat(ValidationProfiles.GROUP.getExtensionSchema(ENTERPRISE)).isEmpty();
            assertThat(ValidationProfiles.USER.getExtensionSchema(ENTERPRISE)).isPresent();
        }
    }

    @Nested
    @DisplayName("required attributes and cardinality")
    class Presence {

        @Test
        @DisplayName("Should reject a missing userName")
        void testMissingUserName() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"]}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.REQUIRED, "userName");
        }

        @Test
        @DisplayName("Should treat null and blank required values as missing")
        void testNullAndBlankUserName() {
            ObjectNode nullName = json("{\"schemas\":[\"" + USER + "\"],\"userName\":null}");
            ObjectNode blankName = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"   \"}");

            assertField(() -> validator.validate(nullName, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.REQUIRED, "userName");
            assertField(() -> validator.validate(blankName, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.REQUIRED, "userName");
        }

        @Test
        @DisplayName("Should find required attributes regardless of key case")
        void testRequiredCaseInsensitive() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"USERNAME\":\"jdoe\"}");

            assertThatCode(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should reject a single object where a list is expected")
        void testMultiValuedNotList() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\","
                    + "\"emails\":{\"value\":\"jdoe@example.com\"}}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.CARDINALITY, "emails");
        }

        @Test
        @DisplayName("Should reject a scalar element inside a complex list")
        void testMultiValuedScalarElement() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\","
                    + "\"emails\":[{\"value\":\"a@example.com\"},\"b@example.com\"]}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.CARDINALITY, "emails[1]");
        }

        @Test
        @DisplayName("Should reject a list where a single value is expected")
        void testSingularAsList() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":[\"jdoe\",\"john\"]}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.CARDINALITY, "userName");
        }

        @Test
        @DisplayName("Should reject a scalar where a complex value is expected")
        void testComplexAsScalar() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\",\"name\":\"Jane Doe\"}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.CARDINALITY, "name");
        }

        @Test
        @DisplayName("Should report nested required sub-attributes with their full path")
        void testNestedRequiredPath() {
            ObjectNode config = json(sample("service-provider-config.json"));
            ((ObjectNode) config.get("bulk")).remove("maxPayloadSize");

            assertField(() -> validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG,
                    ValidationMode.STANDARD), Violation.REQUIRED, "bulk.maxPayloadSize");
        }

        @Test
        @DisplayName("Should report required sub-attributes of list elements with the index")
        void testIndexedRequiredPath() {
            ObjectNode config = json(sample("service-provider-config.json"));
            ((ObjectNode) config.get("authenticationSchemes").get(0)).remove("description");

            assertField(() -> validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG,
                    ValidationMode.STANDARD), Violation.REQUIRED, "authenticationSchemes[0].description");
        }

        @Test
        @DisplayName("Should require every service provider feature")
        void testMissingFeature() {
            ObjectNode config = json(sample("service-provider-config.json"));
            config.remove("etag");

            assertField(() -> validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG,
                    ValidationMode.STANDARD), Violation.REQUIRED, "etag");
        }

        @Test
        @DisplayName("Should require at least one authentication scheme")
        void testEmptyAuthenticationSchemes() {
            ObjectNode config = json(sample("service-provider-config.json"));
            config.putArray("authenticationSchemes");

            assertField(() -> validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG,
                    ValidationMode.STANDARD), Violation.REQUIRED, "authenticationSchemes");
        }

        @Test
        @DisplayName("Should require endpoint on a resource type")
        void testResourceTypeWithoutEndpoint() {
            ObjectNode resourceType = json(sample("resource-type-group.json"));
            resourceType.remove("endpoint");

            assertField(() -> validator.validate(resourceType, ValidationProfiles.RESOURCE_TYPE,
                    ValidationMode.STANDARD), Violation.REQUIRED, "endpoint");
        }

        @Test
        @DisplayName("Should require the required flag of each schema extension")
        void testSchemaExtensionWithoutRequiredFlag() {
            ObjectNode resourceType = json(sample("resource-type-user.json"));
            ((ObjectNode) resourceType.get("schemaExtensions").get(0)).remove("required");

            assertField(() -> validator.validate(resourceType, ValidationProfiles.RESOURCE_TYPE,
                    ValidationMode.STANDARD), Violation.REQUIRED, "schemaExtensions[0].required");
        }
    }

    @Nested
    @DisplayName("primary and canonical values")
    class Values {

        @Test
        @DisplayName("Should reject two primary addresses")
        void testMultiplePrimary() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\",\"addresses\":["
                    + "{\"type\":\"work\",\"primary\":true},{\"type\":\"home\",\"primary\":true}]}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.MULTIPLE_PRIMARY, "addresses");
        }

        @Test
        @DisplayName("Should check primary uniqueness before canonical values")
        void testPrimaryBeforeCanonical() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\",\"emails\":["
                    + "{\"value\":\"a@example.com\",\"type\":\"bogus\",\"primary\":true},"
                    + "{\"value\":\"b@example.com\",\"type\":\"home\",\"primary\":true}]}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD),
                    Violation.MULTIPLE_PRIMARY, "emails");
        }

        @Test
        @DisplayName("Should reject a phone number type outside the canonical set")
        void testNonCanonicalPhoneType() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\",\"phoneNumbers\":["
                    + "{\"value\":\"555-555-5555\",\"type\":\"work\"},{\"value\":\"555-555-4444\",\"type\":\"car\"}]}");

            assertThatThrownBy(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD))
                    .isInstanceOf(FieldViolationException.class)
                    .hasMessageStartingWith("Attribute 'phoneNumbers[1].type' has value 'car' which is not one of");
        }

        @Test
        @DisplayName("Should reject an unknown authentication scheme type")
        void testNonCanonicalAuthenticationScheme() {
            ObjectNode config = json(sample("service-provider-config.json"));
            ((ObjectNode) config.get("authenticationSchemes").get(1)).put("type", "kerberos");

            assertField(() -> validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG,
                    ValidationMode.STANDARD), Violation.CANONICAL_VALUE, "authenticationSchemes[1].type");
        }

        @Test
        @DisplayName("Should reject an unknown sort order")
        void testNonCanonicalSortOrder() {
            ObjectNode request = json("{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:SearchRequest\"],"
                    + "\"sortOrder\":\"sideways\"}");

            assertField(() -> validator.validate(request, ValidationProfiles.SEARCH_REQUEST, ValidationMode.STANDARD),
                    Violation.CANONICAL_VALUE, "sortOrder");
        }
    }

    @Nested
    @DisplayName("cross-field rules")
    class Consistency {

        @Test
        @DisplayName("Should reject a group member of an unknown kind")
        void testGroupMemberType() {
            ObjectNode group = json("{\"schemas\":[\"urn:ietf:params:scim:schemas:core:2.0:Group\"],"
                    + "\"displayName\":\"Tour Guides\",\"members\":[{\"value\":\"1\",\"type\":\"User\"},"
                    + "{\"value\":\"2\",\"type\":\"Robot\"}]}");

            assertField(() -> validator.validate(group, ValidationProfiles.GROUP, ValidationMode.STANDARD),
                    Violation.INCONSISTENT, "members[1].type");
        }

        @Test
        @DisplayName("Should reject a group member with a reference but no value")
        void testGroupMemberRefWithoutValue() {
            ObjectNode group = json("{\"schemas\":[\"urn:ietf:params:scim:schemas:core:2.0:Group\"],"
                    + "\"displayName\":\"Tour Guides\",\"members\":[{\"$ref\":\"https://example.com/v2/Users/1\"}]}");

            assertField(() -> validator.validate(group, ValidationProfiles.GROUP, ValidationMode.STANDARD),
                    Violation.INCONSISTENT, "members[0].value");
        }

        @Test
        @DisplayName("Should reject a schema extension that repeats the base schema")
        void testSchemaExtensionRepeatsBase() {
            ObjectNode resourceType = json(sample("resource-type-user.json"));
            ((ObjectNode) resourceType.get("schemaExtensions").get(0)).put("schema", USER);

            assertField(() -> validator.validate(resourceType, ValidationProfiles.RESOURCE_TYPE,
                    ValidationMode.STANDARD), Violation.INCONSISTENT, "schemaExtensions[0].schema");
        }

        @Test
        @DisplayName("Should reject a schema extension listed twice")
        void testDuplicateSchemaExtension() {
            ObjectNode resourceType = json(sample("resource-type-user.json"));
            ((ArrayNode) resourceType.get("schemaExtensions"))
                    .addObject().put("schema", ENTERPRISE).put("required", false);

            assertField(() -> validator.validate(resourceType, ValidationProfiles.RESOURCE_TYPE,
                    ValidationMode.STANDARD), Violation.INCONSISTENT, "schemaExtensions[1].schema");
        }

        @Test
        @DisplayName("Should reject negative service provider limits")
        void testNegativeLimit() {
            ObjectNode config = json(sample("service-provider-config.json"));
            ((ObjectNode) config.get("filter")).put("maxResults", -1);

            assertField(() -> validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG,
                    ValidationMode.STANDARD), Violation.INCONSISTENT, "filter.maxResults");
        }

        @Test
        @DisplayName("Should reject a zero startIndex on a search request")
        void testSearchStartIndex() {
            ObjectNode request = json("{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:SearchRequest\"],"
                    + "\"startIndex\":0}");

            assertField(() -> validator.validate(request, ValidationProfiles.SEARCH_REQUEST, ValidationMode.STANDARD),
                    Violation.INCONSISTENT, "startIndex");
        }

        @Test
        @DisplayName("Should reject a negative count on a search request")
        void testSearchCount() {
            ObjectNode request = json("{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:SearchRequest\"],"
                    + "\"count\":-5}");

            assertField(() -> validator.validate(request, ValidationProfiles.SEARCH_REQUEST, ValidationMode.STANDARD),
                    Violation.INCONSISTENT, "count");
        }

        @Test
        @DisplayName("Should accept an empty attributes list beside excludedAttributes")
        void testEmptyAttributesBesideExcluded() {
            ObjectNode request = json("{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:SearchRequest\"],"
                    + "\"attributes\":[],\"excludedAttributes\":[\"emails\"]}");

            assertThatCode(() -> validator.validate(request, ValidationProfiles.SEARCH_REQUEST,
                    ValidationMode.STANDARD)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("list responses")
    class ListResponses {

        private static final String LIST = "urn:ietf:params:scim:api:messages:2.0:ListResponse";

        @Test
        @DisplayName("Should require totalResults")
        void testMissingTotalResults() {
            ObjectNode list = json("{\"schemas\":[\"" + LIST + "\"],\"Resources\":[]}");

            assertField(() -> validator.validate(list, ValidationProfiles.LIST_RESPONSE, ValidationMode.STANDARD),
                    Violation.REQUIRED, "totalResults");
        }

        @Test
        @DisplayName("Should reject a zero startIndex")
        void testZeroStartIndex() {
            ObjectNode list = json("{\"schemas\":[\"" + LIST + "\"],\"totalResults\":0,\"startIndex\":0}");

            assertField(() -> validator.validate(list, ValidationProfiles.LIST_RESPONSE, ValidationMode.STANDARD),
                    Violation.INCONSISTENT, "startIndex");
        }

        @Test
        @DisplayName("Should reject an element that names no supported resource type")
        void testUnsupportedElement() {
            ObjectNode list = json("{\"schemas\":[\"" + LIST + "\"],\"totalResults\":1,"
                    + "\"Resources\":[{\"schemas\":[\"urn:example:Device\"],\"id\":\"1\"}]}");

            assertSchema(() -> validator.validate(list, ValidationProfiles.LIST_RESPONSE, ValidationMode.STANDARD),
                    "Resources[0].schemas");
        }

        @Test
        @DisplayName("Should validate each element under its own profile")
        void testElementValidated() {
            ObjectNode list = json("{\"schemas\":[\"" + LIST + "\"],\"totalResults\":2,\"Resources\":["
                    + "{\"schemas\":[\"urn:ietf:params:scim:schemas:core:2.0:Group\"],\"displayName\":\"Tour Guides\"},"
                    + "{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\",\"emails\":[{\"type\":\"bogus\"}]}]}");

            assertField(() -> validator.validate(list, ValidationProfiles.LIST_RESPONSE, ValidationMode.STANDARD),
                    Violation.CANONICAL_VALUE, "Resources[1].emails[0].type");
        }

        @Test
        @DisplayName("Should carry the validation mode into elements")
        void testElementCreateMode() {
            ObjectNode list = json("{\"schemas\":[\"" + LIST + "\"],\"totalResults\":1,\"Resources\":["
                    + "{\"schemas\":[\"" + USER + "\"],\"id\":\"1\",\"userName\":\"jdoe\"}]}");

            assertThatCode(() -> validator.validate(list, ValidationProfiles.LIST_RESPONSE, ValidationMode.STANDARD))
                    .doesNotThrowAnyException();
            assertField(() -> validator.validate(list, ValidationProfiles.LIST_RESPONSE, ValidationMode.CREATE),
                    Violation.MUTABILITY, "Resources[0].id");
        }
    }

    @Nested
    @DisplayName("creation payloads")
    class Creation {

        @Test
        @DisplayName("Should reject client supplied meta")
        void testMetaOnCreate() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\","
                    + "\"meta\":{\"resourceType\":\"User\"}}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.CREATE),
                    Violation.MUTABILITY, "meta");
        }

        @Test
        @DisplayName("Should reject client supplied group memberships")
        void testGroupsOnCreate() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\","
                    + "\"groups\":[{\"value\":\"e9e30dba\"}]}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.CREATE),
                    Violation.MUTABILITY, "groups");
        }

        @Test
        @DisplayName("Should reject a manager display name inside the enterprise extension")
        void testManagerDisplayNameOnCreate() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],\"userName\":\"jdoe\","
                    + "\"" + ENTERPRISE + "\":{\"manager\":{\"value\":\"26118915\",\"displayName\":\"John Smith\"}}}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.CREATE),
                    Violation.MUTABILITY, ENTERPRISE + ":manager.displayName");
        }

        @Test
        @DisplayName("Should accept an explicit null on a read-only attribute")
        void testNullIdOnCreate() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"id\":null,\"userName\":\"jdoe\"}");

            assertThatCode(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.CREATE))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should report field violations before mutability")
        void testRequiredBeforeMutability() {
            ObjectNode user = json("{\"schemas\":[\"" + USER + "\"],\"id\":\"1\"}");

            assertField(() -> validator.validate(user, ValidationProfiles.USER, ValidationMode.CREATE),
                    Violation.REQUIRED, "userName");
        }
    }

    @Test
    @DisplayName("Should accept every RFC sample and leave the tree untouched")
    void testSamplesValidAndUnchanged() throws ScimModelException {
        ObjectNode user = json(sample("enterprise-user-full.json"));
        ObjectNode group = json(sample("group-tour-guides.json"));
        ObjectNode resourceType = json(sample("resource-type-user.json"));
        ObjectNode config = json(sample("service-provider-config.json"));
        ObjectNode before = user.deepCopy();

        validator.validate(user, ValidationProfiles.USER, ValidationMode.STANDARD);
        validator.validate(group, ValidationProfiles.GROUP, ValidationMode.STANDARD);
        validator.validate(resourceType, ValidationProfiles.RESOURCE_TYPE, ValidationMode.STANDARD);
        validator.validate(config, ValidationProfiles.SERVICE_PROVIDER_CONFIG, ValidationMode.STANDARD);

        assertThat(user).isEqualTo(before);
    }

    @Test
    @DisplayName("Should require all six attributes on a standalone enterprise record")
    void testEnterpriseRecord() {
        ObjectNode record = json("{\"employeeNumber\":\"701984\",\"costCenter\":\"4130\","
                + "\"organization\":\"Universal Studios\",\"division\":\"Theme Park\",\"department\":\"Tour Operations\"}");

        assertField(() -> validator.validate(record, ValidationProfiles.ENTERPRISE_USER_RECORD, ValidationMode.STANDARD),
                Violation.REQUIRED, "manager");
    }
}
