package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.config.ScimCodecConfig;
import com.pingidentity.scim2.config.UnknownAttributePolicy;
import com.pingidentity.scim2.exceptions.ErrorKind;
import com.pingidentity.scim2.exceptions.SchemaViolationException;
import com.pingidentity.scim2.exceptions.ScimSyntaxException;
import com.pingidentity.scim2.exceptions.TypeMismatchException;
import com.pingidentity.scim2.model.AttributeValue;
import com.pingidentity.scim2.model.Email;
import com.pingidentity.scim2.model.EnterpriseUser;
import com.pingidentity.scim2.model.GenericExtension;
import com.pingidentity.scim2.model.Group;
import com.pingidentity.scim2.model.ListResponse;
import com.pingidentity.scim2.model.Member;
import com.pingidentity.scim2.model.ScimExtension;
import com.pingidentity.scim2.model.ServiceProviderConfig;
import com.pingidentity.scim2.model.User;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static com.pingidentity.scim2.TestResources.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ScimJsonCodec.
 */
class ScimJsonCodecTest {

    private static final String USER = "urn:ietf:params:scim:schemas:core:2.0:User";
    private static final String ENTERPRISE = "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User";
    private static final String BADGE = "urn:example:params:scim:schemas:Badge";

    private final ScimJsonCodec rejecting = codec(UnknownAttributePolicy.REJECT);
    private final ScimJsonCodec ignoring = codec(UnknownAttributePolicy.IGNORE);
    private final ScimJsonCodec preserving = codec(UnknownAttributePolicy.PRESERVE);

    private static ScimJsonCodec codec(UnknownAttributePolicy policy) {
        return new ScimJsonCodec(ScimCodecConfig.of(policy));
    }

    private static String user(String attributes) {
        return "{\"schemas\":[\"" + USER + "\"],\"userName\":\"jdoe\"" + attributes + "}";
    }

    private static void assertTypeMismatch(ThrowingCallable call, String path) {
        assertThatThrownBy(call).isInstanceOfSatisfying(TypeMismatchException.class, e -> {
            assertThat(e.getKind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
            assertThat(e.getAttributePath()).isEqualTo(path);
        });
    }

    @Nested
    @DisplayName("JSON syntax")
    class Syntax {

        @Test
        @DisplayName("Should reject malformed JSON")
        void testMalformed() {
            assertThatThrownBy(() -> rejecting.decode("{\"userName\": ", User.class))
                    .isInstanceOf(ScimSyntaxException.class)
                    .hasMessageStartingWith("Malformed JSON");
        }

        @Test
        @DisplayName("Should reject empty and blank documents")
        void testEmpty() {
            assertThatThrownBy(() -> rejecting.decode("", User.class)).isInstanceOf(ScimSyntaxException.class);
            assertThatThrownBy(() -> rejecting.decode("  \n ", User.class)).isInstanceOf(ScimSyntaxException.class);
            assertThatThrownBy(() -> rejecting.decode((String) null, User.class)).isInstanceOf(ScimSyntaxException.class);
        }

        @Test
        @DisplayName("Should reject a key repeated verbatim")
        void testDuplicateKey() {
            assertThatThrownBy(() -> rejecting.decode(user(",\"userName\":\"john\""), User.class))
                    .isInstanceOfSatisfying(ScimSyntaxException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SYNTAX));
        }

        @Test
        @DisplayName("Should reject keys that differ only in case")
        void testCaseOnlyDuplicateKey() {
            assertThatThrownBy(() -> rejecting.decode(user(",\"USERNAME\":\"john\""), User.class))
                    .isInstanceOfSatisfying(ScimSyntaxException.class,
                            e -> assertThat(e.getAttributePath()).isEqualTo("USERNAME"));
        }

        @Test
        @DisplayName("Should reject case-only duplicates inside sub-records")
        void testCaseOnlyDuplicateNested() {
            assertThatThrownBy(() -> rejecting.decode(
                    user(",\"emails\":[{\"value\":\"a@example.com\",\"Value\":\"b@example.com\"}]"), User.class))
                    .isInstanceOfSatisfying(ScimSyntaxException.class,
                            e -> assertThat(e.getAttributePath()).isEqualTo("emails[0].Value"));
        }

        @Test
        @DisplayName("Should reject content after the document")
        void testTrailingTokens() {
            assertThatThrownBy(() -> rejecting.decode(user("") + " {}", User.class))
                    .isInstanceOf(ScimSyntaxException.class);
        }

        @Test
        @DisplayName("Should reject a top-level value that is not an object")
        void testNotAnObject() {
            assertTypeMismatch(() -> rejecting.decode("[]", User.class), "");
            assertTypeMismatch(() -> rejecting.decode("\"jdoe\"", User.class), "");
            assertTypeMismatch(() -> rejecting.decode("null", User.class), "");
        }
    }

    @Nested
    @DisplayName("value types")
    class Types {

        @Test
        @DisplayName("Should not coerce a number into a string")
        void testNumberForString() {
            assertThatThrownBy(() -> rejecting.decode(
                    "{\"schemas\":[\"" + USER + "\"],\"userName\":12345}", User.class))
                    .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                        assertThat(e.getAttributePath()).isEqualTo("userName");
                        assertThat(e.getExpectedType()).isEqualTo("a string");
                        assertThat(e.getMessage()).isEqualTo(
                                "Attribute 'userName' must be a string but was an integer (12345)");
                    });
        }

        @Test
        @DisplayName("Should not coerce a string into a boolean")
        void testStringForBoolean() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"active\":\"true\""), User.class), "active");
        }

        @Test
        @DisplayName("Should name the indexed sub-attribute on a nested mismatch")
        void testNestedBoolean() {
            String json = user(",\"emails\":[{\"value\":\"a@example.com\"},"
                    + "{\"value\":\"b@example.com\",\"primary\":\"yes\"}]");

            assertTypeMismatch(() -> rejecting.decode(json, User.class), "emails[1].primary");
        }

        @Test
        @DisplayName("Should reject a single object where a list is expected")
        void testObjectForList() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"emails\":{\"value\":\"a@example.com\"}"), User.class),
                    "emails");
        }

        @Test
        @DisplayName("Should reject a list where a single value is expected")
        void testListForString() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"displayName\":[\"Jane\"]"), User.class), "displayName");
        }

        @Test
        @DisplayName("Should reject a string element where a complex value is expected")
        void testStringElementInComplexList() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"emails\":[\"a@example.com\"]"), User.class),
                    "emails[0]");
        }

        @Test
        @DisplayName("Should reject non-string schema URNs")
        void testNonStringSchemas() {
            assertTypeMismatch(() -> rejecting.decode("{\"schemas\":[\"" + USER + "\",42]}", User.class), "schemas[1]");
        }

        @Test
        @DisplayName("Should reject fractional and beyond-64-bit integers")
        void testIntegerRange() {
            String fractional = sample("service-provider-config.json").replace("\"maxOperations\": 1000",
                    "\"maxOperations\": 1.5");
            String huge = sample("service-provider-config.json").replace("\"maxOperations\": 1000",
                    "\"maxOperations\": 9223372036854775808");

            assertTypeMismatch(() -> rejecting.decode(fractional, ServiceProviderConfig.class), "bulk.maxOperations");
            assertTypeMismatch(() -> rejecting.decode(huge, ServiceProviderConfig.class), "bulk.maxOperations");
        }

        @Test
        @DisplayName("Should accept limits beyond the 32-bit range")
        void testLargeLimits() throws Exception {
            // Arrange
            String json = sample("service-provider-config.json")
                    .replace("\"maxPayloadSize\": 1048576", "\"maxPayloadSize\": 3000000000");

            // Act
            ServiceProviderConfig config = rejecting.decode(json, ServiceProviderConfig.class);

            // Assert
            assertThat(config.getBulk().get().getMaxPayloadSize().get()).isEqualTo(3_000_000_000L);
            assertThat(rejecting.encode(config).get("bulk").get("maxPayloadSize").longValue())
                    .isEqualTo(3_000_000_000L);
        }

        @Test
        @DisplayName("Should reject date-times that are not ISO-8601 strings")
        void testDateTime() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"meta\":{\"created\":\"yesterday\"}"), User.class),
                    "meta.created");
            assertTypeMismatch(() -> rejecting.decode(user(",\"meta\":{\"created\":1264222582}"), User.class),
                    "meta.created");
        }

        @Test
        @DisplayName("Should reject epoch values written as date-time strings")
        void testDateTimeEpochString() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"meta\":{\"created\":\"1264222582\"}"), User.class),
                    "meta.created");
            assertTypeMismatch(() -> rejecting.decode(user(",\"meta\":{\"lastModified\":\"1.5\"}"), User.class),
                    "meta.lastModified");
        }

        @Test
        @DisplayName("Should reject date-times without an offset")
        void testDateTimeWithoutOffset() {
            assertTypeMismatch(() -> rejecting.decode(user(",\"meta\":{\"created\":\"2010-01-23T04:56:22\"}"),
                    User.class), "meta.created");
        }

        @Test
        @DisplayName("Should keep the offset of a date-time as written")
        void testDateTimeOffset() throws Exception {
            // Act
            User user = rejecting.decode(user(",\"meta\":{\"created\":\"2011-05-13T04:42:34+02:00\","
                    + "\"lastModified\":\"2010-01-23T04:56:22Z\"}"), User.class);
            ObjectNode meta = (ObjectNode) rejecting.encode(user).get("meta");

            // Assert
            OffsetDateTime created = user.getMeta().get().getCreated().get();
            assertThat(created.getOffset()).isEqualTo(ZoneOffset.ofHours(2));
            assertThat(created.getHour()).isEqualTo(4);
            assertThat(meta.get("created").asText()).isEqualTo("2011-05-13T04:42:34+02:00");
            assertThat(meta.get("lastModified").asText()).isEqualTo("2010-01-23T04:56:22Z");
        }
    }

    @Nested
    @DisplayName("attribute names")
    class Names {

        @Test
        @DisplayName("Should match attribute names regardless of case")
        void testCaseInsensitiveNames() throws Exception {
            // Act
            User user = rejecting.decode("{\"SCHEMAS\":[\"" + USER + "\"],\"UserName\":\"jdoe\","
                    + "\"EMAILS\":[{\"VALUE\":\"jdoe@example.com\",\"Primary\":true}]}", User.class);
            ObjectNode encoded = rejecting.encode(user);

            // Assert
            assertThat(user.getUserName().get()).isEqualTo("jdoe");
            assertThat(user.getEmails().get().get(0).isPrimary()).isTrue();
            assertThat(encoded.has("userName")).isTrue();
            assertThat(encoded.get("emails").get(0).has("primary")).isTrue();
        }
    }

    @Nested
    @DisplayName("unknown attributes")
    class Unknown {

        private final String json = user(",\"favouriteColour\":\"teal\"");

        @Test
        @DisplayName("Should reject unknown attributes under REJECT")
        void testReject() {
            assertThatThrownBy(() -> rejecting.decode(json, User.class))
                    .isInstanceOfSatisfying(SchemaViolationException.class, e -> {
                        assertThat(e.getAttributePath()).isEqualTo("favouriteColour");
                        assertThat(e.getMessage()).isEqualTo(
                                "Attribute 'favouriteColour' is not defined by the declared schemas");
                    });
        }

        @Test
        @DisplayName("Should drop unknown attributes under IGNORE")
        void testIgnore() throws Exception {
            User user = ignoring.decode(json, User.class);

            assertThat(user.getUnknownAttributes()).isEmpty();
            assertThat(ignoring.encode(user).has("favouriteColour")).isFalse();
        }

        @Test
        @DisplayName("Should keep unknown attributes under PRESERVE and write them back")
        void testPreserve() throws Exception {
            User user = preserving.decode(json, User.class);

            assertThat(user.getUnknownAttributes()).containsOnlyKeys("favouriteColour");
            assertThat(preserving.encode(user).get("favouriteColour").asText()).isEqualTo("teal");
        }

        @Test
        @DisplayName("Should reject unknown sub-attributes under REJECT and drop them otherwise")
        void testSubRecord() throws Exception {
            String nested = user(",\"name\":{\"givenName\":\"Jane\",\"nickname\":\"JJ\"}");

            assertThatThrownBy(() -> rejecting.decode(nested, User.class))
                    .isInstanceOfSatisfying(SchemaViolationException.class,
                            e -> assertThat(e.getAttributePath()).isEqualTo("name.nickname"));

            User preserved = preserving.decode(nested, User.class);
            assertThat(preserved.getName().get().getGivenName().get()).isEqualTo("Jane");
            assertThat(preserving.encode(preserved).get("name").has("nickname")).isFalse();
        }

        @Test
        @DisplayName("Should reject an unknown URN key that schemas does not declare")
        void testUndeclaredUrn() {
            String undeclared = user(",\"" + BADGE + "\":{\"badge\":\"gold\"}");

            assertThatThrownBy(() -> rejecting.decode(undeclared, User.class))
                    .isInstanceOfSatisfying(SchemaViolationException.class,
                            e -> assertThat(e.getAttributePath()).isEqualTo(BADGE));
        }

        @Test
        @DisplayName("Should apply the policy to unknown message attributes")
        void testMessage() throws Exception {
            String listJson = "{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:ListResponse\"],"
                    + "\"totalResults\":0,\"nextCursor\":\"abc\"}";

            assertThatThrownBy(() -> rejecting.decodeListResponse(listJson))
                    .isInstanceOf(SchemaViolationException.class);
            ListResponse preserved = preserving.decodeListResponse(listJson);
            assertThat(preserved.getUnknownAttributes()).containsKey("nextCursor");
            assertThat(preserving.encode(preserved).get("nextCursor").asText()).isEqualTo("abc");
        }
    }

    @Nested
    @DisplayName("extensions")
    class Extensions {

        @Test
        @DisplayName("Should decode the enterprise extension into its typed payload")
        void testEnterpriseExtension() throws Exception {
            User user = rejecting.decode(sample("enterprise-user-full.json"), User.class);

            EnterpriseUser enterprise = user.getEnterpriseUser().orElseThrow();
            assertThat(enterprise.getCostCenter().get()).isEqualTo("4130");
            assertThat(user.getExtension(ENTERPRISE.toLowerCase())).containsSame(enterprise);
        }

        @Test
        @DisplayName("Should decode the enterprise extension even when schemas does not declare it")
        void testUndeclaredEnterpriseExtension() throws Exception {
            User user = rejecting.decode(user(",\"" + ENTERPRISE + "\":{\"employeeNumber\":\"701984\"}"), User.class);

            assertThat(user.getEnterpriseUser()).isPresent();
            assertThat(user.getSchemaUrns()).containsExactly(USER);
        }

        @Test
        @DisplayName("Should report enterprise attribute paths in urn notation")
        void testEnterpriseAttributePath() {
            String json = "{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],\"userName\":\"jdoe\","
                    + "\"" + ENTERPRISE + "\":{\"manager\":{\"value\":26118915}}}";

            assertTypeMismatch(() -> rejecting.decode(json, User.class), ENTERPRISE + ":manager.value");
        }

        @Test
        @DisplayName("Should reject an enterprise extension that is not an object")
        void testEnterpriseNotObject() {
            String json = "{\"schemas\":[\"" + USER + "\",\"" + ENTERPRISE + "\"],\"userName\":\"jdoe\","
                    + "\"" + ENTERPRISE + "\":\"701984\"}";

            assertTypeMismatch(() -> rejecting.decode(json, User.class), ENTERPRISE);
        }

        @Test
        @DisplayName("Should keep a declared extension of unknown schema as a generic payload")
        void testGenericExtension() throws Exception {
            // Arrange
            String json = "{\"schemas\":[\"" + USER + "\",\"" + BADGE + "\"],\"userName\":\"jdoe\","
                    + "\"" + BADGE + "\":{\"badge\":\"gold\",\"level\":3}}";

            // Act
            User user = rejecting.decode(json, User.class);
            JsonNode encoded = rejecting.encode(user);

            // Assert
            ScimExtension extension = user.getExtension(BADGE).orElseThrow();
            assertThat(extension).isInstanceOf(GenericExtension.class);
            assertThat(((GenericExtension) extension).getAttributes().get("level").asInt()).isEqualTo(3);
            assertThat(encoded).isEqualTo(rejecting.parse(json));
        }

        @Test
        @DisplayName("Should reject a declared generic extension that is not an object")
        void testGenericNotObject() {
            String json = "{\"schemas\":[\"" + USER + "\",\"" + BADGE + "\"],\"userName\":\"jdoe\","
                    + "\"" + BADGE + "\":null}";

            assertTypeMismatch(() -> rejecting.decode(json, User.class), BADGE);
        }
    }

    @Nested
    @DisplayName("absent, null and empty values")
    class Omission {

        @Test
        @DisplayName("Should write null and empty values and omit absent ones")
        void testEncodeThreeStates() {
            // Arrange
            User user = User.withUserName("jdoe");
            user.setDisplayName(AttributeValue.ofNull());
            user.setNickName(AttributeValue.of(""));
            user.setEmails(AttributeValue.of(Collections.emptyList()));

            // Act
            ObjectNode encoded = rejecting.encode(user);

            // Assert
            assertThat(encoded.get("displayName").isNull()).isTrue();
            assertThat(encoded.get("nickName").asText()).isEmpty();
            assertThat(encoded.get("emails").isArray()).isTrue();
            assertThat(encoded.get("emails")).isEmpty();
            assertThat(encoded.has("title")).isFalse();
            assertThat(encoded.has("meta")).isFalse();
        }

        @Test
        @DisplayName("Should decode null, empty and missing values into distinct states")
        void testDecodeThreeStates() throws Exception {
            User user = rejecting.decode(user(",\"displayName\":null,\"nickName\":\"\",\"emails\":[]"), User.class);

            assertThat(user.getDisplayName().isNull()).isTrue();
            assertThat(user.getNickName().get()).isEmpty();
            assertThat(user.getEmails().get()).isEmpty();
            assertThat(user.getTitle().isAbsent()).isTrue();
        }

        @Test
        @DisplayName("Should omit sub-attributes left null in convenience constructors")
        void testConvenienceConstructorNulls() {
            // Arrange
            User user = User.withUserName("jdoe");
            user.setEmails(AttributeValue.of(List.of(new Email("a@example.com", null, false))));
            Group group = new Group();
            group.setDisplayName(AttributeValue.of("Tour Guides"));
            group.setMembers(AttributeValue.of(List.of(new Member("2819c223", null, null))));

            // Act
            JsonNode email = rejecting.encode(user).get("emails").get(0);
            JsonNode member = rejecting.encode(group).get("members").get(0);

            // Assert
            assertThat(email.has("type")).isFalse();
            assertThat(email.get("value").asText()).isEqualTo("a@example.com");
            assertThat(member.has("$ref")).isFalse();
            assertThat(member.has("display")).isFalse();
            assertThat(member.get("value").asText()).isEqualTo("2819c223");
        }
    }

    @Nested
    @DisplayName("list responses and other documents")
    class Documents {

        @Test
        @DisplayName("Should reject a Resources element of an unsupported type")
        void testUnsupportedResource() {
            String json = "{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:ListResponse\"],"
                    + "\"totalResults\":1,\"Resources\":[{\"schemas\":[\"urn:example:Device\"]}]}";

            assertThatThrownBy(() -> rejecting.decodeListResponse(json))
                    .isInstanceOfSatisfying(SchemaViolationException.class,
                            e -> assertThat(e.getAttributePath()).isEqualTo("Resources[0].schemas"));
        }

        @Test
        @DisplayName("Should prefix element paths with the Resources index")
        void testElementPath() {
            String json = "{\"schemas\":[\"urn:ietf:params:scim:api:messages:2.0:ListResponse\"],"
                    + "\"totalResults\":1,\"Resources\":[{\"schemas\":[\"urn:ietf:params:scim:schemas:core:2.0:Group\"],"
                    + "\"displayName\":false}]}";

            assertTypeMismatch(() -> rejecting.decodeListResponse(json), "Resources[0].displayName");
        }

        @Test
        @DisplayName("Should decode a group and keep member order")
        void testGroup() throws Exception {
            Group group = rejecting.decode(sample("group-tour-guides.json"), Group.class);

            assertThat(group.getMembers().get()).extracting(member -> member.getValue().get())
                    .containsExactly("2819c223-7f76-453a-919d-413861904646", "902c246b-6245-4190-8e05-00816be7344a");
        }

        @Test
        @DisplayName("Should decode a standalone enterprise payload without schemas")
        void testStandaloneEnterpriseUser() throws Exception {
            String json = "{\"employeeNumber\":\"701984\",\"department\":\"Tour Operations\",\"badge\":\"gold\"}";

            assertThatThrownBy(() -> rejecting.decodeEnterpriseUser(json))
                    .isInstanceOfSatisfying(SchemaViolationException.class,
                            e -> assertThat(e.getAttributePath()).isEqualTo("badge"));
            EnterpriseUser enterprise = ignoring.decodeEnterpriseUser(json);
            assertThat(enterprise.getDepartment().get()).isEqualTo("Tour Operations");
            assertThat(ignoring.encode(enterprise).has("badge")).isFalse();
        }
    }
}
