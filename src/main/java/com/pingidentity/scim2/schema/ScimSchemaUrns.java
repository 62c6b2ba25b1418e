package com.pingidentity.scim2.schema;

/**
 * Constants for SCIM 2.0 schema URNs.
 *
 * <p>These URNs are defined in RFC 7643 (SCIM Core Schema) and RFC 7644 (SCIM Protocol).</p>
 */
public final class ScimSchemaUrns {

    // ========================================================================
    // Core SCIM Resource Schemas (RFC 7643)
    // ========================================================================

    /** Core User schema URN */
    public static final String CORE_USER_SCHEMA = "urn:ietf:params:scim:schemas:core:2.0:User";

    /** Core Group schema URN */
    public static final String CORE_GROUP_SCHEMA = "urn:ietf:params:scim:schemas:core:2.0:Group";

    /** Enterprise User Extension schema URN (RFC 7643 Section 4.3) */
    public static final String ENTERPRISE_USER_SCHEMA = "urn:ietf:params:scim:schemas:extension:enterprise:2.0:User";

    // ========================================================================
    // SCIM Discovery Schemas
    // ========================================================================

    /** Service Provider Configuration schema URN */
    public static final String SERVICE_PROVIDER_CONFIG = "urn:ietf:params:scim:schemas:core:2.0:ServiceProviderConfig";

    /** Resource Type schema URN */
    public static final String RESOURCE_TYPE = "urn:ietf:params:scim:schemas:core:2.0:ResourceType";

    // ========================================================================
    // SCIM Protocol Message Schemas (RFC 7644)
    // ========================================================================

    /** Error response schema URN */
    public static final String ERROR = "urn:ietf:params:scim:api:messages:2.0:Error";

    /** List response schema URN */
    public static final String LIST_RESPONSE = "urn:ietf:params:scim:api:messages:2.0:ListResponse";

    /** Search request schema URN */
    public static final String SEARCH_REQUEST = "urn:ietf:params:scim:api:messages:2.0:SearchRequest";

    /** Prefix shared by every URN-named attribute */
    public static final String URN_PREFIX = "urn:";

    // Private constructor to prevent instantiation
    private ScimSchemaUrns() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    /**
     * Check whether a top-level attribute name is a schema URN rather than a plain attribute.
     */
    public static boolean isUrn(String name) {
        return name != null && name.regionMatches(true, 0, URN_PREFIX, 0, URN_PREFIX.length());
    }
}
