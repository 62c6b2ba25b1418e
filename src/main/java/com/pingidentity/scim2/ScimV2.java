package com.pingidentity.scim2;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.config.ScimCodecConfig;
import com.pingidentity.scim2.exceptions.ScimErrorResponseBuilder;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.mapping.ScimJsonCodec;
import com.pingidentity.scim2.model.EnterpriseUser;
import com.pingidentity.scim2.model.Group;
import com.pingidentity.scim2.model.ListResponse;
import com.pingidentity.scim2.model.ResourceType;
import com.pingidentity.scim2.model.ScimResource;
import com.pingidentity.scim2.model.SearchRequest;
import com.pingidentity.scim2.model.ServiceProviderConfig;
import com.pingidentity.scim2.model.User;
import com.pingidentity.scim2.validation.ScimResourceValidator;
import com.pingidentity.scim2.validation.ValidationMode;
import com.pingidentity.scim2.validation.ValidationProfile;
import com.pingidentity.scim2.validation.ValidationProfiles;
import com.unboundid.scim2.common.exceptions.ScimException;

import java.util.logging.Logger;

/**
 * Entry point for validating SCIM 2.0 resources and converting them to and from JSON.
 *
 * <p>Decoding and validation are separate steps: {@code jsonToX} only checks that the
 * document has the right shape, and {@code validateX} is called by the caller when the
 * protocol rules must hold. A typical inbound flow:</p>
 * <pre>
 * ScimV2 scim = new ScimV2(ScimCodecConfig.of(UnknownAttributePolicy.REJECT));
 * User user = scim.jsonToUser(body);
 * scim.validateUser(user, ValidationMode.CREATE);
 * </pre>
 *
 * <p>Every method is stateless over its input, so one instance can serve any number of threads.</p>
 */
public class ScimV2 {

    private static final Logger LOGGER = Logger.getLogger(ScimV2.class.getName());

    private final ScimJsonCodec codec;
    private final ScimResourceValidator validator;
    private final ScimErrorResponseBuilder errorResponseBuilder;

    public ScimV2(ScimCodecConfig config) {
        this(new ScimJsonCodec(config), new ScimResourceValidator());
    }

    public ScimV2(ScimJsonCodec codec, ScimResourceValidator validator) {
        this.codec = codec;
        this.validator = validator;
        this.errorResponseBuilder = new ScimErrorResponseBuilder(codec.getObjectMapper());
    }

    // ---- User ----

    public void validateUser(User user) throws ScimModelException {
        validateUser(user, ValidationMode.STANDARD);
    }

    /**
     * Validate a User together with any extensions attached to it.
     */
    public void validateUser(User user, ValidationMode mode) throws ScimModelException {
        validate(codec.encode(user), ValidationProfiles.USER, mode);
    }

    public String userToJson(User user) {
        return toJson(user);
    }

    public User jsonToUser(String json) throws ScimModelException {
        return decode(json, User.class);
    }

    // ---- EnterpriseUser ----

    /**
     * Validate a stand-alone Enterprise User payload as a complete employee record:
     * every attribute must be present and non-empty. An extension attached to a User is
     * checked by {@link #validateUser(User)} against the RFC rules instead.
     */
    public void validateEnterpriseUser(EnterpriseUser enterpriseUser) throws ScimModelException {
        validate(codec.encode(enterpriseUser), ValidationProfiles.ENTERPRISE_USER_RECORD, ValidationMode.STANDARD);
    }

    public String enterpriseUserToJson(EnterpriseUser enterpriseUser) {
        return codec.write(codec.encode(enterpriseUser));
    }

    public EnterpriseUser jsonToEnterpriseUser(String json) throws ScimModelException {
        try {
            return codec.decodeEnterpriseUser(json);
        } catch (ScimModelException e) {
            throw rejected("EnterpriseUser", e);
        }
    }

    // ---- Group ----

    public void validateGroup(Group group) throws ScimModelException {
        validateGroup(group, ValidationMode.STANDARD);
    }

    public void validateGroup(Group group, ValidationMode mode) throws ScimModelException {
        validate(codec.encode(group), ValidationProfiles.GROUP, mode);
    }

    public String groupToJson(Group group) {
        return toJson(group);
    }

    public Group jsonToGroup(String json) throws ScimModelException {
        return decode(json, Group.class);
    }

    // ---- ResourceType ----

    public void validateResourceType(ResourceType resourceType) throws ScimModelException {
        validateResourceType(resourceType, ValidationMode.STANDARD);
    }

    public void validateResourceType(ResourceType resourceType, ValidationMode mode) throws ScimModelException {
        validate(codec.encode(resourceType), ValidationProfiles.RESOURCE_TYPE, mode);
    }

    public String resourceTypeToJson(ResourceType resourceType) {
        return toJson(resourceType);
    }

    public ResourceType jsonToResourceType(String json) throws ScimModelException {
        return decode(json, ResourceType.class);
    }

    // ---- ServiceProviderConfig ----

    public void validateServiceProviderConfig(ServiceProviderConfig config) throws ScimModelException {
        validateServiceProviderConfig(config, ValidationMode.STANDARD);
    }

    public void validateServiceProviderConfig(ServiceProviderConfig config, ValidationMode mode)
            throws ScimModelException {
        validate(codec.encode(config), ValidationProfiles.SERVICE_PROVIDER_CONFIG, mode);
    }

    public String serviceProviderConfigToJson(ServiceProviderConfig config) {
        return toJson(config);
    }

    public ServiceProviderConfig jsonToServiceProviderConfig(String json) throws ScimModelException {
        return decode(json, ServiceProviderConfig.class);
    }

    // ---- Messages ----

    /**
     * Validate a ListResponse and every resource in it, each under its own resource type's rules.
     */
    public void validateListResponse(ListResponse listResponse) throws ScimModelException {
        validate(codec.encode(listResponse), ValidationProfiles.LIST_RESPONSE, ValidationMode.STANDARD);
    }

    public String listResponseToJson(ListResponse listResponse) {
        return codec.write(codec.encode(listResponse));
    }

    public ListResponse jsonToListResponse(String json) throws ScimModelException {
        try {
            return codec.decodeListResponse(json);
        } catch (ScimModelException e) {
            throw rejected("ListResponse", e);
        }
    }

    public void validateSearchRequest(SearchRequest searchRequest) throws ScimModelException {
        validate(codec.encode(searchRequest), ValidationProfiles.SEARCH_REQUEST, ValidationMode.STANDARD);
    }

    public String searchRequestToJson(SearchRequest searchRequest) {
        return codec.write(codec.encode(searchRequest));
    }

    public SearchRequest jsonToSearchRequest(String json) throws ScimModelException {
        try {
            return codec.decodeSearchRequest(json);
        } catch (ScimModelException e) {
            throw rejected("SearchRequest", e);
        }
    }

    // ---- Errors ----

    /**
     * Render a failure as a SCIM Error message (RFC 7644 Section 3.12).
     */
    public String errorToJson(ScimException exception) {
        return errorResponseBuilder.buildErrorResponse(exception);
    }

    private String toJson(ScimResource resource) {
        return codec.write(codec.encode(resource));
    }

    private <T extends ScimResource> T decode(String json, Class<T> type) throws ScimModelException {
        try {
            return codec.decode(json, type);
        } catch (ScimModelException e) {
            throw rejected(type.getSimpleName(), e);
        }
    }

    private void validate(ObjectNode tree, ValidationProfile profile, ValidationMode mode)
            throws ScimModelException {
        try {
            validator.validate(tree, profile, mode);
        } catch (ScimModelException e) {
            throw rejected(profile.getName(), e);
        }
    }

    private ScimModelException rejected(String type, ScimModelException e) {
        LOGGER.warning(() -> String.format("Rejected %s: %s [%s at '%s']",
                type, e.getMessage(), e.getKind(), e.getAttributePath()));
        return e;
    }
}
