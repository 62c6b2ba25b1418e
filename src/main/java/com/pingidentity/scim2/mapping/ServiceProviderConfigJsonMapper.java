package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.ServiceProviderConfig;
import com.pingidentity.scim2.schema.ScimSchemaUrns;

/**
 * JSON mapper for the service provider configuration (RFC 7643 Section 5).
 */
public class ServiceProviderConfigJsonMapper extends ResourceJsonMapper<ServiceProviderConfig> {

    public ServiceProviderConfigJsonMapper(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Class<ServiceProviderConfig> getResourceClass() {
        return ServiceProviderConfig.class;
    }

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.SERVICE_PROVIDER_CONFIG;
    }

    @Override
    protected ServiceProviderConfig newResource() {
        return new ServiceProviderConfig();
    }

    @Override
    protected void readAttributes(JsonAttributeReader reader, ServiceProviderConfig config) throws ScimModelException {
        config.setDocumentationUri(reader.readString("documentationUri"));
        config.setPatch(reader.readComplex("patch", ComplexAttributeMappers::readSupportedFeature));
        config.setBulk(reader.readComplex("bulk", ComplexAttributeMappers::readBulkSupport));
        config.setFilter(reader.readComplex("filter", ComplexAttributeMappers::readFilterSupport));
        config.setChangePassword(reader.readComplex("changePassword", ComplexAttributeMappers::readSupportedFeature));
        config.setSort(reader.readComplex("sort", ComplexAttributeMappers::readSupportedFeature));
        config.setEtag(reader.readComplex("etag", ComplexAttributeMappers::readSupportedFeature));
        config.setAuthenticationSchemes(
                reader.readComplexList("authenticationSchemes", ComplexAttributeMappers::readAuthenticationScheme));
    }

    @Override
    protected void writeAttributes(ServiceProviderConfig config, JsonAttributeWriter writer) {
        writer.writeString("documentationUri", config.getDocumentationUri())
                .writeComplex("patch", config.getPatch(), ComplexAttributeMappers::writeSupportedFeature)
                .writeComplex("bulk", config.getBulk(), ComplexAttributeMappers::writeBulkSupport)
                .writeComplex("filter", config.getFilter(), ComplexAttributeMappers::writeFilterSupport)
                .writeComplex("changePassword", config.getChangePassword(),
                        ComplexAttributeMappers::writeSupportedFeature)
                .writeComplex("sort", config.getSort(), ComplexAttributeMappers::writeSupportedFeature)
                .writeComplex("etag", config.getEtag(), ComplexAttributeMappers::writeSupportedFeature)
                .writeComplexList("authenticationSchemes", config.getAuthenticationSchemes(),
                        ComplexAttributeMappers::writeAuthenticationScheme);
    }
}
