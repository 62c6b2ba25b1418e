package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.ResourceType;
import com.pingidentity.scim2.schema.ScimSchemaUrns;

/**
 * JSON mapper for ResourceType descriptors (RFC 7643 Section 6).
 */
public class ResourceTypeJsonMapper extends ResourceJsonMapper<ResourceType> {

    public ResourceTypeJsonMapper(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Class<ResourceType> getResourceClass() {
        return ResourceType.class;
    }

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.RESOURCE_TYPE;
    }

    @Override
    protected ResourceType newResource() {
        return new ResourceType();
    }

    @Override
    protected void readAttributes(JsonAttributeReader reader, ResourceType resourceType) throws ScimModelException {
        resourceType.setName(reader.readString("name"));
        resourceType.setDescription(reader.readString("description"));
        resourceType.setEndpoint(reader.readString("endpoint"));
        resourceType.setSchema(reader.readString("schema"));
        resourceType.setSchemaExtensions(
                reader.readComplexList("schemaExtensions", ComplexAttributeMappers::readSchemaExtension));
    }

    @Override
    protected void writeAttributes(ResourceType resourceType, JsonAttributeWriter writer) {
        writer.writeString("name", resourceType.getName())
                .writeString("description", resourceType.getDescription())
                .writeString("endpoint", resourceType.getEndpoint())
                .writeString("schema", resourceType.getSchema())
                .writeComplexList("schemaExtensions", resourceType.getSchemaExtensions(),
                        ComplexAttributeMappers::writeSchemaExtension);
    }
}
