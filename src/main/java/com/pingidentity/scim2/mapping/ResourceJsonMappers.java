package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.model.ScimResource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The resource mappers of the supported resource types, looked up by model class or by
 * the base schema URN a document declares.
 */
public class ResourceJsonMappers {

    private final List<ResourceJsonMapper<? extends ScimResource>> mappers;

    public ResourceJsonMappers(ObjectMapper objectMapper) {
        this.mappers = Collections.unmodifiableList(Arrays.asList(
                new UserJsonMapper(objectMapper),
                new GroupJsonMapper(objectMapper),
                new ResourceTypeJsonMapper(objectMapper),
                new ServiceProviderConfigJsonMapper(objectMapper)));
    }

    @SuppressWarnings("unchecked")
    public <T extends ScimResource> ResourceJsonMapper<T> forClass(Class<T> type) {
        for (ResourceJsonMapper<? extends ScimResource> mapper : mappers) {
            if (mapper.getResourceClass().equals(type)) {
                return (ResourceJsonMapper<T>) mapper;
            }
        }
        throw new IllegalArgumentException("No JSON mapper for resource type " + type.getName());
    }

    /**
     * Pick the mapper whose base schema URN appears in a {@code schemas} array.
     */
    public Optional<ResourceJsonMapper<? extends ScimResource>> forSchemas(JsonNode schemas) {
        if (schemas == null || !schemas.isArray()) {
            return Optional.empty();
        }
        for (ResourceJsonMapper<? extends ScimResource> mapper : mappers) {
            for (JsonNode urn : schemas) {
                if (urn.isTextual() && urn.asText().equalsIgnoreCase(mapper.getBaseSchemaUrn())) {
                    return Optional.of(mapper);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Encode any supported resource with the mapper of its class.
     */
    @SuppressWarnings("unchecked")
    public ObjectNode encode(ScimResource resource) {
        for (ResourceJsonMapper<? extends ScimResource> mapper : mappers) {
            if (mapper.getResourceClass().isInstance(resource)) {
                return ((ResourceJsonMapper<ScimResource>) mapper).encode(resource);
            }
        }
        throw new IllegalArgumentException("No JSON mapper for resource type " + resource.getClass().getName());
    }
}
