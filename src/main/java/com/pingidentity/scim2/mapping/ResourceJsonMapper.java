package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.config.UnknownAttributePolicy;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.exceptions.TypeMismatchException;
import com.pingidentity.scim2.model.EnterpriseUser;
import com.pingidentity.scim2.model.GenericExtension;
import com.pingidentity.scim2.model.ScimExtension;
import com.pingidentity.scim2.model.ScimResource;
import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Base JSON mapper for SCIM resources.
 *
 * <p>Handles what every resource shares: the common attributes, extension objects
 * flattened under their URN and unknown top-level attributes. Subclasses map the
 * attributes of their own resource type.</p>
 *
 * <p>Encoded key order: {@code schemas}, {@code id}, {@code externalId}, the type's
 * attributes, {@code meta}, extensions, preserved unknown attributes.</p>
 *
 * @param <T> the resource type
 */
public abstract class ResourceJsonMapper<T extends ScimResource> {

    private static final Logger LOGGER = Logger.getLogger(ResourceJsonMapper.class.getName());

    private final ObjectMapper objectMapper;

    protected ResourceJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the resource class this mapper produces
     */
    public abstract Class<T> getResourceClass();

    /**
     * @return the core schema URN of the resource type
     */
    public abstract String getBaseSchemaUrn();

    protected abstract T newResource();

    protected abstract void readAttributes(JsonAttributeReader reader, T resource) throws ScimModelException;

    protected abstract void writeAttributes(T resource, JsonAttributeWriter writer);

    public ObjectNode encode(T resource) {
        JsonAttributeWriter writer = new JsonAttributeWriter(objectMapper);
        writer.writeStringList("schemas", resource.getSchemas())
                .writeString("id", resource.getId())
                .writeString("externalId", resource.getExternalId());
        writeAttributes(resource, writer);
        writer.writeComplex("meta", resource.getMeta(), ComplexAttributeMappers::writeMeta);

        for (Map.Entry<String, ScimExtension> entry : resource.getExtensions().entrySet()) {
            writer.writeNode(entry.getKey(), encodeExtension(entry.getValue()));
        }
        for (Map.Entry<String, JsonNode> entry : resource.getUnknownAttributes().entrySet()) {
            writer.writeNode(entry.getKey(), entry.getValue() == null ? null : entry.getValue().deepCopy());
        }
        return writer.getNode();
    }

    /**
     * Decode a resource from a reader scoped to its JSON object.
     */
    public T decode(JsonAttributeReader reader) throws ScimModelException {
        T resource = newResource();
        resource.setSchemas(reader.readStringList("schemas"));
        resource.setId(reader.readString("id"));
        resource.setExternalId(reader.readString("externalId"));
        resource.setMeta(reader.readComplex("meta", ComplexAttributeMappers::readMeta));
        readAttributes(reader, resource);

        List<String> declared = resource.getSchemaUrns();
        for (String key : reader.remainingKeys()) {
            JsonNode value = reader.take(key);
            if (key.equalsIgnoreCase(ScimSchemaUrns.ENTERPRISE_USER_SCHEMA)) {
                resource.putExtension(reader.readExtension(key, EnterpriseUserJsonMapper::read));
            } else if (ScimSchemaUrns.isUrn(key) && declared.stream().anyMatch(key::equalsIgnoreCase)) {
                if (!value.isObject()) {
                    throw new TypeMismatchException(reader.pathOf(key), "an extension object",
                            JsonAttributeReader.describe(value));
                }
                resource.putExtension(new GenericExtension(key, (ObjectNode) value));
            } else {
                handleUnknown(reader, resource, key, value);
            }
        }
        return resource;
    }

    private void handleUnknown(JsonAttributeReader reader, T resource, String key, JsonNode value)
            throws ScimModelException {
        UnknownAttributePolicy policy = reader.getPolicy();
        if (policy == UnknownAttributePolicy.REJECT) {
            throw reader.unknownAttribute(key);
        }
        if (policy == UnknownAttributePolicy.PRESERVE) {
            resource.putUnknownAttribute(key, value.deepCopy());
        } else {
            LOGGER.fine(() -> "Dropping unknown attribute '" + reader.pathOf(key) + "'");
        }
    }

    private ObjectNode encodeExtension(ScimExtension extension) {
        if (extension instanceof EnterpriseUser) {
            JsonAttributeWriter writer = new JsonAttributeWriter(objectMapper);
            EnterpriseUserJsonMapper.write((EnterpriseUser) extension, writer);
            return writer.getNode();
        }
        if (extension instanceof GenericExtension) {
            return ((GenericExtension) extension).getAttributes();
        }
        throw new IllegalArgumentException("No JSON mapping for extension type " + extension.getClass().getName());
    }
}
