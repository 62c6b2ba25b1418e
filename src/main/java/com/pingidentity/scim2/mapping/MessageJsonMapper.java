package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.config.UnknownAttributePolicy;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.ScimMessage;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Base JSON mapper for SCIM protocol messages. Messages carry {@code schemas} but no
 * extensions; every other unknown top-level key goes to the unknown-attribute policy.
 *
 * @param <T> the message type
 */
public abstract class MessageJsonMapper<T extends ScimMessage> {

    private static final Logger LOGGER = Logger.getLogger(MessageJsonMapper.class.getName());

    private final ObjectMapper objectMapper;

    protected MessageJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract T newMessage();

    protected abstract void readAttributes(JsonAttributeReader reader, T message) throws ScimModelException;

    protected abstract void writeAttributes(T message, JsonAttributeWriter writer);

    public ObjectNode encode(T message) {
        JsonAttributeWriter writer = new JsonAttributeWriter(objectMapper);
        writer.writeStringList("schemas", message.getSchemas());
        writeAttributes(message, writer);
        for (Map.Entry<String, JsonNode> entry : message.getUnknownAttributes().entrySet()) {
            writer.writeNode(entry.getKey(), entry.getValue() == null ? null : entry.getValue().deepCopy());
        }
        return writer.getNode();
    }

    public T decode(JsonAttributeReader reader) throws ScimModelException {
        T message = newMessage();
        message.setSchemas(reader.readStringList("schemas"));
        readAttributes(reader, message);

        for (String key : reader.remainingKeys()) {
            JsonNode value = reader.take(key);
            if (reader.getPolicy() == UnknownAttributePolicy.REJECT) {
                throw reader.unknownAttribute(key);
            }
            if (reader.getPolicy() == UnknownAttributePolicy.PRESERVE) {
                message.putUnknownAttribute(key, value.deepCopy());
            } else {
                LOGGER.fine(() -> "Dropping unknown attribute '" + reader.pathOf(key) + "'");
            }
        }
        return message;
    }
}
