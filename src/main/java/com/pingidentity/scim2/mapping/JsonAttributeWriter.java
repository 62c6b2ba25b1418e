package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.model.AttributeValue;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * Writes attribute values into one JSON object in call order.
 *
 * <p>An absent attribute writes nothing, an explicit null writes a JSON {@code null},
 * and any value, empty strings and empty lists included, is written as it is.</p>
 */
public final class JsonAttributeWriter {

    private final ObjectMapper objectMapper;
    private final ObjectNode node;

    public JsonAttributeWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.node = objectMapper.createObjectNode();
    }

    public ObjectNode getNode() {
        return node;
    }

    public JsonAttributeWriter writeString(String name, AttributeValue<String> value) {
        return write(name, value, node::textNode);
    }

    public JsonAttributeWriter writeBoolean(String name, AttributeValue<Boolean> value) {
        return write(name, value, node::booleanNode);
    }

    public JsonAttributeWriter writeLong(String name, AttributeValue<Long> value) {
        return write(name, value, node::numberNode);
    }

    /**
     * Dates are written as ISO-8601 strings by the mapper's JavaTimeModule.
     */
    public JsonAttributeWriter writeDateTime(String name, AttributeValue<OffsetDateTime> value) {
        return write(name, value, objectMapper::valueToTree);
    }

    public JsonAttributeWriter writeStringList(String name, AttributeValue<List<String>> value) {
        return writeList(name, value, node::textNode);
    }

    public <T> JsonAttributeWriter writeComplex(String name, AttributeValue<T> value, ComplexWriter<T> writer) {
        return write(name, value, v -> encodeComplex(v, writer));
    }

    public <T> JsonAttributeWriter writeComplexList(String name, AttributeValue<List<T>> value,
                                                    ComplexWriter<T> writer) {
        return writeList(name, value, v -> encodeComplex(v, writer));
    }

    /**
     * Put an already encoded value under the key.
     */
    public JsonAttributeWriter writeNode(String name, JsonNode value) {
        node.set(name, value == null ? node.nullNode() : value);
        return this;
    }

    private <T> ObjectNode encodeComplex(T value, ComplexWriter<T> writer) {
        JsonAttributeWriter nested = new JsonAttributeWriter(objectMapper);
        writer.write(value, nested);
        return nested.getNode();
    }

    /**
     * Write a list whose elements are encoded by the caller.
     */
    public <T> JsonAttributeWriter writeList(String name, AttributeValue<List<T>> value,
                                             Function<T, JsonNode> encoder) {
        return write(name, value, list -> {
            ArrayNode array = node.arrayNode();
            for (T element : list) {
                array.add(element == null ? node.nullNode() : encoder.apply(element));
            }
            return array;
        });
    }

    private <T> JsonAttributeWriter write(String name, AttributeValue<T> value, Function<T, JsonNode> encoder) {
        if (value == null || value.isAbsent()) {
            return this;
        }
        node.set(name, value.isNull() ? node.nullNode() : encoder.apply(value.get()));
        return this;
    }

    /**
     * Encodes one complex value into a fresh JSON object.
     */
    @FunctionalInterface
    public interface ComplexWriter<T> {
        void write(T value, JsonAttributeWriter writer);
    }
}
