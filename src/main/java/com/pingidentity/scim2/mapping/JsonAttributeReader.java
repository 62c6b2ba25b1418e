package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.config.UnknownAttributePolicy;
import com.pingidentity.scim2.exceptions.SchemaViolationException;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.exceptions.ScimSyntaxException;
import com.pingidentity.scim2.exceptions.TypeMismatchException;
import com.pingidentity.scim2.model.AttributeValue;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads typed attribute values out of one JSON object.
 *
 * <p>Attribute names match case-insensitively. Every read records the key as consumed
 * so that whatever is left over can be handed to the unknown-attribute policy. Values
 * are never coerced: a value of the wrong JSON type is a {@link TypeMismatchException}
 * naming the full attribute path.</p>
 */
public final class JsonAttributeReader {

    private static final Logger LOGGER = Logger.getLogger(JsonAttributeReader.class.getName());

    private final ObjectNode node;
    private final String pathPrefix;
    private final UnknownAttributePolicy policy;
    private final Map<String, String> keysByLowerName = new LinkedHashMap<>();
    private final Set<String> consumed = new HashSet<>();

    private JsonAttributeReader(ObjectNode node, String pathPrefix, UnknownAttributePolicy policy)
            throws ScimSyntaxException {
        this.node = node;
        this.pathPrefix = pathPrefix;
        this.policy = policy;

        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            String previous = keysByLowerName.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
            if (previous != null) {
                throw new ScimSyntaxException(pathPrefix + name,
                        String.format("Attribute names '%s' and '%s' differ only in case", previous, pathPrefix + name));
            }
        }
    }

    /**
     * Reader for a top-level document.
     *
     * @throws TypeMismatchException if the document is not a JSON object
     * @throws ScimSyntaxException if two keys differ only in case
     */
    public static JsonAttributeReader forDocument(JsonNode document, UnknownAttributePolicy policy)
            throws ScimModelException {
        return forObject(document, "", "", policy);
    }

    private static JsonAttributeReader forObject(JsonNode value, String path, String childPrefix,
                                                 UnknownAttributePolicy policy) throws ScimModelException {
        if (value == null || !value.isObject()) {
            throw new TypeMismatchException(path, "a JSON object", describe(value));
        }
        return new JsonAttributeReader((ObjectNode) value, childPrefix, policy);
    }

    public UnknownAttributePolicy getPolicy() {
        return policy;
    }

    /**
     * @return the full path of an attribute of this object
     */
    public String pathOf(String name) {
        return pathPrefix + name;
    }

    /**
     * Raw lookup; the key counts as consumed.
     *
     * @return the value, or null when the key is missing
     */
    public JsonNode take(String name) {
        String key = keysByLowerName.get(name.toLowerCase(Locale.ROOT));
        if (key == null) {
            return null;
        }
        consumed.add(key);
        return node.get(key);
    }

    /**
     * @return the keys not read so far, in document order
     */
    public List<String> remainingKeys() {
        List<String> remaining = new ArrayList<>();
        for (String key : keysByLowerName.values()) {
            if (!consumed.contains(key)) {
                remaining.add(key);
            }
        }
        return remaining;
    }

    /**
     * Look at a value without consuming its key.
     */
    public JsonNode peek(String name) {
        String key = keysByLowerName.get(name.toLowerCase(Locale.ROOT));
        return key == null ? null : node.get(key);
    }

    public AttributeValue<String> readString(String name) throws TypeMismatchException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        return AttributeValue.of(requireString(value, pathOf(name)));
    }

    public AttributeValue<Boolean> readBoolean(String name) throws TypeMismatchException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        if (!value.isBoolean()) {
            throw new TypeMismatchException(pathOf(name), "a boolean", describe(value));
        }
        return AttributeValue.of(value.booleanValue());
    }

    /**
     * Read a JSON integer. SCIM integers have no fractional part; the full 64-bit range is accepted.
     */
    public AttributeValue<Long> readLong(String name) throws TypeMismatchException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        if (!value.isIntegralNumber()) {
            throw new TypeMismatchException(pathOf(name), "an integer", describe(value));
        }
        if (!value.canConvertToLong()) {
            throw new TypeMismatchException(pathOf(name), "a 64-bit integer", describe(value));
        }
        return AttributeValue.of(value.longValue());
    }

    /**
     * Read an ISO-8601 date-time with an offset, keeping the offset as written.
     * Epoch numbers written as strings are not date-times.
     */
    public AttributeValue<OffsetDateTime> readDateTime(String name) throws TypeMismatchException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        if (!value.isTextual()) {
            throw new TypeMismatchException(pathOf(name), "an ISO-8601 date-time string", describe(value));
        }
        try {
            return AttributeValue.of(OffsetDateTime.parse(value.textValue(), DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeParseException e) {
            throw new TypeMismatchException(pathOf(name), "an ISO-8601 date-time string",
                    "'" + value.asText() + "'", e);
        }
    }

    public AttributeValue<List<String>> readStringList(String name) throws TypeMismatchException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        String path = pathOf(name);
        if (!value.isArray()) {
            throw new TypeMismatchException(path, "a list of strings", describe(value));
        }
        List<String> values = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            values.add(requireString(value.get(i), path + "[" + i + "]"));
        }
        return AttributeValue.of(values);
    }

    /**
     * Read a singular complex attribute.
     */
    public <T> AttributeValue<T> readComplex(String name, ComplexReader<T> reader) throws ScimModelException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        return AttributeValue.of(readNested(value, pathOf(name), reader));
    }

    /**
     * Read a multi-valued complex attribute, keeping element order.
     */
    public <T> AttributeValue<List<T>> readComplexList(String name, ComplexReader<T> reader)
            throws ScimModelException {
        JsonNode value = take(name);
        if (value == null) {
            return AttributeValue.absent();
        }
        if (value.isNull()) {
            return AttributeValue.ofNull();
        }
        String path = pathOf(name);
        if (!value.isArray()) {
            throw new TypeMismatchException(path, "a list of objects", describe(value));
        }
        List<T> values = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            values.add(readNested(value.get(i), path + "[" + i + "]", reader));
        }
        return AttributeValue.of(values);
    }

    /**
     * Decode a nested JSON object with a reader scoped to it, then apply the
     * sub-record unknown-attribute rule to whatever the reader left over.
     */
    public <T> T readNested(JsonNode value, String path, ComplexReader<T> reader) throws ScimModelException {
        return readNested(value, path, path + ".", reader);
    }

    /**
     * Decode the extension object under a URN key. Paths inside it use the SCIM
     * {@code urn:attribute} notation.
     */
    public <T> T readExtension(String key, ComplexReader<T> reader) throws ScimModelException {
        consumed.add(key);
        return readNested(node.get(key), pathOf(key), pathOf(key) + ":", reader);
    }

    private <T> T readNested(JsonNode value, String path, String childPrefix, ComplexReader<T> reader)
            throws ScimModelException {
        JsonAttributeReader nested = forObject(value, path, childPrefix, policy);
        T result = reader.read(nested);
        nested.finishSubRecord();
        return result;
    }

    /**
     * Sub-records have nowhere to keep unknown attributes: they are rejected under
     * {@link UnknownAttributePolicy#REJECT} and dropped otherwise.
     */
    public void finishSubRecord() throws SchemaViolationException {
        for (String key : remainingKeys()) {
            if (policy == UnknownAttributePolicy.REJECT) {
                throw unknownAttribute(key);
            }
            LOGGER.fine(() -> "Dropping unknown attribute '" + pathOf(key) + "'");
        }
    }

    public SchemaViolationException unknownAttribute(String key) {
        return new SchemaViolationException(pathOf(key),
                String.format("Attribute '%s' is not defined by the declared schemas", pathOf(key)));
    }

    private static String requireString(JsonNode value, String path) throws TypeMismatchException {
        if (value == null || !value.isTextual()) {
            throw new TypeMismatchException(path, "a string", describe(value));
        }
        return value.textValue();
    }

    /**
     * Short description of a JSON value's type for error messages.
     */
    static String describe(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "missing";
        }
        switch (value.getNodeType()) {
            case NULL:
                return "null";
            case STRING:
                return "a string";
            case BOOLEAN:
                return "a boolean";
            case NUMBER:
                return value.isIntegralNumber() ? "an integer (" + value.asText() + ")" : "a decimal number (" + value.asText() + ")";
            case ARRAY:
                return "a list";
            case OBJECT:
                return "an object";
            default:
                return value.getNodeType().name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Decodes one complex value from a reader scoped to its JSON object.
     */
    @FunctionalInterface
    public interface ComplexReader<T> {
        T read(JsonAttributeReader reader) throws ScimModelException;
    }
}
