package com.pingidentity.scim2.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for every SCIM resource.
 *
 * <p>Holds the common attributes of RFC 7643 Section 3.1 ({@code schemas}, {@code id},
 * {@code externalId}, {@code meta}) plus the attached schema extensions, keyed by URN,
 * and any unknown top-level attributes kept by the PRESERVE decoding policy.</p>
 *
 * <p>A freshly constructed resource declares no schemas; callers populate
 * {@code schemas} before validating or encoding it for a protocol consumer.</p>
 */
public abstract class ScimResource {

    private AttributeValue<List<String>> schemas = AttributeValue.absent();
    private AttributeValue<String> id = AttributeValue.absent();
    private AttributeValue<String> externalId = AttributeValue.absent();
    private AttributeValue<Meta> meta = AttributeValue.absent();

    private final Map<String, ScimExtension> extensions = new LinkedHashMap<>();
    private final Map<String, JsonNode> unknownAttributes = new LinkedHashMap<>();

    /**
     * @return the core schema URN this resource type is defined by
     */
    public abstract String getBaseSchemaUrn();

    public AttributeValue<List<String>> getSchemas() { return schemas; }
    public void setSchemas(AttributeValue<List<String>> schemas) { this.schemas = schemas; }

    public AttributeValue<String> getId() { return id; }
    public void setId(AttributeValue<String> id) { this.id = id; }

    public AttributeValue<String> getExternalId() { return externalId; }
    public void setExternalId(AttributeValue<String> externalId) { this.externalId = externalId; }

    public AttributeValue<Meta> getMeta() { return meta; }
    public void setMeta(AttributeValue<Meta> meta) { this.meta = meta; }

    /**
     * @return the declared schema URNs, or an empty list when absent or null
     */
    public List<String> getSchemaUrns() {
        return schemas.orElse(Collections.emptyList());
    }

    /**
     * @return read-only view of the attached extensions in attachment order
     */
    public Map<String, ScimExtension> getExtensions() {
        return Collections.unmodifiableMap(extensions);
    }

    /**
     * Find an attached extension by URN. URNs are compared case-insensitively.
     */
    public Optional<ScimExtension> getExtension(String schemaUrn) {
        return Optional.ofNullable(findKey(schemaUrn)).map(extensions::get);
    }

    /**
     * Find the first attached extension of the given payload type.
     */
    public <T extends ScimExtension> Optional<T> getExtension(Class<T> type) {
        return extensions.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }

    /**
     * Attach an extension, replacing any extension already attached under the same URN.
     * This does not touch {@code schemas}; keeping both in step is the caller's job.
     */
    public void putExtension(ScimExtension extension) {
        Objects.requireNonNull(extension, "extension");
        String existing = findKey(extension.getSchemaUrn());
        if (existing != null) {
            extensions.remove(existing);
        }
        extensions.put(extension.getSchemaUrn(), extension);
    }

    /**
     * Detach the extension registered under the URN.
     *
     * @return the removed extension, if one was attached
     */
    public Optional<ScimExtension> removeExtension(String schemaUrn) {
        String existing = findKey(schemaUrn);
        return existing == null ? Optional.empty() : Optional.of(extensions.remove(existing));
    }

    /**
     * Attach an extension and declare its URN in {@code schemas}, keeping both in step.
     */
    public void attachExtension(ScimExtension extension) {
        putExtension(extension);
        List<String> declared = new ArrayList<>(getSchemaUrns());
        if (declared.stream().noneMatch(urn -> urn.equalsIgnoreCase(extension.getSchemaUrn()))) {
            declared.add(extension.getSchemaUrn());
            schemas = AttributeValue.of(declared);
        }
    }

    /**
     * Detach an extension and drop its URN from {@code schemas}.
     *
     * @return the removed extension, if one was attached
     */
    public Optional<ScimExtension> detachExtension(String schemaUrn) {
        if (schemas.hasValue()) {
            List<String> declared = new ArrayList<>(schemas.get());
            if (declared.removeIf(urn -> urn.equalsIgnoreCase(schemaUrn))) {
                schemas = AttributeValue.of(declared);
            }
        }
        return removeExtension(schemaUrn);
    }

    /**
     * @return read-only view of unknown top-level attributes kept while decoding
     */
    public Map<String, JsonNode> getUnknownAttributes() {
        return Collections.unmodifiableMap(unknownAttributes);
    }

    public void putUnknownAttribute(String name, JsonNode value) {
        unknownAttributes.put(Objects.requireNonNull(name, "name"), value);
    }

    public void clearUnknownAttributes() {
        unknownAttributes.clear();
    }

    private String findKey(String schemaUrn) {
        if (schemaUrn == null) {
            return null;
        }
        for (String key : extensions.keySet()) {
            if (key.equalsIgnoreCase(schemaUrn)) {
                return key;
            }
        }
        return null;
    }

    /**
     * Compare the common attributes; subclasses call this from {@code equals}.
     */
    protected boolean commonAttributesEqual(ScimResource other) {
        return schemas.equals(other.schemas)
                && id.equals(other.id)
                && externalId.equals(other.externalId)
                && meta.equals(other.meta)
                && extensions.equals(other.extensions)
                && unknownAttributes.equals(other.unknownAttributes);
    }

    protected int commonAttributesHash() {
        return Objects.hash(schemas, id, externalId, meta, extensions, unknownAttributes);
    }
}
