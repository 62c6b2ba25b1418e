package com.pingidentity.scim2.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.ws.rs.ext.ContextResolver;
import jakarta.ws.rs.ext.Provider;

/**
 * Jackson ObjectMapper configuration for the SCIM codec.
 *
 * <p>The codec works on the JSON tree and decides itself which attributes are written,
 * so no serialization inclusion filter is set here: explicit nulls survive a round trip.</p>
 *
 * <p>Parsing is strict:</p>
 * <ul>
 *   <li>duplicate keys in one object fail the parse</li>
 *   <li>content after the top-level value fails the parse</li>
 * </ul>
 *
 * <p>Register with a JAX-RS application to share the same configuration with an HTTP binding.</p>
 */
@Provider
public class ScimObjectMapperProvider implements ContextResolver<ObjectMapper> {

    private final ObjectMapper objectMapper;

    public ScimObjectMapperProvider() {
        this(false);
    }

    /**
     * @param prettyPrint indent serialized output
     */
    public ScimObjectMapperProvider(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper();

        this.objectMapper.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

        // SCIM uses ISO 8601 format: "2024-01-15T10:30:00Z"
        this.objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.objectMapper.registerModule(new JavaTimeModule());

        this.objectMapper.configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    public ScimObjectMapperProvider(ScimCodecConfig config) {
        this(config.isPrettyPrint());
    }

    @Override
    public ObjectMapper getContext(Class<?> type) {
        return objectMapper;
    }

    /**
     * Get the configured ObjectMapper for use outside a JAX-RS context.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
