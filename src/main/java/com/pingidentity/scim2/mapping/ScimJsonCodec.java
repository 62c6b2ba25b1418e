package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.config.ScimCodecConfig;
import com.pingidentity.scim2.config.ScimObjectMapperProvider;
import com.pingidentity.scim2.config.UnknownAttributePolicy;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.exceptions.ScimSyntaxException;
import com.pingidentity.scim2.model.EnterpriseUser;
import com.pingidentity.scim2.model.ListResponse;
import com.pingidentity.scim2.model.ScimResource;
import com.pingidentity.scim2.model.SearchRequest;

import java.util.logging.Logger;

/**
 * Converts SCIM resources and messages to and from JSON text.
 *
 * <p>Decoding parses the text with duplicate-key and trailing-content detection, then
 * maps the tree onto the model without coercing any value. Decoding never validates;
 * requiredness and the other schema rules are the validator's job.</p>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 */
public class ScimJsonCodec {

    private static final Logger LOGGER = Logger.getLogger(ScimJsonCodec.class.getName());

    private final ObjectMapper objectMapper;
    private final UnknownAttributePolicy policy;
    private final ResourceJsonMappers resourceMappers;
    private final ListResponseJsonMapper listResponseMapper;
    private final SearchRequestJsonMapper searchRequestMapper;

    public ScimJsonCodec(ScimCodecConfig config) {
        this(config, new ScimObjectMapperProvider(config).getObjectMapper());
    }

    /**
     * @param objectMapper mapper used to parse and write JSON; should be configured like
     *                     {@link ScimObjectMapperProvider} does
     */
    public ScimJsonCodec(ScimCodecConfig config, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.policy = config.getUnknownAttributePolicy();
        this.resourceMappers = new ResourceJsonMappers(objectMapper);
        this.listResponseMapper = new ListResponseJsonMapper(objectMapper, resourceMappers);
        this.searchRequestMapper = new SearchRequestJsonMapper(objectMapper);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public UnknownAttributePolicy getPolicy() {
        return policy;
    }

    // ---- encoding ----

    public ObjectNode encode(ScimResource resource) {
        return resourceMappers.encode(resource);
    }

    public ObjectNode encode(ListResponse listResponse) {
        return listResponseMapper.encode(listResponse);
    }

    public ObjectNode encode(SearchRequest searchRequest) {
        return searchRequestMapper.encode(searchRequest);
    }

    /**
     * Encode a stand-alone Enterprise User payload, without {@code schemas}.
     */
    public ObjectNode encode(EnterpriseUser enterpriseUser) {
        JsonAttributeWriter writer = new JsonAttributeWriter(objectMapper);
        EnterpriseUserJsonMapper.write(enterpriseUser, writer);
        return writer.getNode();
    }

    /**
     * Serialize a tree to JSON text.
     *
     * @throws IllegalStateException if Jackson cannot write the tree
     */
    public String write(JsonNode tree) {
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write SCIM JSON", e);
        }
    }

    // ---- decoding ----

    /**
     * Parse JSON text into a tree.
     *
     * @throws ScimSyntaxException if the text is empty or not well-formed JSON, or repeats a key
     */
    public JsonNode parse(String json) throws ScimSyntaxException {
        if (json == null || json.isBlank()) {
            throw new ScimSyntaxException("JSON document is empty");
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOGGER.fine(() -> "Rejected malformed JSON: " + e.getOriginalMessage());
            throw new ScimSyntaxException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null || tree.isMissingNode()) {
            throw new ScimSyntaxException("JSON document is empty");
        }
        return tree;
    }

    public <T extends ScimResource> T decode(String json, Class<T> type) throws ScimModelException {
        return decode(parse(json), type);
    }

    /**
     * Decode an already parsed tree.
     */
    public <T extends ScimResource> T decode(JsonNode tree, Class<T> type) throws ScimModelException {
        return resourceMappers.forClass(type).decode(reader(tree));
    }

    public ListResponse decodeListResponse(String json) throws ScimModelException {
        return listResponseMapper.decode(reader(parse(json)));
    }

    public SearchRequest decodeSearchRequest(String json) throws ScimModelException {
        return searchRequestMapper.decode(reader(parse(json)));
    }

    /**
     * Decode a stand-alone Enterprise User payload. It has nowhere to keep unknown
     * attributes, so they are rejected under REJECT and dropped otherwise.
     */
    public EnterpriseUser decodeEnterpriseUser(String json) throws ScimModelException {
        JsonAttributeReader reader = reader(parse(json));
        EnterpriseUser enterpriseUser = EnterpriseUserJsonMapper.read(reader);
        reader.finishSubRecord();
        return enterpriseUser;
    }

    private JsonAttributeReader reader(JsonNode tree) throws ScimModelException {
        return JsonAttributeReader.forDocument(tree, policy);
    }
}
