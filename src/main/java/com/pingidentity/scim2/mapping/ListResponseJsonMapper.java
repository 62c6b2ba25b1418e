package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingidentity.scim2.exceptions.SchemaViolationException;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.mapping.JsonAttributeReader.ComplexReader;
import com.pingidentity.scim2.model.ListResponse;
import com.pingidentity.scim2.model.ScimResource;

/**
 * JSON mapper for the ListResponse message (RFC 7644 Section 3.4.2).
 *
 * <p>Each element of {@code Resources} is decoded by the resource mapper whose base
 * schema URN it declares, so one response may mix resource types.</p>
 */
public class ListResponseJsonMapper extends MessageJsonMapper<ListResponse> {

    private final ResourceJsonMappers resourceMappers;

    public ListResponseJsonMapper(ObjectMapper objectMapper, ResourceJsonMappers resourceMappers) {
        super(objectMapper);
        this.resourceMappers = resourceMappers;
    }

    @Override
    protected ListResponse newMessage() {
        return new ListResponse();
    }

    @Override
    protected void readAttributes(JsonAttributeReader reader, ListResponse listResponse) throws ScimModelException {
        listResponse.setTotalResults(reader.readLong("totalResults"));
        listResponse.setStartIndex(reader.readLong("startIndex"));
        listResponse.setItemsPerPage(reader.readLong("itemsPerPage"));
        listResponse.setResources(reader.readComplexList("Resources", resourceReader()));
    }

    @Override
    protected void writeAttributes(ListResponse listResponse, JsonAttributeWriter writer) {
        writer.writeLong("totalResults", listResponse.getTotalResults())
                .writeLong("startIndex", listResponse.getStartIndex())
                .writeLong("itemsPerPage", listResponse.getItemsPerPage())
                .writeList("Resources", listResponse.getResources(), resourceMappers::encode);
    }

    private ComplexReader<ScimResource> resourceReader() {
        return reader -> {
            ResourceJsonMapper<? extends ScimResource> mapper = resourceMappers.forSchemas(reader.peek("schemas"))
                    .orElseThrow(() -> new SchemaViolationException(reader.pathOf("schemas"),
                            "Attribute 'schemas' names no supported resource type"));
            return mapper.decode(reader);
        };
    }
}
