package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.SearchRequest;

/**
 * JSON mapper for the SearchRequest message (RFC 7644 Section 3.4.3).
 * The filter is carried as an opaque string.
 */
public class SearchRequestJsonMapper extends MessageJsonMapper<SearchRequest> {

    public SearchRequestJsonMapper(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected SearchRequest newMessage() {
        return new SearchRequest();
    }

    @Override
    protected void readAttributes(JsonAttributeReader reader, SearchRequest request) throws ScimModelException {
        request.setAttributes(reader.readStringList("attributes"));
        request.setExcludedAttributes(reader.readStringList("excludedAttributes"));
        request.setFilter(reader.readString("filter"));
        request.setSortBy(reader.readString("sortBy"));
        request.setSortOrder(reader.readString("sortOrder"));
        request.setStartIndex(reader.readLong("startIndex"));
        request.setCount(reader.readLong("count"));
    }

    @Override
    protected void writeAttributes(SearchRequest request, JsonAttributeWriter writer) {
        writer.writeStringList("attributes", request.getAttributes())
                .writeStringList("excludedAttributes", request.getExcludedAttributes())
                .writeString("filter", request.getFilter())
                .writeString("sortBy", request.getSortBy())
                .writeString("sortOrder", request.getSortOrder())
                .writeLong("startIndex", request.getStartIndex())
                .writeLong("count", request.getCount());
    }
}
