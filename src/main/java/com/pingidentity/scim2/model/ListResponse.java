package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.List;
import java.util.Objects;

/**
 * Query result message (RFC 7644 Section 3.4.2). {@code Resources} may mix resource types;
 * each element keeps its own type.
 */
public class ListResponse extends ScimMessage {

    private AttributeValue<Long> totalResults = AttributeValue.absent();
    private AttributeValue<Long> startIndex = AttributeValue.absent();
    private AttributeValue<Long> itemsPerPage = AttributeValue.absent();
    private AttributeValue<List<ScimResource>> resources = AttributeValue.absent();

    @Override
    public String getMessageSchemaUrn() {
        return ScimSchemaUrns.LIST_RESPONSE;
    }

    public AttributeValue<Long> getTotalResults() { return totalResults; }
    public void setTotalResults(AttributeValue<Long> totalResults) { this.totalResults = totalResults; }

    /** 1-based index of the first result. */
    public AttributeValue<Long> getStartIndex() { return startIndex; }
    public void setStartIndex(AttributeValue<Long> startIndex) { this.startIndex = startIndex; }

    public AttributeValue<Long> getItemsPerPage() { return itemsPerPage; }
    public void setItemsPerPage(AttributeValue<Long> itemsPerPage) { this.itemsPerPage = itemsPerPage; }

    /** The {@code Resources} attribute. */
    public AttributeValue<List<ScimResource>> getResources() { return resources; }
    public void setResources(AttributeValue<List<ScimResource>> resources) { this.resources = resources; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListResponse)) return false;
        ListResponse that = (ListResponse) o;
        return commonAttributesEqual(that)
                && totalResults.equals(that.totalResults)
                && startIndex.equals(that.startIndex)
                && itemsPerPage.equals(that.itemsPerPage)
                && resources.equals(that.resources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonAttributesHash(), totalResults, startIndex, itemsPerPage, resources);
    }

    @Override
    public String toString() {
        return "ListResponse{totalResults=" + totalResults + ", startIndex=" + startIndex
                + ", itemsPerPage=" + itemsPerPage + '}';
    }
}
