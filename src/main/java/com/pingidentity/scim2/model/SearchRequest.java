package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.List;
import java.util.Objects;

/**
 * Query message sent with POST {@code /.search} (RFC 7644 Section 3.4.3).
 *
 * <p>The filter is carried as an opaque string; evaluating it is left to the service provider.</p>
 */
public class SearchRequest extends ScimMessage {

    private AttributeValue<List<String>> attributes = AttributeValue.absent();
    private AttributeValue<List<String>> excludedAttributes = AttributeValue.absent();
    private AttributeValue<String> filter = AttributeValue.absent();
    private AttributeValue<String> sortBy = AttributeValue.absent();
    private AttributeValue<String> sortOrder = AttributeValue.absent();
    private AttributeValue<Long> startIndex = AttributeValue.absent();
    private AttributeValue<Long> count = AttributeValue.absent();

    @Override
    public String getMessageSchemaUrn() {
        return ScimSchemaUrns.SEARCH_REQUEST;
    }

    public AttributeValue<List<String>> getAttributes() { return attributes; }
    public void setAttributes(AttributeValue<List<String>> attributes) { this.attributes = attributes; }

    public AttributeValue<List<String>> getExcludedAttributes() { return excludedAttributes; }
    public void setExcludedAttributes(AttributeValue<List<String>> excludedAttributes) { this.excludedAttributes = excludedAttributes; }

    public AttributeValue<String> getFilter() { return filter; }
    public void setFilter(AttributeValue<String> filter) { this.filter = filter; }

    public AttributeValue<String> getSortBy() { return sortBy; }
    public void setSortBy(AttributeValue<String> sortBy) { this.sortBy = sortBy; }

    public AttributeValue<String> getSortOrder() { return sortOrder; }
    public void setSortOrder(AttributeValue<String> sortOrder) { this.sortOrder = sortOrder; }

    public AttributeValue<Long> getStartIndex() { return startIndex; }
    public void setStartIndex(AttributeValue<Long> startIndex) { this.startIndex = startIndex; }

    public AttributeValue<Long> getCount() { return count; }
    public void setCount(AttributeValue<Long> count) { this.count = count; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchRequest)) return false;
        SearchRequest that = (SearchRequest) o;
        return commonAttributesEqual(that)
                && attributes.equals(that.attributes)
                && excludedAttributes.equals(that.excludedAttributes)
                && filter.equals(that.filter)
                && sortBy.equals(that.sortBy)
                && sortOrder.equals(that.sortOrder)
                && startIndex.equals(that.startIndex)
                && count.equals(that.count);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonAttributesHash(), attributes, excludedAttributes, filter, sortBy, sortOrder,
                startIndex, count);
    }

    @Override
    public String toString() {
        return "SearchRequest{filter=" + filter + ", startIndex=" + startIndex + ", count=" + count + '}';
    }
}
