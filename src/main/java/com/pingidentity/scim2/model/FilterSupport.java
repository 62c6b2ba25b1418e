package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Filter capability and the maximum number of resources a filtered query returns.
 */
public class FilterSupport extends SupportedFeature {

    private AttributeValue<Long> maxResults = AttributeValue.absent();

    public FilterSupport() {
    }

    public FilterSupport(boolean supported, long maxResults) {
        super(supported);
        this.maxResults = AttributeValue.of(maxResults);
    }

    public AttributeValue<Long> getMaxResults() { return maxResults; }
    public void setMaxResults(AttributeValue<Long> maxResults) { this.maxResults = maxResults; }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        return maxResults.equals(((FilterSupport) o).maxResults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), maxResults);
    }
}
