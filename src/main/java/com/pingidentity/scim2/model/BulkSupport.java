package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Bulk operation capability and its limits.
 */
public class BulkSupport extends SupportedFeature {

    private AttributeValue<Long> maxOperations = AttributeValue.absent();
    private AttributeValue<Long> maxPayloadSize = AttributeValue.absent();

    public BulkSupport() {
    }

    public BulkSupport(boolean supported, long maxOperations, long maxPayloadSize) {
        super(supported);
        this.maxOperations = AttributeValue.of(maxOperations);
        this.maxPayloadSize = AttributeValue.of(maxPayloadSize);
    }

    public AttributeValue<Long> getMaxOperations() { return maxOperations; }
    public void setMaxOperations(AttributeValue<Long> maxOperations) { this.maxOperations = maxOperations; }

    /** Maximum payload size in bytes. */
    public AttributeValue<Long> getMaxPayloadSize() { return maxPayloadSize; }
    public void setMaxPayloadSize(AttributeValue<Long> maxPayloadSize) { this.maxPayloadSize = maxPayloadSize; }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        BulkSupport that = (BulkSupport) o;
        return maxOperations.equals(that.maxOperations) && maxPayloadSize.equals(that.maxPayloadSize);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), maxOperations, maxPayloadSize);
    }
}
