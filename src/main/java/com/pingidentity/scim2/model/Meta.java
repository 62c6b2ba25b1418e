package com.pingidentity.scim2.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Resource metadata ({@code meta}), maintained by the service provider.
 */
public class Meta {

    private AttributeValue<String> resourceType = AttributeValue.absent();
    private AttributeValue<OffsetDateTime> created = AttributeValue.absent();
    private AttributeValue<OffsetDateTime> lastModified = AttributeValue.absent();
    private AttributeValue<String> location = AttributeValue.absent();
    private AttributeValue<String> version = AttributeValue.absent();

    public AttributeValue<String> getResourceType() { return resourceType; }
    public void setResourceType(AttributeValue<String> resourceType) { this.resourceType = resourceType; }

    public AttributeValue<OffsetDateTime> getCreated() { return created; }
    public void setCreated(AttributeValue<OffsetDateTime> created) { this.created = created; }

    public AttributeValue<OffsetDateTime> getLastModified() { return lastModified; }
    public void setLastModified(AttributeValue<OffsetDateTime> lastModified) { this.lastModified = lastModified; }

    public AttributeValue<String> getLocation() { return location; }
    public void setLocation(AttributeValue<String> location) { this.location = location; }

    public AttributeValue<String> getVersion() { return version; }
    public void setVersion(AttributeValue<String> version) { this.version = version; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Meta)) return false;
        Meta meta = (Meta) o;
        return resourceType.equals(meta.resourceType)
                && created.equals(meta.created)
                && lastModified.equals(meta.lastModified)
                && location.equals(meta.location)
                && version.equals(meta.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, created, lastModified, location, version);
    }

    @Override
    public String toString() {
        return "Meta{resourceType=" + resourceType + ", location=" + location + ", version=" + version + '}';
    }
}
