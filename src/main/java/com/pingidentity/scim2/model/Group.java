package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.List;
import java.util.Objects;

/**
 * SCIM Group resource (RFC 7643 Section 4.2).
 */
public class Group extends ScimResource {

    private AttributeValue<String> displayName = AttributeValue.absent();
    private AttributeValue<List<Member>> members = AttributeValue.absent();

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.CORE_GROUP_SCHEMA;
    }

    public AttributeValue<String> getDisplayName() { return displayName; }
    public void setDisplayName(AttributeValue<String> displayName) { this.displayName = displayName; }

    public AttributeValue<List<Member>> getMembers() { return members; }
    public void setMembers(AttributeValue<List<Member>> members) { this.members = members; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Group)) return false;
        Group group = (Group) o;
        return commonAttributesEqual(group)
                && displayName.equals(group.displayName)
                && members.equals(group.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonAttributesHash(), displayName, members);
    }

    @Override
    public String toString() {
        return "Group{id=" + getId() + ", displayName=" + displayName + ", members=" + members + '}';
    }
}
