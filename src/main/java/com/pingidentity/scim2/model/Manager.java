package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * The User's manager, as carried by the enterprise extension.
 */
public class Manager {

    private AttributeValue<String> value = AttributeValue.absent();
    private AttributeValue<String> ref = AttributeValue.absent();
    private AttributeValue<String> displayName = AttributeValue.absent();

    public Manager() {
    }

    public Manager(String value) {
        this.value = AttributeValue.ofOptional(value);
    }

    /** The id of the manager's User resource. */
    public AttributeValue<String> getValue() { return value; }
    public void setValue(AttributeValue<String> value) { this.value = value; }

    public AttributeValue<String> getRef() { return ref; }
    public void setRef(AttributeValue<String> ref) { this.ref = ref; }

    public AttributeValue<String> getDisplayName() { return displayName; }
    public void setDisplayName(AttributeValue<String> displayName) { this.displayName = displayName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Manager)) return false;
        Manager manager = (Manager) o;
        return value.equals(manager.value) && ref.equals(manager.ref) && displayName.equals(manager.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, ref, displayName);
    }

    @Override
    public String toString() {
        return "Manager{value=" + value + ", displayName=" + displayName + '}';
    }
}
