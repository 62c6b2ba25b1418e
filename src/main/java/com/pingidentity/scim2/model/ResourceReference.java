package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Reference from one resource to another: identifier, URI, display text and type label.
 */
public abstract class ResourceReference {

    private AttributeValue<String> value = AttributeValue.absent();
    private AttributeValue<String> ref = AttributeValue.absent();
    private AttributeValue<String> display = AttributeValue.absent();
    private AttributeValue<String> type = AttributeValue.absent();

    protected ResourceReference() {
    }

    protected ResourceReference(String value, String ref, String display) {
        this.value = AttributeValue.ofOptional(value);
        this.ref = AttributeValue.ofOptional(ref);
        this.display = AttributeValue.ofOptional(display);
    }

    public AttributeValue<String> getValue() { return value; }
    public void setValue(AttributeValue<String> value) { this.value = value; }

    /** The {@code $ref} sub-attribute. */
    public AttributeValue<String> getRef() { return ref; }
    public void setRef(AttributeValue<String> ref) { this.ref = ref; }

    public AttributeValue<String> getDisplay() { return display; }
    public void setDisplay(AttributeValue<String> display) { this.display = display; }

    public AttributeValue<String> getType() { return type; }
    public void setType(AttributeValue<String> type) { this.type = type; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceReference that = (ResourceReference) o;
        return value.equals(that.value)
                && ref.equals(that.ref)
                && display.equals(that.display)
                && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value, ref, display, type);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{value=" + value + ", $ref=" + ref + ", type=" + type + '}';
    }
}
