package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Element of a standard multi-valued attribute (RFC 7643 Section 2.4): a value with an
 * optional display text, type label and primary flag.
 */
public abstract class MultiValuedAttribute {

    private AttributeValue<String> value = AttributeValue.absent();
    private AttributeValue<String> display = AttributeValue.absent();
    private AttributeValue<String> type = AttributeValue.absent();
    private AttributeValue<Boolean> primary = AttributeValue.absent();

    protected MultiValuedAttribute() {
    }

    protected MultiValuedAttribute(String value, String type, boolean primary) {
        this.value = AttributeValue.ofOptional(value);
        this.type = AttributeValue.ofOptional(type);
        this.primary = AttributeValue.of(primary);
    }

    public AttributeValue<String> getValue() { return value; }
    public void setValue(AttributeValue<String> value) { this.value = value; }

    public AttributeValue<String> getDisplay() { return display; }
    public void setDisplay(AttributeValue<String> display) { this.display = display; }

    public AttributeValue<String> getType() { return type; }
    public void setType(AttributeValue<String> type) { this.type = type; }

    public AttributeValue<Boolean> getPrimary() { return primary; }
    public void setPrimary(AttributeValue<Boolean> primary) { this.primary = primary; }

    /**
     * @return true only when primary is explicitly set to true
     */
    public boolean isPrimary() {
        return Boolean.TRUE.equals(primary.orElse(Boolean.FALSE));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MultiValuedAttribute that = (MultiValuedAttribute) o;
        return value.equals(that.value)
                && display.equals(that.display)
                && type.equals(that.type)
                && primary.equals(that.primary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value, display, type, primary);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{value=" + value + ", type=" + type + ", primary=" + primary + '}';
    }
}
