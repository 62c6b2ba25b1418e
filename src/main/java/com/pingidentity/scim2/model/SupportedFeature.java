package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * A service provider capability that is either supported or not.
 */
public class SupportedFeature {

    private AttributeValue<Boolean> supported = AttributeValue.absent();

    public SupportedFeature() {
    }

    public SupportedFeature(boolean supported) {
        this.supported = AttributeValue.of(supported);
    }

    public AttributeValue<Boolean> getSupported() { return supported; }
    public void setSupported(AttributeValue<Boolean> supported) { this.supported = supported; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return supported.equals(((SupportedFeature) o).supported);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), supported);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{supported=" + supported + '}';
    }
}
