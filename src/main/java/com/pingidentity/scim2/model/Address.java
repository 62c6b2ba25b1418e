package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Physical mailing address of a User. Canonical types are work, home and other.
 */
public class Address {

    private AttributeValue<String> formatted = AttributeValue.absent();
    private AttributeValue<String> streetAddress = AttributeValue.absent();
    private AttributeValue<String> locality = AttributeValue.absent();
    private AttributeValue<String> region = AttributeValue.absent();
    private AttributeValue<String> postalCode = AttributeValue.absent();
    private AttributeValue<String> country = AttributeValue.absent();
    private AttributeValue<String> type = AttributeValue.absent();
    private AttributeValue<Boolean> primary = AttributeValue.absent();

    public AttributeValue<String> getFormatted() { return formatted; }
    public void setFormatted(AttributeValue<String> formatted) { this.formatted = formatted; }

    public AttributeValue<String> getStreetAddress() { return streetAddress; }
    public void setStreetAddress(AttributeValue<String> streetAddress) { this.streetAddress = streetAddress; }

    public AttributeValue<String> getLocality() { return locality; }
    public void setLocality(AttributeValue<String> locality) { this.locality = locality; }

    public AttributeValue<String> getRegion() { return region; }
    public void setRegion(AttributeValue<String> region) { this.region = region; }

    public AttributeValue<String> getPostalCode() { return postalCode; }
    public void setPostalCode(AttributeValue<String> postalCode) { this.postalCode = postalCode; }

    /** ISO 3166-1 alpha-2 country code. */
    public AttributeValue<String> getCountry() { return country; }
    public void setCountry(AttributeValue<String> country) { this.country = country; }

    public AttributeValue<String> getType() { return type; }
    public void setType(AttributeValue<String> type) { this.type = type; }

    public AttributeValue<Boolean> getPrimary() { return primary; }
    public void setPrimary(AttributeValue<Boolean> primary) { this.primary = primary; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        Address address = (Address) o;
        return formatted.equals(address.formatted)
                && streetAddress.equals(address.streetAddress)
                && locality.equals(address.locality)
                && region.equals(address.region)
                && postalCode.equals(address.postalCode)
                && country.equals(address.country)
                && type.equals(address.type)
                && primary.equals(address.primary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formatted, streetAddress, locality, region, postalCode, country, type, primary);
    }

    @Override
    public String toString() {
        return "Address{formatted=" + formatted + ", type=" + type + ", primary=" + primary + '}';
    }
}
