package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Components of a User's real name.
 */
public class Name {

    private AttributeValue<String> formatted = AttributeValue.absent();
    private AttributeValue<String> familyName = AttributeValue.absent();
    private AttributeValue<String> givenName = AttributeValue.absent();
    private AttributeValue<String> middleName = AttributeValue.absent();
    private AttributeValue<String> honorificPrefix = AttributeValue.absent();
    private AttributeValue<String> honorificSuffix = AttributeValue.absent();

    public AttributeValue<String> getFormatted() { return formatted; }
    public void setFormatted(AttributeValue<String> formatted) { this.formatted = formatted; }

    public AttributeValue<String> getFamilyName() { return familyName; }
    public void setFamilyName(AttributeValue<String> familyName) { this.familyName = familyName; }

    public AttributeValue<String> getGivenName() { return givenName; }
    public void setGivenName(AttributeValue<String> givenName) { this.givenName = givenName; }

    public AttributeValue<String> getMiddleName() { return middleName; }
    public void setMiddleName(AttributeValue<String> middleName) { this.middleName = middleName; }

    public AttributeValue<String> getHonorificPrefix() { return honorificPrefix; }
    public void setHonorificPrefix(AttributeValue<String> honorificPrefix) { this.honorificPrefix = honorificPrefix; }

    public AttributeValue<String> getHonorificSuffix() { return honorificSuffix; }
    public void setHonorificSuffix(AttributeValue<String> honorificSuffix) { this.honorificSuffix = honorificSuffix; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Name)) return false;
        Name name = (Name) o;
        return formatted.equals(name.formatted)
                && familyName.equals(name.familyName)
                && givenName.equals(name.givenName)
                && middleName.equals(name.middleName)
                && honorificPrefix.equals(name.honorificPrefix)
                && honorificSuffix.equals(name.honorificSuffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formatted, familyName, givenName, middleName, honorificPrefix, honorificSuffix);
    }

    @Override
    public String toString() {
        return "Name{formatted=" + formatted + ", familyName=" + familyName + ", givenName=" + givenName + '}';
    }
}
