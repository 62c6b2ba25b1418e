package com.pingidentity.scim2.model;

import java.util.Objects;

/**
 * Authentication scheme supported by the service provider.
 */
public class AuthenticationScheme {

    private AttributeValue<String> type = AttributeValue.absent();
    private AttributeValue<String> name = AttributeValue.absent();
    private AttributeValue<String> description = AttributeValue.absent();
    private AttributeValue<String> specUri = AttributeValue.absent();
    private AttributeValue<String> documentationUri = AttributeValue.absent();
    private AttributeValue<Boolean> primary = AttributeValue.absent();

    public AttributeValue<String> getType() { return type; }
    public void setType(AttributeValue<String> type) { this.type = type; }

    public AttributeValue<String> getName() { return name; }
    public void setName(AttributeValue<String> name) { this.name = name; }

    public AttributeValue<String> getDescription() { return description; }
    public void setDescription(AttributeValue<String> description) { this.description = description; }

    public AttributeValue<String> getSpecUri() { return specUri; }
    public void setSpecUri(AttributeValue<String> specUri) { this.specUri = specUri; }

    public AttributeValue<String> getDocumentationUri() { return documentationUri; }
    public void setDocumentationUri(AttributeValue<String> documentationUri) { this.documentationUri = documentationUri; }

    public AttributeValue<Boolean> getPrimary() { return primary; }
    public void setPrimary(AttributeValue<Boolean> primary) { this.primary = primary; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthenticationScheme)) return false;
        AuthenticationScheme that = (AuthenticationScheme) o;
        return type.equals(that.type)
                && name.equals(that.name)
                && description.equals(that.description)
                && specUri.equals(that.specUri)
                && documentationUri.equals(that.documentationUri)
                && primary.equals(that.primary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, description, specUri, documentationUri, primary);
    }

    @Override
    public String toString() {
        return "AuthenticationScheme{type=" + type + ", name=" + name + '}';
    }
}
