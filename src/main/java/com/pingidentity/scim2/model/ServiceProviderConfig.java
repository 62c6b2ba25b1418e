package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.List;
import java.util.Objects;

/**
 * Service provider capability descriptor (RFC 7643 Section 5).
 */
public class ServiceProviderConfig extends ScimResource {

    private AttributeValue<String> documentationUri = AttributeValue.absent();
    private AttributeValue<SupportedFeature> patch = AttributeValue.absent();
    private AttributeValue<BulkSupport> bulk = AttributeValue.absent();
    private AttributeValue<FilterSupport> filter = AttributeValue.absent();
    private AttributeValue<SupportedFeature> changePassword = AttributeValue.absent();
    private AttributeValue<SupportedFeature> sort = AttributeValue.absent();
    private AttributeValue<SupportedFeature> etag = AttributeValue.absent();
    private AttributeValue<List<AuthenticationScheme>> authenticationSchemes = AttributeValue.absent();

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.SERVICE_PROVIDER_CONFIG;
    }

    public AttributeValue<String> getDocumentationUri() { return documentationUri; }
    public void setDocumentationUri(AttributeValue<String> documentationUri) { this.documentationUri = documentationUri; }

    public AttributeValue<SupportedFeature> getPatch() { return patch; }
    public void setPatch(AttributeValue<SupportedFeature> patch) { this.patch = patch; }

    public AttributeValue<BulkSupport> getBulk() { return bulk; }
    public void setBulk(AttributeValue<BulkSupport> bulk) { this.bulk = bulk; }

    public AttributeValue<FilterSupport> getFilter() { return filter; }
    public void setFilter(AttributeValue<FilterSupport> filter) { this.filter = filter; }

    public AttributeValue<SupportedFeature> getChangePassword() { return changePassword; }
    public void setChangePassword(AttributeValue<SupportedFeature> changePassword) { this.changePassword = changePassword; }

    public AttributeValue<SupportedFeature> getSort() { return sort; }
    public void setSort(AttributeValue<SupportedFeature> sort) { this.sort = sort; }

    public AttributeValue<SupportedFeature> getEtag() { return etag; }
    public void setEtag(AttributeValue<SupportedFeature> etag) { this.etag = etag; }

    public AttributeValue<List<AuthenticationScheme>> getAuthenticationSchemes() { return authenticationSchemes; }
    public void setAuthenticationSchemes(AttributeValue<List<AuthenticationScheme>> authenticationSchemes) { this.authenticationSchemes = authenticationSchemes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceProviderConfig)) return false;
        ServiceProviderConfig that = (ServiceProviderConfig) o;
        return commonAttributesEqual(that)
                && documentationUri.equals(that.documentationUri)
                && patch.equals(that.patch)
                && bulk.equals(that.bulk)
                && filter.equals(that.filter)
                && changePassword.equals(that.changePassword)
                && sort.equals(that.sort)
                && etag.equals(that.etag)
                && authenticationSchemes.equals(that.authenticationSchemes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonAttributesHash(), documentationUri, patch, bulk, filter, changePassword, sort,
                etag, authenticationSchemes);
    }

    @Override
    public String toString() {
        return "ServiceProviderConfig{patch=" + patch + ", bulk=" + bulk + ", filter=" + filter + '}';
    }
}
