package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SCIM User resource (RFC 7643 Section 4.1).
 *
 * <p>Multi-valued attributes are ordered lists; the order read from the wire is kept
 * through a round trip. The Enterprise User extension is composed onto a User through
 * the extension map, see {@link #setEnterpriseUser(EnterpriseUser)}.</p>
 */
public class User extends ScimResource {

    private AttributeValue<String> userName = AttributeValue.absent();
    private AttributeValue<Name> name = AttributeValue.absent();
    private AttributeValue<String> displayName = AttributeValue.absent();
    private AttributeValue<String> nickName = AttributeValue.absent();
    private AttributeValue<String> profileUrl = AttributeValue.absent();
    private AttributeValue<String> title = AttributeValue.absent();
    private AttributeValue<String> userType = AttributeValue.absent();
    private AttributeValue<String> preferredLanguage = AttributeValue.absent();
    private AttributeValue<String> locale = AttributeValue.absent();
    private AttributeValue<String> timezone = AttributeValue.absent();
    private AttributeValue<Boolean> active = AttributeValue.absent();
    private AttributeValue<String> password = AttributeValue.absent();

    private AttributeValue<List<Email>> emails = AttributeValue.absent();
    private AttributeValue<List<PhoneNumber>> phoneNumbers = AttributeValue.absent();
    private AttributeValue<List<Im>> ims = AttributeValue.absent();
    private AttributeValue<List<Photo>> photos = AttributeValue.absent();
    private AttributeValue<List<Address>> addresses = AttributeValue.absent();
    private AttributeValue<List<GroupMembership>> groups = AttributeValue.absent();
    private AttributeValue<List<Entitlement>> entitlements = AttributeValue.absent();
    private AttributeValue<List<Role>> roles = AttributeValue.absent();
    private AttributeValue<List<X509Certificate>> x509Certificates = AttributeValue.absent();

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.CORE_USER_SCHEMA;
    }

    public AttributeValue<String> getUserName() { return userName; }
    public void setUserName(AttributeValue<String> userName) { this.userName = userName; }

    public AttributeValue<Name> getName() { return name; }
    public void setName(AttributeValue<Name> name) { this.name = name; }

    public AttributeValue<String> getDisplayName() { return displayName; }
    public void setDisplayName(AttributeValue<String> displayName) { this.displayName = displayName; }

    public AttributeValue<String> getNickName() { return nickName; }
    public void setNickName(AttributeValue<String> nickName) { this.nickName = nickName; }

    public AttributeValue<String> getProfileUrl() { return profileUrl; }
    public void setProfileUrl(AttributeValue<String> profileUrl) { this.profileUrl = profileUrl; }

    public AttributeValue<String> getTitle() { return title; }
    public void setTitle(AttributeValue<String> title) { this.title = title; }

    public AttributeValue<String> getUserType() { return userType; }
    public void setUserType(AttributeValue<String> userType) { this.userType = userType; }

    public AttributeValue<String> getPreferredLanguage() { return preferredLanguage; }
    public void setPreferredLanguage(AttributeValue<String> preferredLanguage) { this.preferredLanguage = preferredLanguage; }

    public AttributeValue<String> getLocale() { return locale; }
    public void setLocale(AttributeValue<String> locale) { this.locale = locale; }

    public AttributeValue<String> getTimezone() { return timezone; }
    public void setTimezone(AttributeValue<String> timezone) { this.timezone = timezone; }

    public AttributeValue<Boolean> getActive() { return active; }
    public void setActive(AttributeValue<Boolean> active) { this.active = active; }

    /** Write-only; a service provider never returns it. */
    public AttributeValue<String> getPassword() { return password; }
    public void setPassword(AttributeValue<String> password) { this.password = password; }

    public AttributeValue<List<Email>> getEmails() { return emails; }
    public void setEmails(AttributeValue<List<Email>> emails) { this.emails = emails; }

    public AttributeValue<List<PhoneNumber>> getPhoneNumbers() { return phoneNumbers; }
    public void setPhoneNumbers(AttributeValue<List<PhoneNumber>> phoneNumbers) { this.phoneNumbers = phoneNumbers; }

    public AttributeValue<List<Im>> getIms() { return ims; }
    public void setIms(AttributeValue<List<Im>> ims) { this.ims = ims; }

    public AttributeValue<List<Photo>> getPhotos() { return photos; }
    public void setPhotos(AttributeValue<List<Photo>> photos) { this.photos = photos; }

    public AttributeValue<List<Address>> getAddresses() { return addresses; }
    public void setAddresses(AttributeValue<List<Address>> addresses) { this.addresses = addresses; }

    /** Read-only, maintained by the service provider from Group membership. */
    public AttributeValue<List<GroupMembership>> getGroups() { return groups; }
    public void setGroups(AttributeValue<List<GroupMembership>> groups) { this.groups = groups; }

    public AttributeValue<List<Entitlement>> getEntitlements() { return entitlements; }
    public void setEntitlements(AttributeValue<List<Entitlement>> entitlements) { this.entitlements = entitlements; }

    public AttributeValue<List<Role>> getRoles() { return roles; }
    public void setRoles(AttributeValue<List<Role>> roles) { this.roles = roles; }

    public AttributeValue<List<X509Certificate>> getX509Certificates() { return x509Certificates; }
    public void setX509Certificates(AttributeValue<List<X509Certificate>> x509Certificates) { this.x509Certificates = x509Certificates; }

    /**
     * @return the attached Enterprise User extension, if any
     */
    public Optional<EnterpriseUser> getEnterpriseUser() {
        return getExtension(EnterpriseUser.class);
    }

    /**
     * Attach the Enterprise User extension and declare its URN in {@code schemas}.
     * Passing null detaches the extension and removes the URN.
     */
    public void setEnterpriseUser(EnterpriseUser enterpriseUser) {
        if (enterpriseUser == null) {
            detachExtension(ScimSchemaUrns.ENTERPRISE_USER_SCHEMA);
        } else {
            attachExtension(enterpriseUser);
        }
    }

    /**
     * Convenience for building a creation payload: declares the core User schema and sets userName.
     */
    public static User withUserName(String userName) {
        User user = new User();
        List<String> schemas = new ArrayList<>();
        schemas.add(ScimSchemaUrns.CORE_USER_SCHEMA);
        user.setSchemas(AttributeValue.of(schemas));
        user.setUserName(AttributeValue.of(userName));
        return user;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User)) return false;
        User user = (User) o;
        return commonAttributesEqual(user)
                && userName.equals(user.userName)
                && name.equals(user.name)
                && displayName.equals(user.displayName)
                && nickName.equals(user.nickName)
                && profileUrl.equals(user.profileUrl)
                && title.equals(user.title)
                && userType.equals(user.userType)
                && preferredLanguage.equals(user.preferredLanguage)
                && locale.equals(user.locale)
                && timezone.equals(user.timezone)
                && active.equals(user.active)
                && password.equals(user.password)
                && emails.equals(user.emails)
                && phoneNumbers.equals(user.phoneNumbers)
                && ims.equals(user.ims)
                && photos.equals(user.photos)
                && addresses.equals(user.addresses)
                && groups.equals(user.groups)
                && entitlements.equals(user.entitlements)
                && roles.equals(user.roles)
                && x509Certificates.equals(user.x509Certificates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonAttributesHash(), userName, name, displayName, nickName, profileUrl, title,
                userType, preferredLanguage, locale, timezone, active, password, emails, phoneNumbers, ims,
                photos, addresses, groups, entitlements, roles, x509Certificates);
    }

    @Override
    public String toString() {
        return "User{id=" + getId() + ", userName=" + userName + ", displayName=" + displayName
                + ", extensions=" + getExtensions().keySet() + '}';
    }
}
