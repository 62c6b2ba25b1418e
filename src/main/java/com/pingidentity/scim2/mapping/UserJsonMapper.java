package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.Email;
import com.pingidentity.scim2.model.Entitlement;
import com.pingidentity.scim2.model.GroupMembership;
import com.pingidentity.scim2.model.Im;
import com.pingidentity.scim2.model.PhoneNumber;
import com.pingidentity.scim2.model.Photo;
import com.pingidentity.scim2.model.Role;
import com.pingidentity.scim2.model.User;
import com.pingidentity.scim2.model.X509Certificate;
import com.pingidentity.scim2.schema.ScimSchemaUrns;

import static com.pingidentity.scim2.mapping.ComplexAttributeMappers.multiValued;
import static com.pingidentity.scim2.mapping.ComplexAttributeMappers.reference;

/**
 * JSON mapper for the SCIM User resource (RFC 7643 Section 4.1).
 */
public class UserJsonMapper extends ResourceJsonMapper<User> {

    public UserJsonMapper(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Class<User> getResourceClass() {
        return User.class;
    }

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.CORE_USER_SCHEMA;
    }

    @Override
    protected User newResource() {
        return new User();
    }

    @Override
    protected void readAttributes(JsonAttributeReader reader, User user) throws ScimModelException {
        user.setUserName(reader.readString("userName"));
        user.setName(reader.readComplex("name", ComplexAttributeMappers::readName));
        user.setDisplayName(reader.readString("displayName"));
        user.setNickName(reader.readString("nickName"));
        user.setProfileUrl(reader.readString("profileUrl"));
        user.setTitle(reader.readString("title"));
        user.setUserType(reader.readString("userType"));
        user.setPreferredLanguage(reader.readString("preferredLanguage"));
        user.setLocale(reader.readString("locale"));
        user.setTimezone(reader.readString("timezone"));
        user.setActive(reader.readBoolean("active"));
        user.setPassword(reader.readString("password"));

        user.setEmails(reader.readComplexList("emails", multiValued(Email::new)));
        user.setPhoneNumbers(reader.readComplexList("phoneNumbers", multiValued(PhoneNumber::new)));
        user.setIms(reader.readComplexList("ims", multiValued(Im::new)));
        user.setPhotos(reader.readComplexList("photos", multiValued(Photo::new)));
        user.setAddresses(reader.readComplexList("addresses", ComplexAttributeMappers::readAddress));
        user.setGroups(reader.readComplexList("groups", reference(GroupMembership::new)));
        user.setEntitlements(reader.readComplexList("entitlements", multiValued(Entitlement::new)));
        user.setRoles(reader.readComplexList("roles", multiValued(Role::new)));
        user.setX509Certificates(reader.readComplexList("x509Certificates", multiValued(X509Certificate::new)));
    }

    @Override
    protected void writeAttributes(User user, JsonAttributeWriter writer) {
        writer.writeString("userName", user.getUserName())
                .writeComplex("name", user.getName(), ComplexAttributeMappers::writeName)
                .writeString("displayName", user.getDisplayName())
                .writeString("nickName", user.getNickName())
                .writeString("profileUrl", user.getProfileUrl())
                .writeString("title", user.getTitle())
                .writeString("userType", user.getUserType())
                .writeString("preferredLanguage", user.getPreferredLanguage())
                .writeString("locale", user.getLocale())
                .writeString("timezone", user.getTimezone())
                .writeBoolean("active", user.getActive())
                .writeString("password", user.getPassword())
                .writeComplexList("emails", user.getEmails(), ComplexAttributeMappers::writeMultiValued)
                .writeComplexList("phoneNumbers", user.getPhoneNumbers(), ComplexAttributeMappers::writeMultiValued)
                .writeComplexList("ims", user.getIms(), ComplexAttributeMappers::writeMultiValued)
                .writeComplexList("photos", user.getPhotos(), ComplexAttributeMappers::writeMultiValued)
                .writeComplexList("addresses", user.getAddresses(), ComplexAttributeMappers::writeAddress)
                .writeComplexList("groups", user.getGroups(), ComplexAttributeMappers::writeReference)
                .writeComplexList("entitlements", user.getEntitlements(), ComplexAttributeMappers::writeMultiValued)
                .writeComplexList("roles", user.getRoles(), ComplexAttributeMappers::writeMultiValued)
                .writeComplexList("x509Certificates", user.getX509Certificates(),
                        ComplexAttributeMappers::writeMultiValued);
    }
}
