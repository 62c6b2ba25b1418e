package com.pingidentity.scim2.mapping;

import com.pingidentity.scim2.exceptions.TypeMismatchException;
import com.pingidentity.scim2.mapping.JsonAttributeReader.ComplexReader;
import com.pingidentity.scim2.model.Address;
import com.pingidentity.scim2.model.AuthenticationScheme;
import com.pingidentity.scim2.model.BulkSupport;
import com.pingidentity.scim2.model.FilterSupport;
import com.pingidentity.scim2.model.Manager;
import com.pingidentity.scim2.model.Meta;
import com.pingidentity.scim2.model.MultiValuedAttribute;
import com.pingidentity.scim2.model.Name;
import com.pingidentity.scim2.model.ResourceReference;
import com.pingidentity.scim2.model.SchemaExtension;
import com.pingidentity.scim2.model.SupportedFeature;

import java.util.function.Supplier;

/**
 * Readers and writers for the complex sub-records shared by the resource mappers.
 */
final class ComplexAttributeMappers {

    private ComplexAttributeMappers() {
    }

    static Meta readMeta(JsonAttributeReader reader) throws TypeMismatchException {
        Meta meta = new Meta();
        meta.setResourceType(reader.readString("resourceType"));
        meta.setCreated(reader.readDateTime("created"));
        meta.setLastModified(reader.readDateTime("lastModified"));
        meta.setLocation(reader.readString("location"));
        meta.setVersion(reader.readString("version"));
        return meta;
    }

    static void writeMeta(Meta meta, JsonAttributeWriter writer) {
        writer.writeString("resourceType", meta.getResourceType())
                .writeDateTime("created", meta.getCreated())
                .writeDateTime("lastModified", meta.getLastModified())
                .writeString("location", meta.getLocation())
                .writeString("version", meta.getVersion());
    }

    static Name readName(JsonAttributeReader reader) throws TypeMismatchException {
        Name name = new Name();
        name.setFormatted(reader.readString("formatted"));
        name.setFamilyName(reader.readString("familyName"));
        name.setGivenName(reader.readString("givenName"));
        name.setMiddleName(reader.readString("middleName"));
        name.setHonorificPrefix(reader.readString("honorificPrefix"));
        name.setHonorificSuffix(reader.readString("honorificSuffix"));
        return name;
    }

    static void writeName(Name name, JsonAttributeWriter writer) {
        writer.writeString("formatted", name.getFormatted())
                .writeString("familyName", name.getFamilyName())
                .writeString("givenName", name.getGivenName())
                .writeString("middleName", name.getMiddleName())
                .writeString("honorificPrefix", name.getHonorificPrefix())
                .writeString("honorificSuffix", name.getHonorificSuffix());
    }

    /**
     * Reader for the value/display/type/primary shape of emails, phoneNumbers, ims,
     * photos, entitlements, roles and x509Certificates.
     */
    static <T extends MultiValuedAttribute> ComplexReader<T> multiValued(Supplier<T> factory) {
        return reader -> {
            T attribute = factory.get();
            attribute.setValue(reader.readString("value"));
            attribute.setDisplay(reader.readString("display"));
            attribute.setType(reader.readString("type"));
            attribute.setPrimary(reader.readBoolean("primary"));
            return attribute;
        };
    }

    static void writeMultiValued(MultiValuedAttribute attribute, JsonAttributeWriter writer) {
        writer.writeString("value", attribute.getValue())
                .writeString("display", attribute.getDisplay())
                .writeString("type", attribute.getType())
                .writeBoolean("primary", attribute.getPrimary());
    }

    static Address readAddress(JsonAttributeReader reader) throws TypeMismatchException {
        Address address = new Address();
        address.setFormatted(reader.readString("formatted"));
        address.setStreetAddress(reader.readString("streetAddress"));
        address.setLocality(reader.readString("locality"));
        address.setRegion(reader.readString("region"));
        address.setPostalCode(reader.readString("postalCode"));
        address.setCountry(reader.readString("country"));
        address.setType(reader.readString("type"));
        address.setPrimary(reader.readBoolean("primary"));
        return address;
    }

    static void writeAddress(Address address, JsonAttributeWriter writer) {
        writer.writeString("formatted", address.getFormatted())
                .writeString("streetAddress", address.getStreetAddress())
                .writeString("locality", address.getLocality())
                .writeString("region", address.getRegion())
                .writeString("postalCode", address.getPostalCode())
                .writeString("country", address.getCountry())
                .writeString("type", address.getType())
                .writeBoolean("primary", address.getPrimary());
    }

    /**
     * Reader for group members and user group memberships.
     */
    static <T extends ResourceReference> ComplexReader<T> reference(Supplier<T> factory) {
        return reader -> {
            T reference = factory.get();
            reference.setValue(reader.readString("value"));
            reference.setRef(reader.readString("$ref"));
            reference.setDisplay(reader.readString("display"));
            reference.setType(reader.readString("type"));
            return reference;
        };
    }

    static void writeReference(ResourceReference reference, JsonAttributeWriter writer) {
        writer.writeString("value", reference.getValue())
                .writeString("$ref", reference.getRef())
                .writeString("display", reference.getDisplay())
                .writeString("type", reference.getType());
    }

    static Manager readManager(JsonAttributeReader reader) throws TypeMismatchException {
        Manager manager = new Manager();
        manager.setValue(reader.readString("value"));
        manager.setRef(reader.readString("$ref"));
        manager.setDisplayName(reader.readString("displayName"));
        return manager;
    }

    static void writeManager(Manager manager, JsonAttributeWriter writer) {
        writer.writeString("value", manager.getValue())
                .writeString("$ref", manager.getRef())
                .writeString("displayName", manager.getDisplayName());
    }

    static SchemaExtension readSchemaExtension(JsonAttributeReader reader) throws TypeMismatchException {
        SchemaExtension extension = new SchemaExtension();
        extension.setSchema(reader.readString("schema"));
        extension.setRequired(reader.readBoolean("required"));
        return extension;
    }

    static void writeSchemaExtension(SchemaExtension extension, JsonAttributeWriter writer) {
        writer.writeString("schema", extension.getSchema())
                .writeBoolean("required", extension.getRequired());
    }

    static SupportedFeature readSupportedFeature(JsonAttributeReader reader) throws TypeMismatchException {
        SupportedFeature feature = new SupportedFeature();
        feature.setSupported(reader.readBoolean("supported"));
        return feature;
    }

    static void writeSupportedFeature(SupportedFeature feature, JsonAttributeWriter writer) {
        writer.writeBoolean("supported", feature.getSupported());
    }

    static BulkSupport readBulkSupport(JsonAttributeReader reader) throws TypeMismatchException {
        BulkSupport bulk = new BulkSupport();
        bulk.setSupported(reader.readBoolean("supported"));
        bulk.setMaxOperations(reader.readLong("maxOperations"));
        bulk.setMaxPayloadSize(reader.readLong("maxPayloadSize"));
        return bulk;
    }

    static void writeBulkSupport(BulkSupport bulk, JsonAttributeWriter writer) {
        writer.writeBoolean("supported", bulk.getSupported())
                .writeLong("maxOperations", bulk.getMaxOperations())
                .writeLong("maxPayloadSize", bulk.getMaxPayloadSize());
    }

    static FilterSupport readFilterSupport(JsonAttributeReader reader) throws TypeMismatchException {
        FilterSupport filter = new FilterSupport();
        filter.setSupported(reader.readBoolean("supported"));
        filter.setMaxResults(reader.readLong("maxResults"));
        return filter;
    }

    static void writeFilterSupport(FilterSupport filter, JsonAttributeWriter writer) {
        writer.writeBoolean("supported", filter.getSupported())
                .writeLong("maxResults", filter.getMaxResults());
    }

    static AuthenticationScheme readAuthenticationScheme(JsonAttributeReader reader) throws TypeMismatchException {
        AuthenticationScheme scheme = new AuthenticationScheme();
        scheme.setType(reader.readString("type"));
        scheme.setName(reader.readString("name"));
        scheme.setDescription(reader.readString("description"));
        scheme.setSpecUri(reader.readString("specUri"));
        scheme.setDocumentationUri(reader.readString("documentationUri"));
        scheme.setPrimary(reader.readBoolean("primary"));
        return scheme;
    }

    static void writeAuthenticationScheme(AuthenticationScheme scheme, JsonAttributeWriter writer) {
        writer.writeString("type", scheme.getType())
                .writeString("name", scheme.getName())
                .writeString("description", scheme.getDescription())
                .writeString("specUri", scheme.getSpecUri())
                .writeString("documentationUri", scheme.getDocumentationUri())
                .writeBoolean("primary", scheme.getPrimary());
    }
}
