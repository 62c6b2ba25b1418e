package com.pingidentity.scim2.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.Group;
import com.pingidentity.scim2.model.Member;
import com.pingidentity.scim2.schema.ScimSchemaUrns;

/**
 * JSON mapper for the SCIM Group resource (RFC 7643 Section 4.2).
 */
public class GroupJsonMapper extends ResourceJsonMapper<Group> {

    public GroupJsonMapper(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Class<Group> getResourceClass() {
        return Group.class;
    }

    @Override
    public String getBaseSchemaUrn() {
        return ScimSchemaUrns.CORE_GROUP_SCHEMA;
    }

    @Override
    protected Group newResource() {
        return new Group();
    }

    @Override
    protected void readAttributes(JsonAttributeReader reader, Group group) throws ScimModelException {
        group.setDisplayName(reader.readString("displayName"));
        group.setMembers(reader.readComplexList("members", ComplexAttributeMappers.reference(Member::new)));
    }

    @Override
    protected void writeAttributes(Group group, JsonAttributeWriter writer) {
        writer.writeString("displayName", group.getDisplayName())
                .writeComplexList("members", group.getMembers(), ComplexAttributeMappers::writeReference);
    }
}
