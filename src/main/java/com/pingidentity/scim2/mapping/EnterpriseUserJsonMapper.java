package com.pingidentity.scim2.mapping;

import com.pingidentity.scim2.exceptions.ScimModelException;
import com.pingidentity.scim2.model.EnterpriseUser;

/**
 * Maps the Enterprise User extension object, either nested under its URN in a
 * resource or as a stand-alone payload.
 */
final class EnterpriseUserJsonMapper {

    private EnterpriseUserJsonMapper() {
    }

    static EnterpriseUser read(JsonAttributeReader reader) throws ScimModelException {
        EnterpriseUser enterpriseUser = new EnterpriseUser();
        enterpriseUser.setEmployeeNumber(reader.readString("employeeNumber"));
        enterpriseUser.setCostCenter(reader.readString("costCenter"));
        enterpriseUser.setOrganization(reader.readString("organization"));
        enterpriseUser.setDivision(reader.readString("division"));
        enterpriseUser.setDepartment(reader.readString("department"));
        enterpriseUser.setManager(reader.readComplex("manager", ComplexAttributeMappers::readManager));
        return enterpriseUser;
    }

    static void write(EnterpriseUser enterpriseUser, JsonAttributeWriter writer) {
        writer.writeString("employeeNumber", enterpriseUser.getEmployeeNumber())
                .writeString("costCenter", enterpriseUser.getCostCenter())
                .writeString("organization", enterpriseUser.getOrganization())
                .writeString("division", enterpriseUser.getDivision())
                .writeString("department", enterpriseUser.getDepartment())
                .writeComplex("manager", enterpriseUser.getManager(), ComplexAttributeMappers::writeManager);
    }
}
