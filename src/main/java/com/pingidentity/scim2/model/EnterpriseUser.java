package com.pingidentity.scim2.model;

import com.pingidentity.scim2.schema.ScimSchemaUrns;

import java.util.Objects;

/**
 * Enterprise User extension (RFC 7643 Section 4.3).
 *
 * <p>Attached to a User under {@link ScimSchemaUrns#ENTERPRISE_USER_SCHEMA}; the URN must
 * also be listed in the User's {@code schemas} for the resource to validate.</p>
 */
public class EnterpriseUser implements ScimExtension {

    private AttributeValue<String> employeeNumber = AttributeValue.absent();
    private AttributeValue<String> costCenter = AttributeValue.absent();
    private AttributeValue<String> organization = AttributeValue.absent();
    private AttributeValue<String> division = AttributeValue.absent();
    private AttributeValue<String> department = AttributeValue.absent();
    private AttributeValue<Manager> manager = AttributeValue.absent();

    @Override
    public String getSchemaUrn() {
        return ScimSchemaUrns.ENTERPRISE_USER_SCHEMA;
    }

    public AttributeValue<String> getEmployeeNumber() { return employeeNumber; }
    public void setEmployeeNumber(AttributeValue<String> employeeNumber) { this.employeeNumber = employeeNumber; }

    public AttributeValue<String> getCostCenter() { return costCenter; }
    public void setCostCenter(AttributeValue<String> costCenter) { this.costCenter = costCenter; }

    public AttributeValue<String> getOrganization() { return organization; }
    public void setOrganization(AttributeValue<String> organization) { this.organization = organization; }

    public AttributeValue<String> getDivision() { return division; }
    public void setDivision(AttributeValue<String> division) { this.division = division; }

    public AttributeValue<String> getDepartment() { return department; }
    public void setDepartment(AttributeValue<String> department) { this.department = department; }

    public AttributeValue<Manager> getManager() { return manager; }
    public void setManager(AttributeValue<Manager> manager) { this.manager = manager; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnterpriseUser)) return false;
        EnterpriseUser that = (EnterpriseUser) o;
        return employeeNumber.equals(that.employeeNumber)
                && costCenter.equals(that.costCenter)
                && organization.equals(that.organization)
                && division.equals(that.division)
                && department.equals(that.department)
                && manager.equals(that.manager);
    }

    @Override
    public int hashCode() {
        return Objects.hash(employeeNumber, costCenter, organization, division, department, manager);
    }

    @Override
    public String toString() {
        return "EnterpriseUser{employeeNumber=" + employeeNumber + ", organization=" + organization
                + ", department=" + department + ", manager=" + manager + '}';
    }
}
