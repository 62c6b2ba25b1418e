package com.pingidentity.scim2.model;

/**
 * A schema extension payload attached to a base resource.
 *
 * <p>Extensions are composed onto a resource under their schema URN rather than
 * inherited, so a resource shape never changes when a new extension appears.</p>
 */
public interface ScimExtension {

    /**
     * @return the URN identifying the extension schema, also the JSON key it is written under
     */
    String getSchemaUrn();
}
