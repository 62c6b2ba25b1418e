package com.pingidentity.scim2.validation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pingidentity.scim2.exceptions.ScimModelException;

/**
 * A cross-field check that a single attribute rule cannot express.
 */
@FunctionalInterface
public interface ConsistencyRule {

    /**
     * @param resource the resource tree under validation
     * @param pathPrefix prefix for reported attribute paths, empty at the top level
     * @throws ScimModelException when the resource is inconsistent
     */
    void check(ObjectNode resource, String pathPrefix) throws ScimModelException;
}
