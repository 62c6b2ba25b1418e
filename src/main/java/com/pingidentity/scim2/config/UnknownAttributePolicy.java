package com.pingidentity.scim2.config;

/**
 * What the decoder does with a top-level attribute that belongs to no known schema
 * and to no extension URN declared in {@code schemas}.
 */
public enum UnknownAttributePolicy {

    /** Fail decoding with a schema violation. */
    REJECT,

    /** Drop the attribute silently. */
    IGNORE,

    /** Keep the attribute on the decoded resource and write it back out on encode. */
    PRESERVE;

    /**
     * Parse a policy name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the name matches no policy
     */
    public static UnknownAttributePolicy fromString(String value) {
        if (value != null) {
            for (UnknownAttributePolicy policy : values()) {
                if (policy.name().equalsIgnoreCase(value.trim())) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown attribute policy '" + value
                + "', expected one of REJECT, IGNORE, PRESERVE");
    }
}
