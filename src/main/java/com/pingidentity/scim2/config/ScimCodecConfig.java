package com.pingidentity.scim2.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Settings for the SCIM JSON codec.
 *
 * <p>There is no built-in unknown-attribute policy: callers pick one, either through
 * {@link #builder()} or as the fallback handed to {@link #fromEnvironment(UnknownAttributePolicy)}.</p>
 *
 * <p>Environment keys:</p>
 * <ul>
 *   <li>{@code SCIM_UNKNOWN_ATTRIBUTE_POLICY} - REJECT, IGNORE or PRESERVE</li>
 *   <li>{@code SCIM_PRETTY_PRINT} - true or false</li>
 * </ul>
 */
public final class ScimCodecConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ScimCodecConfig.class);

    public static final String UNKNOWN_ATTRIBUTE_POLICY_KEY = "SCIM_UNKNOWN_ATTRIBUTE_POLICY";
    public static final String PRETTY_PRINT_KEY = "SCIM_PRETTY_PRINT";

    private final UnknownAttributePolicy unknownAttributePolicy;
    private final boolean prettyPrint;

    private ScimCodecConfig(Builder builder) {
        this.unknownAttributePolicy = builder.unknownAttributePolicy;
        this.prettyPrint = builder.prettyPrint;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a compact-output configuration with the given policy.
     */
    public static ScimCodecConfig of(UnknownAttributePolicy policy) {
        return builder().unknownAttributePolicy(policy).build();
    }

    /**
     * Load configuration from environment variables or system properties.
     * Environment variables take precedence over system properties.
     *
     * @param fallbackPolicy policy used when neither source names one
     * @throws IllegalArgumentException if a configured value cannot be parsed
     */
    public static ScimCodecConfig fromEnvironment(UnknownAttributePolicy fallbackPolicy) {
        return fromSource(ScimCodecConfig::getConfigValue, fallbackPolicy);
    }

    static ScimCodecConfig fromSource(UnaryOperator<String> source, UnknownAttributePolicy fallbackPolicy) {
        Objects.requireNonNull(fallbackPolicy, "fallbackPolicy");

        String policyValue = source.apply(UNKNOWN_ATTRIBUTE_POLICY_KEY);
        UnknownAttributePolicy policy = policyValue == null
                ? fallbackPolicy
                : UnknownAttributePolicy.fromString(policyValue);

        String prettyValue = source.apply(PRETTY_PRINT_KEY);
        boolean prettyPrint = prettyValue != null && parseBoolean(PRETTY_PRINT_KEY, prettyValue);

        ScimCodecConfig config = builder()
                .unknownAttributePolicy(policy)
                .prettyPrint(prettyPrint)
                .build();

        LOG.info("Loaded SCIM codec configuration: {}", config);
        if (policyValue == null) {
            LOG.debug("{} not set, using fallback policy {}", UNKNOWN_ATTRIBUTE_POLICY_KEY, fallbackPolicy);
        }
        return config;
    }

    public UnknownAttributePolicy getUnknownAttributePolicy() {
        return unknownAttributePolicy;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    private static String getConfigValue(String key) {
        return Optional.ofNullable(System.getenv(key))
                .or(() -> Optional.ofNullable(System.getProperty(key)))
                .orElse(null);
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value '" + value + "' for " + key + ", expected true or false");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScimCodecConfig)) return false;
        ScimCodecConfig that = (ScimCodecConfig) o;
        return prettyPrint == that.prettyPrint && unknownAttributePolicy == that.unknownAttributePolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unknownAttributePolicy, prettyPrint);
    }

    @Override
    public String toString() {
        return "ScimCodecConfig{" +
                "unknownAttributePolicy=" + unknownAttributePolicy +
                ", prettyPrint=" + prettyPrint +
                '}';
    }

    public static final class Builder {

        private UnknownAttributePolicy unknownAttributePolicy;
        private boolean prettyPrint;

        private Builder() {
        }

        public Builder unknownAttributePolicy(UnknownAttributePolicy unknownAttributePolicy) {
            this.unknownAttributePolicy = unknownAttributePolicy;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        /**
         * @throws IllegalStateException if no unknown-attribute policy was chosen
         */
        public ScimCodecConfig build() {
            if (unknownAttributePolicy == null) {
                throw new IllegalStateException("An unknown attribute policy must be chosen explicitly");
            }
            return new ScimCodecConfig(this);
        }
    }
}
