package io.duomap.core;

/**
 * Immutable configuration for a Duomap session.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * DuomapConfiguration config = DuomapConfiguration.builder()
 *     .defaultPrimaryKey("uid")
 *     .enforceForeignKeys(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class DuomapConfiguration {

    private static final DuomapConfiguration DEFAULTS = builder().build();

    // Schema derivation
    private final String defaultPrimaryKey;

    // DDL rendering
    private final int defaultStringLength;

    // In-memory storage
    private final boolean enforceForeignKeys;

    // Validation
    private final boolean validateOnConstruction;

    private DuomapConfiguration(Builder builder) {
        this.defaultPrimaryKey = builder.defaultPrimaryKey;
        this.defaultStringLength = builder.defaultStringLength;
        this.enforceForeignKeys = builder.enforceForeignKeys;
        this.validateOnConstruction = builder.validateOnConstruction;
    }

    /**
     * Create a new builder for DuomapConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static DuomapConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Primary-key field name used when a definition does not mark one.
     *
     * @return the field name (default: {@code id})
     */
    public String defaultPrimaryKey() {
        return defaultPrimaryKey;
    }

    /**
     * Length of {@code VARCHAR} columns rendered for string fields.
     *
     * @return the length (default: 255)
     */
    public int defaultStringLength() {
        return defaultStringLength;
    }

    /**
     * Whether the in-memory storage engine rejects foreign keys that point at
     * missing rows.
     *
     * @return true if enforced (default: false)
     */
    public boolean enforceForeignKeys() {
        return enforceForeignKeys;
    }

    /**
     * Whether scalar values are validated when a runtime instance is created,
     * in addition to before every write.
     *
     * @return true if enabled (default: true)
     */
    public boolean validateOnConstruction() {
        return validateOnConstruction;
    }

    /**
     * Builder for DuomapConfiguration.
     */
    public static final class Builder {
        private String defaultPrimaryKey = "id";
        private int defaultStringLength = 255;
        private boolean enforceForeignKeys = false;
        private boolean validateOnConstruction = true;

        private Builder() {
        }

        public Builder defaultPrimaryKey(String defaultPrimaryKey) {
            if (defaultPrimaryKey == null || defaultPrimaryKey.isBlank()) {
                throw new IllegalArgumentException("defaultPrimaryKey must not be blank");
            }
            this.defaultPrimaryKey = defaultPrimaryKey;
            return this;
        }

        public Builder defaultStringLength(int defaultStringLength) {
            if (defaultStringLength <= 0) {
                throw new IllegalArgumentException("defaultStringLength must be positive");
            }
            this.defaultStringLength = defaultStringLength;
            return this;
        }

        public Builder enforceForeignKeys(boolean enforceForeignKeys) {
            this.enforceForeignKeys = enforceForeignKeys;
            return this;
        }

        public Builder validateOnConstruction(boolean validateOnConstruction) {
            this.validateOnConstruction = validateOnConstruction;
            return this;
        }

        /**
         * Build the immutable configuration.
         *
         * @return the configuration
         */
        public DuomapConfiguration build() {
            return new DuomapConfiguration(this);
        }
    }
}
