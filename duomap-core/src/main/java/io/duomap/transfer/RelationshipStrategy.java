package io.duomap.transfer;

/**
 * How relationships appear in a transfer schema.
 */
public enum RelationshipStrategy {
    /**
     * No relationship fields and no foreign keys.
     */
    OMIT,
    /**
     * All storage columns plus every relationship field as an opaque, optional value.
     */
    OPAQUE_OPTIONAL,
    /**
     * All storage columns, foreign keys included; no relationship fields.
     */
    ID_ONLY
}
