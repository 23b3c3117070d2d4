package io.duomap.core;

public enum Cardinality {
    /**
     * This entity holds the foreign key.
     */
    TO_ONE,
    /**
     * The other entity holds the foreign key; nothing is stored on this side.
     */
    TO_MANY
}
