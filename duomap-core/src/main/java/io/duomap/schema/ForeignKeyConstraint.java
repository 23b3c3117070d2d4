package io.duomap.schema;

/**
 * Foreign-key constraint from a synthesized column to the target entity's primary key.
 */
public record ForeignKeyConstraint(
        String column,
        String relationshipField,
        String targetEntityName,
        String targetTableName,
        String targetColumn) {
}
