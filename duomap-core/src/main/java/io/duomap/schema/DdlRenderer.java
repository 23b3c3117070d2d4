package io.duomap.schema;

import io.duomap.core.DuomapConfiguration;
import io.duomap.core.ScalarType;

import java.util.StringJoiner;

/**
 * Renders {@code CREATE TABLE} statements for persistence schemas.
 * <p>
 * Output is portable ANSI-style SQL; dialect quirks belong to the storage
 * engine that executes it.
 */
public final class DdlRenderer {

    private final DuomapConfiguration configuration;

    public DdlRenderer(DuomapConfiguration configuration) {
        this.configuration = configuration;
    }

    public String createTable(PersistenceSchema schema) {
        return createTable(schema, false);
    }

    public String createTable(PersistenceSchema schema, boolean ifNotExists) {
        String prefix = "CREATE TABLE " + (ifNotExists ? "IF NOT EXISTS " : "") + schema.tableName();
        StringJoiner joiner = new StringJoiner(", ", prefix + " (", ");");

        for (Column column : schema.columns()) {
            joiner.add(column.name() + " " + sqlType(column.type()) + (column.nullable() ? "" : " NOT NULL"));
        }
        joiner.add("PRIMARY KEY (" + schema.primaryKey() + ")");
        for (ForeignKeyConstraint foreignKey : schema.foreignKeys()) {
            joiner.add("FOREIGN KEY (" + foreignKey.column() + ") REFERENCES "
                    + foreignKey.targetTableName() + " (" + foreignKey.targetColumn() + ")");
        }
        return joiner.toString();
    }

    String sqlType(ScalarType type) {
        return switch (type) {
            case INT -> "INTEGER";
            case LONG -> "BIGINT";
            case BOOLEAN -> "BOOLEAN";
            case DOUBLE -> "DOUBLE PRECISION";
            case DECIMAL -> "DECIMAL(38, 10)";
            case STRING -> "VARCHAR(" + configuration.defaultStringLength() + ")";
            case UUID -> "CHAR(36)";
            case INSTANT -> "TIMESTAMP WITH TIME ZONE";
            case LOCAL_DATE -> "DATE";
            case LOCAL_DATE_TIME -> "TIMESTAMP";
        };
    }
}
