package io.duomap.schema;

import io.duomap.core.RelationshipDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived storage definition of an entity: table, primary key, ordered columns
 * and foreign-key constraints.
 * <p>
 * Raw relationship fields are never columns; they are kept in
 * {@link #relationships()} so that runtime binding and transfer projection can
 * see them. Instances are immutable and compare structurally.
 */
public record PersistenceSchema(
        String entityName,
        String tableName,
        String primaryKey,
        List<Column> columns,
        List<ForeignKeyConstraint> foreignKeys,
        Map<String, RelationshipDescriptor> relationships) {

    public PersistenceSchema {
        columns = List.copyOf(columns);
        foreignKeys = List.copyOf(foreignKeys);
        relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }

    /**
     * @return the column, or {@code null} if no such column exists
     */
    public Column column(String name) {
        for (var column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        return null;
    }

    public boolean hasColumn(String name) {
        return column(name) != null;
    }

    public Column primaryKeyColumn() {
        return column(primaryKey);
    }

    public List<String> columnNames() {
        var names = new ArrayList<String>(columns.size());
        for (var column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * @return the constraint for a to-one relationship field, or {@code null}
     */
    public ForeignKeyConstraint foreignKeyFor(String relationshipField) {
        for (var foreignKey : foreignKeys) {
            if (foreignKey.relationshipField().equals(relationshipField)) {
                return foreignKey;
            }
        }
        return null;
    }

    public List<RelationshipDescriptor> toOneRelationships() {
        var toOne = new ArrayList<RelationshipDescriptor>();
        for (var descriptor : relationships.values()) {
            if (descriptor.isToOne()) {
                toOne.add(descriptor);
            }
        }
        return toOne;
    }

    public boolean isRelationship(String fieldName) {
        return relationships.containsKey(fieldName);
    }
}
