package io.duomap.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Author-declared structure of one entity: a name and an ordered set of fields.
 * <p>
 * Definitions are immutable once built. Equality is identity: two definitions
 * with the same name are different entities as far as schema caching goes.
 * <pre>
 * EntityDefinition book = EntityDefinition.builder("Book")
 *     .field("id", Types.LONG)
 *     .field("title", Types.STRING)
 *     .field("author", Types.relation(Types.entity("Author")))
 *     .build();
 * </pre>
 */
public final class EntityDefinition {

    private final String name;
    private final String tableName;
    private final String primaryKey;
    private final List<FieldDefinition> fields;
    private final Map<String, FieldDefinition> fieldsByName;

    private EntityDefinition(Builder builder) {
        this.name = builder.name;
        this.tableName = builder.tableName;
        this.primaryKey = builder.primaryKey;
        this.fields = List.copyOf(builder.fields.values());
        this.fieldsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Table name override, or {@code null} when the default (lower-cased entity name) applies.
     */
    public String tableNameOverride() {
        return tableName;
    }

    public String tableName() {
        return tableName != null ? tableName : name.toLowerCase(Locale.ROOT);
    }

    /**
     * Primary-key field name marked by the author, or {@code null} to use the
     * configured default.
     */
    public String primaryKeyOverride() {
        return primaryKey;
    }

    public List<FieldDefinition> fields() {
        return fields;
    }

    public FieldDefinition field(String fieldName) {
        return fieldsByName.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return fieldsByName.containsKey(fieldName);
    }

    @Override
    public String toString() {
        return "EntityDefinition[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        private String tableName;
        private String primaryKey;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("entity name required");
            }
            this.name = name;
        }

        public Builder tableName(String tableName) {
            if (tableName == null || tableName.isBlank()) {
                throw new IllegalArgumentException("tableName must not be blank");
            }
            this.tableName = tableName;
            return this;
        }

        public Builder primaryKey(String fieldName) {
            if (fieldName == null || fieldName.isBlank()) {
                throw new IllegalArgumentException("primaryKey must not be blank");
            }
            this.primaryKey = fieldName;
            return this;
        }

        public Builder field(String fieldName, TypeExpression type) {
            return field(FieldDefinition.of(fieldName, type));
        }

        public Builder field(String fieldName, TypeExpression type, Object defaultValue) {
            return field(FieldDefinition.withDefault(fieldName, type, defaultValue));
        }

        public Builder field(FieldDefinition field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new DefinitionException("Duplicate field '" + field.name() + "' in entity " + name);
            }
            return this;
        }

        public EntityDefinition build() {
            if (fields.isEmpty()) {
                throw new DefinitionException("Entity " + name + " declares no fields");
            }
            return new EntityDefinition(this);
        }
    }
}
