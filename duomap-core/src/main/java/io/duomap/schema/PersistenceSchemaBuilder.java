package io.duomap.schema;

import io.duomap.core.DefinitionException;
import io.duomap.core.DuomapConfiguration;
import io.duomap.core.EntityDefinition;
import io.duomap.core.EntityRegistry;
import io.duomap.core.FieldDefinition;
import io.duomap.core.ForeignKeySynthesizer;
import io.duomap.core.RelationshipExtractor;
import io.duomap.core.ScalarType;
import io.duomap.core.SynthesizedForeignKey;

import java.util.ArrayList;

/**
 * Derives a {@link PersistenceSchema} from an entity definition.
 * <p>
 * Storage columns are the declared scalar fields in declaration order followed
 * by one synthesized foreign key per to-one relationship. Each synthesized
 * column takes the type of the target's primary key and gets a constraint
 * referencing it, so every to-one target must be registered by build time.
 * <p>
 * The definition is only read; the schema is a separate artifact. Use
 * {@link SchemaCache} to build once per entity.
 */
public final class PersistenceSchemaBuilder {

    private final EntityRegistry registry;
    private final DuomapConfiguration configuration;

    public PersistenceSchemaBuilder(EntityRegistry registry, DuomapConfiguration configuration) {
        this.registry = registry;
        this.configuration = configuration;
    }

    /**
     * @throws DefinitionException                    on malformed types, a bad primary key or a key-name collision
     * @throws io.duomap.core.UnregisteredTargetException if a to-one target is not registered
     */
    public PersistenceSchema build(EntityDefinition definition) {
        var relationships = RelationshipExtractor.extract(definition);
        var primaryKey = primaryKeyField(definition);
        var foreignKeys = ForeignKeySynthesizer.synthesize(definition, relationships.values());

        var columns = new ArrayList<Column>();
        for (var field : definition.fields()) {
            var unwrapped = field.unwrap();
            if (unwrapped.isRelationship()) {
                continue;
            }
            boolean isPrimaryKey = field.name().equals(primaryKey.name());
            columns.add(Column.declared(field.name(), unwrapped.scalarType(), unwrapped.nullable(), isPrimaryKey));
        }

        var constraints = new ArrayList<ForeignKeyConstraint>();
        for (SynthesizedForeignKey key : foreignKeys) {
            var target = resolveTarget(definition, key);
            var targetPrimaryKey = primaryKeyField(target);
            var targetType = targetPrimaryKey.unwrap().scalarType();
            columns.add(Column.synthesized(key.name(), targetType, key.nullable(), key.relationshipField()));
            constraints.add(new ForeignKeyConstraint(
                    key.name(),
                    key.relationshipField(),
                    target.name(),
                    target.tableName(),
                    targetPrimaryKey.name()));
        }

        return new PersistenceSchema(
                definition.name(),
                definition.tableName(),
                primaryKey.name(),
                columns,
                constraints,
                relationships);
    }

    /**
     * Resolve and check the primary-key field of a definition: it must exist,
     * be a non-nullable scalar and have an identifier-compatible type.
     *
     * @throws DefinitionException if any of those checks fails
     */
    public FieldDefinition primaryKeyField(EntityDefinition definition) {
        var name = primaryKeyName(definition);
        var field = definition.field(name);
        if (field == null) {
            throw new DefinitionException("Entity " + definition.name() + " has no primary-key field '" + name + "'");
        }
        var unwrapped = field.unwrap();
        if (unwrapped.isRelationship()) {
            throw new DefinitionException("Primary key '" + name + "' of entity " + definition.name()
                    + " cannot be a relationship");
        }
        if (unwrapped.nullable()) {
            throw new DefinitionException("Primary key '" + name + "' of entity " + definition.name()
                    + " cannot be nullable");
        }
        ScalarType type = unwrapped.scalarType();
        if (!type.identifierCompatible()) {
            throw new DefinitionException("Primary key '" + name + "' of entity " + definition.name()
                    + " has non-identifier type " + type);
        }
        return field;
    }

    public String primaryKeyName(EntityDefinition definition) {
        var marked = definition.primaryKeyOverride();
        return marked != null ? marked : configuration.defaultPrimaryKey();
    }

    private EntityDefinition resolveTarget(EntityDefinition definition, SynthesizedForeignKey key) {
        var registered = registry.find(key.targetEntityName());
        if (registered == null && key.targetEntityName().equals(definition.name())) {
            return definition;
        }
        return registry.require(key.relationshipField(), key.targetEntityName());
    }
}
