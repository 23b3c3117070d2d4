package io.duomap.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Name to definition mapping used to resolve relationship targets.
 * <p>
 * A registry is owned by whoever manages the entity types (normally a
 * {@code Duomap} session) instead of being global state. Entries are added
 * when an entity is declared and never removed.
 * <p>
 * <b>Thread-safety:</b> registration and lookup may run concurrently. Declare
 * entities before the first persistence operation that needs them; a lookup
 * that races with the target's registration may miss it.
 */
public final class EntityRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EntityRegistry.class);

    private final ConcurrentMap<String, EntityDefinition> definitions = new ConcurrentHashMap<>();
    // lower-cased table name -> owning entity name
    private final ConcurrentMap<String, String> tableOwners = new ConcurrentHashMap<>();

    /**
     * Register a definition under its name. Registering the same definition
     * object again is a no-op.
     * <p>
     * Table names are compared case-insensitively, so {@code Author} and
     * {@code AUTHOR} cannot both be declared with their default table names.
     *
     * @throws DefinitionException if a different definition already uses the name,
     *                             or another entity already maps to the same table
     */
    public EntityDefinition register(EntityDefinition definition) {
        var existing = definitions.get(definition.name());
        if (existing == definition) {
            return existing;
        }
        if (existing != null) {
            throw nameTaken(definition);
        }
        var tableKey = definition.tableName().toLowerCase(Locale.ROOT);
        var owner = tableOwners.putIfAbsent(tableKey, definition.name());
        if (owner != null && !owner.equals(definition.name())) {
            throw new DefinitionException("Table '" + definition.tableName() + "' of entity " + definition.name()
                    + " is already mapped by entity " + owner);
        }
        existing = definitions.putIfAbsent(definition.name(), definition);
        if (existing == null) {
            LOG.debug("Registered entity {} on table {}", definition.name(), definition.tableName());
            return definition;
        }
        if (existing != definition) {
            throw nameTaken(definition);
        }
        return existing;
    }

    private static DefinitionException nameTaken(EntityDefinition definition) {
        return new DefinitionException("Entity name '" + definition.name() + "' is already registered");
    }

    /**
     * @return the definition, or {@code null} if the name is not registered
     */
    public EntityDefinition find(String entityName) {
        return definitions.get(entityName);
    }

    /**
     * Look up a relationship target.
     *
     * @param fieldName        the relationship field asking, for the error message
     * @param targetEntityName the target to resolve
     * @throws UnregisteredTargetException if the target is not registered
     */
    public EntityDefinition require(String fieldName, String targetEntityName) {
        var definition = definitions.get(targetEntityName);
        if (definition == null) {
            throw new UnregisteredTargetException(fieldName, targetEntityName);
        }
        return definition;
    }

    /**
     * Look up an entity by name outside a relationship context.
     *
     * @throws IllegalArgumentException if the name is not registered
     */
    public EntityDefinition require(String entityName) {
        var definition = definitions.get(entityName);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown entity: " + entityName);
        }
        return definition;
    }

    public boolean contains(String entityName) {
        return definitions.containsKey(entityName);
    }

    public Collection<EntityDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public int size() {
        return definitions.size();
    }
}
