package io.duomap.runtime;

import io.duomap.core.EntityDefinition;
import io.duomap.core.EntityRegistry;
import io.duomap.schema.SchemaCache;
import io.duomap.storage.StorageEngine;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the entity bindings of a session and turns storage rows into
 * {@link EntityInstance}s.
 * <p>
 * Bindings are installed on first use through
 * {@link ConcurrentMap#computeIfAbsent}; concurrent first use of an entity
 * type installs one binding and every caller sees it.
 */
public final class EntityRuntime {

    private final EntityRegistry registry;
    private final SchemaCache schemas;
    private final StorageEngine storage;
    private final ConcurrentMap<EntityDefinition, EntityBinding> bindings = new ConcurrentHashMap<>();

    public EntityRuntime(EntityRegistry registry, SchemaCache schemas, StorageEngine storage) {
        this.registry = registry;
        this.schemas = schemas;
        this.storage = storage;
    }

    public EntityBinding binding(EntityDefinition definition) {
        var binding = bindings.get(definition);
        if (binding != null) {
            return binding;
        }
        return bindings.computeIfAbsent(definition,
                d -> new EntityBinding(d, schemas.derive(d), this::loadReference));
    }

    /**
     * @return the installed binding, or {@code null} if the type was never used
     */
    public EntityBinding peek(EntityDefinition definition) {
        return bindings.get(definition);
    }

    /**
     * A fresh unsaved instance with every column null and every to-many list empty.
     */
    public EntityInstance instantiate(EntityBinding binding) {
        return new EntityInstance(binding);
    }

    /**
     * An instance loaded from a storage row: foreign keys set, reference slots unfilled.
     */
    public EntityInstance materialise(EntityBinding binding, Map<String, Object> row) {
        var instance = new EntityInstance(binding);
        instance.load(row);
        instance.markPersisted(true);
        return instance;
    }

    /**
     * Replace the column values of an instance, for example with validated ones.
     * Reference slots whose foreign key changed are dropped.
     */
    public void assignValues(EntityInstance instance, Map<String, Object> values) {
        for (var reference : instance.binding().references()) {
            var foreignKey = reference.foreignKey();
            if (values.containsKey(foreignKey)
                    && !Objects.equals(values.get(foreignKey), instance.value(foreignKey))) {
                instance.dropSlot(reference.fieldName());
            }
        }
        for (var entry : values.entrySet()) {
            if (instance.schema().hasColumn(entry.getKey())) {
                instance.putValue(entry.getKey(), entry.getValue());
            }
        }
    }

    public void markSaved(EntityInstance instance, Object id) {
        instance.putValue(instance.schema().primaryKey(), id);
        instance.markPersisted(true);
    }

    public void markDeleted(EntityInstance instance) {
        instance.markPersisted(false);
    }

    private Optional<EntityInstance> loadReference(String fieldName, String targetEntityName, Object id) {
        var target = binding(registry.require(fieldName, targetEntityName));
        storage.ensureTable(target.schema());
        return storage.findById(target.schema(), id).map(row -> materialise(target, row));
    }
}
