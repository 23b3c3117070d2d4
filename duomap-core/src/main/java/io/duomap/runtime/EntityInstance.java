package io.duomap.runtime;

import io.duomap.schema.PersistenceSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A live entity: column values, one reference cache slot per to-one field and
 * an in-memory list per to-many field.
 * <p>
 * A slot is either unfilled (never resolved) or holds an {@link Optional}
 * whose emptiness means "resolved to absent". Slots are private to the
 * instance.
 * <p>
 * <b>Thread-safety:</b> not thread-safe; confine an instance to one thread
 * or synchronize externally.
 */
public final class EntityInstance {

    private final EntityBinding binding;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Optional<EntityInstance>> slots = new HashMap<>();
    private final Map<String, List<EntityInstance>> collections = new LinkedHashMap<>();
    private boolean persisted;

    EntityInstance(EntityBinding binding) {
        this.binding = binding;
        for (var column : binding.schema().columns()) {
            values.put(column.name(), null);
        }
        for (var field : binding.toManyFields()) {
            collections.put(field, new ArrayList<>());
        }
    }

    public String entityName() {
        return binding.entityName();
    }

    public EntityBinding binding() {
        return binding;
    }

    public PersistenceSchema schema() {
        return binding.schema();
    }

    /**
     * @return the primary-key value, or {@code null} before the first save when auto-assigned
     */
    public Object id() {
        return values.get(binding.schema().primaryKey());
    }

    /**
     * Whether this instance was saved or loaded and not deleted since.
     */
    public boolean isPersisted() {
        return persisted;
    }

    public boolean hasField(String field) {
        return values.containsKey(field) || binding.reference(field) != null || collections.containsKey(field);
    }

    /**
     * Read a column, to-one or to-many field. Reading a to-one field may load
     * the related instance through the storage engine.
     *
     * @throws IllegalArgumentException for unknown fields
     */
    public Object get(String field) {
        if (values.containsKey(field)) {
            return values.get(field);
        }
        var reference = binding.reference(field);
        if (reference != null) {
            return reference.get(this);
        }
        var collection = collections.get(field);
        if (collection != null) {
            return collection;
        }
        throw unknownField(field);
    }

    /**
     * Typed read of a to-one field.
     */
    public EntityInstance getRelated(String field) {
        var reference = binding.reference(field);
        if (reference == null) {
            throw new IllegalArgumentException(entityName() + "." + field + " is not a to-one relationship");
        }
        return reference.get(this);
    }

    /**
     * Typed read of a to-many field. The returned list is live.
     */
    public List<EntityInstance> getCollection(String field) {
        var collection = collections.get(field);
        if (collection == null) {
            throw new IllegalArgumentException(entityName() + "." + field + " is not a to-many relationship");
        }
        return collection;
    }

    /**
     * Write a column, to-one or to-many field.
     * <p>
     * Writing a foreign-key column directly drops the cached related instance
     * for its relationship.
     *
     * @throws IllegalArgumentException for unknown fields and values of the wrong type
     */
    public void set(String field, Object value) {
        if (values.containsKey(field)) {
            var column = binding.schema().column(field);
            Object stored = value;
            if (value != null) {
                if (!column.type().accepts(value)) {
                    throw new IllegalArgumentException(entityName() + "." + field + " expects " + column.type()
                            + " but got " + value.getClass().getSimpleName());
                }
                stored = column.type().coerce(value);
            }
            values.put(field, stored);
            if (column.isSynthesized()) {
                slots.remove(column.relationshipField());
            }
            return;
        }
        var reference = binding.reference(field);
        if (reference != null) {
            reference.set(this, value);
            return;
        }
        var collection = collections.get(field);
        if (collection != null) {
            setCollection(field, collection, value);
            return;
        }
        throw unknownField(field);
    }

    /**
     * Whether the cache slot of a to-one field is filled.
     */
    public boolean isResolved(String field) {
        return slots.containsKey(field);
    }

    /**
     * The cached related instance without triggering resolution.
     *
     * @return the cached instance, or {@code null} if unresolved or resolved to absent
     */
    public EntityInstance cachedReference(String field) {
        var slot = slots.get(field);
        return slot == null ? null : slot.orElse(null);
    }

    /**
     * Snapshot of the column values, keyed by column name in schema order.
     */
    public Map<String, Object> row() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    Optional<EntityInstance> slot(String field) {
        return slots.get(field);
    }

    void fillSlot(String field, Optional<EntityInstance> related) {
        slots.put(field, related);
    }

    void dropSlot(String field) {
        slots.remove(field);
    }

    Object value(String column) {
        return values.get(column);
    }

    void putValue(String column, Object value) {
        values.put(column, value);
    }

    void load(Map<String, Object> row) {
        for (var column : values.keySet()) {
            values.put(column, row.get(column));
        }
        slots.clear();
    }

    void markPersisted(boolean persisted) {
        this.persisted = persisted;
    }

    private void setCollection(String field, List<EntityInstance> collection, Object value) {
        if (value == null) {
            collection.clear();
            return;
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(entityName() + "." + field + " expects a list but got "
                    + value.getClass().getSimpleName());
        }
        var target = binding.schema().relationships().get(field).targetEntityName();
        var replacement = new ArrayList<EntityInstance>(list.size());
        for (Object element : list) {
            if (!(element instanceof EntityInstance related) || !related.entityName().equals(target)) {
                throw new IllegalArgumentException(entityName() + "." + field + " holds " + target
                        + " instances only");
            }
            replacement.add(related);
        }
        collection.clear();
        collection.addAll(replacement);
    }

    private IllegalArgumentException unknownField(String field) {
        return new IllegalArgumentException("Unknown field '" + field + "' on entity " + entityName());
    }

    @Override
    public String toString() {
        return entityName() + values;
    }
}
