package io.duomap.runtime;

import io.duomap.core.RelationshipDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Accessor and mutator for one to-one relationship field of an entity type.
 * <p>
 * One instance exists per field per entity type; the state lives in the
 * cache slot of each {@link EntityInstance}. A read returns the cached value
 * when the slot is filled, caches "absent" without a query when the foreign
 * key is null, and otherwise loads the target by key once and caches whatever
 * comes back, including "not found". A write keeps cache and foreign key in
 * step.
 */
public final class LazyReference {

    private static final Logger LOG = LoggerFactory.getLogger(LazyReference.class);

    private final RelationshipDescriptor descriptor;
    private final String foreignKey;
    private final ReferenceLoader loader;

    LazyReference(RelationshipDescriptor descriptor, ReferenceLoader loader) {
        if (!descriptor.isToOne()) {
            throw new IllegalArgumentException("Lazy references are only installed for to-one fields: "
                    + descriptor.fieldName());
        }
        this.descriptor = descriptor;
        this.foreignKey = descriptor.foreignKeyName();
        this.loader = loader;
    }

    public String fieldName() {
        return descriptor.fieldName();
    }

    public String foreignKey() {
        return foreignKey;
    }

    public String targetEntityName() {
        return descriptor.targetEntityName();
    }

    public RelationshipDescriptor descriptor() {
        return descriptor;
    }

    /**
     * @return the related instance, or {@code null} when unset or not found
     */
    public EntityInstance get(EntityInstance owner) {
        var cached = owner.slot(descriptor.fieldName());
        if (cached != null) {
            return cached.orElse(null);
        }
        Object key = owner.value(foreignKey);
        if (key == null) {
            owner.fillSlot(descriptor.fieldName(), Optional.empty());
            return null;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Resolving {}.{} -> {}#{}", owner.entityName(), descriptor.fieldName(),
                    descriptor.targetEntityName(), key);
        }
        var loaded = loader.load(descriptor.fieldName(), descriptor.targetEntityName(), key);
        owner.fillSlot(descriptor.fieldName(), loaded);
        return loaded.orElse(null);
    }

    /**
     * Assign the related instance, or clear it with {@code null}.
     *
     * @throws IllegalArgumentException if the value is not an instance of the
     *                                  target entity or has no primary key yet
     */
    public void set(EntityInstance owner, Object value) {
        if (value == null) {
            owner.putValue(foreignKey, null);
            owner.fillSlot(descriptor.fieldName(), Optional.empty());
            return;
        }
        if (!(value instanceof EntityInstance related)) {
            throw new IllegalArgumentException("Relationship '" + descriptor.fieldName() + "' expects a "
                    + descriptor.targetEntityName() + " instance but got " + value.getClass().getName());
        }
        if (!related.entityName().equals(descriptor.targetEntityName())) {
            throw new IllegalArgumentException("Relationship '" + descriptor.fieldName() + "' expects a "
                    + descriptor.targetEntityName() + " instance but got " + related.entityName());
        }
        Object id = related.id();
        if (id == null) {
            throw new IllegalArgumentException("Cannot assign " + related.entityName() + " to '"
                    + descriptor.fieldName() + "': it has no primary key, save it first");
        }
        owner.putValue(foreignKey, id);
        owner.fillSlot(descriptor.fieldName(), Optional.of(related));
    }
}
