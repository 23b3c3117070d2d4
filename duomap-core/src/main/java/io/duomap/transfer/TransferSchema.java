package io.duomap.transfer;

import io.duomap.core.Cardinality;
import io.duomap.runtime.EntityInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat, non-lazy shape of an entity for crossing process boundaries.
 */
public record TransferSchema(String entityName, RelationshipStrategy strategy, List<TransferField> fields) {

    public TransferSchema {
        fields = List.copyOf(fields);
    }

    /**
     * @return the field, or {@code null}
     */
    public TransferField field(String name) {
        for (var field : fields) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        return null;
    }

    public List<String> fieldNames() {
        var names = new ArrayList<String>(fields.size());
        for (var field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Copy the values of an instance into a map ordered like this schema.
     * <p>
     * Opaque to-one fields get the related instance only if it is already
     * cached on the instance, otherwise {@code null}; nothing is loaded.
     * Opaque to-many fields get a copy of the in-memory list.
     *
     * @throws IllegalArgumentException if the instance is of another entity
     */
    public Map<String, Object> extract(EntityInstance instance) {
        if (!instance.entityName().equals(entityName)) {
            throw new IllegalArgumentException("Transfer schema for " + entityName + " cannot extract "
                    + instance.entityName());
        }
        var result = new LinkedHashMap<String, Object>();
        var row = instance.row();
        for (var field : fields) {
            if (!field.isOpaque()) {
                result.put(field.name(), row.get(field.name()));
            } else if (field.cardinality() == Cardinality.TO_MANY) {
                result.put(field.name(), List.copyOf(instance.getCollection(field.name())));
            } else {
                result.put(field.name(), instance.cachedReference(field.name()));
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
