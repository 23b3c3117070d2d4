package io.duomap.runtime;

import io.duomap.core.EntityDefinition;
import io.duomap.schema.PersistenceSchema;
import io.duomap.validation.ValidationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime type of an entity: its derived schemas plus the lazy references
 * installed for its to-one fields.
 * <p>
 * Created by a {@code Duomap} session the first time an entity type is used for
 * persistence, once per definition, and shared by all of its instances.
 */
public final class EntityBinding {

    private static final Logger LOG = LoggerFactory.getLogger(EntityBinding.class);

    private final EntityDefinition definition;
    private final PersistenceSchema schema;
    private final ValidationSchema validationSchema;
    private final Map<String, LazyReference> references;
    private final List<String> toManyFields;

    EntityBinding(EntityDefinition definition, PersistenceSchema schema, ReferenceLoader loader) {
        this.definition = definition;
        this.schema = schema;
        this.validationSchema = ValidationSchema.forSchema(schema);

        var installed = new LinkedHashMap<String, LazyReference>();
        var collections = new ArrayList<String>();
        for (var descriptor : schema.relationships().values()) {
            if (descriptor.isToOne()) {
                installed.put(descriptor.fieldName(), new LazyReference(descriptor, loader));
            } else {
                collections.add(descriptor.fieldName());
            }
        }
        this.references = Collections.unmodifiableMap(installed);
        this.toManyFields = List.copyOf(collections);
        LOG.debug("Installed {} lazy reference(s) on {}: {}", installed.size(), definition.name(), installed.keySet());
    }

    public EntityDefinition definition() {
        return definition;
    }

    public String entityName() {
        return definition.name();
    }

    public PersistenceSchema schema() {
        return schema;
    }

    public ValidationSchema validationSchema() {
        return validationSchema;
    }

    /**
     * @return the accessor for a to-one field, or {@code null}
     */
    public LazyReference reference(String fieldName) {
        return references.get(fieldName);
    }

    public Collection<LazyReference> references() {
        return references.values();
    }

    public List<String> toManyFields() {
        return toManyFields;
    }

    public boolean isToMany(String fieldName) {
        return toManyFields.contains(fieldName);
    }
}
