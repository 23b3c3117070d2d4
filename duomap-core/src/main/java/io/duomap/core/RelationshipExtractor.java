package io.duomap.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks an entity's declared fields and classifies the relationship fields.
 * <p>
 * Targets are recorded by name only. An unknown target is not an error here;
 * it surfaces when the schema builder or a lazy reference needs it.
 */
public final class RelationshipExtractor {

    private RelationshipExtractor() {
    }

    /**
     * @return relationship descriptors keyed by field name, in declaration order
     * @throws DefinitionException if a field's type expression is malformed
     */
    public static Map<String, RelationshipDescriptor> extract(EntityDefinition definition) {
        var descriptors = new LinkedHashMap<String, RelationshipDescriptor>();
        for (var field : definition.fields()) {
            var unwrapped = field.unwrap();
            if (!unwrapped.isRelationship()) {
                continue;
            }
            var cardinality = unwrapped.collection() ? Cardinality.TO_MANY : Cardinality.TO_ONE;
            descriptors.put(field.name(), new RelationshipDescriptor(
                    field.name(),
                    unwrapped.targetEntityName(),
                    cardinality,
                    unwrapped.nullable(),
                    unwrapped.relation().reverseField()));
        }
        return Collections.unmodifiableMap(descriptors);
    }
}
