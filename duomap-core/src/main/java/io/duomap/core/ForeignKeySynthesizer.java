package io.duomap.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Produces one synthesized foreign-key field per to-one relationship.
 * To-many relationships yield nothing: the key lives on the other entity.
 */
public final class ForeignKeySynthesizer {

    static final String FOREIGN_KEY_SUFFIX = "_id";

    private ForeignKeySynthesizer() {
    }

    public static String foreignKeyName(String relationshipField) {
        return relationshipField + FOREIGN_KEY_SUFFIX;
    }

    public static List<SynthesizedForeignKey> synthesize(Collection<RelationshipDescriptor> descriptors) {
        var keys = new ArrayList<SynthesizedForeignKey>();
        for (var descriptor : descriptors) {
            if (!descriptor.isToOne()) {
                continue;
            }
            keys.add(new SynthesizedForeignKey(
                    foreignKeyName(descriptor.fieldName()),
                    descriptor.fieldName(),
                    descriptor.targetEntityName(),
                    descriptor.nullable()));
        }
        return List.copyOf(keys);
    }

    /**
     * Synthesizes keys for a definition and rejects any key whose name is
     * already taken by a declared field.
     *
     * @throws DefinitionException on a name collision
     */
    public static List<SynthesizedForeignKey> synthesize(EntityDefinition definition,
            Collection<RelationshipDescriptor> descriptors) {
        var keys = synthesize(descriptors);
        for (var key : keys) {
            if (definition.hasField(key.name())) {
                throw new DefinitionException("Synthesized foreign key '" + key.name() + "' for relationship '"
                        + key.relationshipField() + "' collides with a declared field in entity "
                        + definition.name());
            }
        }
        return keys;
    }
}
