package io.duomap.validation;

import io.duomap.core.RequiredRelationshipException;
import io.duomap.schema.PersistenceSchema;

import java.util.Map;

/**
 * Pre-write check that every required to-one relationship has its foreign key set.
 * <p>
 * Relationships are checked in declaration order and the first missing one is
 * reported. Only null keys are caught: a key pointing at a row that no longer
 * exists passes. To-many relationships are never checked.
 */
public final class RequiredRelationshipValidator {

    /**
     * @param schema schema of the entity being written
     * @param row    storage values about to be written, keyed by column name
     * @throws RequiredRelationshipException for the first required relationship with a null key
     */
    public void validate(PersistenceSchema schema, Map<String, Object> row) {
        for (var descriptor : schema.toOneRelationships()) {
            if (!descriptor.isRequired()) {
                continue;
            }
            if (row.get(descriptor.foreignKeyName()) == null) {
                throw new RequiredRelationshipException(descriptor.fieldName(), descriptor.targetEntityName());
            }
        }
    }
}
