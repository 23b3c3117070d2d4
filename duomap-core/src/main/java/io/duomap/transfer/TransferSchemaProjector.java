package io.duomap.transfer;

import io.duomap.schema.PersistenceSchema;

import java.util.ArrayList;

/**
 * Projects a persistence schema into a {@link TransferSchema}.
 */
public final class TransferSchemaProjector {

    private TransferSchemaProjector() {
    }

    public static TransferSchema project(PersistenceSchema schema, RelationshipStrategy strategy) {
        var fields = new ArrayList<TransferField>();
        for (var column : schema.columns()) {
            if (strategy == RelationshipStrategy.OMIT && column.isSynthesized()) {
                continue;
            }
            fields.add(TransferField.of(column));
        }
        if (strategy == RelationshipStrategy.OPAQUE_OPTIONAL) {
            for (var descriptor : schema.relationships().values()) {
                fields.add(TransferField.opaque(descriptor));
            }
        }
        return new TransferSchema(schema.entityName(), strategy, fields);
    }
}
