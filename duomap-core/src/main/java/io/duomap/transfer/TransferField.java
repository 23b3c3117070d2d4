package io.duomap.transfer;

import io.duomap.core.Cardinality;
import io.duomap.core.RelationshipDescriptor;
import io.duomap.core.ScalarType;
import io.duomap.schema.Column;

/**
 * One field of a transfer schema.
 *
 * @param name             field name
 * @param type             scalar type, {@code null} for opaque relationship fields
 * @param nullable         whether the field may be absent
 * @param targetEntityName related entity for opaque fields, otherwise {@code null}
 * @param cardinality      cardinality for opaque fields, otherwise {@code null}
 */
public record TransferField(
        String name,
        ScalarType type,
        boolean nullable,
        String targetEntityName,
        Cardinality cardinality) {

    static TransferField of(Column column) {
        return new TransferField(column.name(), column.type(), column.nullable(), null, null);
    }

    static TransferField opaque(RelationshipDescriptor descriptor) {
        return new TransferField(descriptor.fieldName(), null, true, descriptor.targetEntityName(),
                descriptor.cardinality());
    }

    public boolean isOpaque() {
        return targetEntityName != null;
    }
}
