package io.duomap.schema;

import io.duomap.core.EntityDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Memoizes persistence schemas per entity definition.
 * <p>
 * Keys are definitions by identity. The first derivation for a definition
 * runs inside {@link ConcurrentMap#computeIfAbsent}, so concurrent first use
 * of the same entity builds once and every caller receives the same schema.
 * A failed build caches nothing and is retried on the next call.
 */
public final class SchemaCache {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCache.class);

    private final PersistenceSchemaBuilder builder;
    private final ConcurrentMap<EntityDefinition, PersistenceSchema> schemas = new ConcurrentHashMap<>();

    public SchemaCache(PersistenceSchemaBuilder builder) {
        this.builder = builder;
    }

    public PersistenceSchema derive(EntityDefinition definition) {
        var cached = schemas.get(definition);
        if (cached != null) {
            return cached;
        }
        return schemas.computeIfAbsent(definition, this::buildLogged);
    }

    /**
     * @return the schema if already derived, otherwise {@code null}
     */
    public PersistenceSchema peek(EntityDefinition definition) {
        return schemas.get(definition);
    }

    public PersistenceSchemaBuilder builder() {
        return builder;
    }

    public int size() {
        return schemas.size();
    }

    private PersistenceSchema buildLogged(EntityDefinition definition) {
        var schema = builder.build(definition);
        LOG.debug("Derived schema for {}: table={}, columns={}, foreignKeys={}",
                definition.name(), schema.tableName(), schema.columnNames(), schema.foreignKeys().size());
        return schema;
    }
}
