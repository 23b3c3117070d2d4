package io.duomap.storage;

import io.duomap.schema.PersistenceSchema;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage collaborator consumed by the mapping core.
 * <p>
 * Rows are maps keyed by column name. Engines may block; timeouts and retries
 * are their own business and any exception they raise reaches the caller
 * unchanged.
 */
public interface StorageEngine {

    /**
     * Create the table for a schema if it does not exist yet.
     */
    void ensureTable(PersistenceSchema schema);

    /**
     * Insert a new row or replace the row with the same primary key.
     *
     * @param values column values; a null primary key asks the engine to assign one
     * @return the primary key of the stored row
     */
    Object insertOrUpdate(PersistenceSchema schema, Map<String, Object> values);

    Optional<Map<String, Object>> findById(PersistenceSchema schema, Object id);

    List<Map<String, Object>> findAll(PersistenceSchema schema);

    /**
     * @return true if a row was removed, false if none had that id
     */
    boolean delete(PersistenceSchema schema, Object id);
}
