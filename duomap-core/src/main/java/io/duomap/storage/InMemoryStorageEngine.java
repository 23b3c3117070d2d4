package io.duomap.storage;

import io.duomap.core.DuomapConfiguration;
import io.duomap.core.ScalarType;
import io.duomap.schema.ForeignKeyConstraint;
import io.duomap.schema.PersistenceSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link StorageEngine}.
 * <p>
 * One table per schema table name, owned by the first entity that creates it;
 * another entity mapping to the same name is rejected. Rows are kept in
 * insertion order and keyed by primary key. Null numeric keys are assigned
 * from a per-table counter, null UUID keys get a random UUID. Foreign keys are checked only when
 * {@link DuomapConfiguration#enforceForeignKeys()} is set.
 * <p>
 * <b>Thread-safety:</b> each table is guarded by its own read/write lock.
 */
public final class InMemoryStorageEngine implements StorageEngine {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStorageEngine.class);

    private final DuomapConfiguration configuration;
    private final ConcurrentMap<String, Table> tables = new ConcurrentHashMap<>();

    public InMemoryStorageEngine() {
        this(DuomapConfiguration.defaults());
    }

    public InMemoryStorageEngine(DuomapConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void ensureTable(PersistenceSchema schema) {
        var table = tables.computeIfAbsent(schema.tableName(), name -> {
            LOG.debug("Created table {} for entity {} with columns {}", name, schema.entityName(),
                    schema.columnNames());
            return new Table(schema);
        });
        checkOwner(table, schema);
    }

    @Override
    public Object insertOrUpdate(PersistenceSchema schema, Map<String, Object> values) {
        var table = table(schema);
        if (configuration.enforceForeignKeys()) {
            checkForeignKeys(schema, values);
        }
        var writeLock = table.lock.writeLock();
        writeLock.lock();
        try {
            Object id = values.get(schema.primaryKey());
            id = id == null ? table.nextId() : table.normaliseId(id);
            table.observeId(id);

            var row = new LinkedHashMap<String, Object>();
            for (var column : schema.columns()) {
                row.put(column.name(), values.get(column.name()));
            }
            row.put(schema.primaryKey(), id);
            table.rows.put(id, row);
            return id;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Map<String, Object>> findById(PersistenceSchema schema, Object id) {
        var table = table(schema);
        if (id == null) {
            return Optional.empty();
        }
        var readLock = table.lock.readLock();
        readLock.lock();
        try {
            var row = table.rows.get(table.normaliseId(id));
            return row == null ? Optional.empty() : Optional.of(copy(row));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Map<String, Object>> findAll(PersistenceSchema schema) {
        var table = table(schema);
        var readLock = table.lock.readLock();
        readLock.lock();
        try {
            var rows = new ArrayList<Map<String, Object>>(table.rows.size());
            for (var row : table.rows.values()) {
                rows.add(copy(row));
            }
            return rows;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean delete(PersistenceSchema schema, Object id) {
        var table = table(schema);
        if (id == null) {
            return false;
        }
        var writeLock = table.lock.writeLock();
        writeLock.lock();
        try {
            return table.rows.remove(table.normaliseId(id)) != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Number of rows currently stored for a table, or -1 if the table does not exist.
     */
    public int rowCount(String tableName) {
        var table = tables.get(tableName);
        if (table == null) {
            return -1;
        }
        var readLock = table.lock.readLock();
        readLock.lock();
        try {
            return table.rows.size();
        } finally {
            readLock.unlock();
        }
    }

    private Table table(PersistenceSchema schema) {
        var table = tables.get(schema.tableName());
        if (table == null) {
            throw new StorageException("Table not found: " + schema.tableName());
        }
        checkOwner(table, schema);
        return table;
    }

    private static void checkOwner(Table table, PersistenceSchema schema) {
        if (!table.entityName.equals(schema.entityName())) {
            throw new StorageException("Table " + schema.tableName() + " belongs to entity " + table.entityName
                    + " and cannot store " + schema.entityName() + " rows");
        }
    }

    private void checkForeignKeys(PersistenceSchema schema, Map<String, Object> values) {
        for (ForeignKeyConstraint foreignKey : schema.foreignKeys()) {
            Object value = values.get(foreignKey.column());
            if (value == null) {
                continue;
            }
            var target = tables.get(foreignKey.targetTableName());
            boolean present;
            if (target == null) {
                present = false;
            } else {
                var readLock = target.lock.readLock();
                readLock.lock();
                try {
                    present = target.rows.containsKey(target.normaliseId(value));
                } finally {
                    readLock.unlock();
                }
            }
            if (!present) {
                throw new StorageException("Foreign key violation: " + schema.tableName() + "."
                        + foreignKey.column() + "=" + value + " has no row in "
                        + foreignKey.targetTableName() + "." + foreignKey.targetColumn());
            }
        }
    }

    private static Map<String, Object> copy(Map<String, Object> row) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    private static final class Table {
        private final ScalarType idType;
        private final String tableName;
        private final String entityName;
        private final Map<Object, Map<String, Object>> rows = new LinkedHashMap<>();
        private final AtomicLong idCounter = new AtomicLong();
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        Table(PersistenceSchema schema) {
            this.idType = schema.primaryKeyColumn().type();
            this.tableName = schema.tableName();
            this.entityName = schema.entityName();
        }

        Object nextId() {
            return switch (idType) {
                case LONG -> idCounter.incrementAndGet();
                case INT -> nextIntId();
                case UUID -> UUID.randomUUID();
                default -> throw new StorageException("Cannot assign a " + idType + " primary key for table "
                        + tableName + "; supply one");
            };
        }

        private Integer nextIntId() {
            long next = idCounter.incrementAndGet();
            if (next > Integer.MAX_VALUE) {
                throw new StorageException("INT primary key space exhausted for table " + tableName
                        + " (next id " + next + ")");
            }
            return (int) next;
        }

        Object normaliseId(Object id) {
            if (!idType.accepts(id)) {
                throw new StorageException("Invalid primary key " + id + " for table " + tableName
                        + " (expected " + idType + ")");
            }
            return idType.coerce(id);
        }

        void observeId(Object id) {
            if (id instanceof Number number) {
                idCounter.accumulateAndGet(number.longValue(), Math::max);
            }
        }
    }
}
