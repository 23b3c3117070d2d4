package io.duomap;

import io.duomap.core.DuomapConfiguration;
import io.duomap.core.EntityDefinition;
import io.duomap.core.EntityRegistry;
import io.duomap.core.RelationshipDescriptor;
import io.duomap.core.RelationshipExtractor;
import io.duomap.runtime.EntityBinding;
import io.duomap.runtime.EntityInstance;
import io.duomap.runtime.EntityRuntime;
import io.duomap.runtime.EntityViewFactory;
import io.duomap.schema.DdlRenderer;
import io.duomap.schema.PersistenceSchema;
import io.duomap.schema.PersistenceSchemaBuilder;
import io.duomap.schema.SchemaCache;
import io.duomap.storage.InMemoryStorageEngine;
import io.duomap.storage.StorageEngine;
import io.duomap.transfer.RelationshipStrategy;
import io.duomap.transfer.TransferSchema;
import io.duomap.transfer.TransferSchemaProjector;
import io.duomap.validation.FieldError;
import io.duomap.validation.JsonObjectReader;
import io.duomap.validation.RequiredRelationshipValidator;
import io.duomap.validation.ScalarValueValidator;
import io.duomap.validation.ValidationException;
import io.duomap.validation.ValidationResult;
import io.duomap.validation.ValueValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session facade: declares entities, derives their schemas and moves runtime
 * instances in and out of a {@link StorageEngine}.
 * <p>
 * Each session owns its entity registry, schema cache and bindings. Typical use:
 * <pre>
 * Duomap duomap = Duomap.inMemory();
 * duomap.declare(author);
 * duomap.declare(book);
 * EntityInstance ada = duomap.save(duomap.newInstance("Author", Map.of("name", "Ada")));
 * EntityInstance notes = duomap.save(duomap.newInstance("Book", Map.of("title", "Notes", "author", ada)));
 * </pre>
 * <p>
 * <b>Write order:</b> every {@link #save} checks required relationships, then
 * validates values, and only then touches storage. Storage exceptions reach the
 * caller unchanged.
 * <p>
 * <b>Thread-safety:</b> the session may be shared; instances may not.
 */
public final class Duomap {

    private static final Logger LOG = LoggerFactory.getLogger(Duomap.class);

    private final DuomapConfiguration configuration;
    private final EntityRegistry registry;
    private final SchemaCache schemas;
    private final StorageEngine storage;
    private final ValueValidator validator;
    private final RequiredRelationshipValidator requiredRelationships;
    private final DdlRenderer ddlRenderer;
    private final EntityRuntime runtime;
    private final EntityViewFactory views;
    private final JsonObjectReader jsonReader;

    public Duomap(StorageEngine storage) {
        this(storage, DuomapConfiguration.defaults());
    }

    public Duomap(StorageEngine storage, DuomapConfiguration configuration) {
        this(storage, configuration, new ScalarValueValidator());
    }

    public Duomap(StorageEngine storage, DuomapConfiguration configuration, ValueValidator validator) {
        this.configuration = configuration;
        this.registry = new EntityRegistry();
        this.schemas = new SchemaCache(new PersistenceSchemaBuilder(registry, configuration));
        this.storage = storage;
        this.validator = validator;
        this.requiredRelationships = new RequiredRelationshipValidator();
        this.ddlRenderer = new DdlRenderer(configuration);
        this.runtime = new EntityRuntime(registry, schemas, storage);
        this.views = new EntityViewFactory();
        this.jsonReader = new JsonObjectReader();
    }

    public static Duomap inMemory() {
        return inMemory(DuomapConfiguration.defaults());
    }

    public static Duomap inMemory(DuomapConfiguration configuration) {
        return new Duomap(new InMemoryStorageEngine(configuration), configuration);
    }

    // Declarations and schemas

    /**
     * Register a definition so that relationships can target it by name.
     *
     * @throws io.duomap.core.DefinitionException if another definition already uses the name
     */
    public EntityDefinition declare(EntityDefinition definition) {
        return registry.register(definition);
    }

    /**
     * Memoized persistence schema of a definition.
     */
    public PersistenceSchema deriveSchema(EntityDefinition definition) {
        return schemas.derive(definition);
    }

    public PersistenceSchema deriveSchema(String entityName) {
        return schemas.derive(registry.require(entityName));
    }

    public Map<String, RelationshipDescriptor> extractRelationships(EntityDefinition definition) {
        return RelationshipExtractor.extract(definition);
    }

    public String renderDdl(String entityName) {
        return ddlRenderer.createTable(deriveSchema(entityName));
    }

    public TransferSchema project(PersistenceSchema schema, RelationshipStrategy strategy) {
        return TransferSchemaProjector.project(schema, strategy);
    }

    // Instances

    /**
     * Build an unsaved instance.
     * <p>
     * Values may hold scalar fields, foreign keys, an {@link EntityInstance} (or
     * null) for to-one fields and a list for to-many fields. Missing fields take
     * their declared default; a relationship value wins over a foreign key given
     * for the same relationship.
     *
     * @throws ValidationException      if scalar values fail validation
     * @throws IllegalArgumentException for unknown fields or bad relationship values
     */
    public EntityInstance newInstance(String entityName, Map<String, ?> values) {
        var binding = binding(entityName);
        var schema = binding.schema();

        var columnValues = new LinkedHashMap<String, Object>();
        var relationshipValues = new LinkedHashMap<String, Object>();
        for (var field : binding.definition().fields()) {
            if (field.hasDefault() && schema.hasColumn(field.name())) {
                columnValues.put(field.name(), field.defaultValue());
            }
        }
        var unknown = new ArrayList<FieldError>();
        for (var entry : values.entrySet()) {
            if (schema.hasColumn(entry.getKey())) {
                columnValues.put(entry.getKey(), entry.getValue());
            } else if (schema.isRelationship(entry.getKey())) {
                relationshipValues.put(entry.getKey(), entry.getValue());
            } else {
                unknown.add(new FieldError(entry.getKey(), "unknown field"));
            }
        }

        Map<String, Object> accepted = columnValues;
        if (configuration.validateOnConstruction()) {
            var result = validator.validate(binding.validationSchema(), columnValues);
            if (!result.isValid() || !unknown.isEmpty()) {
                var errors = new ArrayList<>(unknown);
                errors.addAll(result.errors());
                throw new ValidationException(entityName, errors);
            }
            accepted = result.values();
        } else if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown field '" + unknown.get(0).field() + "' on entity "
                    + entityName);
        }

        var instance = runtime.instantiate(binding);
        for (var entry : accepted.entrySet()) {
            instance.set(entry.getKey(), entry.getValue());
        }
        for (var entry : relationshipValues.entrySet()) {
            instance.set(entry.getKey(), entry.getValue());
        }
        return instance;
    }

    /**
     * Build an unsaved instance from a JSON object of scalar fields and
     * foreign keys. Text is coerced loosely, so {@code "id": "123"} is read
     * as {@code 123}.
     *
     * @throws io.duomap.validation.JsonInputException if the input is not a JSON object
     * @throws ValidationException                     if field values fail validation
     */
    public EntityInstance newInstanceFromJson(String entityName, String json) {
        return newInstance(entityName, jsonReader.read(entityName, json));
    }

    /**
     * Check required relationships without writing.
     *
     * @throws io.duomap.core.RequiredRelationshipException for the first required relationship left unset
     */
    public void validateRequired(EntityInstance instance) {
        requiredRelationships.validate(instance.schema(), instance.row());
    }

    /**
     * Run the validation collaborator over raw values for an entity.
     */
    public ValidationResult validateValues(String entityName, Map<String, ?> values) {
        return validator.validate(binding(entityName).validationSchema(), new LinkedHashMap<>(values));
    }

    /**
     * Parse a JSON object and run the validation collaborator over it.
     *
     * @throws io.duomap.validation.JsonInputException if the input is not a JSON object
     */
    public ValidationResult validateJson(String entityName, String json) {
        return validateValues(entityName, jsonReader.read(entityName, json));
    }

    /**
     * Insert or update an instance. The primary key assigned by storage is
     * written back to the instance.
     *
     * @return the same instance
     * @throws io.duomap.core.RequiredRelationshipException before any storage call
     * @throws ValidationException                        before any storage call
     */
    public EntityInstance save(EntityInstance instance) {
        var schema = instance.schema();
        var row = instance.row();
        requiredRelationships.validate(schema, row);
        var accepted = validator.validate(instance.binding().validationSchema(), row).orThrow();
        runtime.assignValues(instance, accepted);

        storage.ensureTable(schema);
        Object id = storage.insertOrUpdate(schema, accepted);
        runtime.markSaved(instance, id);
        LOG.debug("Saved {}#{}", schema.entityName(), id);
        return instance;
    }

    public Optional<EntityInstance> findById(String entityName, Object id) {
        var binding = binding(entityName);
        storage.ensureTable(binding.schema());
        return storage.findById(binding.schema(), id).map(row -> runtime.materialise(binding, row));
    }

    public List<EntityInstance> findAll(String entityName) {
        var binding = binding(entityName);
        storage.ensureTable(binding.schema());
        var rows = storage.findAll(binding.schema());
        var instances = new ArrayList<EntityInstance>(rows.size());
        for (var row : rows) {
            instances.add(runtime.materialise(binding, row));
        }
        return instances;
    }

    /**
     * Delete the row of a saved instance.
     *
     * @return whether a row was removed
     * @throws IllegalStateException if the instance was never saved
     */
    public boolean delete(EntityInstance instance) {
        if (!instance.isPersisted() || instance.id() == null) {
            throw new IllegalStateException("Cannot delete unsaved " + instance.entityName() + " instance");
        }
        var schema = instance.schema();
        storage.ensureTable(schema);
        boolean removed = storage.delete(schema, instance.id());
        runtime.markDeleted(instance);
        LOG.debug("Deleted {}#{} (removed={})", schema.entityName(), instance.id(), removed);
        return removed;
    }

    /**
     * Typed interface views over instances.
     */
    public EntityViewFactory views() {
        return views;
    }

    public <V> V view(Class<V> viewInterface, EntityInstance instance) {
        return views.create(viewInterface, instance);
    }

    // Accessors

    public DuomapConfiguration configuration() {
        return configuration;
    }

    public EntityRegistry registry() {
        return registry;
    }

    public StorageEngine storage() {
        return storage;
    }

    public SchemaCache schemas() {
        return schemas;
    }

    private EntityBinding binding(String entityName) {
        return runtime.binding(registry.require(entityName));
    }
}
