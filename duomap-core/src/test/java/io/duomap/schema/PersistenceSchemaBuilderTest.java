package io.duomap.schema;

import io.duomap.core.DefinitionException;
import io.duomap.core.DuomapConfiguration;
import io.duomap.core.EntityDefinition;
import io.duomap.core.EntityRegistry;
import io.duomap.core.RelationshipDescriptor;
import io.duomap.core.ScalarType;
import io.duomap.core.Types;
import io.duomap.core.UnregisteredTargetException;
import io.duomap.testutil.Library;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistenceSchemaBuilderTest {

    private EntityRegistry registry;
    private PersistenceSchemaBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new EntityRegistry();
        builder = new PersistenceSchemaBuilder(registry, DuomapConfiguration.defaults());
    }

    @Test
    void shouldPlaceDeclaredColumnsBeforeSynthesizedKeys() {
        registry.register(Library.author());
        var book = registry.register(Library.book());

        var schema = builder.build(book);

        assertThat(schema.tableName()).isEqualTo("book");
        assertThat(schema.primaryKey()).isEqualTo("id");
        assertThat(schema.columnNames()).containsExactly("id", "title", "pages", "author_id", "editor_id");
        assertThat(schema.column("author_id")).isEqualTo(
                Column.synthesized("author_id", ScalarType.LONG, false, "author"));
        assertThat(schema.column("editor_id").nullable()).isTrue();
        assertThat(schema.column("pages").nullable()).isTrue();
        assertThat(schema.primaryKeyColumn().primaryKey()).isTrue();
    }

    @Test
    void shouldNeverTurnRelationshipFieldsIntoColumns() {
        registry.register(Library.book());
        var author = registry.register(Library.author());

        var schema = builder.build(author);

        assertThat(schema.columnNames()).containsExactly("id", "name");
        assertThat(schema.foreignKeys()).isEmpty();
        assertThat(schema.relationships()).containsOnlyKeys("books");
        assertThat(schema.hasColumn("books")).isFalse();
    }

    @Test
    void shouldReferenceTargetTableAndPrimaryKey() {
        registry.register(Library.author());
        var book = registry.register(Library.book());

        var schema = builder.build(book);

        assertThat(schema.foreignKeys()).containsExactly(
                new ForeignKeyConstraint("author_id", "author", "Author", "author", "id"),
                new ForeignKeyConstraint("editor_id", "editor", "Author", "author", "id"));
        assertThat(schema.foreignKeyFor("editor").column()).isEqualTo("editor_id");
        assertThat(schema.toOneRelationships()).extracting(RelationshipDescriptor::fieldName).containsExactly("author", "editor");
    }

    @Test
    void foreignKeyShouldTakeTargetPrimaryKeyType() {
        registry.register(EntityDefinition.builder("Country")
                .tableName("countries")
                .primaryKey("code")
                .field("code", Types.STRING)
                .build());
        var city = registry.register(EntityDefinition.builder("City")
                .field("id", Types.INT)
                .field("country", Types.relation(Types.entity("Country")))
                .build());

        var schema = builder.build(city);

        assertThat(schema.column("country_id").type()).isEqualTo(ScalarType.STRING);
        assertThat(schema.foreignKeys().get(0).targetTableName()).isEqualTo("countries");
        assertThat(schema.foreignKeys().get(0).targetColumn()).isEqualTo("code");
    }

    @Test
    void shouldAllowSelfReferenceBeforeRegistration() {
        var employee = EntityDefinition.builder("Employee")
                .field("id", Types.LONG)
                .field("manager", Types.relation(Types.nullable(Types.entity("Employee"))))
                .build();

        var schema = builder.build(employee);

        assertThat(schema.foreignKeys()).singleElement()
                .satisfies(fk -> assertThat(fk.targetTableName()).isEqualTo("employee"));
    }

    @Test
    void shouldNotMutateDefinition() {
        registry.register(Library.author());
        var book = registry.register(Library.book());
        var fieldsBefore = book.fields();

        builder.build(book);

        assertThat(book.fields()).isEqualTo(fieldsBefore);
        assertThat(book.hasField("author_id")).isFalse();
    }

    @Test
    void shouldUseConfiguredDefaultPrimaryKey() {
        var custom = new PersistenceSchemaBuilder(registry,
                DuomapConfiguration.builder().defaultPrimaryKey("uid").build());
        var token = EntityDefinition.builder("Token")
                .field("uid", Types.UUID)
                .field("value", Types.STRING)
                .build();

        assertThat(custom.build(token).primaryKey()).isEqualTo("uid");
    }

    @Nested
    class Failures {

        @Test
        void unregisteredTarget() {
            var book = registry.register(Library.book());

            assertThatThrownBy(() -> builder.build(book))
                    .isInstanceOfSatisfying(UnregisteredTargetException.class, e -> {
                        assertThat(e.fieldName()).isEqualTo("author");
                        assertThat(e.targetEntityName()).isEqualTo("Author");
                    });
        }

        @Test
        void missingPrimaryKey() {
            var keyless = EntityDefinition.builder("Keyless")
                    .field("name", Types.STRING)
                    .build();

            assertThatThrownBy(() -> builder.build(keyless))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("no primary-key field 'id'");
        }

        @Test
        void nullablePrimaryKey() {
            var loose = EntityDefinition.builder("Loose")
                    .field("id", Types.nullable(Types.LONG))
                    .build();

            assertThatThrownBy(() -> builder.build(loose))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("cannot be nullable");
        }

        @Test
        void nonIdentifierPrimaryKey() {
            var measured = EntityDefinition.builder("Measured")
                    .field("id", Types.DOUBLE)
                    .build();

            assertThatThrownBy(() -> builder.build(measured))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("non-identifier type DOUBLE");
        }

        @Test
        void relationshipAsPrimaryKey() {
            registry.register(Library.author());
            var odd = EntityDefinition.builder("Odd")
                    .primaryKey("owner")
                    .field("owner", Types.relation(Types.entity("Author")))
                    .build();

            assertThatThrownBy(() -> builder.build(odd))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("cannot be a relationship");
        }

        @Test
        void foreignKeyNameCollision() {
            registry.register(Library.author());
            var clash = EntityDefinition.builder("Clash")
                    .field("id", Types.LONG)
                    .field("author", Types.relation(Types.entity("Author")))
                    .field("author_id", Types.LONG)
                    .build();

            assertThatThrownBy(() -> builder.build(clash))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("author_id");
        }

        @Test
        void targetWithInvalidPrimaryKey() {
            registry.register(EntityDefinition.builder("Blob")
                    .field("id", Types.BOOLEAN)
                    .build());
            var holder = EntityDefinition.builder("Holder")
                    .field("id", Types.LONG)
                    .field("blob", Types.relation(Types.nullable(Types.entity("Blob"))))
                    .build();

            assertThatThrownBy(() -> builder.build(holder))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("Blob");
        }
    }
}
