package io.duomap.runtime;

import io.duomap.Duomap;
import io.duomap.core.EntityDefinition;
import io.duomap.core.Types;
import io.duomap.core.UnregisteredTargetException;
import io.duomap.testutil.CountingStorageEngine;
import io.duomap.testutil.Library;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LazyReferenceTest {

    private CountingStorageEngine storage;
    private Duomap duomap;
    private EntityInstance ada;

    @BeforeEach
    void setUp() {
        storage = new CountingStorageEngine();
        duomap = new Duomap(storage);
        duomap.declare(Library.author());
        duomap.declare(Library.book());
        ada = duomap.save(duomap.newInstance("Author", Map.of("name", "Ada")));
    }

    @Nested
    class Reads {

        @Test
        void loadedInstanceResolvesOnceAndCachesIdentity() {
            var saved = duomap.save(duomap.newInstance("Book", Map.of("title", "Notes", "author", ada)));
            var loaded = duomap.findById("Book", saved.id()).orElseThrow();
            storage.reset();

            assertThat(loaded.isResolved("author")).isFalse();
            var first = loaded.getRelated("author");
            var second = loaded.getRelated("author");

            assertThat(first).isNotNull();
            assertThat(second).isSameAs(first);
            assertThat(first.get("name")).isEqualTo("Ada");
            assertThat(first.id()).isEqualTo(ada.id());
            assertThat(storage.findByIdCalls()).isEqualTo(1);
        }

        @Test
        void nullForeignKeyResolvesToAbsentWithoutQuery() {
            var saved = duomap.save(duomap.newInstance("Book", Map.of("title", "Notes", "author", ada)));
            var loaded = duomap.findById("Book", saved.id()).orElseThrow();
            storage.reset();

            assertThat(loaded.get("editor")).isNull();
            assertThat(loaded.isResolved("editor")).isTrue();
            assertThat(storage.totalCalls()).isZero();
        }

        @Test
        void danglingForeignKeyResolvesToAbsentAndIsCached() {
            var book = duomap.newInstance("Book", Map.of("title", "Orphan", "author_id", 404L));
            storage.reset();

            assertThat(book.getRelated("author")).isNull();
            assertThat(book.getRelated("author")).isNull();
            assertThat(book.isResolved("author")).isTrue();
            assertThat(storage.findByIdCalls()).isEqualTo(1);
        }

        @Test
        void selfReferenceResolvesThroughOwnEntityType() {
            var other = new Duomap(new CountingStorageEngine());
            var person = other.declare(EntityDefinition.builder("Person")
                    .field("id", Types.LONG)
                    .field("mentor", Types.relation(Types.nullable(Types.entity("Person"))))
                    .build());
            var instance = other.newInstance("Person", Map.of("mentor_id", 1L));

            assertThat(person.name()).isEqualTo("Person");
            assertThat(instance.getRelated("mentor")).isNull();
        }

        @Test
        void undeclaredTargetFailsOnFirstUse() {
            var other = new Duomap(new CountingStorageEngine());
            var ghostly = EntityDefinition.builder("Haunted")
                    .field("id", Types.LONG)
                    .field("ghost", Types.relation(Types.nullable(Types.entity("Ghost"))))
                    .build();
            other.declare(ghostly);

            assertThatThrownBy(() -> other.newInstance("Haunted", Map.of()))
                    .isInstanceOf(UnregisteredTargetException.class)
                    .hasMessageContaining("'Ghost'");
        }
    }

    @Nested
    class Writes {

        @Test
        void writingInstanceUpdatesCacheAndForeignKeyTogether() {
            var book = duomap.newInstance("Book", Map.of("title", "Notes"));
            storage.reset();

            book.set("author", ada);

            assertThat(book.get("author_id")).isEqualTo(ada.id());
            assertThat(book.getRelated("author")).isSameAs(ada);
            assertThat(storage.totalCalls()).isZero();
        }

        @Test
        void writingNullClearsBothEvenForRequiredRelationship() {
            var book = duomap.newInstance("Book", Map.of("title", "Notes", "author", ada));

            book.set("author", null);

            assertThat(book.get("author_id")).isNull();
            assertThat(book.cachedReference("author")).isNull();
            assertThat(book.isResolved("author")).isTrue();
        }

        @Test
        void writingForeignKeyDirectlyInvalidatesCache() {
            var grace = duomap.save(duomap.newInstance("Author", Map.of("name", "Grace")));
            var book = duomap.newInstance("Book", Map.of("title", "Notes", "author", ada));
            storage.reset();

            book.set("author_id", grace.id());

            assertThat(book.isResolved("author")).isFalse();
            assertThat(book.getRelated("author").get("name")).isEqualTo("Grace");
            assertThat(storage.findByIdCalls()).isEqualTo(1);
        }

        @Test
        void unsavedInstanceCannotBeAssigned() {
            var draft = duomap.newInstance("Author", Map.of("name", "Draft"));
            var book = duomap.newInstance("Book", Map.of("title", "Notes"));

            assertThatThrownBy(() -> book.set("author", draft))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("has no primary key");
            assertThat(book.get("author_id")).isNull();
        }

        @Test
        void wrongEntityTypeIsRejected() {
            var book = duomap.newInstance("Book", Map.of("title", "Notes", "author", ada));
            var saved = duomap.save(book);
            var other = duomap.newInstance("Book", Map.of("title", "Other"));

            assertThatThrownBy(() -> other.set("author", saved))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("expects a Author instance but got Book");
            assertThatThrownBy(() -> other.set("author", "Ada"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void referencesAreInstalledOncePerEntityType() {
        var first = duomap.newInstance("Book", Map.of("title", "A"));
        var second = duomap.newInstance("Book", Map.of("title", "B"));

        assertThat(first.binding()).isSameAs(second.binding());
        assertThat(first.binding().reference("author")).isSameAs(second.binding().reference("author"));
        assertThat(first.binding().references()).extracting(LazyReference::foreignKey)
                .containsExactly("author_id", "editor_id");
        assertThat(first.binding().reference("title")).isNull();
    }
}
