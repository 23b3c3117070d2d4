package io.duomap.core;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeUnwrapperTest {

    @Nested
    class SupportedShapes {

        @Test
        void plainScalar() {
            var unwrapped = TypeUnwrapper.unwrap(Types.STRING);

            assertThat(unwrapped.shape()).isEqualTo(FieldShape.PLAIN_SCALAR);
            assertThat(unwrapped.scalarType()).isEqualTo(ScalarType.STRING);
            assertThat(unwrapped.nullable()).isFalse();
            assertThat(unwrapped.collection()).isFalse();
            assertThat(unwrapped.isRelationship()).isFalse();
        }

        @Test
        void nullableScalar() {
            var unwrapped = TypeUnwrapper.unwrap(Types.nullable(Types.INT));

            assertThat(unwrapped.shape()).isEqualTo(FieldShape.NULLABLE_SCALAR);
            assertThat(unwrapped.scalarType()).isEqualTo(ScalarType.INT);
            assertThat(unwrapped.targetEntityName()).isNull();
        }

        @Test
        void requiredToOne() {
            var unwrapped = TypeUnwrapper.unwrap(Types.relation(Types.entity("Author")));

            assertThat(unwrapped.shape()).isEqualTo(FieldShape.TO_ONE);
            assertThat(unwrapped.targetEntityName()).isEqualTo("Author");
            assertThat(unwrapped.relation()).isEqualTo(Relation.of());
            assertThat(unwrapped.scalarType()).isNull();
        }

        @Test
        void optionalToOneKeepsReverseField() {
            var unwrapped = TypeUnwrapper.unwrap(
                    Types.relation(Types.nullable(Types.entity("Author")), Relation.reversedBy("books")));

            assertThat(unwrapped.shape()).isEqualTo(FieldShape.NULLABLE_TO_ONE);
            assertThat(unwrapped.nullable()).isTrue();
            assertThat(unwrapped.relation().reverseField()).isEqualTo("books");
        }

        @Test
        void toMany() {
            var unwrapped = TypeUnwrapper.unwrap(Types.relation(Types.listOf(Types.entity("Book"))));

            assertThat(unwrapped.shape()).isEqualTo(FieldShape.TO_MANY);
            assertThat(unwrapped.collection()).isTrue();
            assertThat(unwrapped.targetEntityName()).isEqualTo("Book");
        }

        @Test
        void nullableListIsStillToMany() {
            var unwrapped = TypeUnwrapper.unwrap(Types.relation(Types.nullable(Types.listOf(Types.entity("Book")))));

            assertThat(unwrapped.shape()).isEqualTo(FieldShape.TO_MANY);
            assertThat(unwrapped.nullable()).isTrue();
        }

        @Test
        void unknownTargetIsNotResolved() {
            var unwrapped = TypeUnwrapper.unwrap(Types.relation(Types.entity("NeverDeclared")));

            assertThat(unwrapped.targetEntityName()).isEqualTo("NeverDeclared");
        }
    }

    @Nested
    class RejectedShapes {

        static Stream<TypeExpression> malformed() {
            return Stream.of(
                    Types.listOf(Types.nullable(Types.entity("Book"))),
                    Types.relation(Types.listOf(Types.nullable(Types.entity("Book")))),
                    Types.nullable(Types.nullable(Types.STRING)),
                    Types.relation(Types.listOf(Types.listOf(Types.entity("Book")))),
                    Types.nullable(Types.relation(Types.entity("Author"))),
                    Types.relation(Types.relation(Types.entity("Author"))),
                    Types.relation(Types.LONG),
                    Types.entity("Author"),
                    Types.nullable(Types.entity("Author")),
                    Types.listOf(Types.STRING));
        }

        @ParameterizedTest
        @MethodSource("malformed")
        void shouldRejectUnsupportedNesting(TypeExpression expression) {
            assertThatThrownBy(() -> TypeUnwrapper.unwrap("field", expression))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("Malformed type expression for field 'field'");
        }

        @Test
        void shouldRejectMissingExpression() {
            assertThatThrownBy(() -> TypeUnwrapper.unwrap(null))
                    .isInstanceOf(DefinitionException.class)
                    .hasMessageContaining("missing type expression");
        }
    }

    @Test
    void shouldBeDeterministic() {
        var expression = Types.relation(Types.nullable(Types.entity("Author")), Relation.reversedBy("books"));

        assertThat(TypeUnwrapper.unwrap(expression)).isEqualTo(TypeUnwrapper.unwrap(expression));
    }
}
