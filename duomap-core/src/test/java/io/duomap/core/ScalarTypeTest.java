package io.duomap.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScalarTypeTest {

    @Test
    void longShouldAcceptNarrowerIntegersAndWidenThem() {
        assertThat(ScalarType.LONG.accepts(7)).isTrue();
        assertThat(ScalarType.LONG.coerce(7)).isEqualTo(7L);
        assertThat(ScalarType.LONG.accepts(7.5d)).isFalse();
    }

    @Test
    void intShouldNarrowLongsThatFit() {
        assertThat(ScalarType.INT.coerce(42L)).isEqualTo(42);
        assertThat(ScalarType.INT.accepts((long) Integer.MAX_VALUE + 1)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "INT, 123, 123",
            "INT, ' 7 ', 7",
            "LONG, 9000000000, 9000000000",
            "DOUBLE, 2.5, 2.5",
            "DECIMAL, 10.25, 10.25",
            "BOOLEAN, TRUE, true",
            "LOCAL_DATE, 2024-02-29, 2024-02-29"
    })
    void numericAndLiteralTextShouldBeParsed(ScalarType type, String text, String expected) {
        assertThat(type.accepts(text)).isTrue();
        var coerced = type.coerce(text);
        assertThat(coerced).isInstanceOf(type.javaType());
        assertThat(coerced.toString()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "INT, not_a_number",
            "INT, 1.5",
            "LONG, seven",
            "BOOLEAN, yes",
            "DECIMAL, abc",
            "INSTANT, yesterday"
    })
    void unparseableTextShouldBeRejected(ScalarType type, String text) {
        assertThat(type.accepts(text)).isFalse();
        assertThatThrownBy(() -> type.coerce(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uuidShouldAcceptParseableStrings() {
        var id = UUID.randomUUID();

        assertThat(ScalarType.UUID.accepts(id.toString())).isTrue();
        assertThat(ScalarType.UUID.coerce(id.toString())).isEqualTo(id);
        assertThat(ScalarType.UUID.accepts("not-a-uuid")).isFalse();
    }

    @Test
    void decimalShouldWidenIntegers() {
        assertThat(ScalarType.DECIMAL.coerce(5)).isEqualTo(BigDecimal.valueOf(5));
    }

    @Test
    void nullIsNeverAccepted() {
        for (var type : ScalarType.values()) {
            assertThat(type.accepts(null)).as(type.name()).isFalse();
        }
    }

    @Test
    void identifierCompatibleTypes() {
        assertThat(ScalarType.LONG.identifierCompatible()).isTrue();
        assertThat(ScalarType.INT.identifierCompatible()).isTrue();
        assertThat(ScalarType.STRING.identifierCompatible()).isTrue();
        assertThat(ScalarType.UUID.identifierCompatible()).isTrue();
        assertThat(ScalarType.DOUBLE.identifierCompatible()).isFalse();
        assertThat(ScalarType.BOOLEAN.identifierCompatible()).isFalse();
    }
}
