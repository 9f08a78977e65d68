package com.dslforge.core.validation;

import com.dslforge.core.model.VarType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LiteralTypes}.
 */
class LiteralTypesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "42        | INTEGER",
        "-7        | INTEGER",
        "3.14      | FLOAT",
        "\"text\"  | STRING",
        "True      | BOOLEAN",
        "[1, 2]    | LIST",
        "{\"a\": 1} | DICT"
    })
    void infer_literal_returnsType(String literal, VarType expected) {
        assertThat(LiteralTypes.infer(literal)).contains(expected);
    }

    @Test
    void infer_singleQuotedText_isString() {
        assertThat(LiteralTypes.infer("'text'")).contains(VarType.STRING);
    }

    @Test
    void infer_expressionText_returnsEmpty() {
        assertThat(LiteralTypes.infer("1 + 2")).isEmpty();
        assertThat(LiteralTypes.infer(null)).isEmpty();
    }

    @Test
    void isCompatible_allowsAnyAndIntegerToFloat() {
        assertThat(LiteralTypes.isCompatible(VarType.ANY, VarType.LIST)).isTrue();
        assertThat(LiteralTypes.isCompatible(VarType.FLOAT, VarType.INTEGER)).isTrue();
        assertThat(LiteralTypes.isCompatible(VarType.INTEGER, VarType.FLOAT)).isFalse();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "\"42\"    | INTEGER | 42",
        "3.0       | INTEGER | 3",
        "\"2.5\"   | FLOAT   | 2.5",
        "\"7\"     | FLOAT   | 7.0",
        "\"yes\"   | BOOLEAN | true",
        "0         | BOOLEAN | false",
        "12        | STRING  | \"12\""
    })
    void coerce_convertibleLiteral_returnsTargetLiteral(String literal, VarType target, String expected) {
        assertThat(LiteralTypes.coerce(literal, target)).contains(expected);
    }

    @Test
    void coerce_lossyOrUnsupported_returnsEmpty() {
        assertThat(LiteralTypes.coerce("3.5", VarType.INTEGER)).isEmpty();
        assertThat(LiteralTypes.coerce("\"five\"", VarType.INTEGER)).isEmpty();
        assertThat(LiteralTypes.coerce("\"maybe\"", VarType.BOOLEAN)).isEmpty();
        assertThat(LiteralTypes.coerce("[1]", VarType.STRING)).isEmpty();
        assertThat(LiteralTypes.coerce("1", VarType.LIST)).isEmpty();
    }
}
