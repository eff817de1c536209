package com.sift.query;

import com.sift.expression.ExpressionType;
import com.sift.index.FieldKind;
import com.sift.index.FieldMetadata;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for QuerySyntax rendering rules
 */
class QuerySyntaxTest {

    @Test
    void testEscapeTagPrefixesEveryReservedCharacter() {
        assertThat(QuerySyntax.escapeTag("a.b@c-d e")).isEqualTo("a\\.b\\@c\\-d\\ e");
        assertThat(QuerySyntax.escapeTag("{x}|[y]")).isEqualTo("\\{x\\}\\|\\[y\\]");
    }

    @Test
    void testEscapeTagEscapesEachOccurrenceOnce() {
        String escaped = QuerySyntax.escapeTag("1,,2");

        assertThat(escaped).isEqualTo("1\\,\\,2");
    }

    @Test
    void testEscapeTagLeavesPlainTextAlone() {
        assertThat(QuerySyntax.escapeTag("Paris_2024")).isEqualTo("Paris_2024");
    }

    @Test
    void testLiteralFormatting() {
        assertThat(QuerySyntax.literal(21)).isEqualTo("21");
        assertThat(QuerySyntax.literal(21.0)).isEqualTo("21");
        assertThat(QuerySyntax.literal(21.5)).isEqualTo("21.5");
        assertThat(QuerySyntax.literal(0.0)).isEqualTo("0");
        assertThat(QuerySyntax.literal(new BigDecimal("3.1400"))).isEqualTo("3.14");
        assertThat(QuerySyntax.literal(true)).isEqualTo("true");
        assertThat(QuerySyntax.literal(FieldKind.TAG)).isEqualTo("TAG");
        assertThat(QuerySyntax.literal(null)).isEqualTo("null");
    }

    @Test
    void testFloatLiteralKeepsItsDecimalForm() {
        // Given: Floats whose double widening is not exact
        // Then: They render as written, not with the widened digits
        assertThat(QuerySyntax.literal(0.1f)).isEqualTo("0.1");
        assertThat(QuerySyntax.literal(2.5f)).isEqualTo("2.5");
        assertThat(QuerySyntax.literal(3.0f)).isEqualTo("3");
        assertThat(QuerySyntax.literal(1.0e10)).isEqualTo("10000000000");
    }

    @Test
    void testRangeComparisons() {
        FieldMetadata age = FieldMetadata.of("Age", FieldKind.NUMERIC);

        assertThat(QuerySyntax.comparison(ExpressionType.GREATER_THAN, age, "5")).isEqualTo("@Age:[(5 inf]");
        assertThat(QuerySyntax.comparison(ExpressionType.LESS_THAN, age, "5")).isEqualTo("@Age:[-inf (5]");
        assertThat(QuerySyntax.comparison(ExpressionType.GREATER_THAN_OR_EQUAL, age, "5")).isEqualTo("@Age:[5 inf]");
        assertThat(QuerySyntax.comparison(ExpressionType.LESS_THAN_OR_EQUAL, age, "5")).isEqualTo("@Age:[-inf 5]");
    }
}
