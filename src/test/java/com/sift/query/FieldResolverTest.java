package com.sift.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.sift.expression.Expressions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FieldResolver
 */
class FieldResolverTest {

    private FieldResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new FieldResolver();
    }

    @Test
    void testResolveMember() {
        assertThat(resolver.resolveFieldName(member("Age"))).isEqualTo("Age");
    }

    @Test
    void testResolveConstant() {
        assertThat(resolver.resolveFieldName(constant("City"))).isEqualTo("City");
        assertThat(resolver.resolveFieldName(constant(42))).isEqualTo("42");
    }

    @Test
    void testResolveIndexerCallUsesFirstConstantArgument() {
        // Given: An indexer access such as x["Nickname"]
        // When / Then: The key names the field
        assertThat(resolver.resolveFieldName(call("get_Item", member("Record"), constant("Nickname"))))
                .isEqualTo("Nickname");
    }

    @Test
    void testResolveThroughLambdaAndUnaryWrappers() {
        assertThat(resolver.resolveFieldName(quote(lambda(convert(member("Rank")))))).isEqualTo("Rank");
    }

    @Test
    void testResolveFailsForBinaryExpression() {
        assertThatThrownBy(() -> resolver.resolveFieldName(greaterThan(member("Age"), constant(1))))
                .isInstanceOf(QueryCompilationException.class)
                .extracting(e -> ((QueryCompilationException) e).getError())
                .isEqualTo(CompilationError.UNRESOLVABLE_FIELD_REFERENCE);
    }

    @Test
    void testResolveFailsForIndexerWithoutConstantKey() {
        assertThatThrownBy(() -> resolver.resolveFieldName(call("get_Item", member("Record"))))
                .isInstanceOf(QueryCompilationException.class)
                .extracting(e -> ((QueryCompilationException) e).getError())
                .isEqualTo(CompilationError.UNRESOLVABLE_FIELD_REFERENCE);
    }

    @Test
    void testResolveSingleFieldKey() {
        assertThat(resolver.resolveFieldNames(quote(lambda(member("City"))))).containsExactly("City");
    }

    @Test
    void testResolveTupleKeyKeepsOrderAndDuplicates() {
        assertThat(resolver.resolveFieldNames(lambda(newObject("City", "Name", "City"))))
                .containsExactly("City", "Name", "City");
    }

    @Test
    void testResolveTupleKeyWithoutMembers() {
        assertThat(resolver.resolveFieldNames(lambda(newObject()))).isEmpty();
    }

    @Test
    void testSingleFieldResolutionRejectsTuple() {
        assertThatThrownBy(() -> resolver.resolveFieldName(newObject("City")))
                .isInstanceOf(QueryCompilationException.class);
    }
}
