package com.sift.aggregation;

import com.sift.expression.ExpressionType;
import com.sift.expression.UnaryExpression;
import com.sift.query.CompilationError;
import com.sift.query.QueryCompilationException;
import org.junit.jupiter.api.Test;

import static com.sift.expression.Expressions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueExpressionCompilerTest {

    private final ValueExpressionCompiler compiler = new ValueExpressionCompiler();

    @Test
    void testArithmetic() {
        assertThat(compiler.compile(binary(ExpressionType.DIVIDE,
                binary(ExpressionType.ADD, member("Total"), constant(1.50)), constant(2))))
                .isEqualTo("((@Total + 1.5) / 2)");
    }

    @Test
    void testLogicalAndComparison() {
        assertThat(compiler.compile(and(greaterThan(member("Age"), constant(21)),
                equal(member("City"), constant("Paris")))))
                .isEqualTo("((@Age > 21) && (@City == \"Paris\"))");
    }

    @Test
    void testBooleansAndEscapedStrings() {
        assertThat(compiler.compile(constant(true))).isEqualTo("1");
        assertThat(compiler.compile(constant(false))).isEqualTo("0");
        assertThat(compiler.compile(constant("say \"hi\""))).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void testUnaryOperators() {
        assertThat(compiler.compile(not(greaterThan(member("Age"), constant(3))))).isEqualTo("!(@Age > 3)");
        assertThat(compiler.compile(new UnaryExpression(ExpressionType.NEGATE, member("Age")))).isEqualTo("-@Age");
        assertThat(compiler.compile(convert(member("Age")))).isEqualTo("@Age");
    }

    @Test
    void testFunctionsAreMappedCaseInsensitively() {
        assertThat(compiler.compile(call("ToUpper", member("City")))).isEqualTo("upper(@City)");
        assertThat(compiler.compile(call("Substring", member("Name"), constant(0), constant(3))))
                .isEqualTo("substr(@Name,0,3)");
        assertThat(compiler.compile(call("Ceiling", member("Total")))).isEqualTo("ceil(@Total)");
    }

    @Test
    void testLambdaBodyIsCompiled() {
        assertThat(compiler.compile(lambda(member("Total")))).isEqualTo("@Total");
    }

    @Test
    void testUnknownFunctionFails() {
        assertThatThrownBy(() -> compiler.compile(call("Soundex", member("Name"))))
                .isInstanceOfSatisfying(QueryCompilationException.class,
                        e -> assertThat(e.getError()).isEqualTo(CompilationError.UNSUPPORTED_OPERATOR));
    }

    @Test
    void testNullLiteralFails() {
        assertThatThrownBy(() -> compiler.compile(constant(null)))
                .isInstanceOfSatisfying(QueryCompilationException.class,
                        e -> assertThat(e.getError()).isEqualTo(CompilationError.UNSUPPORTED_OPERATOR));
    }

    @Test
    void testNewObjectIsNotAValue() {
        assertThatThrownBy(() -> compiler.compile(newObject("Name")))
                .isInstanceOf(QueryCompilationException.class);
    }
}
