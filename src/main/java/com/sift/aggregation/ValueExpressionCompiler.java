package com.sift.aggregation;

import com.sift.expression.BinaryExpression;
import com.sift.expression.ConstantExpression;
import com.sift.expression.Expression;
import com.sift.expression.LambdaExpression;
import com.sift.expression.MemberExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.expression.UnaryExpression;
import com.sift.query.CompilationError;
import com.sift.query.QueryCompilationException;
import com.sift.query.QuerySyntax;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compiles value expressions for APPLY and FILTER stages, e.g.
 * {@code (@price * @quantity)} or {@code ((@age > 21) && upper(@city) == "PARIS")}
 */
@Component
public class ValueExpressionCompiler {

    private static final Map<String, String> FUNCTIONS = new HashMap<>();

    static {
        registerFunction("abs", "abs");
        registerFunction("floor", "floor");
        registerFunction("ceil", "ceil");
        registerFunction("ceiling", "ceil");
        registerFunction("sqrt", "sqrt");
        registerFunction("log", "log");
        registerFunction("log2", "log2");
        registerFunction("exp", "exp");
        registerFunction("upper", "upper");
        registerFunction("toupper", "upper");
        registerFunction("lower", "lower");
        registerFunction("tolower", "lower");
        registerFunction("strlen", "strlen");
        registerFunction("length", "strlen");
        registerFunction("substr", "substr");
        registerFunction("substring", "substr");
        registerFunction("contains", "contains");
        registerFunction("startswith", "startswith");
        registerFunction("format", "format");
        registerFunction("timefmt", "timefmt");
        registerFunction("day", "day");
        registerFunction("hour", "hour");
        registerFunction("minute", "minute");
        registerFunction("month", "month");
        registerFunction("year", "year");
    }

    private static void registerFunction(String callName, String engineName) {
        FUNCTIONS.put(callName, engineName);
    }

    /**
     * Compile a value expression
     *
     * @param expression the expression (or a lambda wrapping it)
     * @return expression text in the engine's APPLY/FILTER syntax
     */
    public String compile(Expression expression) {
        if (expression instanceof MemberExpression) {
            return "@" + ((MemberExpression) expression).getName();
        }
        if (expression instanceof ConstantExpression) {
            return constant((ConstantExpression) expression);
        }
        if (expression instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) expression;
            return "(" + compile(binary.getLeft()) + " " + binary.getOperator().getSymbol() + " "
                    + compile(binary.getRight()) + ")";
        }
        if (expression instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) expression;
            String operand = compile(unary.getOperand());
            return switch (unary.getOperator()) {
                case NOT -> "!" + operand;
                case NEGATE -> "-" + operand;
                default -> operand;
            };
        }
        if (expression instanceof MethodCallExpression) {
            return function((MethodCallExpression) expression);
        }
        if (expression instanceof LambdaExpression) {
            return compile(((LambdaExpression) expression).getBody());
        }
        throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                "Expression cannot be used in an apply or filter stage", expression);
    }

    private String function(MethodCallExpression call) {
        String engineName = FUNCTIONS.get(call.getMethodName().toLowerCase(Locale.ROOT));
        if (engineName == null) {
            throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "Function " + call.getMethodName() + " is not supported in apply or filter stages", call);
        }
        return call.getArguments().stream()
                .map(this::compile)
                .collect(Collectors.joining(",", engineName + "(", ")"));
    }

    private static String constant(ConstantExpression constant) {
        Object value = constant.getValue();
        if (value == null) {
            throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "Null literals are not supported in apply or filter stages", constant);
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        if (value instanceof Number) {
            return QuerySyntax.literal(value);
        }
        String text = value instanceof Enum<?> ? ((Enum<?>) value).name() : value.toString();
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
