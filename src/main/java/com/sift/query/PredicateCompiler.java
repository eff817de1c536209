package com.sift.query;

import com.sift.expression.BinaryExpression;
import com.sift.expression.ConstantExpression;
import com.sift.expression.Expression;
import com.sift.expression.ExpressionType;
import com.sift.expression.LambdaExpression;
import com.sift.expression.MemberExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.expression.UnaryExpression;
import com.sift.index.DocumentIndex;
import com.sift.index.FieldMetadata;
import org.springframework.stereotype.Component;

/**
 * Compiles boolean filter expressions into search query text.
 *
 * Grammar produced:
 * <ul>
 *   <li>groups are parenthesized; {@code a b} is AND, {@code a | b} is OR</li>
 *   <li>{@code -} prefixes a negated predicate</li>
 *   <li>leaf predicates are {@code @field:} followed by a tag {@code {..}}, text {@code ".."}
 *       or range {@code [lo hi]} literal, with {@code (} marking an exclusive bound</li>
 * </ul>
 */
@Component
public class PredicateCompiler {

    private final MethodCallTranslator methodCallTranslator;

    public PredicateCompiler(MethodCallTranslator methodCallTranslator) {
        this.methodCallTranslator = methodCallTranslator;
    }

    /**
     * Compile a filter expression
     *
     * @param expression the filter body (or a lambda wrapping it)
     * @param index      index declaration supplying the field metadata
     * @return the query text
     */
    public String compile(Expression expression, DocumentIndex index) {
        if (expression instanceof BinaryExpression) {
            return compileBinary((BinaryExpression) expression, index);
        }
        if (expression instanceof MethodCallExpression) {
            return methodCallTranslator.translate((MethodCallExpression) expression, index);
        }
        if (expression instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) expression;
            String operand = compile(unary.getOperand(), index);
            return unary.getOperator() == ExpressionType.NOT ? "-" + operand : operand;
        }
        if (expression instanceof LambdaExpression) {
            return compile(((LambdaExpression) expression).getBody(), index);
        }
        throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                "Unparseable filter body detected", expression);
    }

    private String compileBinary(BinaryExpression binary, DocumentIndex index) {
        Expression left = binary.getLeft();
        Expression right = binary.getRight();
        boolean leftCompound = left instanceof BinaryExpression;
        boolean rightCompound = right instanceof BinaryExpression;

        if (leftCompound || rightCompound) {
            String leftText = leftCompound ? compileBinary((BinaryExpression) left, index) : operand(left, index);
            String separator = separator(binary);
            String rightText = rightCompound ? compileBinary((BinaryExpression) right, index) : operand(right, index);
            return "(" + leftText + separator + rightText + ")";
        }

        // two non-binary predicates joined directly, e.g. two method calls
        if (binary.getOperator().isLogical()) {
            return "(" + operand(left, index) + separator(binary) + operand(right, index) + ")";
        }

        return "(" + compileComparison(binary, index) + ")";
    }

    private String compileComparison(BinaryExpression binary, DocumentIndex index) {
        if (!binary.getOperator().isComparison()) {
            throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "Operator " + binary.getOperator() + " is not supported in search queries", binary);
        }

        Expression left = CallChain.unquote(binary.getLeft());
        if (!(left instanceof MemberExpression)) {
            throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                    "Left side of expression must be a member of the searched document", binary);
        }

        FieldMetadata field = QuerySyntax.requireSearchable(index, ((MemberExpression) left).getName());
        String value = operand(binary.getRight(), index);
        return QuerySyntax.comparison(binary.getOperator(), field, value);
    }

    /**
     * Render the non-binary side of a binary node
     */
    private String operand(Expression expression, DocumentIndex index) {
        if (expression instanceof ConstantExpression) {
            return QuerySyntax.literal(((ConstantExpression) expression).getValue());
        }
        if (expression instanceof MemberExpression) {
            return "@" + ((MemberExpression) expression).getName();
        }
        if (expression instanceof MethodCallExpression) {
            return methodCallTranslator.translate((MethodCallExpression) expression, index);
        }
        if (expression instanceof BinaryExpression) {
            return compileBinary((BinaryExpression) expression, index);
        }
        if (expression instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) expression;
            String operand = operand(unary.getOperand(), index);
            return switch (unary.getOperator()) {
                case NOT -> "-" + operand;
                case NEGATE -> negateLiteral(operand);
                default -> operand;
            };
        }
        if (expression instanceof LambdaExpression) {
            return operand(((LambdaExpression) expression).getBody(), index);
        }
        throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                "Expression cannot be used as a query operand", expression);
    }

    private static String negateLiteral(String literal) {
        return literal.startsWith("-") ? literal.substring(1) : "-" + literal;
    }

    private static String separator(BinaryExpression binary) {
        return switch (binary.getOperator()) {
            case OR_ELSE -> " | ";
            case AND_ALSO -> " ";
            default -> throw new QueryCompilationException(CompilationError.UNKNOWN_SEPARATOR,
                    "Unknown separator type " + binary.getOperator(), binary);
        };
    }
}
