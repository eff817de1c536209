package com.sift.query;

import com.sift.expression.ConstantExpression;
import com.sift.expression.Expression;
import com.sift.expression.LambdaExpression;
import com.sift.expression.MemberExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.expression.NewExpression;
import com.sift.expression.UnaryExpression;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Extracts field names from the expression fragments that denote them:
 * member references, constant names, indexer calls and group-by key selectors
 */
@Component
public class FieldResolver {

    /**
     * Resolve the single field an expression refers to
     *
     * @param expression member, constant, indexer call, or a unary/lambda wrapping one
     * @return the field name
     * @throws QueryCompilationException UNRESOLVABLE_FIELD_REFERENCE for any other shape
     */
    public String resolveFieldName(Expression expression) {
        if (expression instanceof ConstantExpression) {
            return String.valueOf(((ConstantExpression) expression).getValue());
        }
        if (expression instanceof MemberExpression) {
            return ((MemberExpression) expression).getName();
        }
        if (expression instanceof MethodCallExpression) {
            return indexerKey((MethodCallExpression) expression);
        }
        if (expression instanceof UnaryExpression) {
            return resolveFieldName(((UnaryExpression) expression).getOperand());
        }
        if (expression instanceof LambdaExpression) {
            return resolveFieldName(((LambdaExpression) expression).getBody());
        }
        throw new QueryCompilationException(CompilationError.UNRESOLVABLE_FIELD_REFERENCE,
                "Invalid expression type detected when parsing field name", expression);
    }

    /**
     * Resolve the fields of a group-by key selector. A constructed tuple yields the
     * names of all its members in declaration order, duplicates included.
     *
     * @param expression key selector
     * @return the field names, possibly empty
     */
    public List<String> resolveFieldNames(Expression expression) {
        if (expression instanceof NewExpression) {
            return ((NewExpression) expression).getMembers();
        }
        if (expression instanceof UnaryExpression) {
            return resolveFieldNames(((UnaryExpression) expression).getOperand());
        }
        if (expression instanceof LambdaExpression) {
            return resolveFieldNames(((LambdaExpression) expression).getBody());
        }
        return List.of(resolveFieldName(expression));
    }

    private String indexerKey(MethodCallExpression call) {
        for (Expression argument : call.getArguments()) {
            if (argument instanceof ConstantExpression) {
                return String.valueOf(((ConstantExpression) argument).getValue());
            }
        }
        throw new QueryCompilationException(CompilationError.UNRESOLVABLE_FIELD_REFERENCE,
                "Method call used as a field reference has no constant key", call);
    }
}
