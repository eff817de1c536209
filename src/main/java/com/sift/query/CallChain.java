package com.sift.query;

import com.sift.expression.ConstantExpression;
import com.sift.expression.Expression;
import com.sift.expression.LambdaExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.expression.UnaryExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for walking a chain of stage calls. Each chained call takes the
 * previous stage as its first argument, so the outermost call is the last one chained.
 */
public final class CallChain {

    private static final String ASYNC_SUFFIX = "Async";

    private CallChain() {
    }

    /**
     * Unwind a chain into a list ordered from the outermost (last chained) call
     * to the innermost (first chained) one
     */
    public static List<MethodCallExpression> unwind(MethodCallExpression outermost) {
        List<MethodCallExpression> calls = new ArrayList<>();
        MethodCallExpression current = outermost;
        calls.add(current);
        while (current.getArgumentCount() > 0 && current.getArgument(0) instanceof MethodCallExpression) {
            current = (MethodCallExpression) current.getArgument(0);
            calls.add(current);
        }
        return calls;
    }

    /**
     * Stage name of a call, with asynchronous variants mapped to their synchronous name
     */
    public static String stageName(MethodCallExpression call) {
        String name = call.getMethodName();
        if (name.endsWith(ASYNC_SUFFIX) && name.length() > ASYNC_SUFFIX.length()) {
            return name.substring(0, name.length() - ASYNC_SUFFIX.length());
        }
        return name;
    }

    public static boolean hasArgument(MethodCallExpression call, int index) {
        return call.getArgumentCount() > index;
    }

    /**
     * The lambda passed at the given position, unwrapped from any quote
     */
    public static LambdaExpression lambdaArgument(MethodCallExpression call, int index) {
        Expression argument = argument(call, index);
        if (!(argument instanceof LambdaExpression)) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " expects a lambda at argument " + index, call);
        }
        return (LambdaExpression) argument;
    }

    /**
     * The constant value passed at the given position
     */
    public static Object constantArgument(MethodCallExpression call, int index) {
        Expression argument = argument(call, index);
        if (!(argument instanceof ConstantExpression)) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " expects a constant at argument " + index, call);
        }
        return ((ConstantExpression) argument).getValue();
    }

    public static int intArgument(MethodCallExpression call, int index) {
        Object value = constantArgument(call, index);
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " expects an integer at argument " + index, call);
        }
        long number = ((Number) value).longValue();
        if (number < 0 || number > Integer.MAX_VALUE) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " expects a non-negative integer at argument " + index
                            + ", got " + number, call);
        }
        return (int) number;
    }

    public static double doubleArgument(MethodCallExpression call, int index) {
        Object value = constantArgument(call, index);
        if (!(value instanceof Number)) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " expects a number at argument " + index, call);
        }
        return ((Number) value).doubleValue();
    }

    /**
     * Strip transparent wrappers (quote, convert) around an expression
     */
    public static Expression unquote(Expression expression) {
        Expression current = expression;
        while (current instanceof UnaryExpression && ((UnaryExpression) current).isTransparent()) {
            current = ((UnaryExpression) current).getOperand();
        }
        return current;
    }

    /**
     * The argument at the given position, unwrapped from any quote
     */
    public static Expression argument(MethodCallExpression call, int index) {
        if (!hasArgument(call, index)) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " is missing argument " + index, call);
        }
        return unquote(call.getArgument(index));
    }
}
