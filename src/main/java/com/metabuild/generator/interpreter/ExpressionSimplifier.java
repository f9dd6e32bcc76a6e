package com.metabuild.generator.interpreter;

import com.metabuild.generator.model.expr.Expression;

/**
 * Entry point for simplifying single expressions.
 */
public final class ExpressionSimplifier {

    private ExpressionSimplifier() {
    }

    /**
     * Simplifies {@code e} as much as possible. Returns {@code e} itself if
     * nothing could be simplified.
     */
    public static Expression simplify(Expression e) {
        return new ConditionalsSimplifier().visit(e);
    }
}
