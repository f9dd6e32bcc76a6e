package com.metabuild.generator.error;

import com.metabuild.generator.model.expr.Expression;

/**
 * Thrown by APIs that require a bake-time constant when the expression
 * can only be evaluated at make-time. The simplifier never lets it escape;
 * it works with {@link com.metabuild.generator.model.expr.ConstantValue} instead.
 */
public class NonConstException extends GeneratorException {

    private static final long serialVersionUID = 1L;

    public NonConstException(Expression expression) {
        super("expression \"" + expression + "\" must evaluate to a constant", expression.getPosition());
    }

    public NonConstException(String message, Expression expression) {
        super(message, expression.getPosition());
    }
}
