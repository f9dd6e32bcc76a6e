package com.metabuild.generator.model.expr;

import com.metabuild.generator.error.NonConstException;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Value expression.
 *
 * Represents a value (typically assigned to a variable, but also conditions)
 * as a tree of expression objects. Expressions are kept in tree form until
 * the very end of processing and are manipulated in this form.
 *
 * Expression objects are immutable: a transformation always produces a new
 * tree. Equality is structural and ignores source positions.
 */
public abstract class Expression {

    private final SourcePosition position;

    protected Expression(SourcePosition position) {
        this.position = position;
    }

    /** Position in source code this expression originates from, may be {@code null}. */
    public SourcePosition getPosition() {
        return position;
    }

    public abstract <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * Evaluates the expression into a bake-time constant: a {@code String},
     * {@code Boolean}, {@code List} or {@code null}. Expressions that can only be
     * evaluated at make-time produce a not-constant result rather than an error.
     */
    public abstract ConstantValue asConstant();

    /** True iff the expression evaluates to a bake-time constant. */
    public boolean isConst() {
        return asConstant().isConstant();
    }

    /** True for expressions that represent an empty/unset value. */
    public boolean isNull() {
        return false;
    }

    /**
     * Like {@link #asConstant()}, but throws if the value cannot be determined.
     *
     * @throws NonConstException if the expression isn't constant
     */
    public Object requireConstant() {
        ConstantValue value = asConstant();
        if (!value.isConstant()) {
            throw new NonConstException(this);
        }
        return value.getValue();
    }
}
