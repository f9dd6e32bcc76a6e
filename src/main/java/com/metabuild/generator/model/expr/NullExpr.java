package com.metabuild.generator.model.expr;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Empty/unset value.
 */
public final class NullExpr extends Expression {

    public NullExpr() {
        this(null);
    }

    public NullExpr(SourcePosition position) {
        super(position);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitNull(this);
    }

    @Override
    public ConstantValue asConstant() {
        return ConstantValue.of(null);
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NullExpr;
    }

    @Override
    public int hashCode() {
        return NullExpr.class.hashCode();
    }

    @Override
    public String toString() {
        return "null";
    }
}
