package com.metabuild.generator.model.expr;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Boolean constant.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class BoolValueExpr extends Expression {

    private final boolean value;

    public BoolValueExpr(boolean value) {
        this(value, null);
    }

    public BoolValueExpr(boolean value, SourcePosition position) {
        super(position);
        this.value = value;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBoolValue(this);
    }

    @Override
    public ConstantValue asConstant() {
        return ConstantValue.of(value);
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
