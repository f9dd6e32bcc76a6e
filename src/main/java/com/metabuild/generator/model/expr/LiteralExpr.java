package com.metabuild.generator.model.expr;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Constant expression holding a literal string.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class LiteralExpr extends Expression {

    private final String value;

    public LiteralExpr(String value) {
        this(value, null);
    }

    public LiteralExpr(String value, SourcePosition position) {
        super(position);
        this.value = value;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public ConstantValue asConstant() {
        return ConstantValue.of(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
