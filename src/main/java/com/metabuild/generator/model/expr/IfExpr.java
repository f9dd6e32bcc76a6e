package com.metabuild.generator.model.expr;

import java.util.Objects;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Conditional value: {@code yes} if {@code cond} holds, {@code no} otherwise.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class IfExpr extends Expression {

    private final Expression cond;
    private final Expression yes;
    private final Expression no;

    public IfExpr(Expression cond, Expression yes, Expression no) {
        this(cond, yes, no, null);
    }

    public IfExpr(Expression cond, Expression yes, Expression no, SourcePosition position) {
        super(position);
        this.cond = Objects.requireNonNull(cond, "cond");
        this.yes = Objects.requireNonNull(yes, "yes");
        this.no = Objects.requireNonNull(no, "no");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public ConstantValue asConstant() {
        ConstantValue c = cond.asConstant();
        if (!c.isBoolean()) {
            return c.isConstant() ? ConstantValue.notConstant(cond) : c;
        }
        return c.isTrue() ? yes.asConstant() : no.asConstant();
    }

    @Override
    public String toString() {
        return "if (" + cond + ") then " + yes + " else " + no;
    }
}
