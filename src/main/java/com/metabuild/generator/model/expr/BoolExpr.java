package com.metabuild.generator.model.expr;

import java.util.Objects;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Boolean expression: {@code &&}, {@code ||}, {@code !}, {@code ==} or {@code !=}.
 * The right operand is {@code null} for {@link BoolOperator#NOT}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class BoolExpr extends Expression {

    private final BoolOperator operator;
    private final Expression left;
    private final Expression right;

    public BoolExpr(BoolOperator operator, Expression left, Expression right) {
        this(operator, left, right, null);
    }

    public BoolExpr(BoolOperator operator, Expression left, Expression right, SourcePosition position) {
        super(position);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        if (operator.isUnary() != (right == null)) {
            throw new IllegalArgumentException("operator " + operator + " used with wrong number of operands");
        }
        this.right = right;
    }

    public static BoolExpr not(Expression operand, SourcePosition position) {
        return new BoolExpr(BoolOperator.NOT, operand, null, position);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBool(this);
    }

    // Evaluated left to right with short-circuiting, like the make-time evaluation would.
    @Override
    public ConstantValue asConstant() {
        ConstantValue l = left.asConstant();
        switch (operator) {
            case NOT:
                if (!l.isBoolean()) {
                    return notBoolean(l, left);
                }
                return ConstantValue.of(!l.isTrue());
            case AND:
                if (l.isFalse()) {
                    return l;
                }
                if (!l.isBoolean()) {
                    return notBoolean(l, left);
                }
                return booleanOperand(right);
            case OR:
                if (l.isTrue()) {
                    return l;
                }
                if (!l.isBoolean()) {
                    return notBoolean(l, left);
                }
                return booleanOperand(right);
            case EQUAL:
            case NOT_EQUAL: {
                if (!l.isConstant()) {
                    return l;
                }
                ConstantValue r = right.asConstant();
                if (!r.isConstant()) {
                    return r;
                }
                boolean eq = Objects.equals(l.getValue(), r.getValue());
                return ConstantValue.of(operator == BoolOperator.EQUAL ? eq : !eq);
            }
            default:
                throw new IllegalStateException("unexpected operator " + operator);
        }
    }

    private static ConstantValue booleanOperand(Expression e) {
        ConstantValue v = e.asConstant();
        return v.isBoolean() ? v : notBoolean(v, e);
    }

    private static ConstantValue notBoolean(ConstantValue v, Expression e) {
        return v.isConstant() ? ConstantValue.notConstant(e) : v;
    }

    @Override
    public String toString() {
        if (operator == BoolOperator.NOT) {
            return "!" + left;
        }
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
