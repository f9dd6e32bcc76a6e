package com.metabuild.generator.interpreter;

import java.util.Objects;

import com.metabuild.generator.model.expr.BoolExpr;
import com.metabuild.generator.model.expr.BoolOperator;
import com.metabuild.generator.model.expr.BoolValueExpr;
import com.metabuild.generator.model.expr.ConstantValue;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;

/**
 * Adds evaluation of constant boolean expressions, and of the conditionals
 * depending on them, to {@link BasicSimplifier}.
 *
 * AND and OR are reduced even when only one operand is known: {@code true && x}
 * is {@code x}, {@code true || x} is {@code true}.
 */
public class ConditionalsSimplifier extends BasicSimplifier {

    @Override
    public Expression visitBool(BoolExpr expr) {
        Expression simplified = super.visitBool(expr);
        if (!(simplified instanceof BoolExpr e)) {
            return simplified;
        }
        ConstantValue left = e.getLeft().asConstant();
        switch (e.getOperator()) {
            case NOT:
                if (left.isBoolean()) {
                    return new BoolValueExpr(!left.isTrue(), e.getPosition());
                }
                return e;
            case AND: {
                ConstantValue right = e.getRight().asConstant();
                if (left.isBoolean() && right.isBoolean()) {
                    return new BoolValueExpr(left.isTrue() && right.isTrue(), e.getPosition());
                }
                if (left.isTrue()) {
                    return e.getRight();
                }
                if (right.isTrue()) {
                    return e.getLeft();
                }
                return e;
            }
            case OR: {
                if (left.isTrue()) {
                    return new BoolValueExpr(true, e.getPosition());
                }
                ConstantValue right = e.getRight().asConstant();
                if (right.isTrue()) {
                    return new BoolValueExpr(true, e.getPosition());
                }
                if (left.isBoolean() && right.isBoolean()) {
                    return new BoolValueExpr(false, e.getPosition());
                }
                return e;
            }
            case EQUAL:
            case NOT_EQUAL: {
                ConstantValue right = e.getRight().asConstant();
                if (!left.isConstant() || !right.isConstant()) {
                    return e;
                }
                boolean equal = Objects.equals(left.getValue(), right.getValue());
                return new BoolValueExpr(e.getOperator() == BoolOperator.EQUAL
                        ? equal : !equal, e.getPosition());
            }
            default:
                return e;
        }
    }

    @Override
    public Expression visitIf(IfExpr expr) {
        Expression simplified = super.visitIf(expr);
        if (!(simplified instanceof IfExpr e)) {
            return simplified;
        }
        ConstantValue cond = e.getCond().asConstant();
        if (!cond.isBoolean()) {
            return e;
        }
        return cond.isTrue() ? e.getYes() : e.getNo();
    }
}
