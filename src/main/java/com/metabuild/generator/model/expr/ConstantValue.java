package com.metabuild.generator.model.expr;

import java.util.Objects;

import com.metabuild.generator.error.NonConstException;

/**
 * Result of evaluating an expression at bake-time: either a constant value
 * or the information that it can't be determined yet, together with the
 * sub-expression that blocked the evaluation.
 */
public final class ConstantValue {

    private static final ConstantValue NULL = new ConstantValue(true, null, null);
    private static final ConstantValue TRUE = new ConstantValue(true, Boolean.TRUE, null);
    private static final ConstantValue FALSE = new ConstantValue(true, Boolean.FALSE, null);

    private final boolean constant;
    private final Object value;
    private final Expression blocker;

    private ConstantValue(boolean constant, Object value, Expression blocker) {
        this.constant = constant;
        this.value = value;
        this.blocker = blocker;
    }

    public static ConstantValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean b) {
            return b ? TRUE : FALSE;
        }
        return new ConstantValue(true, value, null);
    }

    public static ConstantValue notConstant(Expression blocker) {
        return new ConstantValue(false, null, Objects.requireNonNull(blocker, "blocker"));
    }

    public boolean isConstant() {
        return constant;
    }

    /** The sub-expression that prevented evaluation; {@code null} for constants. */
    public Expression getBlocker() {
        return blocker;
    }

    /**
     * @throws NonConstException if the value isn't constant
     */
    public Object getValue() {
        if (!constant) {
            throw new NonConstException(blocker);
        }
        return value;
    }

    /** True iff the value is the boolean constant {@code true}. */
    public boolean isTrue() {
        return constant && Boolean.TRUE.equals(value);
    }

    /** True iff the value is the boolean constant {@code false}. */
    public boolean isFalse() {
        return constant && Boolean.FALSE.equals(value);
    }

    /** True iff the value is a boolean constant. */
    public boolean isBoolean() {
        return constant && value instanceof Boolean;
    }

    @Override
    public String toString() {
        return constant ? String.valueOf(value) : "<not constant: " + blocker + ">";
    }
}
