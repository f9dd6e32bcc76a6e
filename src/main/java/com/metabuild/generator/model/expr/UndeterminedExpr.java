package com.metabuild.generator.model.expr;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Placeholder for a value that is not known at bake-time, such as the
 * {@code toolset} property before a toolset is bound or a build option whose
 * value is chosen by the user at make-time.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class UndeterminedExpr extends Expression {

    /** Name of the placeholder, e.g. {@code toolset} or an option name. */
    private final String name;

    public UndeterminedExpr(String name) {
        this(name, null);
    }

    public UndeterminedExpr(String name, SourcePosition position) {
        super(position);
        this.name = name;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitUndetermined(this);
    }

    @Override
    public ConstantValue asConstant() {
        return ConstantValue.notConstant(this);
    }

    @Override
    public String toString() {
        return "?" + name;
    }
}
