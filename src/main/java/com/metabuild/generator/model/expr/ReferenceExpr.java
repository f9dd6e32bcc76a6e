package com.metabuild.generator.model.expr;

import java.util.Objects;

import com.metabuild.generator.error.UnresolvedReferenceException;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Reference to a variable, {@code $(name)}.
 *
 * The reference remembers the scope it was written in; the variable is
 * looked up from there using the normal scoping rules. This is a lookup-only
 * relation, the reference doesn't own the scope.
 */
public final class ReferenceExpr extends Expression {

    private final String var;
    private final ModelPart context;

    public ReferenceExpr(String var, ModelPart context) {
        this(var, context, null);
    }

    public ReferenceExpr(String var, ModelPart context, SourcePosition position) {
        super(position);
        this.var = Objects.requireNonNull(var, "var");
        this.context = Objects.requireNonNull(context, "context");
    }

    /** Name of the referenced variable. */
    public String getVar() {
        return var;
    }

    /** Scope the reference is resolved in. */
    public ModelPart getContext() {
        return context;
    }

    /**
     * Returns the referenced variable object, or {@code null} if the reference
     * is to a property's default value.
     */
    public Variable getVariable() {
        return context.resolveVariable(var);
    }

    /**
     * Returns the value of the referenced variable, falling back to property defaults.
     *
     * @throws UnresolvedReferenceException if the variable doesn't exist at all
     */
    public Expression getValue() {
        try {
            return context.getVariableValue(var);
        } catch (UnresolvedReferenceException e) {
            throw new UnresolvedReferenceException(var, getPosition());
        }
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public ConstantValue asConstant() {
        Expression value;
        try {
            value = context.getVariableValue(var);
        } catch (UnresolvedReferenceException e) {
            return ConstantValue.notConstant(this);
        }
        ConstantValue v = value.asConstant();
        return v.isConstant() ? v : ConstantValue.notConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceExpr other)) return false;
        return var.equals(other.var)
                && context.getQualifiedName().equals(other.context.getQualifiedName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(var, context.getQualifiedName());
    }

    @Override
    public String toString() {
        return "$(" + var + ")";
    }
}
