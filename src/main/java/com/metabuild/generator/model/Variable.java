package com.metabuild.generator.model;

import java.util.Objects;
import java.util.function.UnaryOperator;

import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.extension.Property;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.parser.SourcePosition;

import lombok.Getter;
import lombok.Setter;

/**
 * A variable bound in some scope (project, module, target or source file).
 *
 * The value is kept as an expression tree and is only replaced as a whole,
 * never edited in place.
 */
@Getter
public class Variable {

    private final String name;
    private Expression value;
    private final boolean readonly;
    private final boolean inheritable;
    private final SourcePosition position;

    /** Indicates if the variable corresponds to a property. */
    @Setter
    private boolean property;

    /** False only for variables holding a property's default value. */
    @Setter
    private boolean explicitlySet = true;

    public Variable(String name, Expression value, SourcePosition position) {
        this(name, value, false, true, position);
    }

    public Variable(String name, Expression value, boolean readonly, boolean inheritable, SourcePosition position) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.readonly = readonly;
        this.inheritable = inheritable;
        this.position = position;
    }

    /**
     * Creates a variable for property {@code prop}, taking its read-only and
     * inheritance flags. The property's default is not used, {@code value} is.
     */
    public static Variable fromProperty(Property prop, Expression value) {
        Variable v = new Variable(prop.getName(), value, prop.isReadonly(), prop.isInheritable(), null);
        v.property = true;
        return v;
    }

    /**
     * Sets a new value from user input.
     *
     * @throws GeneratorException if the variable is read-only
     */
    public void setValue(Expression value) {
        if (readonly) {
            throw new GeneratorException("variable \"" + name + "\" is read-only");
        }
        this.value = value;
    }

    /**
     * Replaces the value with the result of {@code transformation}. Used by
     * the model passes, read-only variables included.
     *
     * @return true if the value changed (by identity)
     */
    public boolean rewrite(UnaryOperator<Expression> transformation) {
        Expression old = getValue();
        Expression updated = transformation.apply(old);
        if (updated == old) {
            return false;
        }
        this.value = updated;
        return true;
    }

    /** Shallow copy, expressions are immutable and shared. */
    public Variable copy() {
        Variable v = new Variable(name, value, readonly, inheritable, position);
        v.property = property;
        v.explicitlySet = explicitlySet;
        return v;
    }

    /** Value assigned directly, bypassing the read-only check. */
    protected void assign(Expression value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return name + " = " + getValue();
    }
}
