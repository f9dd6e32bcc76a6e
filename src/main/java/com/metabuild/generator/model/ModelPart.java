package com.metabuild.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.error.NonConstException;
import com.metabuild.generator.error.UnresolvedReferenceException;
import com.metabuild.generator.extension.Property;
import com.metabuild.generator.model.expr.ConstantValue;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Base class for all parts of the project model: a variable scope nested in
 * its parent's scope.
 *
 * Variables are kept in insertion order, so that emitted output is stable.
 */
public abstract class ModelPart {

    private static final Logger log = LoggerFactory.getLogger(ModelPart.class);

    private final ModelPart parent;
    private final SourcePosition position;
    private final Map<String, Variable> variables = new LinkedHashMap<>();

    protected ModelPart(ModelPart parent, SourcePosition position) {
        this.parent = parent;
        this.position = position;
    }

    public abstract String getName();

    public abstract PropertyScope getScope();

    /** Model parts directly contained in this one. */
    public abstract List<? extends ModelPart> getChildParts();

    public ModelPart getParent() {
        return parent;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public Project getProject() {
        ModelPart p = this;
        while (p.parent != null) {
            p = p.parent;
        }
        return (Project) p;
    }

    /** The module this part belongs to, or {@code null} for the project. */
    public Module getModule() {
        ModelPart p = this;
        while (p != null && !(p instanceof Module)) {
            p = p.parent;
        }
        return (Module) p;
    }

    /**
     * Name unique within the project, e.g. {@code main::hello} for target
     * {@code hello} in module {@code main}. Empty for the project itself.
     */
    public String getQualifiedName() {
        if (parent == null) {
            return "";
        }
        String outer = parent.getQualifiedName();
        return outer.isEmpty() ? getName() : outer + "::" + getName();
    }

    /** Variables defined directly in this scope. */
    public Map<String, Variable> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    /** Variable defined in this scope, or {@code null}. Doesn't look at parents. */
    public Variable getVariable(String name) {
        return variables.get(name);
    }

    /**
     * Finds the variable using the same rules as {@code $(name)} references:
     * this scope first, then parent scopes, unless the name is a
     * non-inheritable property of this scope.
     *
     * Property defaults are not considered.
     */
    public Variable resolveVariable(String name) {
        Variable var = variables.get(name);
        if (var != null) {
            return var;
        }
        if (parent != null) {
            Optional<Property> prop = getProperty(name);
            if (prop.isEmpty() || prop.get().isInheritable()) {
                return parent.resolveVariable(name);
            }
        }
        return null;
    }

    /**
     * Value of variable {@code name} as seen from this scope. Falls back to the
     * default of a property with that name in this or an enclosing scope.
     *
     * @throws UnresolvedReferenceException if there's no such variable
     */
    public Expression getVariableValue(String name) {
        Variable var = resolveVariable(name);
        if (var != null) {
            return var.getValue();
        }
        for (ModelPart scope = this; scope != null; scope = scope.parent) {
            Optional<Property> prop = scope.getProperty(name);
            if (prop.isPresent()) {
                return prop.get().defaultExpr(scope);
            }
        }
        throw new UnresolvedReferenceException(name, null);
    }

    /** True if the variable is unset or null, i.e. not set under the current toolset or condition. */
    public boolean isVariableNull(String name) {
        Variable var = resolveVariable(name);
        return var == null || var.getValue().isNull();
    }

    /**
     * Adds a new variable to this scope.
     *
     * @throws IllegalStateException if the scope already has a variable of that name
     */
    public void addVariable(Variable var) {
        if (variables.containsKey(var.getName())) {
            throw new IllegalStateException("variable \"" + var.getName() + "\" already defined in " + this);
        }
        putVariable(var);
    }

    /** Adds {@code var}, replacing any existing variable of the same name. */
    public void replaceVariable(Variable var) {
        putVariable(var);
    }

    public void removeVariable(String name) {
        variables.remove(name);
    }

    private void putVariable(Variable var) {
        if (var instanceof ConditionalVariable cv) {
            cv.attachTo(this);
        }
        variables.put(var.getName(), var);
    }

    /**
     * Sets the value of property {@code prop} in this scope, creating the
     * variable if needed. Read-only properties may be set this way too.
     */
    public void setPropertyValue(Property prop, Expression value) {
        Variable var = variables.get(prop.getName());
        if (var == null) {
            addVariable(Variable.fromProperty(prop, value));
        } else {
            var.assign(value);
        }
    }

    /** Convenience for {@link #setPropertyValue(Property, Expression)} by name. */
    public void setPropertyValue(String name, Expression value) {
        Property prop = getProperty(name)
                .orElseThrow(() -> new GeneratorException("unknown property \"" + name + "\" on " + this, position));
        setPropertyValue(prop, value);
    }

    /** Property {@code name} defined for this scope exactly. */
    public Optional<Property> getProperty(String name) {
        return getProject().getRegistry().findProperty(this, name);
    }

    /**
     * Like {@link #getProperty(String)}, but also finds inheritable properties
     * of nested scopes, e.g. a target's {@code outputdir} in module scope.
     * Used when assigning to variables.
     */
    public Optional<Property> getMatchingPropertyWithInheritance(String name) {
        return getProject().getRegistry().findPropertyWithInheritance(this, name);
    }

    /** All properties defined for this scope. */
    public List<Property> enumerateProperties() {
        return getProject().getRegistry().propertiesFor(this);
    }

    /**
     * Creates variables holding default values of properties that aren't set
     * yet. Properties specific to other toolsets than {@code toolset} are
     * skipped.
     */
    public void makeVariablesForMissingProperties(String toolset) {
        for (Property prop : enumerateProperties()) {
            if (!prop.appliesToToolset(toolset)) {
                continue;
            }
            if (!isVariableNull(prop.getName())) {
                continue;
            }
            if (prop.isInheritable() && !prop.isDirectlyFor(this)) {
                continue;
            }
            Variable var = Variable.fromProperty(prop, prop.requireDefault(this));
            var.setExplicitlySet(false);
            log.debug("{}: setting default of {}: {}", this, var.getName(), var.getValue());
            variables.put(prop.getName(), var);
        }
    }

    /** All variables of this part and of all parts nested in it. */
    public List<Variable> allVariables() {
        List<Variable> result = new ArrayList<>(variables.values());
        for (ModelPart child : getChildParts()) {
            result.addAll(child.allVariables());
        }
        return result;
    }

    /** Condition under which this part is built, {@code null} if unconditional. */
    public Expression getCondition() {
        Variable var = variables.get("_condition");
        return var == null ? null : var.getValue();
    }

    /**
     * Evaluates the condition of this part.
     *
     * @throws NonConstException if the condition can't be evaluated now
     */
    public boolean shouldBuild() {
        Expression cond = getCondition();
        if (cond == null) {
            return true;
        }
        ConstantValue value = cond.asConstant();
        if (!value.isBoolean()) {
            throw new NonConstException("condition for building " + this + " couldn't be resolved (condition \""
                    + cond + "\" set at " + cond.getPosition() + ")", cond);
        }
        return value.isTrue();
    }

    /** Copies all variables into {@code other}; values are shared. */
    protected void copyVariablesTo(ModelPart other) {
        for (Variable var : variables.values()) {
            other.putVariable(var.copy());
        }
    }

    @Override
    public String toString() {
        String name = getQualifiedName();
        return name.isEmpty() ? getScope().name().toLowerCase() : name;
    }
}
