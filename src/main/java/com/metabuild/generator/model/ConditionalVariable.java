package com.metabuild.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Variable whose value depends on build options: an ordered list of
 * (condition, value) alternatives. The first matching alternative wins, an
 * empty string is used when none matches.
 *
 * For everything that doesn't know about alternatives, the value is the
 * equivalent chain of {@code if} expressions.
 */
public class ConditionalVariable extends Variable {

    public record Alternative(Condition condition, Expression value) {
    }

    private final List<Alternative> alternatives = new ArrayList<>();
    private ModelPart owner;

    public ConditionalVariable(String name, SourcePosition position) {
        this(name, false, true, position);
    }

    public ConditionalVariable(String name, boolean readonly, boolean inheritable, SourcePosition position) {
        super(name, null, readonly, inheritable, position);
    }

    public void addAlternative(Condition condition, Expression value) {
        alternatives.add(new Alternative(condition, value));
    }

    public List<Alternative> getAlternatives() {
        return List.copyOf(alternatives);
    }

    /** Called when the variable is added to a scope; option references are resolved there. */
    void attachTo(ModelPart owner) {
        this.owner = owner;
    }

    /**
     * Picks the value for a concrete assignment of option values.
     */
    public Expression resolve(Map<String, String> assignment, Map<String, Option> options) {
        for (Alternative alt : alternatives) {
            if (alt.condition().matches(assignment, options)) {
                return alt.value();
            }
        }
        return new LiteralExpr("", getPosition());
    }

    @Override
    public Expression getValue() {
        Expression result = new LiteralExpr("", getPosition());
        for (int i = alternatives.size() - 1; i >= 0; i--) {
            Alternative alt = alternatives.get(i);
            SourcePosition pos = alt.value().getPosition();
            result = new IfExpr(alt.condition().toExpression(owner, pos), alt.value(), result, pos);
        }
        return result;
    }

    @Override
    public void setValue(Expression value) {
        throw new UnsupportedOperationException(
                "conditional variable \"" + getName() + "\" must be converted before assigning");
    }

    @Override
    public boolean rewrite(UnaryOperator<Expression> transformation) {
        boolean changed = false;
        for (int i = 0; i < alternatives.size(); i++) {
            Alternative alt = alternatives.get(i);
            Expression updated = transformation.apply(alt.value());
            if (updated != alt.value()) {
                alternatives.set(i, new Alternative(alt.condition(), updated));
                changed = true;
            }
        }
        return changed;
    }

    @Override
    public ConditionalVariable copy() {
        ConditionalVariable v = new ConditionalVariable(getName(), isReadonly(), isInheritable(), getPosition());
        v.alternatives.addAll(alternatives);
        v.setProperty(isProperty());
        v.setExplicitlySet(isExplicitlySet());
        return v;
    }

    /** Converts into an ordinary variable holding the equivalent if-chain. */
    public Variable toPlainVariable() {
        return new Variable(getName(), getValue(), isReadonly(), isInheritable(), getPosition());
    }
}
