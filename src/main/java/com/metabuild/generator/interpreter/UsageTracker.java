package com.metabuild.generator.interpreter;

import java.util.HashSet;
import java.util.Set;

import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.ExpressionWalker;
import com.metabuild.generator.model.expr.ReferenceExpr;

/**
 * Remembers which variables are referenced, for unused variable warnings.
 *
 * Usage is keyed by the position of the variable's declaration rather than
 * by the variable object: the same declaration can end up in several
 * objects (model copies, submodules), and all of them count as one.
 */
public class UsageTracker extends ExpressionWalker {

    private final Set<Object> used = new HashSet<>();

    @Override
    public Void visitReference(ReferenceExpr e) {
        Variable var = e.getVariable();
        if (var != null && !var.isProperty()) {
            used.add(usageKey(var));
        }
        return null;
    }

    public void markUsed(Variable var) {
        used.add(usageKey(var));
    }

    /** Marks all variables referenced in {@code e} as used. */
    public void markUsedIn(Expression e) {
        visit(e);
    }

    public boolean isUsed(Variable var) {
        return used.contains(usageKey(var));
    }

    private static Object usageKey(Variable var) {
        return var.getPosition() != null ? var.getPosition() : var;
    }
}
