package com.metabuild.generator.flatten;

import com.metabuild.generator.error.UnresolvedReferenceException;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.model.expr.RewritingVisitor;

/**
 * Replaces every variable reference with the referenced value, recursively.
 * The model must be free of reference cycles.
 */
class ReferenceInliner extends RewritingVisitor {

    @Override
    public Expression visitReference(ReferenceExpr e) {
        Expression value;
        try {
            value = e.getValue();
        } catch (UnresolvedReferenceException ex) {
            // references are checked before flattening, keep it for the emitter to report
            return e;
        }
        return visit(value);
    }
}
