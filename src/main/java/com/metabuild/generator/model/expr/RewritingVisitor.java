package com.metabuild.generator.model.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for visitors that transform expressions.
 *
 * The default implementation rebuilds a node only if one of its children
 * changed and returns the very same instance otherwise, so callers can use
 * identity comparison to detect modifications. New nodes keep the position of
 * the node they replace.
 */
public abstract class RewritingVisitor implements ExpressionVisitor<Expression> {

    @Override
    public Expression visitLiteral(LiteralExpr e) {
        return e;
    }

    @Override
    public Expression visitBoolValue(BoolValueExpr e) {
        return e;
    }

    @Override
    public Expression visitNull(NullExpr e) {
        return e;
    }

    @Override
    public Expression visitUndetermined(UndeterminedExpr e) {
        return e;
    }

    @Override
    public Expression visitReference(ReferenceExpr e) {
        return e;
    }

    @Override
    public Expression visitList(ListExpr e) {
        List<Expression> items = visitAll(e.getItems());
        return items == e.getItems() ? e : new ListExpr(items, e.getPosition());
    }

    @Override
    public Expression visitConcat(ConcatExpr e) {
        List<Expression> items = visitAll(e.getItems());
        return items == e.getItems() ? e : new ConcatExpr(items, e.getPosition());
    }

    @Override
    public Expression visitPath(PathExpr e) {
        List<Expression> components = visitAll(e.getComponents());
        if (components == e.getComponents()) {
            return e;
        }
        return new PathExpr(components, e.getAnchor(), e.getAnchorFile(), e.getPosition());
    }

    @Override
    public Expression visitBool(BoolExpr e) {
        Expression left = visit(e.getLeft());
        Expression right = e.getRight() == null ? null : visit(e.getRight());
        if (left == e.getLeft() && right == e.getRight()) {
            return e;
        }
        return new BoolExpr(e.getOperator(), left, right, e.getPosition());
    }

    @Override
    public Expression visitIf(IfExpr e) {
        Expression cond = visit(e.getCond());
        Expression yes = visit(e.getYes());
        Expression no = visit(e.getNo());
        if (cond == e.getCond() && yes == e.getYes() && no == e.getNo()) {
            return e;
        }
        return new IfExpr(cond, yes, no, e.getPosition());
    }

    /**
     * Visits all expressions in the list. Returns the same list instance if
     * none of them changed, a new list otherwise.
     */
    protected final List<Expression> visitAll(List<Expression> items) {
        List<Expression> out = null;
        for (int i = 0; i < items.size(); i++) {
            Expression item = items.get(i);
            Expression result = visit(item);
            if (out == null && result != item) {
                out = new ArrayList<>(items.subList(0, i));
            }
            if (out != null) {
                out.add(result);
            }
        }
        return out == null ? items : out;
    }
}
