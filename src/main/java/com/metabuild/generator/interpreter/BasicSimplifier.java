package com.metabuild.generator.interpreter;

import java.util.ArrayList;
import java.util.List;

import com.metabuild.generator.error.UnresolvedReferenceException;
import com.metabuild.generator.model.expr.BoolExpr;
import com.metabuild.generator.model.expr.BoolValueExpr;
import com.metabuild.generator.model.expr.ConcatExpr;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.NullExpr;
import com.metabuild.generator.model.expr.PathExpr;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.model.expr.RewritingVisitor;

/**
 * Cheap simplifications: merging concatenated literals, dropping null list
 * items and replacing references to simple values with the values
 * ({@code foo=$(x); bar=$(foo)} becomes {@code bar=$(x)}).
 */
public class BasicSimplifier extends RewritingVisitor {

    @Override
    public Expression visitList(ListExpr e) {
        List<Expression> items = visitAll(e.getItems());
        List<Expression> kept = new ArrayList<>(items.size());
        for (Expression item : items) {
            if (!item.isNull()) {
                kept.add(item);
            }
        }
        if (items == e.getItems() && kept.size() == items.size()) {
            return e;
        }
        if (kept.isEmpty()) {
            return new NullExpr(e.getPosition());
        }
        return new ListExpr(kept, e.getPosition());
    }

    @Override
    public Expression visitConcat(ConcatExpr e) {
        List<Expression> items = visitAll(e.getItems());
        if (items.isEmpty()) {
            return new NullExpr(e.getPosition());
        }
        List<Expression> out = new ArrayList<>();
        out.add(items.get(0));
        for (Expression item : items.subList(1, items.size())) {
            Expression last = out.get(out.size() - 1);
            if (item instanceof LiteralExpr lit && last instanceof LiteralExpr prev) {
                out.set(out.size() - 1, new LiteralExpr(prev.getValue() + lit.getValue(), prev.getPosition()));
            } else {
                out.add(item);
            }
        }
        if (out.size() == 1) {
            return out.get(0);
        }
        if (items == e.getItems() && out.size() == items.size()) {
            return e;
        }
        return new ConcatExpr(out, e.getPosition());
    }

    /*
     * Only scalar values are inlined. Lists would be duplicated and paths may
     * still have @builddir anchors that are only resolved per toolset.
     */
    @Override
    public Expression visitReference(ReferenceExpr e) {
        Expression value;
        try {
            value = e.getValue();
        } catch (UnresolvedReferenceException ex) {
            // left for the analyzer to report
            return e;
        }
        if (value instanceof LiteralExpr || value instanceof ReferenceExpr || value instanceof BoolValueExpr) {
            return visit(value);
        }
        return e;
    }

    @Override
    public Expression visitPath(PathExpr e) {
        List<Expression> components = visitAll(e.getComponents());
        // null components are kept, they are positional
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
        if (left.isNull() && (right == null || right.isNull())) {
            return new NullExpr(e.getPosition());
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
        if (yes.isNull() && no.isNull()) {
            return new NullExpr(e.getPosition());
        }
        return new IfExpr(cond, yes, no, e.getPosition());
    }
}
