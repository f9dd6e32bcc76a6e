package com.metabuild.generator.model.expr;

/**
 * Read-only traversal of an expression tree. Composite nodes visit their
 * children, leaves do nothing; subclasses override what they care about,
 * typically {@link #visitReference(ReferenceExpr)}.
 */
public abstract class ExpressionWalker implements ExpressionVisitor<Void> {

    @Override
    public Void visitLiteral(LiteralExpr e) {
        return null;
    }

    @Override
    public Void visitBoolValue(BoolValueExpr e) {
        return null;
    }

    @Override
    public Void visitNull(NullExpr e) {
        return null;
    }

    @Override
    public Void visitUndetermined(UndeterminedExpr e) {
        return null;
    }

    @Override
    public Void visitReference(ReferenceExpr e) {
        return null;
    }

    @Override
    public Void visitList(ListExpr e) {
        e.getItems().forEach(this::visit);
        return null;
    }

    @Override
    public Void visitConcat(ConcatExpr e) {
        e.getItems().forEach(this::visit);
        return null;
    }

    @Override
    public Void visitPath(PathExpr e) {
        e.getComponents().forEach(this::visit);
        return null;
    }

    @Override
    public Void visitBool(BoolExpr e) {
        visit(e.getLeft());
        if (e.getRight() != null) {
            visit(e.getRight());
        }
        return null;
    }

    @Override
    public Void visitIf(IfExpr e) {
        visit(e.getCond());
        visit(e.getYes());
        visit(e.getNo());
        return null;
    }
}
