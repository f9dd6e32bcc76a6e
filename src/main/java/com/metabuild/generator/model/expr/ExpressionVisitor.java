package com.metabuild.generator.model.expr;

/**
 * Visitor over the closed set of expression kinds.
 */
public interface ExpressionVisitor<T> {
    T visitLiteral(LiteralExpr e);
    T visitList(ListExpr e);
    T visitConcat(ConcatExpr e);
    T visitPath(PathExpr e);
    T visitReference(ReferenceExpr e);
    T visitBool(BoolExpr e);
    T visitBoolValue(BoolValueExpr e);
    T visitIf(IfExpr e);
    T visitNull(NullExpr e);
    T visitUndetermined(UndeterminedExpr e);

    default T visit(Expression e) {
        return e.accept(this);
    }
}
