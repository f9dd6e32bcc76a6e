package com.metabuild.generator.interpreter;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.metabuild.generator.extension.ExtensionRegistry;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.BoolExpr;
import com.metabuild.generator.model.expr.BoolOperator;
import com.metabuild.generator.model.expr.BoolValueExpr;
import com.metabuild.generator.model.expr.ConcatExpr;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.NullExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.model.expr.UndeterminedExpr;

class ExpressionSimplifierTest {

    private Module module;

    @BeforeEach
    void setUp() {
        Project project = new Project(new ExtensionRegistry());
        module = new Module(project, "test.bkl");
        module.addVariable(new Variable("name", new LiteralExpr("foo"), null));
        module.addVariable(new Variable("alias", new ReferenceExpr("name", module), null));
        module.addVariable(new Variable("files", new ListExpr(List.of(new LiteralExpr("a.c"))), null));
        module.addVariable(new Variable("arch", new UndeterminedExpr("arch"), null));
    }

    private ReferenceExpr ref(String var) {
        return new ReferenceExpr(var, module);
    }

    @Test
    void testConcatenatedLiteralsAreMergedAfterInlining() {
        Expression e = new ConcatExpr(List.of(new LiteralExpr("lib"), ref("alias"), new LiteralExpr(".a")));

        assertThat(ExpressionSimplifier.simplify(e)).isEqualTo(new LiteralExpr("libfoo.a"));
    }

    @Test
    void testConcatenatedLiteralsAreMerged() {
        Expression e = new ConcatExpr(List.of(new LiteralExpr("a"), new LiteralExpr("b")));

        assertThat(ExpressionSimplifier.simplify(e)).isEqualTo(new LiteralExpr("ab"));
    }

    @Test
    void testOnlyAdjacentLiteralsAreMerged() {
        Expression e = new ConcatExpr(List.of(new LiteralExpr("a"), new LiteralExpr("b"), ref("arch"),
                new LiteralExpr("c")));

        assertThat(ExpressionSimplifier.simplify(e)).isEqualTo(new ConcatExpr(List.of(new LiteralExpr("ab"),
                ref("arch"), new LiteralExpr("c"))));
    }

    @Test
    void testUnchangedExpressionIsReturnedAsIs() {
        Expression e = new ConcatExpr(List.of(new LiteralExpr("a"), ref("arch")));

        assertThat(ExpressionSimplifier.simplify(e)).isSameAs(e);
    }

    @Test
    void testNullListItemsAreDropped() {
        Expression e = new ListExpr(List.of(new LiteralExpr("a"), new NullExpr(), new LiteralExpr("b")));

        assertThat(ExpressionSimplifier.simplify(e))
                .isEqualTo(new ListExpr(List.of(new LiteralExpr("a"), new LiteralExpr("b"))));
        assertThat(ExpressionSimplifier.simplify(new ListExpr(List.of(new NullExpr())))).isInstanceOf(NullExpr.class);
    }

    @Test
    void testListReferencesAreNotInlined() {
        Expression e = ref("files");

        assertThat(ExpressionSimplifier.simplify(e)).isSameAs(e);
    }

    @Test
    void testUnknownReferenceIsKept() {
        Expression e = ref("nonexistent");

        assertThat(ExpressionSimplifier.simplify(e)).isSameAs(e);
    }

    @Test
    void testEmptyBuilddirPathSurvives() {
        Expression e = new PathExpr(List.of(), PathAnchor.BUILDDIR);

        assertThat(ExpressionSimplifier.simplify(e)).isSameAs(e);
    }

    @Test
    void testComparisonOfKnownValuesIsEvaluated() {
        Expression e = new BoolExpr(BoolOperator.EQUAL, ref("name"), new LiteralExpr("foo"));

        assertThat(ExpressionSimplifier.simplify(e)).isEqualTo(new BoolValueExpr(true));
    }

    @Test
    void testAndWithTrueOperandReducesToTheOther() {
        Expression cond = new BoolExpr(BoolOperator.EQUAL, ref("arch"), new LiteralExpr("x86"));
        Expression e = new BoolExpr(BoolOperator.AND, new BoolValueExpr(true), cond);

        assertThat(ExpressionSimplifier.simplify(e)).isSameAs(cond);
    }

    @Test
    void testOrWithTrueOperandIsTrue() {
        Expression cond = new BoolExpr(BoolOperator.EQUAL, ref("arch"), new LiteralExpr("x86"));

        assertThat(ExpressionSimplifier.simplify(new BoolExpr(BoolOperator.OR, cond, new BoolValueExpr(true))))
                .isEqualTo(new BoolValueExpr(true));
    }

    @Test
    void testOrWithTrueLeftOperandIsTrue() {
        Expression cond = new BoolExpr(BoolOperator.EQUAL, ref("arch"), new LiteralExpr("x86"));

        assertThat(ExpressionSimplifier.simplify(new BoolExpr(BoolOperator.OR, new BoolValueExpr(true), cond)))
                .isEqualTo(new BoolValueExpr(true));
    }

    @Test
    void testIfWithKnownConditionIsReplacedByBranch() {
        Expression cond = new BoolExpr(BoolOperator.NOT_EQUAL, ref("name"), new LiteralExpr("foo"));
        Expression e = new IfExpr(cond, new LiteralExpr("yes"), new LiteralExpr("no"));

        assertThat(ExpressionSimplifier.simplify(e)).isEqualTo(new LiteralExpr("no"));
    }

    @Test
    void testIfWithUnknownConditionIsKept() {
        Expression cond = new BoolExpr(BoolOperator.EQUAL, ref("arch"), new LiteralExpr("x86"));
        Expression e = new IfExpr(cond, new LiteralExpr("yes"), new LiteralExpr("no"));

        assertThat(ExpressionSimplifier.simplify(e)).isSameAs(e);
    }

    @Test
    void testSimplifyingTwiceChangesNothing() {
        Expression e = new ListExpr(List.of(
                new ConcatExpr(List.of(ref("name"), new LiteralExpr(".c"))),
                new IfExpr(new BoolExpr(BoolOperator.EQUAL, ref("arch"), ref("alias")), ref("alias"), new NullExpr()),
                new NullExpr()));

        Expression once = ExpressionSimplifier.simplify(e);
        Expression twice = ExpressionSimplifier.simplify(once);

        assertThat(twice).isSameAs(once);
    }

    @Test
    void testBasicSimplifierKeepsConditionals() {
        Expression e = new IfExpr(new BoolValueExpr(true), new LiteralExpr("yes"), new LiteralExpr("no"));

        assertThat(new BasicSimplifier().visit(e)).isSameAs(e);
    }
}
