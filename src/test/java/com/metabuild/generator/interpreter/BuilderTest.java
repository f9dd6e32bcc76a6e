package com.metabuild.generator.interpreter;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.metabuild.generator.context.CompilationContext;
import com.metabuild.generator.error.ParseException;
import com.metabuild.generator.model.ConditionalVariable;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.SourceFile;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.BoolExpr;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;
import com.metabuild.generator.model.expr.UndeterminedExpr;
import com.metabuild.generator.parser.SourcePosition;
import com.metabuild.generator.parser.ast.AssignmentNode;
import com.metabuild.generator.parser.ast.Ast;
import com.metabuild.generator.parser.ast.RootNode;
import com.metabuild.generator.parser.ast.SubmoduleNode;

class BuilderTest {

    private final Ast ast = new Ast("test.bkl");
    private final CompilationContext context = CompilationContext.builder().build();
    private final List<String> submodules = new ArrayList<>();

    private Module build(RootNode root) {
        Project project = new Project(context.getRegistry());
        Builder builder = new Builder(context, (file, pos) -> submodules.add(file));
        return builder.createModel(root, project);
    }

    private static Expression valueOf(Module module, String var) {
        return module.getVariable(var).getValue();
    }

    private static Target target(Module module, String name) {
        return module.getTargets().get(name);
    }

    private static List<LiteralExpr> literals(String... values) {
        return List.of(values).stream().map(LiteralExpr::new).toList();
    }

    @Test
    void testSimpleAssignment() {
        Module module = build(ast.root(ast.assign("name", "hello")));

        assertThat(module.getName()).isEqualTo("test");
        assertThat(valueOf(module, "name")).isEqualTo(new LiteralExpr("hello"));
    }

    @Test
    void testAppendExtendsValue() {
        Module module = build(ast.root(
                ast.assign("flags", "-O2"),
                ast.append("flags", ast.list("-g", "-Wall"))));

        assertThat(valueOf(module, "flags")).isEqualTo(new ListExpr(literals("-O2", "-g", "-Wall")));
    }

    @Test
    void testAppendToUnknownVariableFails() {
        AssignmentNode append = ast.append("flags", ast.lit("-g"));

        assertThatThrownBy(() -> build(ast.root(append)))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.getDetail()).isEqualTo("unknown variable \"flags\"");
                    assertThat(e.getPosition()).isEqualTo(append.position());
                });
    }

    @Test
    void testListPropertyValueIsWrappedInList() {
        Module module = build(ast.root(
                ast.target("exe", "hello", ast.assign("defines", "FOO"))));

        Variable defines = target(module, "hello").getVariable("defines");
        assertThat(defines.getValue()).isEqualTo(new ListExpr(literals("FOO")));
        assertThat(defines.isProperty()).isTrue();
    }

    @Test
    void testScopedAssignment() {
        Module module = build(ast.root(
                ast.target("exe", "hello"),
                ast.assignIn(List.of("hello"), "defines", ast.lit("BAR"))));

        assertThat(target(module, "hello").getVariable("defines").getValue())
                .isEqualTo(new ListExpr(literals("BAR")));
    }

    @Test
    void testUnknownScopeFails() {
        assertThatThrownBy(() -> build(ast.root(ast.assignIn(List.of("nope"), "x", ast.lit("1")))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unknown scope \"nope\"");
    }

    @Test
    void testReadOnlyPropertyCannotBeAssigned() {
        assertThatThrownBy(() -> build(ast.root(ast.target("exe", "hello", ast.assign("id", "other")))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("variable \"id\" is read-only");
    }

    @Test
    void testConditionalAssignment() {
        Module module = build(ast.root(
                ast.assign("debug", "1"),
                ast.when(ast.eq("debug", "1"), ast.assign("suffix", "d"))));

        Expression suffix = valueOf(module, "suffix");
        assertThat(suffix).isInstanceOf(IfExpr.class);
        IfExpr conditional = (IfExpr) suffix;
        assertThat(conditional.getCond()).isInstanceOf(BoolExpr.class);
        assertThat(conditional.getYes()).isEqualTo(new LiteralExpr("d"));
        assertThat(conditional.getNo().isNull()).isTrue();
    }

    @Test
    void testAssignmentsDependingOnOptionsMakeConditionalVariable() {
        Module module = build(ast.root(
                ast.option("BUILD", "debug", "debug", "release"),
                ast.when(ast.eq("BUILD", "debug"), ast.assign("suffix", "d")),
                ast.when(ast.eq("BUILD", "release"), ast.assign("suffix", ""))));

        Variable suffix = module.getVariable("suffix");
        assertThat(suffix).isInstanceOf(ConditionalVariable.class);
        assertThat(((ConditionalVariable) suffix).getAlternatives()).hasSize(2);
        assertThat(module.getProject().getVariable("BUILD").getValue()).isInstanceOf(UndeterminedExpr.class);
    }

    @Test
    void testOptionDefaultMustBeOneOfValues() {
        assertThatThrownBy(() -> build(ast.root(ast.option("BUILD", "profile", "debug", "release"))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("is not one of its values");
    }

    @Test
    void testDuplicateOptionFails() {
        assertThatThrownBy(() -> build(ast.root(
                ast.option("BUILD", "debug", "debug"),
                ast.option("BUILD", "debug", "debug"))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("option \"BUILD\" already defined");
    }

    @Test
    void testDuplicateTargetFails() {
        assertThatThrownBy(() -> build(ast.root(
                ast.target("exe", "hello"),
                ast.target("library", "hello"))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("target with ID \"hello\" already exists");
    }

    @Test
    void testUnknownTargetTypeFails() {
        assertThatThrownBy(() -> build(ast.root(ast.target("jar", "hello"))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unknown target type \"jar\"");
    }

    @Test
    void testConditionalTarget() {
        Module module = build(ast.root(
                ast.assign("enable", "1"),
                ast.when(ast.eq("enable", "1"), ast.target("exe", "hello"))));

        assertThat(target(module, "hello").getCondition()).isInstanceOf(BoolExpr.class);
    }

    @Test
    void testSourceFiles() {
        Module module = build(ast.root(
                ast.assign("extra", "1"),
                ast.target("exe", "hello",
                        ast.sources("main.cpp", "src/util.cpp"),
                        ast.headers("util.h"),
                        ast.when(ast.eq("extra", "1"), ast.sources("extra.cpp")))));

        Target hello = target(module, "hello");
        assertThat(hello.getSources()).hasSize(3);
        assertThat(hello.getHeaders()).hasSize(1);

        SourceFile util = hello.getSources().get(1);
        assertThat(util.getFilename()).isEqualTo(new PathExpr(literals("src", "util.cpp"), PathAnchor.SRCDIR,
                "test.bkl", null));
        assertThat(util.getExtension()).isEqualTo("cpp");
        assertThat(util.getCondition()).isNull();
        assertThat(hello.getSources().get(2).getCondition()).isInstanceOf(BoolExpr.class);
    }

    @Test
    void testSourcesOutsideOfTargetFail() {
        assertThatThrownBy(() -> build(ast.root(ast.sources("main.cpp"))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("source files can only be listed in targets");
    }

    @Test
    void testPathAnchorInAssignment() {
        Module module = build(ast.root(
                ast.target("exe", "hello",
                        ast.assign("outputdir", ast.concat(ast.anchor("@top_builddir"), ast.lit("/bin"))))));

        assertThat(target(module, "hello").getVariable("outputdir").getValue())
                .isEqualTo(new PathExpr(literals("bin"), PathAnchor.TOP_BUILDDIR));
    }

    @Test
    void testUnknownPathAnchorFails() {
        assertThatThrownBy(() -> build(ast.root(ast.assign("dir", ast.anchor("@nowhere")))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unknown path anchor");
    }

    @Test
    void testTemplatesAreAppliedBeforeTargetContent() {
        Module module = build(ast.root(
                ast.template("base", List.of(), ast.assign("defines", "BASE")),
                ast.template("derived", List.of("base"), ast.append("defines", ast.lit("DERIVED"))),
                ast.target("exe", "hello", List.of("derived", "base"), ast.append("defines", ast.lit("OWN")))));

        assertThat(target(module, "hello").getVariable("defines").getValue())
                .isEqualTo(new ListExpr(literals("BASE", "DERIVED", "OWN")));
    }

    @Test
    void testUnknownTemplateFails() {
        assertThatThrownBy(() -> build(ast.root(ast.target("exe", "hello", List.of("missing")))))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unknown base template \"missing\"");
    }

    @Test
    void testPropertyDefaultDoesNotOverrideExplicitValue() {
        Module module = build(ast.root(
                ast.target("exe", "hello",
                        ast.assign("defines", "EXPLICIT"),
                        ast.propertyDefault("defines", ast.lit("DEFAULT"))),
                ast.target("exe", "world",
                        ast.propertyDefault("defines", ast.lit("DEFAULT")))));

        assertThat(target(module, "hello").getVariable("defines").getValue())
                .isEqualTo(new ListExpr(literals("EXPLICIT")));
        Variable defaulted = target(module, "world").getVariable("defines");
        assertThat(defaulted.getValue()).isEqualTo(new ListExpr(literals("DEFAULT")));
        assertThat(defaulted.isExplicitlySet()).isFalse();
    }

    @Test
    void testSubmoduleIsRelativeToCurrentFile() {
        Ast nested = new Ast("dir/main.bkl");
        build(nested.root(nested.submodule("lib/lib.bkl")));

        assertThat(submodules).containsExactly("dir/lib/lib.bkl");
    }

    @Test
    void testConditionalSubmoduleFails() {
        SubmoduleNode submodule = ast.submodule("lib.bkl");

        assertThatThrownBy(() -> build(ast.root(
                ast.assign("foo", "1"),
                ast.when(ast.eq("foo", "1"), submodule))))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.getDetail()).startsWith("conditionally included submodules not supported yet");
                    assertThat(e.getPosition()).isEqualTo(submodule.position());
                });
        assertThat(submodules).isEmpty();
    }

    @Test
    void testSrcdirStatement() {
        Module module = build(ast.root(ast.srcdir("../src")));

        assertThat(module.getSrcdir()).isEqualTo("../src");
    }

    @Test
    void testUnderscoreVariablesAreWarnedAbout() {
        build(ast.root(ast.assign("_private", "1")));

        assertThat(context.getDiagnostics().getWarnings()).hasSize(1);
        assertThat(context.getDiagnostics().getWarnings().get(0).position())
                .isEqualTo(SourcePosition.of("test.bkl", 2, 1));
    }
}
