package com.metabuild.generator.interpreter;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.metabuild.generator.error.FlattenException;
import com.metabuild.generator.extension.ExtensionRegistry;
import com.metabuild.generator.extension.Toolset;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;

class PathsNormalizerTest {

    private ExtensionRegistry registry;
    private Project project;
    private Module top;
    private Module sub;

    @BeforeEach
    void setUp() {
        registry = ExtensionRegistry.withDefaults();
        project = new Project(registry);
        top = new Module(project, "test.bkl");
        sub = new Module(top, "sub/sub.bkl");
    }

    private static PathExpr path(PathAnchor anchor, String... components) {
        return new PathExpr(List.of(components).stream().map(LiteralExpr::new).toList(), anchor);
    }

    private static PathExpr srcdirPath(String file, String... components) {
        return new PathExpr(List.of(components).stream().map(LiteralExpr::new).toList(), PathAnchor.SRCDIR, file, null);
    }

    private Expression valueOf(Module module, String var) {
        return module.getVariable(var).getValue();
    }

    @Test
    void testSrcdirOfTopModuleBecomesTopSrcdir() {
        top.addVariable(new Variable("inc", srcdirPath("test.bkl", "include"), null));

        ModelPasses.normalizePathsInModel(project, null, null);

        assertThat(valueOf(top, "inc")).isEqualTo(path(PathAnchor.TOP_SRCDIR, "include"));
    }

    @Test
    void testSrcdirOfSubmoduleGetsPrefix() {
        sub.addVariable(new Variable("src", srcdirPath("sub/sub.bkl", "x.c"), null));

        ModelPasses.normalizePathsInModel(project, null, null);

        assertThat(valueOf(sub, "src")).isEqualTo(path(PathAnchor.TOP_SRCDIR, "sub", "x.c"));
    }

    @Test
    void testSrcdirOverride() {
        project.setSrcdir("sub/sub.bkl", "other/dir");
        sub.addVariable(new Variable("src", srcdirPath("sub/sub.bkl", "x.c"), null));

        ModelPasses.normalizePathsInModel(project, null, null);

        assertThat(valueOf(sub, "src")).isEqualTo(path(PathAnchor.TOP_SRCDIR, "other", "dir", "x.c"));
    }

    @Test
    void testNormalizingTwiceChangesNothing() {
        sub.addVariable(new Variable("src", srcdirPath("sub/sub.bkl", "x.c"), null));
        ModelPasses.normalizePathsInModel(project, null, null);
        Expression once = valueOf(sub, "src");

        ModelPasses.normalizePathsInModel(project, null, null);

        assertThat(valueOf(sub, "src")).isSameAs(once);
    }

    @Test
    void testBuilddirIsKeptWithoutToolset() {
        Target hello = new Target(top, "hello", registry.getTargetType("exe").orElseThrow(), null);
        hello.addVariable(new Variable("out", path(PathAnchor.BUILDDIR, "bin"), null));

        ModelPasses.normalizePathsInModel(project, null, null);

        assertThat(hello.getVariable("out").getValue()).isEqualTo(path(PathAnchor.BUILDDIR, "bin"));
    }

    @Test
    void testBuilddirOfGnuToolsetIsMakefileDirectory() {
        Target hello = new Target(top, "hello", registry.getTargetType("exe").orElseThrow(), null);
        Target lib = new Target(sub, "lib", registry.getTargetType("library").orElseThrow(), null);
        hello.addVariable(new Variable("out", path(PathAnchor.BUILDDIR, "bin"), null));
        lib.addVariable(new Variable("out", path(PathAnchor.BUILDDIR, "bin"), null));
        Toolset gnu = registry.getToolset("gnu").orElseThrow();
        ModelPasses.makeVariablesForMissingProperties(project, gnu.getName());

        ModelPasses.normalizePathsInModel(project, gnu, null);

        assertThat(hello.getVariable("out").getValue()).isEqualTo(path(PathAnchor.TOP_BUILDDIR, "bin"));
        assertThat(lib.getVariable("out").getValue()).isEqualTo(path(PathAnchor.TOP_BUILDDIR, "sub", "bin"));
        assertThat(hello.getVariable("outputdir").getValue()).isEqualTo(path(PathAnchor.TOP_BUILDDIR));
    }

    @Test
    void testBuilddirOutsideOfTargetFails() {
        top.addVariable(new Variable("out", path(PathAnchor.BUILDDIR, "bin"), null));
        Toolset gnu = registry.getToolset("gnu").orElseThrow();

        assertThatThrownBy(() -> ModelPasses.normalizePathsInModel(project, gnu, null))
                .isInstanceOf(FlattenException.class)
                .hasMessageContaining("@builddir references are not allowed outside of targets");
    }
}
