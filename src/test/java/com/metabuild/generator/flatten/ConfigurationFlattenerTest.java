package com.metabuild.generator.flatten;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.metabuild.generator.context.CompilationContext;
import com.metabuild.generator.error.FlattenException;
import com.metabuild.generator.extension.ExtensionRegistry;
import com.metabuild.generator.interpreter.Interpreter;
import com.metabuild.generator.interpreter.ToolsetModel;
import com.metabuild.generator.model.FlattenedConfiguration;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Option;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.NullExpr;
import com.metabuild.generator.parser.ast.Ast;
import com.metabuild.generator.parser.ast.RootNode;
import com.metabuild.generator.parser.ast.StatementNode;

class ConfigurationFlattenerTest {

    private final Ast ast = new Ast("test.bkl");

    private Project generate(StatementNode... statements) {
        StatementNode[] all = new StatementNode[statements.length + 1];
        all[0] = ast.assign("toolsets", "vs2010");
        System.arraycopy(statements, 0, all, 1, statements.length);
        RootNode root = ast.root(all);

        Interpreter interpreter = new Interpreter(CompilationContext.create(file -> {
            throw new AssertionError("unexpected submodule " + file);
        }));
        List<ToolsetModel> models = interpreter.process(root);
        assertThat(models).hasSize(1);
        return models.get(0).project();
    }

    private static List<String> names(List<FlattenedConfiguration> configs) {
        return configs.stream().map(FlattenedConfiguration::getName).toList();
    }

    private static Target target(Project project, String name) {
        return project.getTarget(name).orElseThrow();
    }

    @Test
    void testConfigurationsAreCartesianProductOfOptions() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.option("Kind", "x", "x", "y"),
                ast.target("exe", "hello", ast.sources("hello.cpp")));

        assertThat(names(project.getConfigurations())).containsExactly("1 x", "1 y", "2 x", "2 y");
        assertThat(target(project, "hello").getConfigs()).containsOnlyKeys("1 x", "1 y", "2 x", "2 y");

        FlattenedConfiguration second = project.getConfigurations().get(1);
        assertThat(second.getOptionValues()).containsExactly(Map.entry("Arch", "1"), Map.entry("Kind", "y"));
        assertThat(second.getVariables())
                .containsEntry("Arch", new LiteralExpr("1"))
                .containsEntry("Kind", new LiteralExpr("y"))
                .containsEntry("toolset", new LiteralExpr("vs2010"));
    }

    @Test
    void testOptionsWithoutEffectAreLeftOutOfDistinctConfigs() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.option("Kind", "x", "x", "y"),
                ast.target("exe", "hello",
                        ast.sources("hello.cpp"),
                        ast.when(ast.eq("Arch", "2"), ast.append("defines", ast.lit("ARCH2")))));

        Target hello = target(project, "hello");
        assertThat(hello.getDistinctConfigs()).containsExactly(Map.entry("1", "1 x"), Map.entry("2", "2 x"));
        assertThat(hello.getConfigs().get("2 y").get("defines"))
                .isEqualTo(new ListExpr(List.of(new LiteralExpr("ARCH2"))));
        assertThat(hello.getConfigs().get("1 y").get("defines")).isInstanceOf(NullExpr.class);
    }

    @Test
    void testOptionSelectingSourceFilesKeepsConfigsDistinct() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.target("exe", "hello",
                        ast.sources("hello.cpp"),
                        ast.when(ast.eq("Arch", "2"), ast.sources("arch2.cpp"))));

        Target hello = target(project, "hello");
        assertThat(hello.getDistinctConfigs()).containsExactly(Map.entry("1", "1"), Map.entry("2", "2"));
        assertThat(((ListExpr) hello.getConfigs().get("1").get(Target.CONFIG_SOURCES)).getItems()).hasSize(1);
        assertThat(((ListExpr) hello.getConfigs().get("2").get(Target.CONFIG_SOURCES)).getItems()).hasSize(2);
        assertThat(hello.getConfigs().get("2").get(Target.CONFIG_HEADERS)).isEqualTo(new ListExpr(List.of()));
    }

    @Test
    void testConfigurationHoldsResolvedTargets() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.when(ast.eq("Arch", "2"), ast.target("exe", "hello", ast.sources("hello.cpp"))));

        List<FlattenedConfiguration> configs = project.getConfigurations();
        assertThat(configs.get(0).getTargets()).isEmpty();
        assertThat(configs.get(1).getTargets()).containsOnlyKeys("hello");
        assertThat(configs.get(1).getTargets().get("hello"))
                .isEqualTo(target(project, "hello").getConfigs().get("2"));
    }

    @Test
    void testOptionTestedThroughVariableInConditionIsKept() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.option("Kind", "x", "x", "y"),
                ast.assign("platform", ast.concat(ast.ref("Arch"), ast.lit("-bit"))),
                ast.when(ast.eq("platform", "2-bit"), ast.target("exe", "hello", ast.sources("hello.cpp"))));

        Target hello = target(project, "hello");
        assertThat(hello.getConfigs()).containsOnlyKeys("2 x", "2 y");
        assertThat(hello.getDistinctConfigs()).containsExactly(Map.entry("2", "2 x"));
    }

    @Test
    void testTargetIsOnlyInConfigurationsWhereItIsBuilt() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.option("Kind", "x", "x", "y"),
                ast.when(ast.eq("Arch", "2"), ast.target("exe", "hello", ast.sources("hello.cpp"))));

        Target hello = target(project, "hello");
        assertThat(hello.getConfigs()).containsOnlyKeys("2 x", "2 y");
        assertThat(hello.getDistinctConfigs()).containsExactly(Map.entry("2", "2 x"));
    }

    @Test
    void testConditionalVariableIsResolvedPerConfiguration() {
        Project project = generate(
                ast.option("Arch", "1", "1", "2"),
                ast.when(ast.eq("Arch", "1"), ast.assign("flags", "a")),
                ast.when(ast.eq("Arch", "2"), ast.assign("flags", "b")),
                ast.target("exe", "hello", ast.sources("hello.cpp")));

        List<FlattenedConfiguration> configs = project.getConfigurations();
        assertThat(names(configs)).containsExactly("1", "2");
        assertThat(configs.get(0).getVariables()).containsEntry("flags", new LiteralExpr("a"));
        assertThat(configs.get(1).getVariables()).containsEntry("flags", new LiteralExpr("b"));
    }

    @Test
    void testWithoutOptionsThereIsOneDefaultConfiguration() {
        Project project = generate(ast.target("exe", "hello", ast.sources("hello.cpp")));

        assertThat(names(project.getConfigurations())).containsExactly("Default");
        Target hello = target(project, "hello");
        assertThat(hello.getConfigs()).containsOnlyKeys("Default");
        assertThat(hello.getDistinctConfigs()).containsExactly(Map.entry("Default", "Default"));
    }

    @Test
    void testOptionWithoutValuesIsFixedToDefault() {
        Project project = generate(
                ast.option("Prefix", "/usr"),
                ast.target("exe", "hello", ast.sources("hello.cpp")));

        List<FlattenedConfiguration> configs = project.getConfigurations();
        assertThat(names(configs)).containsExactly("Default");
        assertThat(configs.get(0).getVariables()).containsEntry("Prefix", new LiteralExpr("/usr"));
        assertThat(configs.get(0).getOptionValues()).isEmpty();
    }

    @Test
    void testOptionWithoutDefaultOrValuesCannotBeFlattened() {
        assertThatThrownBy(() -> generate(
                ast.option("Prefix", null),
                ast.target("exe", "hello", ast.sources("hello.cpp"))))
                .isInstanceOf(FlattenException.class)
                .hasMessage("can't flatten makefile: option 'Prefix' does not have default value"
                        + " or list of possible values");
    }

    @Test
    void testValueLabelsAreUsedInNames() {
        Project project = new Project(new ExtensionRegistry());
        new Module(project, "test.bkl");
        project.addOption(Option.builder()
                .name("Build")
                .values(List.of("debug", "release"))
                .valueLabel("debug", "Debug")
                .valueLabel("release", "")
                .defaultValue("debug")
                .build());
        project.addVariable(new Variable("Build", new LiteralExpr("?"), null));

        List<FlattenedConfiguration> configs = new ConfigurationFlattener().flatten(project);

        assertThat(names(configs)).containsExactly("Debug", "Default");
        assertThat(project.getConfigurations()).isEqualTo(configs);
    }
}
