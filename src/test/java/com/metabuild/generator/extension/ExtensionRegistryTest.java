package com.metabuild.generator.extension;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.PropertyScope;
import com.metabuild.generator.model.SourceFile;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;

class ExtensionRegistryTest {

    private final ExtensionRegistry registry = ExtensionRegistry.withDefaults();
    private final Project project = new Project(registry);
    private final Module module = new Module(project, "test.bkl");

    private Target target(String type, String name) {
        return new Target(module, name, registry.getTargetType(type).orElseThrow(), null);
    }

    @Test
    void testBuiltInExtensions() {
        assertThat(registry.getToolsets()).containsOnlyKeys("gnu", "vs2010");
        assertThat(registry.getToolset("vs2010").orElseThrow().requiresFlattening()).isTrue();
        assertThat(registry.getToolset("gnu").orElseThrow().requiresFlattening()).isFalse();
        assertThat(registry.getTargetType("shared-library")).isPresent();
        assertThat(registry.getTargetType("action")).isPresent();
        assertThat(registry.getTargetType("jar")).isEmpty();
    }

    @Test
    void testPropertiesDependOnTargetType() {
        Target exe = target("exe", "hello");
        Target action = target("action", "docs");

        assertThat(registry.findProperty(exe, "defines")).isPresent();
        assertThat(registry.findProperty(action, "defines")).isEmpty();
        assertThat(registry.findProperty(action, "commands")).isPresent();
        assertThat(registry.findProperty(exe, "id")).isPresent();
        assertThat(registry.propertiesFor(action)).extracting(Property::getName)
                .contains("_condition", "id", "deps", "commands", "vs2010.projectfile")
                .doesNotContain("outputdir");
    }

    @Test
    void testInheritablePropertiesOfNestedScopes() {
        assertThat(registry.findProperty(module, "outputdir")).isEmpty();
        assertThat(registry.findPropertyWithInheritance(module, "outputdir")).isPresent();
        assertThat(registry.findPropertyWithInheritance(module, "basename")).isEmpty();
        assertThat(registry.findPropertyWithInheritance(project, "toolsets")).isPresent();
    }

    @Test
    void testToolsetSpecificProperties() {
        Property makefile = registry.findProperty(module, GnuToolset.MAKEFILE_PROPERTY).orElseThrow();

        assertThat(makefile.appliesToToolset("gnu")).isTrue();
        assertThat(makefile.appliesToToolset("vs2010")).isFalse();
        assertThat(makefile.defaultExpr(module)).isEqualTo(new PathExpr(List.of(new LiteralExpr("GNUmakefile")),
                PathAnchor.SRCDIR, "test.bkl", null));
    }

    @Test
    void testRequiredProperty() {
        Property required = Property.builder().name("license").scope(PropertyScope.MODULE).build();
        registry.registerToolset(new Toolset() {
            @Override
            public String getName() {
                return "custom";
            }

            @Override
            public List<Property> getProperties() {
                return List.of(required);
            }

            @Override
            public PathExpr getBuilddirFor(Target target) {
                return new PathExpr(List.of(), PathAnchor.TOP_BUILDDIR);
            }
        });

        assertThat(registry.findProperty(module, "license")).contains(required);
        assertThat(required.isRequired()).isTrue();
        assertThatThrownBy(() -> module.makeVariablesForMissingProperties("custom"))
                .isInstanceOf(GeneratorException.class)
                .hasMessageContaining("required property \"license\"");
    }

    @Test
    void testFileCompilers() {
        Target exe = target("exe", "hello");
        SourceFile cpp = new SourceFile(exe, new PathExpr(List.of(new LiteralExpr("a.cc")), PathAnchor.SRCDIR), null);
        SourceFile c = new SourceFile(exe, new PathExpr(List.of(new LiteralExpr("b.c")), PathAnchor.SRCDIR), null);
        SourceFile txt = new SourceFile(exe, new PathExpr(List.of(new LiteralExpr("c.txt")), PathAnchor.SRCDIR), null);

        assertThat(registry.findFileCompiler(cpp)).map(FileCompiler::name).contains("C++");
        assertThat(registry.findFileCompiler(c)).map(FileCompiler::name).contains("C");
        assertThat(registry.findFileCompiler(txt)).isEmpty();
    }
}
