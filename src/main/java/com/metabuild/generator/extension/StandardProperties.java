package com.metabuild.generator.extension;

import java.util.List;

import com.metabuild.generator.model.PropertyScope;
import com.metabuild.generator.model.expr.BoolValueExpr;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.UndeterminedExpr;

/**
 * Properties available regardless of target type and toolset.
 */
public final class StandardProperties {

    public static final String CONDITION = "_condition";
    public static final String FILENAME = "_filename";
    public static final String TOOLSET = "toolset";
    public static final String TOOLSETS = "toolsets";

    private StandardProperties() {
    }

    public static List<Property> all() {
        return List.of(
                Property.builder()
                        .name(TOOLSET)
                        .scope(PropertyScope.PROJECT)
                        .type(PropertyType.STRING)
                        .readonly(true)
                        .defaultValue(p -> new UndeterminedExpr(TOOLSET))
                        .description("The toolset makefiles or projects are being generated for.")
                        .build(),
                Property.builder()
                        .name(TOOLSETS)
                        .scope(PropertyScope.MODULE)
                        .type(PropertyType.LIST)
                        .inheritable(true)
                        .defaultValue(p -> new ListExpr(List.of()))
                        .description("List of toolsets to generate makefiles/projects for.")
                        .build(),
                condition(PropertyScope.TARGET),
                Property.builder()
                        .name("id")
                        .scope(PropertyScope.TARGET)
                        .type(PropertyType.STRING)
                        .readonly(true)
                        .defaultValue(t -> new LiteralExpr(t.getName()))
                        .description("Target's unique name (ID).")
                        .build(),
                Property.builder()
                        .name("deps")
                        .scope(PropertyScope.TARGET)
                        .type(PropertyType.LIST)
                        .defaultValue(t -> new ListExpr(List.of()))
                        .description("Dependencies of the target (list of IDs).")
                        .build(),
                condition(PropertyScope.SOURCE_FILE),
                Property.builder()
                        .name(FILENAME)
                        .scope(PropertyScope.SOURCE_FILE)
                        .type(PropertyType.PATH)
                        .readonly(true)
                        .defaultValue(f -> new ListExpr(List.of()))
                        .description("Source file name.")
                        .build());
    }

    private static Property condition(PropertyScope scope) {
        return Property.builder()
                .name(CONDITION)
                .scope(scope)
                .type(PropertyType.BOOL)
                .readonly(true)
                .defaultValue(p -> new BoolValueExpr(true))
                .description("Whether to include this object in the build.")
                .build();
    }
}
