package com.metabuild.generator.extension;

import java.util.List;

import com.metabuild.generator.model.PropertyScope;
import com.metabuild.generator.model.expr.ListExpr;

/**
 * Custom action target: runs commands, produces nothing the toolchain knows about.
 */
public class ActionTargetType implements TargetType {

    public static final String NAME = "action";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Property> getProperties() {
        return List.of(Property.builder()
                .name("commands")
                .scope(PropertyScope.TARGET)
                .type(PropertyType.LIST)
                .targetType(NAME)
                .defaultValue(t -> new ListExpr(List.of()))
                .description("List of commands to run.")
                .build());
    }
}
