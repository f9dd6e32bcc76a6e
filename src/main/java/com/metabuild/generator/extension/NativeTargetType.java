package com.metabuild.generator.extension;

import java.util.ArrayList;
import java.util.List;

import com.metabuild.generator.model.PropertyScope;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;

/**
 * Targets compiled and linked from C/C++ sources: executables, static and
 * shared libraries.
 */
public class NativeTargetType implements TargetType {

    private final String name;

    public NativeTargetType(String name) {
        this.name = name;
    }

    public static List<TargetType> all() {
        return List.of(new NativeTargetType("exe"),
                new NativeTargetType("library"),
                new NativeTargetType("shared-library"));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Property> getProperties() {
        List<Property> props = new ArrayList<>();
        props.add(listProperty("defines", PropertyType.LIST, "List of preprocessor macros to define."));
        props.add(listProperty("includedirs", PropertyType.PATH_LIST, "Directories where to look for header files."));
        props.add(listProperty("libs", PropertyType.LIST, "Additional libraries to link with."));
        props.add(listProperty("libdirs", PropertyType.PATH_LIST, "Additional directories to search for libraries."));
        props.add(Property.builder()
                .name("outputdir")
                .scope(PropertyScope.TARGET)
                .type(PropertyType.PATH)
                .targetType(name)
                .inheritable(true)
                .defaultValue(t -> new PathExpr(List.of(), PathAnchor.BUILDDIR))
                .description("Directory where final binaries are put.")
                .build());
        props.add(Property.builder()
                .name("basename")
                .scope(PropertyScope.TARGET)
                .type(PropertyType.STRING)
                .targetType(name)
                .defaultValue(t -> new LiteralExpr(t.getName()))
                .description("File name of the output, without extension and prefix.")
                .build());
        return props;
    }

    private Property listProperty(String propName, PropertyType type, String description) {
        return Property.builder()
                .name(propName)
                .scope(PropertyScope.TARGET)
                .type(type)
                .targetType(name)
                .inheritable(true)
                .defaultValue(t -> new ListExpr(List.of()))
                .description(description)
                .build();
    }
}
