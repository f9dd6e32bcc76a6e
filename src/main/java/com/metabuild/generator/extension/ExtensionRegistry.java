package com.metabuild.generator.extension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.SourceFile;

/**
 * Known toolsets, target types, file compilers and the properties they
 * contribute. Everything is registered explicitly; one registry is created
 * per compilation and only read after setup.
 */
public class ExtensionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtensionRegistry.class);

    private final Map<String, Toolset> toolsets = new LinkedHashMap<>();
    private final Map<String, TargetType> targetTypes = new LinkedHashMap<>();
    private final List<FileCompiler> compilers = new ArrayList<>();
    private final List<Property> standardProperties = new ArrayList<>();
    private List<Property> propertyCache;

    /** Registry with the standard properties and nothing else. */
    public ExtensionRegistry() {
        standardProperties.addAll(StandardProperties.all());
    }

    /** Registry with all built-in toolsets, target types and compilers. */
    public static ExtensionRegistry withDefaults() {
        ExtensionRegistry registry = new ExtensionRegistry();
        registry.registerToolset(new GnuToolset());
        registry.registerToolset(VisualStudioToolset.vs2010());
        NativeTargetType.all().forEach(registry::registerTargetType);
        registry.registerTargetType(new ActionTargetType());
        registry.registerFileCompiler(FileCompiler.c());
        registry.registerFileCompiler(FileCompiler.cxx());
        return registry;
    }

    public void registerToolset(Toolset toolset) {
        log.debug("Registering toolset {}", toolset.getName());
        toolsets.put(toolset.getName(), toolset);
        propertyCache = null;
    }

    public void registerTargetType(TargetType type) {
        log.debug("Registering target type {}", type.getName());
        targetTypes.put(type.getName(), type);
        propertyCache = null;
    }

    public void registerFileCompiler(FileCompiler compiler) {
        compilers.add(compiler);
    }

    public Optional<Toolset> getToolset(String name) {
        return Optional.ofNullable(toolsets.get(name));
    }

    public Map<String, Toolset> getToolsets() {
        return Collections.unmodifiableMap(toolsets);
    }

    public Optional<TargetType> getTargetType(String name) {
        return Optional.ofNullable(targetTypes.get(name));
    }

    /** Compiler for the file's extension, if any is registered. */
    public Optional<FileCompiler> findFileCompiler(SourceFile file) {
        String ext = file.getExtension();
        return compilers.stream().filter(c -> c.handles(ext)).findFirst();
    }

    /** All properties defined for {@code part}'s scope, standard ones first. */
    public List<Property> propertiesFor(ModelPart part) {
        List<Property> result = new ArrayList<>();
        for (Property p : allProperties()) {
            if (p.isDirectlyFor(part)) {
                result.add(p);
            }
        }
        return result;
    }

    public Optional<Property> findProperty(ModelPart part, String name) {
        for (Property p : allProperties()) {
            if (p.getName().equals(name) && p.isDirectlyFor(part)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds property {@code name} of {@code part}'s scope or, failing that, an
     * inheritable property of any scope nested in it.
     */
    public Optional<Property> findPropertyWithInheritance(ModelPart part, String name) {
        Optional<Property> direct = findProperty(part, name);
        if (direct.isPresent()) {
            return direct;
        }
        for (Property p : allProperties()) {
            if (p.getName().equals(name) && p.isInheritable() && part.getScope().isOuterTo(p.getScope())) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    private List<Property> allProperties() {
        if (propertyCache == null) {
            List<Property> all = new ArrayList<>(standardProperties);
            targetTypes.values().forEach(tt -> all.addAll(tt.getProperties()));
            toolsets.values().forEach(ts -> all.addAll(ts.getProperties()));
            propertyCache = List.copyOf(all);
        }
        return propertyCache;
    }
}
