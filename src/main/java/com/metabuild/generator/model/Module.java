package com.metabuild.generator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Model of one input file, with the targets declared in it. A module's
 * parent is either the project or the module that included it with a
 * {@code submodule} statement.
 */
public class Module extends ModelPart {

    private final String sourceFile;
    private final Map<String, Target> targets = new LinkedHashMap<>();

    public Module(ModelPart parent, String sourceFile) {
        super(parent, SourcePosition.ofFile(sourceFile));
        this.sourceFile = sourceFile;
        getProject().registerModule(this);
    }

    /** Base name of the input file without extension. */
    @Override
    public String getName() {
        int slash = sourceFile.lastIndexOf('/');
        String base = slash >= 0 ? sourceFile.substring(slash + 1) : sourceFile;
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    @Override
    public PropertyScope getScope() {
        return PropertyScope.MODULE;
    }

    @Override
    public List<Target> getChildParts() {
        return List.copyOf(targets.values());
    }

    public String getSourceFile() {
        return sourceFile;
    }

    /** Source directory, relative to the current directory. */
    public String getSrcdir() {
        return getProject().getSrcdir(sourceFile);
    }

    public Map<String, Target> getTargets() {
        return Collections.unmodifiableMap(targets);
    }

    void registerTarget(Target target) {
        targets.put(target.getName(), target);
    }

    public void removeTarget(Target target) {
        targets.remove(target.getName());
    }

    /** Modules included by this one. */
    public List<Module> getSubmodules() {
        return getProject().getModules().stream()
                .filter(m -> m.getParent() == this)
                .collect(Collectors.toList());
    }

    Module cloneInto(ModelPart newParent, Map<ModelPart, ModelPart> mapping) {
        Module copy = new Module(newParent, sourceFile);
        mapping.put(this, copy);
        copyVariablesTo(copy);
        for (Target t : targets.values()) {
            t.cloneInto(copy, mapping);
        }
        return copy;
    }
}
