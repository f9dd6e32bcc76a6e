package com.metabuild.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.metabuild.generator.extension.ExtensionRegistry;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.model.expr.RewritingVisitor;

/**
 * Root of the model: all modules loaded for one top-level input file, plus
 * project-wide options, templates and configurations.
 */
public class Project extends ModelPart {

    private final ExtensionRegistry registry;
    private final List<Module> modules = new ArrayList<>();
    private final Map<String, Option> options = new LinkedHashMap<>();
    private final Map<String, Template> templates = new LinkedHashMap<>();
    private final Map<String, String> srcdirMap = new LinkedHashMap<>();
    private final List<FlattenedConfiguration> configurations = new ArrayList<>();

    public Project(ExtensionRegistry registry) {
        super(null, null);
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ExtensionRegistry getRegistry() {
        return registry;
    }

    @Override
    public String getName() {
        return "project";
    }

    @Override
    public PropertyScope getScope() {
        return PropertyScope.PROJECT;
    }

    /** All modules, in load order; the first one is the top-level module. */
    @Override
    public List<Module> getChildParts() {
        return Collections.unmodifiableList(modules);
    }

    public List<Module> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public Module getTopModule() {
        return modules.isEmpty() ? null : modules.get(0);
    }

    void registerModule(Module module) {
        modules.add(module);
    }

    public void removeModule(Module module) {
        modules.remove(module);
    }

    /** All targets of all modules. */
    public List<Target> allTargets() {
        List<Target> result = new ArrayList<>();
        for (Module m : modules) {
            result.addAll(m.getTargets().values());
        }
        return result;
    }

    public boolean hasTarget(String name) {
        return getTarget(name).isPresent();
    }

    public Optional<Target> getTarget(String name) {
        for (Module m : modules) {
            Target t = m.getTargets().get(name);
            if (t != null) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** Declared options, in declaration order. */
    public Map<String, Option> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public void addOption(Option option) {
        options.put(option.getName(), option);
    }

    public Map<String, Template> getTemplates() {
        return Collections.unmodifiableMap(templates);
    }

    public void addTemplate(Template template) {
        templates.put(template.getName(), template);
    }

    /**
     * Source directory of input file {@code filename}: the directory set by a
     * {@code srcdir} statement in it, or the file's own directory.
     */
    public String getSrcdir(String filename) {
        String dir = srcdirMap.get(filename);
        if (dir != null) {
            return dir;
        }
        int slash = filename.lastIndexOf('/');
        return slash > 0 ? filename.substring(0, slash) : ".";
    }

    public void setSrcdir(String filename, String srcdir) {
        srcdirMap.put(filename, srcdir);
    }

    /** Configurations computed by flattening; empty for formats that don't need it. */
    public List<FlattenedConfiguration> getConfigurations() {
        return Collections.unmodifiableList(configurations);
    }

    public void setConfigurations(List<FlattenedConfiguration> configs) {
        configurations.clear();
        configurations.addAll(configs);
    }

    /**
     * Makes an independent deep copy of the model. References in the copy
     * resolve against the copy's scopes, never against this project.
     */
    public Project cloneModel() {
        Project copy = new Project(registry);
        Map<ModelPart, ModelPart> mapping = new IdentityHashMap<>();
        mapping.put(this, copy);
        copyVariablesTo(copy);
        copy.options.putAll(options);
        copy.templates.putAll(templates);
        copy.srcdirMap.putAll(srcdirMap);
        copy.configurations.addAll(configurations);
        // parents always precede their submodules in the list
        for (Module m : modules) {
            m.cloneInto(mapping.get(m.getParent()), mapping);
        }
        ContextRemapper remapper = new ContextRemapper(mapping);
        for (Variable var : copy.allVariables()) {
            var.rewrite(remapper::visit);
        }
        for (Target t : copy.allTargets()) {
            t.remapConfigs(remapper::visit);
        }
        return copy;
    }

    private static final class ContextRemapper extends RewritingVisitor {
        private final Map<ModelPart, ModelPart> mapping;

        ContextRemapper(Map<ModelPart, ModelPart> mapping) {
            this.mapping = mapping;
        }

        @Override
        public Expression visitReference(ReferenceExpr e) {
            ModelPart target = mapping.get(e.getContext());
            if (target == null || target == e.getContext()) {
                return e;
            }
            return new ReferenceExpr(e.getVar(), target, e.getPosition());
        }
    }
}
