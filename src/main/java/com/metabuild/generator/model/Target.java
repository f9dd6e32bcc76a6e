package com.metabuild.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import com.metabuild.generator.extension.TargetType;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.parser.SourcePosition;

/**
 * A build target: executable, library, custom action etc.
 *
 * For formats that need flattening, {@link #getConfigs()} holds the target's
 * variables resolved for every configuration it is built in, plus the file
 * names of the sources and headers built in it under {@link #CONFIG_SOURCES}
 * and {@link #CONFIG_HEADERS}. {@link #getDistinctConfigs()} maps the reduced
 * names the output may use to configuration names.
 */
public class Target extends ModelPart {

    public static final String CONFIG_SOURCES = "_sources";
    public static final String CONFIG_HEADERS = "_headers";

    private final String name;
    private final TargetType type;
    private final List<SourceFile> sources = new ArrayList<>();
    private final List<SourceFile> headers = new ArrayList<>();
    private final Map<String, Map<String, Expression>> configs = new LinkedHashMap<>();
    private final Map<String, String> distinctConfigs = new LinkedHashMap<>();

    public Target(Module parent, String name, TargetType type, SourcePosition position) {
        super(parent, position);
        this.name = name;
        this.type = type;
        parent.registerTarget(this);
    }

    @Override
    public String getName() {
        return name;
    }

    public TargetType getType() {
        return type;
    }

    @Override
    public PropertyScope getScope() {
        return PropertyScope.TARGET;
    }

    @Override
    public List<SourceFile> getChildParts() {
        List<SourceFile> all = new ArrayList<>(sources);
        all.addAll(headers);
        return all;
    }

    public List<SourceFile> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public List<SourceFile> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    public void addSource(SourceFile file) {
        sources.add(file);
    }

    public void addHeader(SourceFile file) {
        headers.add(file);
    }

    public void removeSourceFile(SourceFile file) {
        if (!sources.remove(file)) {
            headers.remove(file);
        }
    }

    public Map<String, Map<String, Expression>> getConfigs() {
        return Collections.unmodifiableMap(configs);
    }

    public void addConfig(String configName, Map<String, Expression> variables) {
        configs.put(configName, Collections.unmodifiableMap(new LinkedHashMap<>(variables)));
    }

    public Map<String, String> getDistinctConfigs() {
        return Collections.unmodifiableMap(distinctConfigs);
    }

    public void setDistinctConfigs(Map<String, String> mapping) {
        distinctConfigs.clear();
        distinctConfigs.putAll(mapping);
    }

    void remapConfigs(UnaryOperator<Expression> remap) {
        for (Map.Entry<String, Map<String, Expression>> e : configs.entrySet()) {
            Map<String, Expression> remapped = new LinkedHashMap<>();
            e.getValue().forEach((k, v) -> remapped.put(k, remap.apply(v)));
            e.setValue(Collections.unmodifiableMap(remapped));
        }
    }

    Target cloneInto(Module newParent, Map<ModelPart, ModelPart> mapping) {
        Target copy = new Target(newParent, name, type, getPosition());
        mapping.put(this, copy);
        copyVariablesTo(copy);
        for (SourceFile f : sources) {
            copy.sources.add(f.cloneInto(copy, mapping));
        }
        for (SourceFile f : headers) {
            copy.headers.add(f.cloneInto(copy, mapping));
        }
        copy.configs.putAll(configs);
        copy.distinctConfigs.putAll(distinctConfigs);
        return copy;
    }
}
