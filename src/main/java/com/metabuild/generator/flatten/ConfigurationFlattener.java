package com.metabuild.generator.flatten;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.error.FlattenException;
import com.metabuild.generator.error.NonConstException;
import com.metabuild.generator.error.UnresolvedReferenceException;
import com.metabuild.generator.interpreter.ConditionalsSimplifier;
import com.metabuild.generator.interpreter.ModelPasses;
import com.metabuild.generator.model.ConditionalVariable;
import com.metabuild.generator.model.FlattenedConfiguration;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.Option;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.SourceFile;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.ExpressionWalker;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.ReferenceExpr;

/**
 * Expands a model with build options into explicit configurations, for
 * output formats that can't express conditions.
 *
 * Every combination of values of the options that have a list of values is
 * one configuration; other options are fixed to their default. For each
 * configuration the model is copied, the options are bound and every target
 * that is built in it gets a snapshot of its fully resolved variables in
 * {@link Target#getConfigs()}.
 */
public class ConfigurationFlattener {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationFlattener.class);

    public static final String DEFAULT_CONFIG_NAME = "Default";

    /**
     * Flattens {@code project} in place: fills each target's configs and
     * distinct configs and the project's configuration list.
     *
     * @return the configurations, in option declaration order
     * @throws FlattenException if an option can't be enumerated or a target's
     *         condition can't be decided for some configuration
     */
    public List<FlattenedConfiguration> flatten(Project project) {
        List<Option> enumerable = new ArrayList<>();
        Map<String, String> fixed = new LinkedHashMap<>();
        for (Option option : project.getOptions().values()) {
            if (option.isEnumerable()) {
                enumerable.add(option);
            } else if (option.getDefaultValue() != null) {
                fixed.put(option.getName(), option.getDefaultValue());
            } else {
                throw new FlattenException("can't flatten makefile: option '" + option.getName()
                        + "' does not have default value or list of possible values");
            }
        }

        List<Map<String, String>> combinations = cartesianProduct(enumerable);
        log.debug("flattening {} into {} configurations", project.getTopModule(), combinations.size());

        List<FlattenedConfiguration> configs = new ArrayList<>();
        Map<String, Map<String, String>> assignments = new LinkedHashMap<>();
        for (Map<String, String> combination : combinations) {
            String name = configName(combination, enumerable);
            assignments.put(name, combination);
            configs.add(flattenConfiguration(project, name, combination, fixed));
        }

        for (Target target : project.allTargets()) {
            target.setDistinctConfigs(findDistinctConfigs(target, enumerable, assignments));
        }
        project.setConfigurations(configs);
        return configs;
    }

    private FlattenedConfiguration flattenConfiguration(Project project, String name,
                                                        Map<String, String> combination, Map<String, String> fixed) {
        log.debug("flattening configuration \"{}\"", name);
        Project copy = project.cloneModel();
        Map<String, String> bound = new LinkedHashMap<>(fixed);
        bound.putAll(combination);
        bindOptions(copy, bound);
        resolveConditionalVariables(copy, combination);
        ModelPasses.eliminateSuperfluousConditionals(copy);

        Map<String, Map<String, Expression>> targets = new LinkedHashMap<>();
        for (Target target : copy.allTargets()) {
            if (!isBuilt(target, name)) {
                log.debug("target {} is not built in configuration \"{}\"", target.getName(), name);
                continue;
            }
            Map<String, Expression> resolved = snapshot(target);
            resolved.put(Target.CONFIG_SOURCES, builtFiles(target.getSources(), name));
            resolved.put(Target.CONFIG_HEADERS, builtFiles(target.getHeaders(), name));
            targets.put(target.getName(), resolved);
            project.getTarget(target.getName())
                    .orElseThrow(() -> new IllegalStateException("target " + target.getName() + " missing"))
                    .addConfig(name, resolved);
        }

        Map<String, Expression> variables = new LinkedHashMap<>(snapshot(copy));
        if (copy.getTopModule() != null) {
            variables.putAll(snapshot(copy.getTopModule()));
        }
        return FlattenedConfiguration.builder()
                .name(name)
                .optionValues(combination)
                .variables(variables)
                .targets(targets)
                .build();
    }

    private static boolean isBuilt(ModelPart part, String config) {
        try {
            return part.shouldBuild();
        } catch (NonConstException e) {
            String what = part instanceof Target ? "target" : "source file";
            throw new FlattenException("can't flatten " + what + " \"" + part.getName() + "\" in configuration \""
                    + config + "\": " + e.getDetail(), part.getPosition());
        }
    }

    /** Resolved names of the files built in the configuration, in declaration order. */
    private static Expression builtFiles(List<SourceFile> files, String config) {
        List<Expression> names = new ArrayList<>();
        for (SourceFile file : files) {
            if (isBuilt(file, config)) {
                names.add(resolve(file.getFilename()));
            }
        }
        return new ListExpr(names);
    }

    private static void bindOptions(Project copy, Map<String, String> values) {
        values.forEach((option, value) -> {
            Variable var = copy.getVariable(option);
            if (var == null) {
                copy.addVariable(new Variable(option, new LiteralExpr(value), null));
            } else {
                var.rewrite(old -> new LiteralExpr(value, old.getPosition()));
            }
        });
    }

    private static void resolveConditionalVariables(ModelPart part, Map<String, String> combination) {
        Map<String, Option> options = part.getProject().getOptions();
        for (Variable var : new ArrayList<>(part.getVariables().values())) {
            if (var instanceof ConditionalVariable cv) {
                Variable resolved = new Variable(cv.getName(), cv.resolve(combination, options), cv.isReadonly(),
                        cv.isInheritable(), cv.getPosition());
                resolved.setProperty(cv.isProperty());
                resolved.setExplicitlySet(cv.isExplicitlySet());
                part.replaceVariable(resolved);
            }
        }
        for (ModelPart child : part.getChildParts()) {
            resolveConditionalVariables(child, combination);
        }
    }

    /** Variables of {@code part} with all references replaced by values, simplified. */
    private static Map<String, Expression> snapshot(ModelPart part) {
        Map<String, Expression> result = new LinkedHashMap<>();
        for (Variable var : part.getVariables().values()) {
            result.put(var.getName(), resolve(var.getValue()));
        }
        return result;
    }

    private static Expression resolve(Expression value) {
        return new ConditionalsSimplifier().visit(new ReferenceInliner().visit(value));
    }

    private static List<Map<String, String>> cartesianProduct(List<Option> options) {
        List<Map<String, String>> result = new ArrayList<>();
        result.add(new LinkedHashMap<>());
        for (Option option : options) {
            List<Map<String, String>> next = new ArrayList<>();
            for (Map<String, String> partial : result) {
                for (String value : option.getValues()) {
                    Map<String, String> extended = new LinkedHashMap<>(partial);
                    extended.put(option.getName(), value);
                    next.add(extended);
                }
            }
            result = next;
        }
        return result;
    }

    /** Joins the non-empty value labels in option order; "Default" if there are none. */
    static String configName(Map<String, String> combination, List<Option> options) {
        List<String> labels = new ArrayList<>();
        for (Option option : options) {
            String value = combination.get(option.getName());
            if (value == null) {
                continue;
            }
            String label = option.getLabel(value);
            if (!label.isEmpty()) {
                labels.add(label);
            }
        }
        return labels.isEmpty() ? DEFAULT_CONFIG_NAME : String.join(" ", labels);
    }

    /**
     * Maps reduced configuration names of {@code target} to the first full
     * configuration with that name. Options that make no difference to the
     * target's variables are left out of the reduced names, unless the
     * target's condition tests them.
     */
    private static Map<String, String> findDistinctConfigs(Target target, List<Option> options,
                                                           Map<String, Map<String, String>> assignments) {
        Map<String, Map<String, Expression>> configs = target.getConfigs();
        Set<String> conditionOptions = referencedOptions(target);

        List<Option> kept = new ArrayList<>(options);
        List<Option> removable = new ArrayList<>();
        for (Option option : options) {
            if (conditionOptions.contains(option.getName())) {
                continue;
            }
            List<Option> without = options.stream().filter(o -> o != option).collect(Collectors.toList());
            if (!hasCollisions(configs, assignments, without)) {
                removable.add(option);
            }
        }
        kept.removeAll(removable);
        if (!removable.isEmpty()) {
            log.debug("options {} make no difference to target {}",
                    removable.stream().map(Option::getName).collect(Collectors.toList()), target.getName());
        }

        Map<String, String> distinct = new LinkedHashMap<>();
        for (String config : configs.keySet()) {
            distinct.putIfAbsent(configName(assignments.get(config), kept), config);
        }
        return distinct;
    }

    private static boolean hasCollisions(Map<String, Map<String, Expression>> configs,
                                         Map<String, Map<String, String>> assignments, List<Option> options) {
        Map<String, Map<String, Expression>> seen = new HashMap<>();
        for (Map.Entry<String, Map<String, Expression>> e : configs.entrySet()) {
            String reduced = configName(assignments.get(e.getKey()), options);
            Map<String, Expression> previous = seen.putIfAbsent(reduced, e.getValue());
            if (previous != null && !previous.equals(e.getValue())) {
                return true;
            }
        }
        return false;
    }

    /** Options the target's condition depends on, also through other variables. */
    private static Set<String> referencedOptions(Target target) {
        Set<String> names = new LinkedHashSet<>();
        Expression cond = target.getCondition();
        if (cond == null) {
            return names;
        }
        Map<String, Option> options = target.getProject().getOptions();
        Set<String> followed = new HashSet<>();
        new ExpressionWalker() {
            @Override
            public Void visitReference(ReferenceExpr e) {
                if (options.containsKey(e.getVar())) {
                    names.add(e.getVar());
                    return null;
                }
                if (!followed.add(e.getContext().getQualifiedName() + "::" + e.getVar())) {
                    return null;
                }
                Expression value;
                try {
                    value = e.getValue();
                } catch (UnresolvedReferenceException ex) {
                    log.debug("not following unresolved {} in condition of {}", e, target.getName());
                    return null;
                }
                return visit(value);
            }
        }.visit(cond);
        return names;
    }
}
