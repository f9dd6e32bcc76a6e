package com.metabuild.generator.interpreter;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.error.NonConstException;
import com.metabuild.generator.extension.StandardProperties;
import com.metabuild.generator.extension.Toolset;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.SourceFile;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.ConstantValue;
import com.metabuild.generator.model.expr.Expression;

/**
 * Whole-model transformations run by the interpreter.
 */
public final class ModelPasses {

    private static final Logger log = LoggerFactory.getLogger(ModelPasses.class);

    private ModelPasses() {
    }

    /**
     * Rewrites relative paths in all module and target variables, see
     * {@link PathsNormalizer}. Normalizing twice has no further effect.
     *
     * @param toolset toolset to resolve {@code @builddir} for, or {@code null}
     */
    public static void normalizePathsInModel(Project model, Toolset toolset, String topSrcdir) {
        log.debug("translating relative paths into absolute");
        PathsNormalizer normalizer = new PathsNormalizer(model, toolset, topSrcdir);
        for (Module module : model.getModules()) {
            normalizer.setContext(module);
            for (Variable var : module.getVariables().values()) {
                var.rewrite(normalizer::visit);
            }
            for (Target target : module.getTargets().values()) {
                normalizer.setContext(target);
                for (Variable var : target.allVariables()) {
                    var.rewrite(normalizer::visit);
                }
            }
        }
    }

    /** Cheap simplifications of all values, see {@link BasicSimplifier}. */
    public static void simplifyExpressions(Project model) {
        log.debug("simplifying expressions");
        BasicSimplifier simplifier = new BasicSimplifier();
        for (Variable var : model.allVariables()) {
            var.rewrite(simplifier::visit);
        }
    }

    /**
     * Removes as much conditional content as possible, repeating
     * {@link ConditionalsSimplifier} until no value changes anymore.
     */
    public static void eliminateSuperfluousConditionals(Project model) {
        ConditionalsSimplifier simplifier = new ConditionalsSimplifier();
        int iteration = 1;
        boolean modified;
        do {
            log.debug("removing superfluous conditional expressions: pass {}", iteration++);
            modified = false;
            for (Variable var : model.allVariables()) {
                Expression old = var.getValue();
                if (var.rewrite(simplifier::visit)) {
                    log.debug("new pass triggered because of this change: {{}} -> {{}}", old, var.getValue());
                    modified = true;
                }
            }
        } while (modified);
    }

    /** Creates variables with default values of all unset properties, recursively. */
    public static void makeVariablesForMissingProperties(ModelPart part, String toolset) {
        part.makeVariablesForMissingProperties(toolset);
        for (ModelPart child : part.getChildParts()) {
            makeVariablesForMissingProperties(child, toolset);
        }
    }

    /**
     * Removes targets and source files whose condition is false, and modules
     * that end up empty or aren't meant for {@code toolset}. Parts whose
     * condition can't be decided yet are kept.
     */
    public static void removeDisabledModelParts(Project model, String toolset) {
        for (Module module : model.getModules()) {
            List<Target> targetsToRemove = new ArrayList<>();
            for (Target target : module.getTargets().values()) {
                if (isDisabled(target)) {
                    targetsToRemove.add(target);
                    continue;
                }
                for (SourceFile file : target.getChildParts()) {
                    if (isDisabled(file)) {
                        log.debug("removing disabled {} from {}", file, target);
                        target.removeSourceFile(file);
                    }
                }
            }
            for (Target target : targetsToRemove) {
                log.debug("removing disabled {}", target);
                module.removeTarget(target);
            }
        }

        List<Module> modulesToRemove = new ArrayList<>();
        for (Module module : model.getModules()) {
            if (module == model.getTopModule()) {
                continue;
            }
            if (module.getSubmodules().isEmpty() && module.getTargets().isEmpty()) {
                log.debug("removing empty {}", module);
                modulesToRemove.add(module);
                continue;
            }
            if (!toolsetsOf(module).contains(toolset)) {
                log.debug("removing {}, because it isn't for toolset {}", module, toolset);
                modulesToRemove.add(module);
            }
        }
        modulesToRemove.forEach(model::removeModule);
    }

    private static boolean isDisabled(ModelPart part) {
        try {
            return !part.shouldBuild();
        } catch (NonConstException e) {
            log.debug("keeping {}, condition not decidable yet: {}", part, e.getDetail());
            return false;
        }
    }

    /** Values of the module's {@code toolsets} property that are known now. */
    static List<String> toolsetsOf(ModelPart module) {
        Expression value = module.getVariableValue(StandardProperties.TOOLSETS);
        ConstantValue constant = value.asConstant();
        List<String> result = new ArrayList<>();
        if (constant.isConstant() && constant.getValue() instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else if (constant.isConstant() && constant.getValue() instanceof String single) {
            result.add(single);
        }
        return result;
    }
}
