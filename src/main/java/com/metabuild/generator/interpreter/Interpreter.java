package com.metabuild.generator.interpreter;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.context.CompilationContext;
import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.extension.StandardProperties;
import com.metabuild.generator.extension.Toolset;
import com.metabuild.generator.flatten.ConfigurationFlattener;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.parser.SourcePosition;
import com.metabuild.generator.parser.ast.RootNode;

/**
 * Turns parsed input files into finalized per-toolset models.
 *
 * Processing happens in stages, see {@link InterpreterState}:
 * <ol>
 *   <li>{@link #addModule} builds the basic model (repeatable).</li>
 *   <li>{@link #finalizeModel} checks it, normalizes paths and simplifies values.</li>
 *   <li>{@link #generate} makes a copy of the model for every toolset, binds
 *       the {@code toolset} property, finalizes it for that toolset and
 *       flattens it if the toolset needs that.</li>
 * </ol>
 * {@link #process} does all of it at once. Calling a stage out of order is
 * an error.
 */
public class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    private final CompilationContext context;
    private final Project model;
    private InterpreterState state = InterpreterState.EMPTY;

    public Interpreter(CompilationContext context) {
        this.context = context;
        this.model = new Project(context.getRegistry());
    }

    public Project getModel() {
        return model;
    }

    public InterpreterState getState() {
        return state;
    }

    public CompilationContext getContext() {
        return context;
    }

    /** Builds, finalizes and specializes the model of {@code ast}. */
    public List<ToolsetModel> process(RootNode ast) {
        addModule(ast, model);
        finalizeModel();
        return generate();
    }

    /**
     * Adds parsed input to the model without any processing, then loads the
     * submodules it includes.
     *
     * @throws GeneratorException if a submodule can't be read; the position is
     *         that of the {@code submodule} statement
     */
    public Module addModule(RootNode ast, ModelPart parent) {
        requireState("add modules", InterpreterState.EMPTY, InterpreterState.BUILT);
        log.info("processing {}", ast.filename());

        Deque<PendingSubmodule> submodules = new ArrayDeque<>();
        Builder builder = new Builder(context, (file, pos) -> submodules.add(new PendingSubmodule(file, pos)));
        Module module = builder.createModel(ast, parent);
        state = InterpreterState.BUILT;

        while (!submodules.isEmpty()) {
            PendingSubmodule sub = submodules.poll();
            RootNode subAst;
            try {
                subAst = context.getAstSource().parse(Paths.get(sub.file()));
            } catch (IOException e) {
                String msg = e.getMessage() != null ? e.getMessage() : "cannot read file " + sub.file();
                throw new GeneratorException(msg, sub.position(), e);
            }
            addModule(subAst, module);
        }
        return module;
    }

    private record PendingSubmodule(String file, SourcePosition position) {
    }

    /** Checks the model for problems, normalizes paths and simplifies it. */
    public void finalizeModel() {
        requireState("finalize the model", InterpreterState.BUILT);
        log.debug("finalizing the model");
        new ModelAnalyzer(context).detectPotentialProblems(model);
        state = InterpreterState.ANALYZED;
        ModelPasses.normalizePathsInModel(model, null, context.getConfig().getTopSrcdir());
        ModelPasses.simplifyExpressions(model);
        state = InterpreterState.NORMALIZED;
    }

    /**
     * Returns a model for {@code toolset} only, with the {@code toolset}
     * property bound. {@link #finalizeForToolset} still has to be called on it.
     *
     * @param skipCopy use the interpreter's own model instead of a copy
     */
    public Project makeToolsetSpecificModel(String toolset, boolean skipCopy) {
        requireState("specialize the model", InterpreterState.NORMALIZED, InterpreterState.SPECIALIZED);
        Project specific = skipCopy ? model : model.cloneModel();
        specific.setPropertyValue(StandardProperties.TOOLSET, new LiteralExpr(toolset));
        return specific;
    }

    /** Finishes a toolset-specific model once the {@code toolset} property is bound. */
    public void finalizeForToolset(Project toolsetModel, String toolset) {
        Toolset ts = lookupToolset(toolset);
        ModelPasses.removeDisabledModelParts(toolsetModel, toolset);
        ModelPasses.makeVariablesForMissingProperties(toolsetModel, toolset);
        ModelPasses.eliminateSuperfluousConditionals(toolsetModel);
        // again, for paths added as property defaults and for @builddir
        ModelPasses.normalizePathsInModel(toolsetModel, ts, context.getConfig().getTopSrcdir());
    }

    /**
     * Produces the finalized model of every toolset the project is for, or of
     * the configured subset of toolsets. The last toolset reuses the
     * interpreter's model instead of copying it.
     */
    public List<ToolsetModel> generate() {
        requireState("generate", InterpreterState.NORMALIZED);
        List<String> toolsets = collectToolsets();
        log.debug("toolsets to generate for: {}", toolsets);
        if (toolsets.isEmpty()) {
            throw new GeneratorException("nothing to generate, \"toolsets\" property is empty");
        }
        toolsets.forEach(this::lookupToolset);

        state = InterpreterState.SPECIALIZED;
        List<ToolsetModel> result = new ArrayList<>();
        for (int i = 0; i < toolsets.size(); i++) {
            boolean last = i == toolsets.size() - 1;
            result.add(generateForToolset(toolsets.get(i), last));
        }
        state = InterpreterState.GENERATED;
        return result;
    }

    private ToolsetModel generateForToolset(String toolset, boolean skipCopy) {
        log.debug("****** preparing model for toolset {} ******", toolset);
        Toolset ts = lookupToolset(toolset);
        Project specific = makeToolsetSpecificModel(toolset, skipCopy);
        finalizeForToolset(specific, toolset);
        if (ts.requiresFlattening()) {
            new ConfigurationFlattener().flatten(specific);
        }
        return new ToolsetModel(ts, specific);
    }

    private List<String> collectToolsets() {
        Set<String> toolsets = new LinkedHashSet<>();
        for (Module module : model.getModules()) {
            if (module.getVariable(StandardProperties.TOOLSETS) != null) {
                toolsets.addAll(ModelPasses.toolsetsOf(module));
            }
        }
        List<String> requested = context.getConfig().getToolsetsToUse();
        if (requested.isEmpty()) {
            return new ArrayList<>(toolsets);
        }
        for (String t : requested) {
            if (toolsets.contains(t)) {
                continue;
            }
            if (context.getRegistry().getToolset(t).isEmpty()) {
                throw new GeneratorException("unknown toolset \"" + t + "\" requested");
            }
            context.warning("toolset \"" + t + "\" is not supported by the project, there may be issues", null);
            for (Module module : model.getModules()) {
                Variable var = module.getVariable(StandardProperties.TOOLSETS);
                if (var != null && var.getValue() instanceof ListExpr list) {
                    List<Expression> items = new ArrayList<>(list.getItems());
                    items.add(new LiteralExpr(t));
                    var.rewrite(old -> new ListExpr(items, list.getPosition()));
                }
            }
        }
        return new ArrayList<>(new LinkedHashSet<>(requested));
    }

    private Toolset lookupToolset(String name) {
        return context.getRegistry().getToolset(name)
                .orElseThrow(() -> new GeneratorException("unknown toolset \"" + name + "\""));
    }

    private void requireState(String action, InterpreterState... allowed) {
        for (InterpreterState s : allowed) {
            if (state == s) {
                return;
            }
        }
        throw new IllegalStateException("cannot " + action + " in state " + state + ", expected one of "
                + Arrays.toString(allowed));
    }
}
