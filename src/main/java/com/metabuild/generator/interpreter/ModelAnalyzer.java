package com.metabuild.generator.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.context.CompilationContext;
import com.metabuild.generator.context.UnusedVariableWarning;
import com.metabuild.generator.error.SelfReferenceException;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.SourceFile;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.ExpressionWalker;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Checks of the built model: reference cycles, references to unknown
 * variables, unused variables and source files nothing can compile.
 */
public class ModelAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ModelAnalyzer.class);

    /** Option groups of Visual Studio toolsets are read by emitters directly. */
    private static final Pattern VS_OPTION = Pattern.compile("(msvs|vs[0-9]+)\\.option\\..*");

    private final CompilationContext context;

    public ModelAnalyzer(CompilationContext context) {
        this.context = context;
    }

    /** Runs all checks. Fails on the first fatal problem, warnings are collected. */
    public void detectPotentialProblems(Project model) {
        detectSelfReferences(model);
        if (context.getConfig().isWarnUnused()) {
            detectUnusedVariables(model);
        }
        detectUnsupportedSourceFiles(model);
    }

    /**
     * Verifies there are no recursive definitions such as {@code foo = $(foo)},
     * and that every reference can be resolved.
     *
     * @throws SelfReferenceException on the first cycle found
     * @throws com.metabuild.generator.error.UnresolvedReferenceException for unknown variables
     */
    public void detectSelfReferences(Project model) {
        log.debug("checking for self-references");
        SelfReferenceChecker checker = new SelfReferenceChecker();
        for (Variable var : model.allVariables()) {
            checker.check(var);
        }
    }

    /** Warns about variables that are never referenced; they may indicate typos. */
    public void detectUnusedVariables(Project model) {
        UsageTracker tracker = context.getUsageTracker();
        List<Variable> all = model.allVariables();
        for (Variable var : all) {
            tracker.markUsedIn(var.getValue());
        }
        for (Variable var : all) {
            if (var.isProperty() || tracker.isUsed(var) || isExempt(var.getName())) {
                continue;
            }
            SourcePosition pos = var.getValue() != null && var.getValue().getPosition() != null
                    ? var.getValue().getPosition()
                    : var.getPosition();
            context.warning(new UnusedVariableWarning(var.getName(), pos));
        }
    }

    /** Warns about source files with an extension no registered compiler handles. */
    public void detectUnsupportedSourceFiles(Project model) {
        for (Target target : model.allTargets()) {
            for (SourceFile file : target.getSources()) {
                if (model.getRegistry().findFileCompiler(file).isEmpty()) {
                    context.warning("don't know how to compile file \"" + file.getName() + "\" of target \""
                            + target.getName() + "\"", file.getPosition());
                }
            }
        }
    }

    private static boolean isExempt(String name) {
        return VS_OPTION.matcher(name).matches() || name.equals("configurations");
    }

    private static final class SelfReferenceChecker extends ExpressionWalker {
        private final List<Variable> stack = new ArrayList<>();
        private final Set<Variable> checked = Collections.newSetFromMap(new IdentityHashMap<>());

        @Override
        public Void visitReference(ReferenceExpr e) {
            Variable var = e.getVariable();
            if (var == null) {
                // property default, or an unknown variable
                e.getValue();
                return null;
            }
            int index = indexOf(var);
            if (index >= 0) {
                List<String> cycle = new ArrayList<>();
                for (Variable v : stack.subList(index, stack.size())) {
                    cycle.add(v.getName());
                }
                cycle.add(var.getName());
                throw new SelfReferenceException(var.getName(), cycle, e.getPosition());
            }
            check(var);
            return null;
        }

        void check(Variable var) {
            if (checked.contains(var)) {
                return;
            }
            stack.add(var);
            try {
                visit(var.getValue());
            } finally {
                stack.remove(stack.size() - 1);
            }
            checked.add(var);
        }

        private int indexOf(Variable var) {
            for (int i = 0; i < stack.size(); i++) {
                if (stack.get(i) == var) {
                    return i;
                }
            }
            return -1;
        }
    }
}
