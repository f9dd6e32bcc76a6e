package com.metabuild.generator.interpreter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.context.CompilationContext;
import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.error.ParseException;
import com.metabuild.generator.extension.Property;
import com.metabuild.generator.extension.PropertyType;
import com.metabuild.generator.extension.StandardProperties;
import com.metabuild.generator.extension.TargetType;
import com.metabuild.generator.model.Condition;
import com.metabuild.generator.model.ConditionalVariable;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Option;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.SourceFile;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.Template;
import com.metabuild.generator.model.Variable;
import com.metabuild.generator.model.expr.BoolExpr;
import com.metabuild.generator.model.expr.BoolOperator;
import com.metabuild.generator.model.expr.BoolValueExpr;
import com.metabuild.generator.model.expr.ConcatExpr;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.NullExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.model.expr.UndeterminedExpr;
import com.metabuild.generator.parser.SourcePosition;
import com.metabuild.generator.parser.ast.AssignmentNode;
import com.metabuild.generator.parser.ast.BoolNode;
import com.metabuild.generator.parser.ast.BoolvalNode;
import com.metabuild.generator.parser.ast.ConcatNode;
import com.metabuild.generator.parser.ast.FilesListNode;
import com.metabuild.generator.parser.ast.IfNode;
import com.metabuild.generator.parser.ast.ListNode;
import com.metabuild.generator.parser.ast.LiteralNode;
import com.metabuild.generator.parser.ast.OptionNode;
import com.metabuild.generator.parser.ast.PathAnchorNode;
import com.metabuild.generator.parser.ast.PropertyDefaultNode;
import com.metabuild.generator.parser.ast.RootNode;
import com.metabuild.generator.parser.ast.SrcdirNode;
import com.metabuild.generator.parser.ast.StatementNode;
import com.metabuild.generator.parser.ast.StatementVisitor;
import com.metabuild.generator.parser.ast.SubmoduleNode;
import com.metabuild.generator.parser.ast.TargetNode;
import com.metabuild.generator.parser.ast.TemplateNode;
import com.metabuild.generator.parser.ast.ValueNode;
import com.metabuild.generator.parser.ast.VarReferenceNode;

/**
 * Builds the project model from parsed input.
 *
 * Only the minimal processing needed for a valid model is done here:
 * scoping rules are applied and conditions attached, but nothing is
 * simplified or checked for consistency. Later interpreter passes do that.
 */
public class Builder implements StatementVisitor {

    private static final Logger log = LoggerFactory.getLogger(Builder.class);

    /** Receives {@code submodule} statements; the interpreter loads the files. */
    @FunctionalInterface
    public interface SubmoduleListener {
        void onSubmodule(String file, SourcePosition position);
    }

    private final CompilationContext compilation;
    private final SubmoduleListener submoduleListener;

    /** Innermost model part statements are currently applied to. */
    private ModelPart context;
    private Deque<Expression> conditions = new ArrayDeque<>();

    public Builder(CompilationContext compilation, SubmoduleListener submoduleListener) {
        this.compilation = compilation;
        this.submoduleListener = submoduleListener;
    }

    /** Creates a module for {@code ast} under {@code parent} and fills it. */
    public Module createModel(RootNode ast, ModelPart parent) {
        Module module = new Module(parent, ast.filename());
        handleChildren(ast.children(), module);
        return module;
    }

    private void handleChildren(List<StatementNode> children, ModelPart scope) {
        ModelPart saved = context;
        context = scope;
        try {
            for (StatementNode node : children) {
                try {
                    node.accept(this);
                } catch (GeneratorException e) {
                    throw e.withPositionIfMissing(node.position());
                }
            }
        } finally {
            context = saved;
        }
    }

    // ---- conditions ----

    /** Conjunction of all enclosing {@code if} conditions, {@code null} outside of any. */
    private Expression activeCondition() {
        Expression result = null;
        Iterator<Expression> it = conditions.descendingIterator();
        while (it.hasNext()) {
            Expression cond = it.next();
            result = result == null ? cond : new BoolExpr(BoolOperator.AND, result, cond, cond.getPosition());
        }
        return result;
    }

    private Optional<Condition> optionCondition(Expression cond) {
        return Condition.fromExpression(cond, context.getProject().getOptions());
    }

    private String describeCondition(Expression cond) {
        return " (condition \"" + cond + "\" set at " + cond.getPosition() + ")";
    }

    private void rejectConditional(String what) {
        Expression cond = activeCondition();
        if (cond != null) {
            throw new ParseException(what + describeCondition(cond));
        }
    }

    // ---- statements ----

    @Override
    public void visit(AssignmentNode node) {
        boolean append = node.append();
        Expression value = buildExpression(node.value());
        Expression cond = activeCondition();
        String name = node.var();
        ModelPart scope = resolveScope(node.scope(), node.position());

        if (name.startsWith("_")) {
            compilation.warning("variable names beginning with underscore are reserved for internal use (\""
                    + name + "\")", node.position());
        }

        Optional<Property> prop = scope.getMatchingPropertyWithInheritance(name);
        if (prop.isPresent()) {
            value = ValueNormalizer.convert(value, prop.get().getType(), fileOf(node.position()));
        }

        Variable var = scope.getVariable(name);
        if (var instanceof ConditionalVariable cv) {
            Optional<Condition> optCond = cond == null ? Optional.empty() : optionCondition(cond);
            if (!append && optCond.isPresent()) {
                cv.addAlternative(optCond.get(), value);
                return;
            }
            var = cv.toPlainVariable();
            scope.replaceVariable(var);
        }

        Variable previous = var != null ? var : scope.resolveVariable(name);

        if (var == null && previous == null && prop.isEmpty() && cond != null && !append) {
            Optional<Condition> optCond = optionCondition(cond);
            if (optCond.isPresent()) {
                ConditionalVariable cv = new ConditionalVariable(name, node.position());
                cv.addAlternative(optCond.get(), value);
                scope.addVariable(cv);
                return;
            }
        }

        if (var == null && prop.isPresent()) {
            // assignment to a property: the variable takes the property's flags
            Expression initial = append || cond != null ? prop.get().defaultExpr(scope) : new NullExpr();
            var = Variable.fromProperty(prop.get(), initial);
            if (var.isReadonly()) {
                throw new ParseException("variable \"" + name + "\" is read-only");
            }
            scope.addVariable(var);
            // lower-scope inheritable properties (e.g. "outputdir" set in a
            // module) have no meaningful default here
            if (previous == null && prop.get().isDirectlyFor(scope)) {
                previous = var;
            }
        }

        if (cond != null) {
            if (append) {
                if (value instanceof ListExpr list) {
                    List<Expression> items = new ArrayList<>();
                    for (Expression item : list.getItems()) {
                        items.add(new IfExpr(cond, item, new NullExpr(item.getPosition()), item.getPosition()));
                    }
                    value = new ListExpr(items, list.getPosition());
                } else {
                    value = new IfExpr(cond, value, new NullExpr(node.position()), node.position());
                }
            } else {
                Expression otherwise = previous != null ? previous.getValue() : new NullExpr(node.position());
                value = new IfExpr(cond, value, otherwise, node.position());
            }
        }

        if (var == null) {
            if (append && previous == null) {
                throw new ParseException("unknown variable \"" + name + "\"");
            }
            if (previous != null) {
                var = new Variable(name, previous.getValue(), previous.isReadonly(), previous.isInheritable(),
                        previous.getPosition());
                var.setProperty(previous.isProperty());
            } else {
                var = new Variable(name, value, node.position());
            }
            scope.addVariable(var);
        }

        if (append) {
            List<Expression> newValues = value instanceof ListExpr list ? list.getItems() : List.of(value);
            List<Expression> items = new ArrayList<>();
            if (previous != null) {
                if (previous.getValue() instanceof ListExpr old) {
                    items.addAll(old.getItems());
                } else if (!previous.getValue().isNull()) {
                    items.add(previous.getValue());
                }
            }
            items.addAll(newValues);
            var.setValue(new ListExpr(items, node.position()));
        } else {
            var.setValue(value);
        }

        // avoid a spurious warning about a variable modified in another scope
        if (previous != null) {
            compilation.getUsageTracker().markUsed(previous);
        }
    }

    private ModelPart resolveScope(List<String> scope, SourcePosition position) {
        ModelPart ctx = context;
        for (String part : scope) {
            if (part.isEmpty()) {
                ctx = ctx.getModule();
                continue;
            }
            ModelPart found = null;
            for (ModelPart child : ctx.getChildParts()) {
                if (child.getName().equals(part)) {
                    found = child;
                    break;
                }
            }
            if (found == null) {
                throw new ParseException("unknown scope \"" + part + "\" in " + ctx, position);
            }
            ctx = found;
        }
        return ctx;
    }

    @Override
    public void visit(PropertyDefaultNode node) {
        Property prop = context.getMatchingPropertyWithInheritance(node.name())
                .orElseThrow(() -> new ParseException("unknown property \"" + node.name() + "\""));
        Expression value = ValueNormalizer.convert(buildExpression(node.value()), prop.getType(),
                fileOf(node.position()));
        Expression cond = activeCondition();
        if (cond != null) {
            value = new IfExpr(cond, value, prop.defaultExpr(context), node.position());
        }
        Variable existing = context.getVariable(node.name());
        if (existing != null && existing.isExplicitlySet()) {
            log.debug("{}: default of {} not used, already set to {}", context, node.name(), existing.getValue());
            return;
        }
        Variable var = Variable.fromProperty(prop, value);
        var.setExplicitlySet(false);
        context.replaceVariable(var);
    }

    @Override
    public void visit(IfNode node) {
        conditions.push(buildExpression(node.cond()));
        try {
            handleChildren(node.content(), context);
        } finally {
            conditions.pop();
        }
    }

    @Override
    public void visit(TargetNode node) {
        Project project = context.getProject();
        String name = node.name();
        Optional<Target> existing = project.getTarget(name);
        if (existing.isPresent()) {
            throw new ParseException("target with ID \"" + name + "\" already exists (see "
                    + existing.get().getPosition() + ")");
        }
        if (!(context instanceof Module module)) {
            throw new ParseException("targets can only be defined at module level");
        }
        TargetType type = project.getRegistry().getTargetType(node.type())
                .orElseThrow(() -> new ParseException("unknown target type \"" + node.type() + "\""));

        Target target = new Target(module, name, type, node.position());
        Expression cond = activeCondition();
        if (cond != null) {
            target.setPropertyValue(StandardProperties.CONDITION, cond);
        }

        // conditions don't leak into the target's own statements
        Deque<Expression> saved = conditions;
        conditions = new ArrayDeque<>();
        try {
            applyTemplates(target, findTemplates(node.baseTemplates(), node.position()), new HashSet<>());
            handleChildren(node.content(), target);
        } finally {
            conditions = saved;
        }
    }

    private List<Template> findTemplates(List<String> names, SourcePosition position) {
        List<Template> result = new ArrayList<>();
        for (String name : names) {
            Template t = context.getProject().getTemplates().get(name);
            if (t == null) {
                throw new ParseException("unknown base template \"" + name + "\"", position);
            }
            result.add(t);
        }
        return result;
    }

    private void applyTemplates(Target target, List<Template> templates, Set<String> applied) {
        for (Template t : templates) {
            if (applied.contains(t.getName())) {
                log.debug("skipping already-applied template {} on {}", t.getName(), target.getName());
                continue;
            }
            applyTemplates(target, t.getBases(), applied);
            log.debug("applying template {} to {}", t.getName(), target.getName());
            applied.add(t.getName());
            handleChildren(t.getDefinition(), target);
        }
    }

    @Override
    public void visit(TemplateNode node) {
        rejectConditional("templates can't be defined conditionally");
        Project project = context.getProject();
        Template previous = project.getTemplates().get(node.name());
        if (previous != null) {
            if (node.position().equals(previous.getPosition())) {
                return;
            }
            throw new ParseException("template \"" + node.name() + "\" already defined (at "
                    + previous.getPosition() + ")");
        }
        List<Template> bases = findTemplates(node.baseTemplates(), node.position());
        project.addTemplate(new Template(node.name(), bases, node.content(), node.position()));
    }

    @Override
    public void visit(SubmoduleNode node) {
        rejectConditional("conditionally included submodules not supported yet");
        submoduleListener.onSubmodule(relativeToCurrentFile(node.position(), node.file()), node.position());
    }

    @Override
    public void visit(SrcdirNode node) {
        rejectConditional("srcdir can't be set conditionally");
        if (!(context instanceof Module module)) {
            throw new ParseException("srcdir can only be set at module level");
        }
        // may be used in an imported file, so key by the real file
        String currentFile = fileOf(node.position()) != null ? fileOf(node.position()) : module.getSourceFile();
        String srcdir = relativeToCurrentFile(node.position(), node.srcdir());
        log.debug("setting @srcdir for {} to {}", currentFile, srcdir);
        context.getProject().setSrcdir(currentFile, srcdir);
    }

    private static String fileOf(SourcePosition position) {
        return position == null ? null : position.filename();
    }

    private static String relativeToCurrentFile(SourcePosition position, String file) {
        Path base = position == null || position.filename() == null
                ? null : Paths.get(position.filename()).getParent();
        Path resolved = base == null ? Paths.get(file) : base.resolve(file);
        String result = resolved.normalize().toString().replace('\\', '/');
        return result.isEmpty() ? "." : result;
    }

    @Override
    public void visit(OptionNode node) {
        rejectConditional("options can't be defined conditionally");
        Project project = context.getProject();
        Option previous = project.getOptions().get(node.name());
        if (previous != null) {
            throw new ParseException("option \"" + node.name() + "\" already defined (at "
                    + previous.getPosition() + ")");
        }
        if (node.values() != null && node.defaultValue() != null && !node.values().contains(node.defaultValue())) {
            throw new ParseException("default value \"" + node.defaultValue() + "\" of option \"" + node.name()
                    + "\" is not one of its values");
        }
        if (project.getVariable(node.name()) != null) {
            throw new ParseException("option \"" + node.name() + "\" conflicts with an existing variable");
        }
        Option.OptionBuilder option = Option.builder()
                .name(node.name())
                .values(node.values() == null ? null : List.copyOf(node.values()))
                .defaultValue(node.defaultValue())
                .description(node.description())
                .position(node.position());
        if (node.valueLabels() != null) {
            option.valueLabels(node.valueLabels());
        }
        project.addOption(option.build());

        // the value is only known at make time or after flattening
        Variable var = new Variable(node.name(), new UndeterminedExpr(node.name(), node.position()), node.position());
        project.addVariable(var);
        compilation.getUsageTracker().markUsed(var);
    }

    @Override
    public void visit(FilesListNode node) {
        if (!(context instanceof Target target)) {
            throw new ParseException("source files can only be listed in targets");
        }
        Expression files = buildExpression(node.files());
        compilation.getUsageTracker().markUsedIn(files);
        List<PossibleValue> values = new ArrayList<>();
        enumeratePossibleValues(files, activeCondition(), values);
        for (PossibleValue pv : values) {
            Expression filename = ValueNormalizer.toPath(pv.value(), fileOf(node.position()));
            SourceFile file = new SourceFile(target, filename, pv.value().getPosition());
            if (pv.condition() != null) {
                file.setPropertyValue(StandardProperties.CONDITION, pv.condition());
            }
            if (node.kind() == FilesListNode.Kind.SOURCES) {
                target.addSource(file);
            } else {
                target.addHeader(file);
            }
        }
    }

    private record PossibleValue(Expression condition, Expression value) {
    }

    /** Splits a list of files into single files, each with the condition it applies under. */
    private static void enumeratePossibleValues(Expression e, Expression cond, List<PossibleValue> out) {
        if (e instanceof ListExpr list) {
            for (Expression item : list.getItems()) {
                enumeratePossibleValues(item, cond, out);
            }
        } else if (e instanceof IfExpr i) {
            enumeratePossibleValues(i.getYes(), and(cond, i.getCond()), out);
            enumeratePossibleValues(i.getNo(), and(cond, BoolExpr.not(i.getCond(), i.getCond().getPosition())), out);
        } else if (e instanceof ReferenceExpr ref && isCollection(ref.getValue())) {
            enumeratePossibleValues(ref.getValue(), cond, out);
        } else if (!e.isNull()) {
            out.add(new PossibleValue(cond, e));
        }
    }

    private static boolean isCollection(Expression e) {
        return e instanceof ListExpr || e instanceof IfExpr || e.isNull();
    }

    private static Expression and(Expression a, Expression b) {
        return a == null ? b : new BoolExpr(BoolOperator.AND, a, b, b.getPosition());
    }

    // ---- expressions ----

    private Expression buildExpression(ValueNode node) {
        SourcePosition pos = node.position();
        if (node instanceof LiteralNode n) {
            return new LiteralExpr(n.text(), pos);
        } else if (node instanceof BoolvalNode n) {
            return new BoolValueExpr(n.value(), pos);
        } else if (node instanceof VarReferenceNode n) {
            return new ReferenceExpr(n.var(), context, pos);
        } else if (node instanceof ListNode n) {
            return new ListExpr(buildAll(n.values()), pos);
        } else if (node instanceof ConcatNode n) {
            return new ConcatExpr(buildAll(n.values()), pos);
        } else if (node instanceof PathAnchorNode n) {
            // a bare anchor; the rest of the path follows in the enclosing concatenation
            PathAnchor anchor;
            try {
                anchor = PathAnchor.fromToken(n.anchor());
            } catch (IllegalArgumentException e) {
                throw new ParseException("unknown path anchor \"" + n.anchor() + "\"", pos);
            }
            return new PathExpr(List.of(), anchor, pos == null ? null : pos.filename(), pos);
        } else if (node instanceof BoolNode n) {
            Expression left = buildExpression(n.left());
            Expression right = n.right() == null ? null : buildExpression(n.right());
            return new BoolExpr(n.operator(), left, right, pos);
        }
        throw new ParseException("unrecognized syntax node " + node, pos);
    }

    private List<Expression> buildAll(List<ValueNode> nodes) {
        List<Expression> result = new ArrayList<>(nodes.size());
        for (ValueNode n : nodes) {
            result.add(buildExpression(n));
        }
        return result;
    }
}
