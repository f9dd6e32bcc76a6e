package com.metabuild.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import com.metabuild.generator.model.expr.BoolExpr;
import com.metabuild.generator.model.expr.BoolOperator;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.ReferenceExpr;
import com.metabuild.generator.parser.SourcePosition;

import lombok.Value;

/**
 * Conjunction of option tests, {@code OPT1 == "a" && OPT2 == "b"}, used to tag
 * the alternatives of a {@link ConditionalVariable}.
 */
@Value
public class Condition {

    public record OptionTest(String option, String value) {
        @Override
        public String toString() {
            return option + "=='" + value + "'";
        }
    }

    List<OptionTest> tests;

    public Condition(List<OptionTest> tests) {
        this.tests = List.copyOf(tests);
    }

    public static Condition of(String option, String value) {
        return new Condition(List.of(new OptionTest(option, value)));
    }

    /**
     * Recognizes a condition expression built only from {@code &&} and
     * {@code $(option) == "value"} tests on declared options.
     *
     * @return the condition, or empty if {@code e} is anything else
     */
    public static Optional<Condition> fromExpression(Expression e, Map<String, Option> options) {
        List<OptionTest> tests = new ArrayList<>();
        return collect(e, options, tests) ? Optional.of(new Condition(tests)) : Optional.empty();
    }

    private static boolean collect(Expression e, Map<String, Option> options, List<OptionTest> tests) {
        if (!(e instanceof BoolExpr b)) {
            return false;
        }
        if (b.getOperator() == BoolOperator.AND) {
            return collect(b.getLeft(), options, tests) && collect(b.getRight(), options, tests);
        }
        if (b.getOperator() != BoolOperator.EQUAL) {
            return false;
        }
        Expression left = b.getLeft();
        Expression right = b.getRight();
        if (right instanceof ReferenceExpr && left instanceof LiteralExpr) {
            Expression tmp = left;
            left = right;
            right = tmp;
        }
        if (left instanceof ReferenceExpr ref && right instanceof LiteralExpr lit
                && options.containsKey(ref.getVar())) {
            tests.add(new OptionTest(ref.getVar(), lit.getValue()));
            return true;
        }
        return false;
    }

    /**
     * Checks the condition against a configuration. A test on an option
     * without a list of values compares against the option's default.
     */
    public boolean matches(Map<String, String> assignment, Map<String, Option> options) {
        for (OptionTest test : tests) {
            Option option = options.get(test.option());
            if (option != null && !option.isEnumerable()) {
                if (!Objects.equals(option.getDefaultValue(), test.value())) {
                    return false;
                }
            } else if (!Objects.equals(assignment.get(test.option()), test.value())) {
                return false;
            }
        }
        return true;
    }

    /** The condition as a boolean expression evaluated in {@code context}. */
    public Expression toExpression(ModelPart context, SourcePosition position) {
        Expression result = null;
        for (OptionTest test : tests) {
            Expression eq = new BoolExpr(BoolOperator.EQUAL,
                    new ReferenceExpr(test.option(), context, position),
                    new LiteralExpr(test.value(), position),
                    position);
            result = result == null ? eq : new BoolExpr(BoolOperator.AND, result, eq, position);
        }
        return result;
    }

    @Override
    public String toString() {
        return tests.stream().map(OptionTest::toString).collect(Collectors.joining(" and "));
    }
}
