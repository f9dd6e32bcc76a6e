package com.metabuild.generator.model.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Concatenation of several expressions into a single string, e.g. {@code lib$(name).a}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ConcatExpr extends Expression {

    private final List<Expression> items;

    public ConcatExpr(List<? extends Expression> items) {
        this(items, null);
    }

    public ConcatExpr(List<? extends Expression> items, SourcePosition position) {
        super(position);
        this.items = List.copyOf(items);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConcat(this);
    }

    @Override
    public ConstantValue asConstant() {
        StringBuilder sb = new StringBuilder();
        for (Expression item : items) {
            ConstantValue v = item.asConstant();
            if (!v.isConstant()) {
                return v;
            }
            sb.append(Objects.toString(v.getValue(), ""));
        }
        return ConstantValue.of(sb.toString());
    }

    @Override
    public String toString() {
        return items.stream().map(String::valueOf).collect(Collectors.joining());
    }
}
