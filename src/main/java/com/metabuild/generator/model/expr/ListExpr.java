package com.metabuild.generator.model.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * List of several values of the same type.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ListExpr extends Expression {

    private final List<Expression> items;

    public ListExpr(List<? extends Expression> items) {
        this(items, null);
    }

    public ListExpr(List<? extends Expression> items, SourcePosition position) {
        super(position);
        this.items = List.copyOf(items);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public ConstantValue asConstant() {
        List<Object> values = new ArrayList<>(items.size());
        for (Expression item : items) {
            ConstantValue v = item.asConstant();
            if (!v.isConstant()) {
                return v;
            }
            values.add(v.getValue());
        }
        return ConstantValue.of(values);
    }

    @Override
    public String toString() {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
