package com.metabuild.generator.interpreter;

import java.util.ArrayList;
import java.util.List;

import com.metabuild.generator.extension.PropertyType;
import com.metabuild.generator.model.expr.ConcatExpr;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.IfExpr;
import com.metabuild.generator.model.expr.ListExpr;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;

/**
 * Brings assigned values into the shape their property's type needs: single
 * values of list properties become one-item lists and text written for path
 * properties, such as {@code src/main.cpp} or {@code @builddir/gen/$(name).h},
 * becomes a path expression.
 *
 * Text is split on {@code /}; a leading anchor is taken from an
 * {@code @anchor} node, paths without one are relative to {@code @srcdir}.
 */
final class ValueNormalizer {

    private ValueNormalizer() {
    }

    /** Converts {@code value} as required by a property of type {@code type}. */
    static Expression convert(Expression value, PropertyType type, String anchorFile) {
        if (type == PropertyType.PATH) {
            return toPath(value, anchorFile);
        }
        if (!type.isList()) {
            return value;
        }
        if (value instanceof LiteralExpr || value instanceof ConcatExpr || value instanceof PathExpr) {
            value = new ListExpr(List.of(value), value.getPosition());
        }
        if (type == PropertyType.PATH_LIST && value instanceof ListExpr list) {
            List<Expression> items = new ArrayList<>();
            for (Expression item : list.getItems()) {
                items.add(toPath(item, anchorFile));
            }
            return new ListExpr(items, list.getPosition());
        }
        return value;
    }

    /**
     * Converts a single value. Values that aren't text (references, nulls,
     * existing paths) are returned unchanged.
     */
    static Expression toPath(Expression e, String anchorFile) {
        if (e instanceof IfExpr i) {
            return new IfExpr(i.getCond(), toPath(i.getYes(), anchorFile), toPath(i.getNo(), anchorFile),
                    i.getPosition());
        }
        List<Expression> items;
        if (e instanceof ConcatExpr c) {
            items = c.getItems();
        } else if (e instanceof LiteralExpr) {
            items = List.of(e);
        } else {
            return e;
        }

        PathAnchor anchor = PathAnchor.SRCDIR;
        String file = anchorFile;
        if (!items.isEmpty() && items.get(0) instanceof PathExpr first && first.getComponents().isEmpty()) {
            anchor = first.getAnchor();
            file = first.getAnchorFile();
            items = items.subList(1, items.size());
        }

        List<Expression> components = new ArrayList<>();
        List<Expression> current = new ArrayList<>();
        for (Expression item : items) {
            if (item instanceof LiteralExpr lit) {
                String[] parts = lit.getValue().split("/", -1);
                for (int i = 0; i < parts.length; i++) {
                    if (i > 0) {
                        flush(current, components);
                    }
                    if (!parts[i].isEmpty()) {
                        current.add(new LiteralExpr(parts[i], lit.getPosition()));
                    }
                }
            } else {
                current.add(item);
            }
        }
        flush(current, components);
        return new PathExpr(components, anchor, anchor == PathAnchor.SRCDIR ? file : null, e.getPosition());
    }

    private static void flush(List<Expression> current, List<Expression> components) {
        if (current.isEmpty()) {
            return;
        }
        components.add(current.size() == 1 ? current.get(0) : new ConcatExpr(current, current.get(0).getPosition()));
        current.clear();
    }
}
