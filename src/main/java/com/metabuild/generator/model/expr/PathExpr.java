package com.metabuild.generator.model.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.metabuild.generator.parser.SourcePosition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * File or directory name, or part of it. For example, the components of
 * {@code foo/bar/file.cpp} are {@code ["foo", "bar", "file.cpp"]}.
 *
 * Components keep positional meaning, so null components are preserved.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class PathExpr extends Expression {

    private final List<Expression> components;
    private final PathAnchor anchor;

    /**
     * Input file the {@code @srcdir} anchor refers to, when it differs from the
     * file of the expression's position. {@code null} otherwise.
     */
    private final String anchorFile;

    public PathExpr(List<? extends Expression> components, PathAnchor anchor) {
        this(components, anchor, null, null);
    }

    public PathExpr(List<? extends Expression> components, PathAnchor anchor, String anchorFile,
                    SourcePosition position) {
        super(position);
        this.components = List.copyOf(components);
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.anchorFile = anchorFile;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitPath(this);
    }

    // The anchor is ignored: the value is relative to it.
    @Override
    public ConstantValue asConstant() {
        StringBuilder sb = new StringBuilder();
        for (Expression c : components) {
            ConstantValue v = c.asConstant();
            if (!v.isConstant()) {
                return v;
            }
            if (sb.length() > 0) sb.append('/');
            sb.append(Objects.toString(v.getValue(), ""));
        }
        return ConstantValue.of(sb.toString());
    }

    /** Components of the directory containing this path, i.e. all but the last one. */
    public List<Expression> getDirectoryComponents() {
        if (components.isEmpty()) {
            return components;
        }
        return components.subList(0, components.size() - 1);
    }

    @Override
    public String toString() {
        if (components.isEmpty()) {
            return anchor.getToken();
        }
        return anchor.getToken() + "/" + components.stream().map(String::valueOf).collect(Collectors.joining("/"));
    }
}
