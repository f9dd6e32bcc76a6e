package com.metabuild.generator.model.expr;

import java.util.Arrays;

/**
 * The point a {@link PathExpr} is relative to.
 */
public enum PathAnchor {
    /** Source directory of the file the path was written in. */
    SRCDIR("@srcdir"),
    /** Source directory of the toplevel module. */
    TOP_SRCDIR("@top_srcdir"),
    /** Toolset-specific build directory of the target. */
    BUILDDIR("@builddir"),
    /** Toplevel build directory. */
    TOP_BUILDDIR("@top_builddir");

    private final String token;

    PathAnchor(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static PathAnchor fromToken(String token) {
        return Arrays.stream(values())
                .filter(a -> a.token.equals(token))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown path anchor: " + token));
    }

    @Override
    public String toString() {
        return token;
    }
}
