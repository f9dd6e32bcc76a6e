package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code sources { ... }} or {@code headers { ... }} inside a target.
 */
public record FilesListNode(Kind kind, ValueNode files, SourcePosition position) implements StatementNode {

    public enum Kind {
        SOURCES,
        HEADERS
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
