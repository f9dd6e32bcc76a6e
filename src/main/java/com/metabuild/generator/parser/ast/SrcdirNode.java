package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code srcdir dir;}: sets the source directory of the current file.
 */
public record SrcdirNode(String srcdir, SourcePosition position) implements StatementNode {

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
