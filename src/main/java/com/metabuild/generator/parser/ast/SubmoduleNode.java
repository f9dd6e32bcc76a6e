package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code submodule file;}, file name relative to the current file.
 */
public record SubmoduleNode(String file, SourcePosition position) implements StatementNode {

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
