package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Parsed input file.
 */
public record RootNode(String filename, List<StatementNode> children) implements AstNode {

    public RootNode {
        children = List.copyOf(children);
    }

    @Override
    public SourcePosition position() {
        return SourcePosition.ofFile(filename);
    }
}
