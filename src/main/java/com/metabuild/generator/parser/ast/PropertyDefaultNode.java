package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Overrides the default value of a property for the current scope and
 * everything nested in it, without marking it as explicitly set.
 */
public record PropertyDefaultNode(String name, ValueNode value, SourcePosition position) implements StatementNode {

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
