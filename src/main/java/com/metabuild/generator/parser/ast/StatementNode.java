package com.metabuild.generator.parser.ast;

/**
 * A statement: assignment, target definition, {@code if} block etc.
 */
public interface StatementNode extends AstNode {

    void accept(StatementVisitor visitor);
}
