package com.metabuild.generator.parser.ast;

/**
 * An expression on the right side of an assignment, in a condition or in a
 * file list.
 */
public interface ValueNode extends AstNode {
}
