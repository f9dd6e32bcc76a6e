package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Node of the tree produced by the parser.
 */
public interface AstNode {

    SourcePosition position();
}
