package com.metabuild.generator.parser.ast;

import com.metabuild.generator.parser.SourcePosition;

/**
 * Path anchor such as {@code @srcdir}; the rest of the path, if any, follows
 * it in an enclosing {@link ConcatNode}.
 */
public record PathAnchorNode(String anchor, SourcePosition position) implements ValueNode {
}
