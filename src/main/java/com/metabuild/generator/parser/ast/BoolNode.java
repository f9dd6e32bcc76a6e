package com.metabuild.generator.parser.ast;

import com.metabuild.generator.model.expr.BoolOperator;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Boolean operation; {@code right} is {@code null} for {@code !}.
 */
public record BoolNode(BoolOperator operator, ValueNode left, ValueNode right, SourcePosition position)
        implements ValueNode {
}
