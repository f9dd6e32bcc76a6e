package com.metabuild.generator.parser.ast;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;

/**
 * {@code scope::var = value} or {@code var += value}.
 *
 * @param scope  names of nested parts to assign in, e.g. {@code ["hello"]}
 *               for {@code hello::var}; an empty string stands for a leading
 *               {@code ::}, i.e. the module scope
 * @param append true for {@code +=}
 */
public record AssignmentNode(List<String> scope, String var, ValueNode value, boolean append,
                             SourcePosition position) implements StatementNode {

    public AssignmentNode {
        scope = List.copyOf(scope);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
