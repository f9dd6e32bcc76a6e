package com.metabuild.generator.parser.ast;

import java.util.List;
import java.util.Map;

import com.metabuild.generator.parser.SourcePosition;

import lombok.Builder;

/**
 * {@code option NAME { values = ...; default = ...; }}.
 *
 * @param values      allowed values, {@code null} if unrestricted
 * @param valueLabels labels of values used in configuration names, may be {@code null}
 */
@Builder
public record OptionNode(String name, List<String> values, Map<String, String> valueLabels,
                         String defaultValue, String description, SourcePosition position)
        implements StatementNode {

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
