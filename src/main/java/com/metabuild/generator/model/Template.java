package com.metabuild.generator.model;

import java.util.List;

import com.metabuild.generator.parser.SourcePosition;
import com.metabuild.generator.parser.ast.StatementNode;

import lombok.NonNull;
import lombok.Value;

/**
 * Named, reusable block of target statements. Applying a template to a target
 * first applies its base templates, then runs its statements in the target's
 * scope.
 */
@Value
public class Template {

    @NonNull
    String name;

    @NonNull
    List<Template> bases;

    @NonNull
    List<StatementNode> definition;

    SourcePosition position;
}
