package com.metabuild.generator.interpreter;

import com.metabuild.generator.extension.Toolset;
import com.metabuild.generator.model.Project;

/**
 * Model finalized for one toolset, ready to be written out by its emitter.
 */
public record ToolsetModel(Toolset toolset, Project project) {
}
