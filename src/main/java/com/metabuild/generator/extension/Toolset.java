package com.metabuild.generator.extension;

import java.util.List;

import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.expr.PathExpr;

/**
 * A kind of output the model is compiled for, e.g. GNU makefiles or Visual
 * Studio projects. Emitting the output is up to emitters, the compiler only
 * needs the toolset's properties and build directory layout.
 */
public interface Toolset {

    String getName();

    /** Properties specific to this toolset. */
    List<Property> getProperties();

    /**
     * True if the output format can't express build options as conditions and
     * needs every configuration spelled out.
     */
    default boolean requiresFlattening() {
        return false;
    }

    /**
     * Build directory used for {@code target}. Called on a model already
     * specialized for this toolset; the path need not be constant.
     */
    PathExpr getBuilddirFor(Target target);
}
