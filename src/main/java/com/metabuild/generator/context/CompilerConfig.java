package com.metabuild.generator.context;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Settings of one compilation run.
 */
@Getter
@Builder(toBuilder = true)
public final class CompilerConfig {

    /** Toolsets to generate for; empty means all toolsets the input asks for. */
    @Singular("toolsetToUse")
    private final List<String> toolsetsToUse;

    @Builder.Default
    private final boolean warnUnused = true;

    /** Directory all {@code @top_srcdir} paths are relative to; the top file's directory if unset. */
    private final String topSrcdir;

    public static CompilerConfig defaults() {
        return CompilerConfig.builder().build();
    }
}
