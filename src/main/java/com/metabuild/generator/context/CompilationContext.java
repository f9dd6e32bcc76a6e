package com.metabuild.generator.context;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.extension.ExtensionRegistry;
import com.metabuild.generator.interpreter.UsageTracker;
import com.metabuild.generator.parser.AstSource;
import com.metabuild.generator.parser.SourcePosition;
import com.metabuild.generator.parser.ast.RootNode;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Everything shared by the passes of a single compilation: configuration,
 * extensions, the parser used for submodules and the collected diagnostics.
 *
 * A new context is made for every run, nothing is kept between runs.
 */
@Getter
@Builder(toBuilder = true)
public final class CompilationContext {

    private static final Logger log = LoggerFactory.getLogger(CompilationContext.class);

    @NonNull
    @Builder.Default
    private final CompilerConfig config = CompilerConfig.defaults();

    @NonNull
    @Builder.Default
    private final ExtensionRegistry registry = ExtensionRegistry.withDefaults();

    @NonNull
    @Builder.Default
    private final AstSource astSource = CompilationContext::noParser;

    @NonNull
    @Builder.Default
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    @NonNull
    @Builder.Default
    private final UsageTracker usageTracker = new UsageTracker();

    /** Context with default configuration and all built-in extensions. */
    public static CompilationContext create(AstSource astSource) {
        return CompilationContext.builder().astSource(astSource).build();
    }

    /** Records and logs a warning. */
    public void warning(String message, SourcePosition position) {
        Warning w = new Warning(message, position);
        log.warn("{}", w.format());
        diagnostics.getWarnings().add(w);
    }

    public void warning(Diagnostic diagnostic) {
        log.warn("{}", diagnostic.format());
        diagnostics.getWarnings().add(diagnostic);
    }

    private static RootNode noParser(Path file) throws IOException {
        throw new IOException("no parser available to read " + file);
    }
}
