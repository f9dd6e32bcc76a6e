package com.metabuild.generator.parser;

import java.io.IOException;
import java.nio.file.Path;

import com.metabuild.generator.parser.ast.RootNode;

/**
 * Produces the syntax tree of an input file. Implemented by the parser; the
 * compiler uses it to load submodules.
 */
@FunctionalInterface
public interface AstSource {

    RootNode parse(Path file) throws IOException;
}
