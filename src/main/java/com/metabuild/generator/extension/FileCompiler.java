package com.metabuild.generator.extension;

import java.util.Set;

/**
 * Compiler of source files of some kind, recognized by file extension.
 */
public record FileCompiler(String name, Set<String> extensions) {

    public static FileCompiler c() {
        return new FileCompiler("C", Set.of("c"));
    }

    public static FileCompiler cxx() {
        return new FileCompiler("C++", Set.of("cpp", "cxx", "cc", "c++"));
    }

    public boolean handles(String extension) {
        return extensions.contains(extension);
    }
}
