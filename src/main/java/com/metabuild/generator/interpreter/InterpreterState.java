package com.metabuild.generator.interpreter;

/**
 * Processing stages of an {@link Interpreter}, in order.
 */
public enum InterpreterState {
    /** Nothing loaded yet. */
    EMPTY,
    /** Modules were added to the model. */
    BUILT,
    /** Reference cycles and unused variables were checked. */
    ANALYZED,
    /** Paths are normalized and values simplified; ready for toolsets. */
    NORMALIZED,
    /** Toolset-specific models are being made. */
    SPECIALIZED,
    /** All toolset models were produced. */
    GENERATED
}
