package com.plcopen.generator.codegen.model.input;

public enum SourceLocationKind {
    /** Byte range within a source file. */
    RANGE,
    /** Only a line number is known. */
    LINE_ONLY,
    /** Created by the compiler, no source text. */
    INTERNAL,
    UNDEFINED
}
