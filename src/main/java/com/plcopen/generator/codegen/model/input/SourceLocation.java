package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Where a declaration or implementation came from.
 */
@Value
@Builder(toBuilder = true)
public class SourceLocation {

    /**
     * Originating file, or {@code null} for sources that are not files (e.g. in-memory snippets).
     */
    String fileName;

    @NonNull
    SourceLocationKind kind;

    /** Inclusive start byte offset. */
    long startOffset;

    /** Exclusive end byte offset. */
    long endOffset;

    public static SourceLocation range(String fileName, long startOffset, long endOffset) {
        return SourceLocation.builder()
                .fileName(fileName)
                .kind(SourceLocationKind.RANGE)
                .startOffset(startOffset)
                .endOffset(endOffset)
                .build();
    }

    public static SourceLocation internal() {
        return SourceLocation.builder().kind(SourceLocationKind.INTERNAL).build();
    }

    public static SourceLocation undefined() {
        return SourceLocation.builder().kind(SourceLocationKind.UNDEFINED).build();
    }

    /**
     * True for compiler-synthesized elements that have no place in the source.
     */
    public boolean isSynthesized() {
        return kind == SourceLocationKind.INTERNAL || kind == SourceLocationKind.UNDEFINED;
    }

    public long getLength() {
        return endOffset - startOffset;
    }

    /**
     * True when this location names a readable byte range of a file.
     */
    public boolean isFileRange() {
        return kind == SourceLocationKind.RANGE
                && fileName != null
                && startOffset >= 0
                && getLength() >= 0;
    }
}
