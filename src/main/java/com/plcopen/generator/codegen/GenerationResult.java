package com.plcopen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of one generation run.
 */
@Data
@Builder
public class GenerationResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int unitsTranslated;
    private int globalVariablesGenerated;
    private int dataTypesGenerated;
    private int pousGenerated;
    private int elementsSkipped;

    /** Passes that were skipped for a unit, e.g. because an anchor element was missing. */
    @Singular
    private List<String> warnings;

    /** True when the output was copied from an existing XML file instead of generated. */
    private boolean copied;

    public static GenerationResult failure(String errorMessage) {
        return GenerationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
