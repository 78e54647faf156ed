package com.plcopen.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for one generation run. Built once, read-only afterwards.
 */
@Value
@Builder(toBuilder = true)
public class GenerationParameters {

    public static final String DEFAULT_PROJECT_NAME = "Sample";

    /**
     * Apply Sysmac Studio workarounds, e.g. replacing unbounded string member types
     * with a fixed-width placeholder.
     */
    boolean outputXmlOmron;

    /**
     * Name written to the {@code ContentHeader}.
     */
    @NonNull
    @Builder.Default
    String projectName = DEFAULT_PROJECT_NAME;

    public static GenerationParameters defaults() {
        return GenerationParameters.builder().build();
    }
}
