package com.plcopen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Declared interface of a program, function or function block.
 */
@Value
@Builder(toBuilder = true)
public class Pou {

    @NonNull
    String name;

    @NonNull
    PouType pouType;

    @Singular("variableBlock")
    List<VariableBlock> variableBlocks;

    /** Declared return type name; functions only. */
    String returnTypeName;

    @NonNull
    @Builder.Default
    LinkageType linkage = LinkageType.INTERNAL;

    SourceLocation location;
}
