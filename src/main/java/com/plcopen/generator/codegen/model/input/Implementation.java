package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Statement part of a POU. Its location spans the body text in the originating file.
 */
@Value
@Builder(toBuilder = true)
public class Implementation {

    @NonNull
    String name;

    @NonNull
    PouType pouType;

    @NonNull
    @Builder.Default
    LinkageType linkage = LinkageType.INTERNAL;

    SourceLocation location;
}
