package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single declared variable.
 */
@Value
@Builder(toBuilder = true)
public class VariableDeclaration {

    @NonNull
    String name;

    /**
     * Name of the resolved data type; {@code null} when the front-end could not name it
     * (inline anonymous types).
     */
    String typeName;

    Expression initializer;

    /** Hardware address such as {@code %IX0.0}. */
    String address;

    @NonNull
    @Builder.Default
    PublishMode publishMode = PublishMode.DO_NOT_PUBLISH;

    /** {@code null} for compiler-synthesized variables. */
    SourceLocation location;

    public boolean hasTypeName() {
        return typeName != null && !typeName.isBlank();
    }

    public boolean isSynthesized() {
        return location == null || location.isSynthesized();
    }
}
