package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A user-defined type ({@code TYPE ... END_TYPE}).
 */
@Value
@Builder(toBuilder = true)
public class DataTypeDeclaration {

    /** {@code null} for anonymous (inline) types. */
    String name;

    @NonNull
    DataType dataType;

    SourceLocation location;

    public boolean isAnonymous() {
        return name == null || name.isBlank();
    }

    public boolean isSynthesized() {
        return location == null || location.isSynthesized();
    }
}
