package com.plcopen.generator.codegen.translate;

import lombok.NonNull;
import lombok.Value;

/**
 * Enumeration member before conflict resolution. The value is the decimal text of a signed integer.
 */
@Value
public class EnumeratorCandidate {

    @NonNull
    String name;

    @NonNull
    String initialValue;

    public static EnumeratorCandidate of(String name, String initialValue) {
        return new EnumeratorCandidate(name, initialValue);
    }
}
