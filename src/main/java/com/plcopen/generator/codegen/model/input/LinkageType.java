package com.plcopen.generator.codegen.model.input;

public enum LinkageType {
    INTERNAL,
    /** Implemented on the target platform; only declared here. */
    EXTERNAL,
    BUILT_IN
}
