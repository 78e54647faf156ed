package com.plcopen.generator.codegen.translate;

import com.plcopen.generator.codegen.model.input.VariableBlock;

/**
 * Container a POU variable is written to. Declaration order is the order the containers
 * appear in the generated POU.
 */
public enum VariableRole {
    INPUT(true),
    OUTPUT(true),
    IN_OUT(true),
    EXTERNAL_CONSTANT(false),
    EXTERNAL(false),
    LOCAL_CONSTANT_RETAIN(false),
    LOCAL_CONSTANT(false),
    LOCAL_RETAIN(false),
    LOCAL(false),
    TEMP_CONSTANT(false),
    TEMP(false);

    private final boolean orderSensitive;

    VariableRole(boolean orderSensitive) {
        this.orderSensitive = orderSensitive;
    }

    /**
     * Whether the target tool needs the declared parameter position ({@code orderWithinParamSet}).
     */
    public boolean isOrderSensitive() {
        return orderSensitive;
    }

    public boolean isParameter() {
        return this == INPUT || this == OUTPUT || this == IN_OUT;
    }

    /**
     * Role of every variable in the block; {@code null} for block types a POU cannot carry (globals).
     */
    public static VariableRole of(VariableBlock block) {
        switch (block.getType()) {
            case INPUT:
                return INPUT;
            case OUTPUT:
                return OUTPUT;
            case IN_OUT:
                return IN_OUT;
            case EXTERNAL:
                return block.isConstant() ? EXTERNAL_CONSTANT : EXTERNAL;
            case LOCAL:
                if (block.isConstant()) {
                    return block.isRetain() ? LOCAL_CONSTANT_RETAIN : LOCAL_CONSTANT;
                }
                return block.isRetain() ? LOCAL_RETAIN : LOCAL;
            case TEMP:
                return block.isConstant() ? TEMP_CONSTANT : TEMP;
            default:
                return null;
        }
    }
}
