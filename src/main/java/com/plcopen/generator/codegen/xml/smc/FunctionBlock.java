package com.plcopen.generator.codegen.xml.smc;

public class FunctionBlock extends PouDeclaration<FunctionBlock> {

    public static final String TAG = "FunctionBlock";

    public FunctionBlock() {
        super(TAG);
    }

    @Override
    public boolean hasResultType() {
        return true;
    }
}
