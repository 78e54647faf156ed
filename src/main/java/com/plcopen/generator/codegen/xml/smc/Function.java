package com.plcopen.generator.codegen.xml.smc;

public class Function extends PouDeclaration<Function> {

    public static final String TAG = "Function";

    public Function() {
        super(TAG);
    }

    @Override
    public boolean hasResultType() {
        return true;
    }
}
