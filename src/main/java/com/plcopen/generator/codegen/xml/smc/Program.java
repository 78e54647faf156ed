package com.plcopen.generator.codegen.xml.smc;

public class Program extends PouDeclaration<Program> {

    public static final String TAG = "Program";

    public Program() {
        super(TAG);
    }

    @Override
    public boolean hasResultType() {
        return false;
    }
}
