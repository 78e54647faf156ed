package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class TempVars extends XmlElement<TempVars> {

    public static final String TAG = "TempVars";

    public TempVars() {
        super(TAG);
    }

    public static TempVars bucket(boolean constant) {
        return new TempVars().maybeAttribute(SmcSchema.ATTR_CONSTANT, constant ? "true" : null);
    }
}
