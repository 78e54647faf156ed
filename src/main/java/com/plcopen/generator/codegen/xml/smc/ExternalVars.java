package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class ExternalVars extends XmlElement<ExternalVars> {

    public static final String TAG = "ExternalVars";

    public ExternalVars() {
        super(TAG);
    }

    public static ExternalVars bucket(boolean constant) {
        return new ExternalVars().maybeAttribute(SmcSchema.ATTR_CONSTANT, constant ? "true" : null);
    }
}
