package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class OutputVars extends XmlElement<OutputVars> {

    public static final String TAG = "OutputVars";

    public OutputVars() {
        super(TAG);
    }
}
