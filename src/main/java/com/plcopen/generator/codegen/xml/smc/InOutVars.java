package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InOutVars extends XmlElement<InOutVars> {

    public static final String TAG = "InOutVars";

    public InOutVars() {
        super(TAG);
    }
}
