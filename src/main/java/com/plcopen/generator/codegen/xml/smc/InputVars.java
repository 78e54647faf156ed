package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InputVars extends XmlElement<InputVars> {

    public static final String TAG = "InputVars";

    public InputVars() {
        super(TAG);
    }
}
