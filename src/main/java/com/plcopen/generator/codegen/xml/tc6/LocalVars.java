package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class LocalVars extends XmlElement<LocalVars> {

    public static final String TAG = "localVars";

    public LocalVars() {
        super(TAG);
    }
}
