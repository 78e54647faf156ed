package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Types extends XmlElement<Types> {

    public static final String TAG = "Types";

    public Types() {
        super(TAG);
    }
}
