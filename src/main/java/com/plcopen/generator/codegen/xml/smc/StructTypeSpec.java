package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class StructTypeSpec extends XmlElement<StructTypeSpec> {

    public static final String TAG = "StructTypeSpec";

    public StructTypeSpec() {
        super(TAG);
    }
}
