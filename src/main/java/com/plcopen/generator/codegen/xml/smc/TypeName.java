package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class TypeName extends XmlElement<TypeName> {

    public static final String TAG = "TypeName";

    public TypeName() {
        super(TAG);
    }
}
