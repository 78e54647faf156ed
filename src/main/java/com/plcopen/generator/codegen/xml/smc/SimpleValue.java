package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class SimpleValue extends XmlElement<SimpleValue> {

    public static final String TAG = "SimpleValue";

    public SimpleValue() {
        super(TAG);
    }
}
