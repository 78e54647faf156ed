package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Interface extends XmlElement<Interface> {

    public static final String TAG = "interface";

    public Interface() {
        super(TAG);
    }
}
