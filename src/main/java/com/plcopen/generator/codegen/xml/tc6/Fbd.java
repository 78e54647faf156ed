package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Fbd extends XmlElement<Fbd> {

    public static final String TAG = "FBD";

    public Fbd() {
        super(TAG);
    }
}
