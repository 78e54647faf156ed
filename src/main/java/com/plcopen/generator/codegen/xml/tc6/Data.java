package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Data extends XmlElement<Data> {

    public static final String TAG = "data";

    public Data() {
        super(TAG);
    }
}
