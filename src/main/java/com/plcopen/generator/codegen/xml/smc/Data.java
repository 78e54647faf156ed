package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Data extends XmlElement<Data> {

    public static final String TAG = "Data";

    public Data() {
        super(TAG);
    }
}
