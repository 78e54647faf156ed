package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class AddData extends XmlElement<AddData> {

    public static final String TAG = "addData";

    public AddData() {
        super(TAG);
    }
}
