package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Connection extends XmlElement<Connection> {

    public static final String TAG = "connection";

    public Connection() {
        super(TAG);
    }
}
