package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class DataTypeDecl extends XmlElement<DataTypeDecl> {

    public static final String TAG = "DataTypeDecl";

    public DataTypeDecl() {
        super(TAG);
    }

    public static DataTypeDecl named(String name) {
        return new DataTypeDecl().attribute(SmcSchema.ATTR_NAME, name);
    }
}
