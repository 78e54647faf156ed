package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class ResultType extends XmlElement<ResultType> {

    public static final String TAG = "ResultType";

    public ResultType() {
        super(TAG);
    }

    public static ResultType named(String typeName) {
        return new ResultType().child(new TypeName().content(typeName));
    }
}
