package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Negated extends XmlElement<Negated> {

    public static final String TAG = "negated";

    public Negated() {
        super(TAG);
    }

    /**
     * {@code <addData><data><negated value="..."/></data></addData>}
     */
    public static AddData asAddData(boolean value) {
        return new AddData().child(new Data().child(new Negated()
                .attribute(Tc6Schema.ATTR_VALUE, Boolean.toString(value))
                .close()));
    }
}
