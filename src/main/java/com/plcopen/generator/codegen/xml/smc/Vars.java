package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Local variables of a POU.
 */
public class Vars extends XmlElement<Vars> {

    public static final String TAG = "Vars";

    public Vars() {
        super(TAG);
    }

    public static Vars bucket(boolean constant, boolean retain) {
        return new Vars()
                .maybeAttribute(SmcSchema.ATTR_CONSTANT, constant ? "true" : null)
                .maybeAttribute(SmcSchema.ATTR_RETAIN, retain ? "true" : null);
    }
}
