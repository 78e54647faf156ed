package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class GlobalVars extends XmlElement<GlobalVars> {

    public static final String TAG = "GlobalVars";

    public GlobalVars() {
        super(TAG);
    }

    /**
     * Container for one constant/retain combination. Flags are written only when set.
     */
    public static GlobalVars bucket(boolean constant, boolean retain) {
        return new GlobalVars()
                .maybeAttribute(SmcSchema.ATTR_CONSTANT, constant ? "true" : null)
                .maybeAttribute(SmcSchema.ATTR_RETAIN, retain ? "true" : null);
    }
}
