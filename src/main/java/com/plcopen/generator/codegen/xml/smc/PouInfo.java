package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Sysmac POU metadata: creation time and version.
 */
public class PouInfo extends XmlElement<PouInfo> {

    public static final String TAG = "smcext:PouInfo";

    public PouInfo() {
        super(TAG);
    }

    public static PouInfo of(String creationDateTime, String version) {
        return new PouInfo()
                .attribute(SmcSchema.ATTR_CREATION_DATE_TIME, creationDateTime)
                .attribute(SmcSchema.ATTR_VERSION, version)
                .close();
    }
}
