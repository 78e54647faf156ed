package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Configuration extends XmlElement<Configuration> {

    public static final String TAG = "Configuration";
    public static final String SUFFIX = "_Configuration";

    public Configuration() {
        super(TAG);
    }

    public static Configuration forUnit(String unitName, Resource resource) {
        return new Configuration()
                .attribute(SmcSchema.ATTR_NAME, unitName + SUFFIX)
                .child(resource);
    }
}
