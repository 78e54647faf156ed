package com.plcopen.generator.codegen.xml.smc;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Resource extends XmlElement<Resource> {

    public static final String TAG = "Resource";
    public static final String SUFFIX = "_Resource";

    public Resource() {
        super(TAG);
    }

    public static Resource forUnit(String unitName, List<GlobalVars> buckets) {
        return new Resource()
                .attribute(SmcSchema.ATTR_NAME, unitName + SUFFIX)
                .children(buckets);
    }
}
