package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.model.input.PublishMode;
import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Sysmac property recording whether a variable is exposed on the network.
 */
public class NetworkPublish extends XmlElement<NetworkPublish> {

    public static final String TAG = "smcext:NetworkPublish";

    public NetworkPublish() {
        super(TAG);
    }

    public static NetworkPublish of(PublishMode mode) {
        return new NetworkPublish().attribute(SmcSchema.ATTR_VALUE, mode.getXmlValue()).close();
    }
}
