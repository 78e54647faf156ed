package com.plcopen.generator.codegen.model.input;

/**
 * Network publish setting of a variable, as understood by Sysmac Studio.
 */
public enum PublishMode {
    DO_NOT_PUBLISH("DoNotPublish"),
    PUBLISH_ONLY("PublishOnly"),
    INPUT("Input"),
    OUTPUT("Output");

    private final String xmlValue;

    PublishMode(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    public String getXmlValue() {
        return xmlValue;
    }
}
