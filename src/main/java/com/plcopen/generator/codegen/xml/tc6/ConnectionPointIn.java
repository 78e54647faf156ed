package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class ConnectionPointIn extends XmlElement<ConnectionPointIn> {

    public static final String TAG = "connectionPointIn";

    public ConnectionPointIn() {
        super(TAG);
    }

    /**
     * {@code <connectionPointIn><connection refLocalId="ref"/></connectionPointIn>}
     */
    public static ConnectionPointIn to(int refLocalId) {
        return new ConnectionPointIn().child(new Connection().withRefId(refLocalId).close());
    }

    /**
     * Same as {@link #to(int)} with the connection naming the formal parameter it feeds.
     */
    public static ConnectionPointIn to(int refLocalId, String formalParameter) {
        return new ConnectionPointIn().child(new Connection()
                .withRefId(refLocalId)
                .attribute(Tc6Schema.ATTR_FORMAL_PARAMETER, formalParameter)
                .close());
    }
}
