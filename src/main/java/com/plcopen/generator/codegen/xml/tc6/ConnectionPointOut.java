package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class ConnectionPointOut extends XmlElement<ConnectionPointOut> {

    public static final String TAG = "connectionPointOut";

    public ConnectionPointOut() {
        super(TAG);
    }

    public static ConnectionPointOut to(int refLocalId) {
        return new ConnectionPointOut().child(new Connection().withRefId(refLocalId).close());
    }
}
