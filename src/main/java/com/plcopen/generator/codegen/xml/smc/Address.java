package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Hardware address of a located variable, e.g. {@code %IX0.0}.
 */
public class Address extends XmlElement<Address> {

    public static final String TAG = "Address";

    public Address() {
        super(TAG);
    }

    public static Address of(String address) {
        return new Address().content(address);
    }
}
