package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.model.input.PublishMode;
import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * A declared variable: name, type, vendor data and optional initial value and address.
 */
public class Variable extends XmlElement<Variable> {

    public static final String TAG = "Variable";

    public Variable() {
        super(TAG);
    }

    public static Variable named(String name) {
        return new Variable().attribute(SmcSchema.ATTR_NAME, name);
    }

    public Variable withType(String typeName) {
        return child(Type.named(typeName));
    }

    public Variable withPublishMode(PublishMode mode) {
        return child(AddData.vendor(NetworkPublish.of(mode)));
    }

    public Variable withInitialValue(String value) {
        return value == null ? this : child(InitialValue.simple(value));
    }

    public Variable withAddress(String address) {
        return address == null ? this : child(Address.of(address));
    }

    public Variable withOrderWithinParamSet(long order) {
        return attribute(SmcSchema.ATTR_ORDER_WITHIN_PARAM_SET, Long.toString(order));
    }
}
