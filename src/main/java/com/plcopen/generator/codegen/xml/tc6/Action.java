package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;
import com.plcopen.generator.codegen.xml.XmlNodeSource;

public class Action extends XmlElement<Action> {

    public static final String TAG = "action";

    public Action() {
        super(TAG);
    }

    public static Action named(String name) {
        return new Action().attribute(Tc6Schema.ATTR_NAME, name);
    }

    public Action withFbd(List<? extends XmlNodeSource> children) {
        return child(Body.withFbd(children));
    }
}
