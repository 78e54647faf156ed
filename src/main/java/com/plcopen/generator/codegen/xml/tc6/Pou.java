package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;
import com.plcopen.generator.codegen.xml.XmlNodeSource;

/**
 * Graphical POU. The textual declaration travels as
 * {@code interface/addData/data/textDeclaration/content}.
 */
public class Pou extends XmlElement<Pou> {

    public static final String TAG = "pou";

    public Pou() {
        super(TAG);
    }

    public static Pou init(String name, String pouType, String declaration) {
        return new Pou()
                .attribute("xmlns", Tc6Schema.NAMESPACE)
                .attribute(Tc6Schema.ATTR_NAME, name)
                .attribute("pouType", pouType)
                .child(new Interface()
                        .child(new LocalVars().close())
                        .child(new AddData().child(new Data()
                                .attribute(Tc6Schema.ATTR_NAME, Tc6Schema.DECLARATION_DATA_NAME)
                                .attribute("handleUnknown", "implementation")
                                .child(new TextDeclaration()
                                        .child(new Content().withDeclaration(declaration))))));
    }

    public Pou withFbd(List<? extends XmlNodeSource> children) {
        return child(Body.withFbd(children));
    }

    public Pou withActions(List<Action> actions) {
        return child(new Actions().children(actions));
    }
}
