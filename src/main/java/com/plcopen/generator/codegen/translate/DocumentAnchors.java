package com.plcopen.generator.codegen.translate;

import java.util.Arrays;

import com.plcopen.generator.codegen.xml.XmlNode;
import com.plcopen.generator.codegen.xml.smc.GlobalNamespace;
import com.plcopen.generator.codegen.xml.smc.Instances;
import com.plcopen.generator.codegen.xml.smc.Types;

import lombok.experimental.UtilityClass;

/**
 * Locates the skeleton elements that generated subtrees are appended to.
 * Returned nodes are live parts of the document.
 */
@UtilityClass
public class DocumentAnchors {

    public static XmlNode globalNamespace(XmlNode document) throws AnchorNotFoundException {
        return find(document, Types.TAG, GlobalNamespace.TAG);
    }

    public static XmlNode instances(XmlNode document) throws AnchorNotFoundException {
        return find(document, Instances.TAG);
    }

    public static XmlNode find(XmlNode document, String... path) throws AnchorNotFoundException {
        XmlNode current = document;
        for (int i = 0; i < path.length; i++) {
            String name = path[i];
            XmlNode next = current.findChild(name).orElse(null);
            if (next == null) {
                throw new AnchorNotFoundException(String.join("/", Arrays.copyOf(path, i + 1)));
            }
            current = next;
        }
        return current;
    }
}
