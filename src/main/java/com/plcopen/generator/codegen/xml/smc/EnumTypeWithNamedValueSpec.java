package com.plcopen.generator.codegen.xml.smc;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Enumeration with explicit values. The schema requires every {@code Enumerator}
 * before the single trailing {@code BaseType}.
 */
public class EnumTypeWithNamedValueSpec extends XmlElement<EnumTypeWithNamedValueSpec> {

    public static final String TAG = "EnumTypeWithNamedValueSpec";

    public EnumTypeWithNamedValueSpec() {
        super(TAG);
    }

    public static EnumTypeWithNamedValueSpec finish(List<Enumerator> enumerators, String baseTypeName) {
        return new EnumTypeWithNamedValueSpec()
                .children(enumerators)
                .child(BaseType.named(baseTypeName));
    }
}
