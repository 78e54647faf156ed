package com.plcopen.generator.codegen.translate;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.xml.XmlNode;
import com.plcopen.generator.codegen.xml.smc.ContentHeader;
import com.plcopen.generator.codegen.xml.smc.FileHeader;
import com.plcopen.generator.codegen.xml.smc.GlobalNamespace;
import com.plcopen.generator.codegen.xml.smc.Instances;
import com.plcopen.generator.codegen.xml.smc.Project;
import com.plcopen.generator.codegen.xml.smc.SmcSchema;
import com.plcopen.generator.codegen.xml.smc.Types;

import lombok.experimental.UtilityClass;

/**
 * Skeleton document every run starts from:
 *
 * <pre>
 * &lt;Project xmlns:xsi=".." xmlns:smcext=".." xsi:schemaLocation=".." schemaVersion="1" xmlns=".."&gt;
 *     &lt;FileHeader companyName="OMRON Corporation" productName="Sysmac Studio" productVersion="1.30.0.0"/&gt;
 *     &lt;ContentHeader name="Sample" creationDateTime=".."/&gt;
 *     &lt;Types&gt;
 *         &lt;GlobalNamespace/&gt;
 *     &lt;/Types&gt;
 *     &lt;Instances/&gt;
 * &lt;/Project&gt;
 * </pre>
 */
@UtilityClass
public class OmronTemplate {

    public static XmlNode create(GenerationParameters parameters, String creationDateTime) {
        return Project.omron()
                .child(new FileHeader()
                        .attribute("companyName", SmcSchema.COMPANY_NAME)
                        .attribute("productName", SmcSchema.PRODUCT_NAME)
                        .attribute("productVersion", SmcSchema.PRODUCT_VERSION))
                .child(ContentHeader.of(parameters.getProjectName(), creationDateTime))
                .child(new Types().child(new GlobalNamespace()))
                .child(new Instances())
                .toNode();
    }
}
