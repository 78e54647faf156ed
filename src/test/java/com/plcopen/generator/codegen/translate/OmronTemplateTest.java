package com.plcopen.generator.codegen.translate;

import org.junit.jupiter.api.Test;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.xml.XmlNode;

import static org.assertj.core.api.Assertions.*;

class OmronTemplateTest {

    @Test
    void testSkeletonStructure() throws Exception {
        XmlNode project = OmronTemplate.create(GenerationParameters.defaults(), "2024-03-05T06:07:08");

        assertThat(project.getName()).isEqualTo("Project");
        assertThat(project.getAttributes()).containsExactly(
                entry("xmlns:xsi", "http://www.w3.org/2001/XMLSchema-instance"),
                entry("xmlns:smcext", "https://www.ia.omron.com/Smc"),
                entry("xsi:schemaLocation", "https://www.ia.omron.com/Smc IEC61131_10_Ed1_0_SmcExt1_0_Spc1_0.xsd"),
                entry("schemaVersion", "1"),
                entry("xmlns", "www.iec.ch/public/TC65SC65BWG7TF10"));
        assertThat(project.getChildren()).extracting(XmlNode::getName)
                .containsExactly("FileHeader", "ContentHeader", "Types", "Instances");

        assertThat(project.findChild("FileHeader").orElseThrow().getAttributes())
                .containsEntry("companyName", "OMRON Corporation")
                .containsEntry("productName", "Sysmac Studio")
                .containsEntry("productVersion", "1.30.0.0");
        assertThat(project.findChild("ContentHeader").orElseThrow().getAttributes())
                .containsExactly(entry("name", "Sample"), entry("creationDateTime", "2024-03-05T06:07:08"));
        assertThat(DocumentAnchors.globalNamespace(project).getChildren()).isEmpty();
        assertThat(DocumentAnchors.instances(project).getChildren()).isEmpty();
    }

    @Test
    void testProjectNameFromParameters() {
        XmlNode project = OmronTemplate.create(
                GenerationParameters.builder().projectName("Line4").build(), "2024-03-05T06:07:08");

        assertThat(project.findChild("ContentHeader").orElseThrow().getAttribute("name")).isEqualTo("Line4");
    }

    @Test
    void testAnchorPathReportedWhenMissing() {
        XmlNode project = new XmlNode("Project").child(new XmlNode("Types"));

        assertThatThrownBy(() -> DocumentAnchors.globalNamespace(project))
                .isInstanceOf(AnchorNotFoundException.class)
                .hasMessage("Anchor element not found: Types/GlobalNamespace");
    }
}
