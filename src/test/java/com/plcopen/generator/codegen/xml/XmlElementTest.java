package com.plcopen.generator.codegen.xml;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.plcopen.generator.codegen.model.input.PublishMode;
import com.plcopen.generator.codegen.xml.smc.EnumTypeWithNamedValueSpec;
import com.plcopen.generator.codegen.xml.smc.Enumerator;
import com.plcopen.generator.codegen.xml.smc.GlobalVars;
import com.plcopen.generator.codegen.xml.smc.MainBody;
import com.plcopen.generator.codegen.xml.smc.SmcSchema;
import com.plcopen.generator.codegen.xml.smc.TypeName;
import com.plcopen.generator.codegen.xml.smc.Variable;
import com.plcopen.generator.codegen.xml.tc6.Block;
import com.plcopen.generator.codegen.xml.tc6.InVariable;
import com.plcopen.generator.codegen.xml.tc6.Jump;
import com.plcopen.generator.codegen.xml.tc6.OutVariable;
import com.plcopen.generator.codegen.xml.tc6.Pou;
import com.plcopen.generator.codegen.xml.tc6.Return;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the typed element builders.
 */
class XmlElementTest {

    @Test
    void testNegatableElementsStartNotNegated() {
        assertThat(new InVariable().toNode().getAttribute("negated")).isEqualTo("false");
        assertThat(new OutVariable().toNode().getAttribute("negated")).isEqualTo("false");
        assertThat(new TypeName().toNode().getAttributes()).doesNotContainKey("negated");
    }

    @Test
    void testIdentifierHelpers() {
        XmlNode node = new Block().withId(3).withRefId(1).withExecutionId(7L).toNode();

        assertThat(node.getAttributes())
                .containsEntry("localId", "3")
                .containsEntry("refLocalId", "1")
                .containsEntry("executionOrderId", "7");
    }

    @Test
    void testMaybeAttributeIgnoresNull() {
        XmlNode node = new GlobalVars()
                .maybeAttribute("constant", null)
                .maybeAttribute("retain", "true")
                .toNode();

        assertThat(node.getAttributes()).containsExactly(entry("retain", "true"));
    }

    @Test
    void testToNodeIsSnapshot() {
        Variable variable = Variable.named("a");
        XmlNode snapshot = variable.toNode();

        variable.withType("INT");

        assertThat(snapshot.getChildren()).isEmpty();
    }

    @Test
    void testVariableHelpers() {
        XmlNode node = Variable.named("gCounter")
                .withType("INT")
                .withPublishMode(PublishMode.PUBLISH_ONLY)
                .withInitialValue("5")
                .withAddress(null)
                .toNode();

        assertThat(node.getChildren()).extracting(XmlNode::getName)
                .containsExactly("Type", "AddData", "InitialValue");
        XmlNode publish = node.findChild("AddData").orElseThrow()
                .findChild("Data").orElseThrow()
                .findChild("smcext:NetworkPublish").orElseThrow();
        assertThat(publish.getAttribute("value")).isEqualTo("PublishOnly");
        assertThat(publish.isClosed()).isTrue();
        assertThat(node.findChild("InitialValue").orElseThrow().getChildren().get(0).getAttribute("value"))
                .isEqualTo("5");
    }

    @Test
    void testEnumSpecPutsBaseTypeLast() {
        XmlNode spec = EnumTypeWithNamedValueSpec.finish(
                List.of(Enumerator.of("A", "0"), Enumerator.of("B", "1")), "DINT").toNode();

        assertThat(spec.getChildren()).extracting(XmlNode::getName)
                .containsExactly("Enumerator", "Enumerator", "BaseType");
        assertThat(spec.getChildren().get(2).getChildren().get(0).getContent()).contains("DINT");
    }

    @Test
    void testMainBodyWrapsStructuredText() {
        XmlNode body = MainBody.structuredText("x := 1;").toNode();

        XmlNode content = body.findChild("BodyContent").orElseThrow();
        assertThat(content.getAttribute(SmcSchema.ATTR_XSI_TYPE)).isEqualTo("ST");
        assertThat(content.findChild("ST").orElseThrow().getContent()).contains("x := 1;");
    }

    @Test
    void testTc6PouWrapsDeclaration() {
        XmlNode pou = Pou.init("main", "program", "PROGRAM main END_PROGRAM")
                .withFbd(List.of(new InVariable().withId(1).withExpression("a")))
                .toNode();

        assertThat(pou.getAttribute("xmlns")).isEqualTo("http://www.plcopen.org/xml/tc6_0201");
        XmlNode content = pou.findChild("interface").orElseThrow()
                .findChild("addData").orElseThrow()
                .findChild("data").orElseThrow()
                .findChild("textDeclaration").orElseThrow()
                .findChild("content").orElseThrow();
        assertThat(content.getContent()).contains("PROGRAM main END_PROGRAM");

        XmlNode fbd = pou.findChild("body").orElseThrow().findChild("FBD").orElseThrow();
        assertThat(fbd.getChildren()).extracting(XmlNode::getName).containsExactly("inVariable");
    }

    @Test
    void testConnectBuildsConnectionPointIn() {
        XmlNode out = new OutVariable().withId(2).connectName(1, "IN1").toNode();

        XmlNode connection = out.findChild("connectionPointIn").orElseThrow()
                .findChild("connection").orElseThrow();
        assertThat(connection.getAttribute("refLocalId")).isEqualTo("1");
        assertThat(connection.getAttribute("formalParameter")).isEqualTo("IN1");
    }

    @Test
    void testBlockWithParameters() {
        XmlNode block = Block.init("ADD", 3, 0)
                .withInput(List.of(new com.plcopen.generator.codegen.xml.tc6.Variable().withName("IN1").connect(1)))
                .withOutput(List.of(new com.plcopen.generator.codegen.xml.tc6.Variable().withName("OUT").connectOut(4)))
                .toNode();

        assertThat(block.getAttribute("typeName")).isEqualTo("ADD");
        assertThat(block.getChildren()).extracting(XmlNode::getName)
                .containsExactly("inputVariables", "outputVariables");
        assertThat(block.findChild("outputVariables").orElseThrow().getChildren().get(0)
                .findChild("connectionPointOut")).isPresent();
    }

    @Test
    void testNegateHelpers() {
        XmlNode ret = Return.init(5, 2).connect(4).negate(true).toNode();
        XmlNode jump = new Jump().withName("end").negate().toNode();

        assertThat(ret.getAttribute("executionOrderId")).isEqualTo("2");
        assertThat(ret.findChild("addData").orElseThrow().findChild("data").orElseThrow()
                .findChild("negated").orElseThrow().getAttribute("value")).isEqualTo("true");
        assertThat(jump.getAttribute("label")).isEqualTo("end");
        assertThat(jump.findChild("addData")).isPresent();
    }
}
