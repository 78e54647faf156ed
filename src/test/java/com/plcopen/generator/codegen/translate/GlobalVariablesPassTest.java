package com.plcopen.generator.codegen.translate;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.model.core.context.GenerationStats;
import com.plcopen.generator.codegen.model.input.CompilationUnit;
import com.plcopen.generator.codegen.model.input.LiteralExpression;
import com.plcopen.generator.codegen.model.input.PublishMode;
import com.plcopen.generator.codegen.model.input.ReferenceExpression;
import com.plcopen.generator.codegen.model.input.SourceLocation;
import com.plcopen.generator.codegen.model.input.UnaryExpression;
import com.plcopen.generator.codegen.model.input.VariableBlock;
import com.plcopen.generator.codegen.model.input.VariableBlockType;
import com.plcopen.generator.codegen.model.input.VariableDeclaration;
import com.plcopen.generator.codegen.xml.XmlNode;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for global variable export into Configuration/Resource containers.
 */
class GlobalVariablesPassTest {

    private static final SourceLocation LOCATION = SourceLocation.range("globals.st", 0, 10);

    private GenerationStats stats;
    private GlobalVariablesPass pass;
    private XmlNode document;

    @BeforeEach
    void setUp() {
        stats = new GenerationStats();
        pass = new GlobalVariablesPass(new VariableElementFactory(), stats);
        document = OmronTemplate.create(GenerationParameters.defaults(), "2024-01-01T00:00:00");
    }

    @Test
    void testConfigurationAndResourceNamedAfterUnit() throws Exception {
        pass.apply(document, unit("src/plant/globals.st", globals(false, false, variable("gCounter", "INT"))));

        XmlNode configuration = DocumentAnchors.instances(document).findChild("Configuration").orElseThrow();
        assertThat(configuration.getAttribute("name")).isEqualTo("globals_Configuration");
        XmlNode resource = configuration.findChild("Resource").orElseThrow();
        assertThat(resource.getAttribute("name")).isEqualTo("globals_Resource");
    }

    @Test
    void testFourContainersInFixedOrder() throws Exception {
        pass.apply(document, unit("globals.st",
                globals(false, false, variable("plain", "INT")),
                globals(true, true, variable("both", "INT")),
                globals(false, true, variable("kept", "INT")),
                globals(true, false, variable("fixed", "INT"))));

        List<XmlNode> buckets = resource().getChildren();
        assertThat(buckets).hasSize(4).allMatch(n -> n.getName().equals("GlobalVars"));
        assertThat(buckets.get(0).getAttributes()).containsEntry("constant", "true").containsEntry("retain", "true");
        assertThat(buckets.get(1).getAttributes()).containsExactly(entry("constant", "true"));
        assertThat(buckets.get(2).getAttributes()).containsExactly(entry("retain", "true"));
        assertThat(buckets.get(3).getAttributes()).isEmpty();

        assertThat(names(buckets.get(0))).containsExactly("both");
        assertThat(names(buckets.get(1))).containsExactly("fixed");
        assertThat(names(buckets.get(2))).containsExactly("kept");
        assertThat(names(buckets.get(3))).containsExactly("plain");
    }

    @Test
    void testEmptyContainersStillWritten() throws Exception {
        pass.apply(document, unit("empty.st"));

        assertThat(resource().getChildren()).hasSize(4).allMatch(n -> n.getChildren().isEmpty());
    }

    @Test
    void testUntypedAndSynthesizedVariablesSkipped() throws Exception {
        pass.apply(document, unit("globals.st", globals(false, false,
                variable("a", "INT"),
                variable("inline", null),
                VariableDeclaration.builder().name("__hidden").typeName("INT").location(SourceLocation.internal()).build(),
                VariableDeclaration.builder().name("noLocation").typeName("INT").build(),
                variable("b", "BOOL"))));

        assertThat(names(resource().getChildren().get(3))).containsExactly("a", "b");
        assertThat(stats.getGlobalVariables()).isEqualTo(2);
        assertThat(stats.getSkipped()).isEqualTo(3);
    }

    @Test
    void testVariableDetails() throws Exception {
        pass.apply(document, unit("globals.st", globals(false, false,
                variable("gCounter", "INT").toBuilder()
                        .initializer(LiteralExpression.of(5))
                        .address("%MW10")
                        .publishMode(PublishMode.OUTPUT)
                        .build(),
                variable("gOffset", "DINT").toBuilder()
                        .initializer(UnaryExpression.negate(LiteralExpression.of(2)))
                        .build(),
                variable("gAlias", "INT").toBuilder()
                        .initializer(ReferenceExpression.of("gCounter"))
                        .build())));

        List<XmlNode> variables = resource().getChildren().get(3).getChildren();

        XmlNode counter = variables.get(0);
        assertThat(counter.getChildren()).extracting(XmlNode::getName)
                .containsExactly("Type", "AddData", "InitialValue", "Address");
        assertThat(initialValue(counter)).isEqualTo("5");
        assertThat(counter.findChild("Address").orElseThrow().getContent()).contains("%MW10");
        assertThat(counter.findChild("AddData").orElseThrow()
                .findChild("Data").orElseThrow()
                .findChild("smcext:NetworkPublish").orElseThrow()
                .getAttribute("value")).isEqualTo("Output");

        assertThat(initialValue(variables.get(1))).isEqualTo("-2");
        assertThat(variables.get(2).findChild("InitialValue")).isEmpty();
    }

    @Test
    void testNonGlobalBlocksIgnored() throws Exception {
        pass.apply(document, unit("globals.st", VariableBlock.builder()
                .type(VariableBlockType.LOCAL)
                .variable(variable("local", "INT"))
                .build()));

        assertThat(resource().getChildren()).allMatch(n -> n.getChildren().isEmpty());
        assertThat(stats.getSkipped()).isEqualTo(1);
    }

    @Test
    void testMissingInstancesAnchor() {
        XmlNode bare = new XmlNode("Project");

        assertThatThrownBy(() -> pass.apply(bare, unit("globals.st")))
                .isInstanceOfSatisfying(AnchorNotFoundException.class,
                        e -> assertThat(e.getPath()).isEqualTo("Instances"));
    }

    private XmlNode resource() throws AnchorNotFoundException {
        return DocumentAnchors.find(DocumentAnchors.instances(document), "Configuration", "Resource");
    }

    private static CompilationUnit unit(String fileName, VariableBlock... blocks) {
        CompilationUnit.CompilationUnitBuilder builder = CompilationUnit.builder().fileName(fileName);
        for (VariableBlock block : blocks) {
            builder.globalVariableBlock(block);
        }
        return builder.build();
    }

    private static VariableBlock globals(boolean constant, boolean retain, VariableDeclaration... variables) {
        return VariableBlock.builder()
                .type(VariableBlockType.GLOBAL)
                .constant(constant)
                .retain(retain)
                .variables(List.of(variables))
                .build();
    }

    private static VariableDeclaration variable(String name, String typeName) {
        return VariableDeclaration.builder().name(name).typeName(typeName).location(LOCATION).build();
    }

    private static List<String> names(XmlNode container) {
        return container.getChildren().stream().map(n -> n.getAttribute("name")).collect(Collectors.toList());
    }

    private static String initialValue(XmlNode variable) {
        return variable.findChild("InitialValue").orElseThrow()
                .findChild("SimpleValue").orElseThrow()
                .getAttribute("value");
    }
}
