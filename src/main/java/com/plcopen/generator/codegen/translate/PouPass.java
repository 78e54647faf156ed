package com.plcopen.generator.codegen.translate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.core.context.GenerationStats;
import com.plcopen.generator.codegen.model.input.CompilationUnit;
import com.plcopen.generator.codegen.model.input.Implementation;
import com.plcopen.generator.codegen.model.input.LinkageType;
import com.plcopen.generator.codegen.model.input.Pou;
import com.plcopen.generator.codegen.model.input.PouType;
import com.plcopen.generator.codegen.model.input.VariableBlock;
import com.plcopen.generator.codegen.model.input.VariableDeclaration;
import com.plcopen.generator.codegen.source.SourceTextReader;
import com.plcopen.generator.codegen.xml.XmlElement;
import com.plcopen.generator.codegen.xml.XmlNode;
import com.plcopen.generator.codegen.xml.smc.ExternalVars;
import com.plcopen.generator.codegen.xml.smc.Function;
import com.plcopen.generator.codegen.xml.smc.FunctionBlock;
import com.plcopen.generator.codegen.xml.smc.InOutVars;
import com.plcopen.generator.codegen.xml.smc.InputVars;
import com.plcopen.generator.codegen.xml.smc.OutputVars;
import com.plcopen.generator.codegen.xml.smc.Parameters;
import com.plcopen.generator.codegen.xml.smc.PouDeclaration;
import com.plcopen.generator.codegen.xml.smc.Program;
import com.plcopen.generator.codegen.xml.smc.SmcSchema;
import com.plcopen.generator.codegen.xml.smc.TempVars;
import com.plcopen.generator.codegen.xml.smc.Variable;
import com.plcopen.generator.codegen.xml.smc.Vars;

/**
 * Appends programs, functions and function blocks to {@code Types/GlobalNamespace}.
 *
 * Each implementation is paired with its declaration by name. The body is the implementation's
 * source text, copied verbatim into an ST leaf.
 */
public class PouPass {

    private static final Logger log = LoggerFactory.getLogger(PouPass.class);

    private static final Set<PouType> SUPPORTED = EnumSet.of(PouType.PROGRAM, PouType.FUNCTION, PouType.FUNCTION_BLOCK);

    private final VariableElementFactory variableFactory;
    private final SourceTextReader sourceReader;
    private final ParameterOrderTracker orderTracker;
    private final GenerationStats stats;
    private final String creationDateTime;

    public PouPass(VariableElementFactory variableFactory, SourceTextReader sourceReader,
                   ParameterOrderTracker orderTracker, GenerationStats stats, String creationDateTime) {
        this.variableFactory = variableFactory;
        this.sourceReader = sourceReader;
        this.orderTracker = orderTracker;
        this.stats = stats;
        this.creationDateTime = creationDateTime;
    }

    public void apply(XmlNode document, CompilationUnit unit) throws AnchorNotFoundException, IOException {
        XmlNode namespace = DocumentAnchors.globalNamespace(document);

        for (Implementation implementation : unit.getImplementations()) {
            Optional<Pou> pou = unit.findPou(implementation.getName());
            if (pou.isEmpty()) {
                log.debug("Skipping {}: no matching declaration", implementation.getName());
                stats.countSkipped();
                continue;
            }
            if (!SUPPORTED.contains(pou.get().getPouType())) {
                log.debug("Skipping {}: {} is not exported", implementation.getName(), pou.get().getPouType());
                stats.countSkipped();
                continue;
            }
            if (implementation.getLinkage() == LinkageType.EXTERNAL || pou.get().getLinkage() == LinkageType.EXTERNAL) {
                log.debug("Skipping {}: implemented on the target", implementation.getName());
                stats.countSkipped();
                continue;
            }

            Optional<String> body = sourceReader.read(implementation.getLocation());
            if (body.isEmpty()) {
                log.debug("Skipping {}: body location {} cannot be read",
                        implementation.getName(), implementation.getLocation());
                stats.countSkipped();
                continue;
            }

            namespace.child(translate(pou.get(), body.get()));
            stats.countPou();
        }
    }

    XmlNode translate(Pou pou, String body) {
        switch (pou.getPouType()) {
            case PROGRAM:
                return populate(new Program(), pou, body).toNode();
            case FUNCTION:
                return populate(new Function(), pou, body).toNode();
            case FUNCTION_BLOCK:
                return populate(new FunctionBlock(), pou, body).toNode();
            default:
                throw new IllegalArgumentException("Unsupported POU type " + pou.getPouType());
        }
    }

    private <T extends PouDeclaration<T>> T populate(T element, Pou pou, String body) {
        element.withName(pou.getName());
        if (element.hasResultType()) {
            String returnType = pou.getReturnTypeName();
            element.withResultType(returnType == null || returnType.isBlank() ? SmcSchema.DEFAULT_RESULT_TYPE : returnType);
        }
        element.withMetadata(creationDateTime);

        Map<VariableRole, List<Variable>> classified = classify(pou);

        Parameters parameters = new Parameters();
        boolean hasParameters = false;
        for (VariableRole role : VariableRole.values()) {
            List<Variable> variables = classified.get(role);
            if (variables == null || variables.isEmpty()) {
                continue;
            }
            if (role.isParameter()) {
                parameters.child(container(role).children(variables));
                hasParameters = true;
            }
        }
        if (hasParameters) {
            element.child(parameters);
        }
        for (VariableRole role : VariableRole.values()) {
            List<Variable> variables = classified.get(role);
            if (!role.isParameter() && variables != null && !variables.isEmpty()) {
                element.child(container(role).children(variables));
            }
        }

        return element.withBody(body);
    }

    /**
     * Groups the POU's variables by role, in declaration order, assigning {@code orderWithinParamSet}
     * to order-sensitive ones.
     */
    Map<VariableRole, List<Variable>> classify(Pou pou) {
        Map<VariableRole, List<Variable>> classified = new EnumMap<>(VariableRole.class);
        long position = 0;

        for (VariableBlock block : pou.getVariableBlocks()) {
            VariableRole role = VariableRole.of(block);
            if (role == null) {
                log.debug("Ignoring {} block in {}", block.getType(), pou.getName());
                continue;
            }
            for (VariableDeclaration declaration : block.getVariables()) {
                Optional<Variable> element = variableFactory.create(declaration);
                if (element.isEmpty()) {
                    continue;
                }
                if (role.isOrderSensitive()) {
                    long order = orderTracker.claim(pou.getName(), position);
                    position = Math.addExact(position, 1L);
                    element.get().withOrderWithinParamSet(order);
                }
                classified.computeIfAbsent(role, r -> new ArrayList<>()).add(element.get());
            }
        }
        return classified;
    }

    private static XmlElement<?> container(VariableRole role) {
        switch (role) {
            case INPUT:
                return new InputVars();
            case OUTPUT:
                return new OutputVars();
            case IN_OUT:
                return new InOutVars();
            case EXTERNAL_CONSTANT:
                return ExternalVars.bucket(true);
            case EXTERNAL:
                return ExternalVars.bucket(false);
            case LOCAL_CONSTANT_RETAIN:
                return Vars.bucket(true, true);
            case LOCAL_CONSTANT:
                return Vars.bucket(true, false);
            case LOCAL_RETAIN:
                return Vars.bucket(false, true);
            case LOCAL:
                return Vars.bucket(false, false);
            case TEMP_CONSTANT:
                return TempVars.bucket(true);
            case TEMP:
                return TempVars.bucket(false);
            default:
                throw new IllegalArgumentException("Unknown role " + role);
        }
    }
}
