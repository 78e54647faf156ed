package com.plcopen.generator.codegen.translate;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.input.VariableDeclaration;
import com.plcopen.generator.codegen.xml.smc.Variable;

/**
 * Builds {@code Variable} elements for globals and POU variables alike.
 */
public class VariableElementFactory {

    private static final Logger log = LoggerFactory.getLogger(VariableElementFactory.class);

    /**
     * Empty when the variable has no type name or was synthesized by the compiler.
     */
    public Optional<Variable> create(VariableDeclaration declaration) {
        if (!declaration.hasTypeName()) {
            log.debug("Skipping variable {}: unresolved type", declaration.getName());
            return Optional.empty();
        }
        if (declaration.isSynthesized()) {
            log.debug("Skipping variable {}: compiler-generated", declaration.getName());
            return Optional.empty();
        }

        Variable element = Variable.named(declaration.getName())
                .withType(declaration.getTypeName())
                .withPublishMode(declaration.getPublishMode());

        if (declaration.getInitializer() != null) {
            element.withInitialValue(ExpressionValues.literal(declaration.getInitializer()).orElse(null));
        }
        return Optional.of(element.withAddress(declaration.getAddress()));
    }
}
