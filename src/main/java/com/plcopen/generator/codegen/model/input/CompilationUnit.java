package com.plcopen.generator.codegen.model.input;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One parsed and validated source file.
 */
@Value
@Builder(toBuilder = true)
public class CompilationUnit {

    @NonNull
    String fileName;

    @Singular("globalVariableBlock")
    List<VariableBlock> globalVariableBlocks;

    @Singular("userType")
    List<DataTypeDeclaration> userTypes;

    @Singular("pou")
    List<Pou> pous;

    @Singular("implementation")
    List<Implementation> implementations;

    /**
     * File name without directories and extension, used to name the unit's configuration.
     */
    public String getBaseName() {
        Path fileNamePart = Path.of(fileName).getFileName();
        String name = fileNamePart == null ? fileName : fileNamePart.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public Optional<Pou> findPou(String pouName) {
        return pous.stream()
                .filter(p -> p.getName().equalsIgnoreCase(pouName))
                .findFirst();
    }
}
