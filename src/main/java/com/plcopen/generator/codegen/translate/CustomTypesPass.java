package com.plcopen.generator.codegen.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.model.core.context.GenerationStats;
import com.plcopen.generator.codegen.model.input.AssignmentExpression;
import com.plcopen.generator.codegen.model.input.CompilationUnit;
import com.plcopen.generator.codegen.model.input.DataTypeDeclaration;
import com.plcopen.generator.codegen.model.input.EnumType;
import com.plcopen.generator.codegen.model.input.Expression;
import com.plcopen.generator.codegen.model.input.ExpressionList;
import com.plcopen.generator.codegen.model.input.ReferenceExpression;
import com.plcopen.generator.codegen.model.input.StructType;
import com.plcopen.generator.codegen.model.input.VariableDeclaration;
import com.plcopen.generator.codegen.xml.XmlNode;
import com.plcopen.generator.codegen.xml.smc.DataTypeDecl;
import com.plcopen.generator.codegen.xml.smc.EnumTypeWithNamedValueSpec;
import com.plcopen.generator.codegen.xml.smc.Member;
import com.plcopen.generator.codegen.xml.smc.SmcSchema;
import com.plcopen.generator.codegen.xml.smc.StructTypeSpec;

/**
 * Appends a unit's structs and enumerations to {@code Types/GlobalNamespace} as {@code DataTypeDecl}s.
 */
public class CustomTypesPass {

    private static final Logger log = LoggerFactory.getLogger(CustomTypesPass.class);

    private final GenerationParameters parameters;
    private final EnumeratorConflictResolver enumResolver;
    private final GenerationStats stats;

    public CustomTypesPass(GenerationParameters parameters, EnumeratorConflictResolver enumResolver,
                           GenerationStats stats) {
        this.parameters = parameters;
        this.enumResolver = enumResolver;
        this.stats = stats;
    }

    public void apply(XmlNode document, CompilationUnit unit) throws AnchorNotFoundException {
        XmlNode namespace = DocumentAnchors.globalNamespace(document);

        for (DataTypeDeclaration declaration : unit.getUserTypes()) {
            if (declaration.isAnonymous() || declaration.isSynthesized()) {
                stats.countSkipped();
                continue;
            }

            Optional<DataTypeDecl> element = translate(declaration);
            if (element.isPresent()) {
                namespace.child(element.get());
                stats.countDataType();
            } else {
                stats.countSkipped();
            }
        }
    }

    Optional<DataTypeDecl> translate(DataTypeDeclaration declaration) {
        if (declaration.getDataType() instanceof StructType struct) {
            return translateStruct(declaration.getName(), struct);
        }
        if (declaration.getDataType() instanceof EnumType enumType) {
            return Optional.of(translateEnum(declaration.getName(), enumType));
        }
        log.debug("Skipping type {}: {} is not exported",
                declaration.getName(), declaration.getDataType().getClass().getSimpleName());
        return Optional.empty();
    }

    private Optional<DataTypeDecl> translateStruct(String name, StructType struct) {
        List<Member> members = new ArrayList<>();
        for (VariableDeclaration field : struct.getFields()) {
            if (!field.hasTypeName()) {
                log.debug("Dropping member {}.{}: unresolved type", name, field.getName());
                continue;
            }
            members.add(Member.of(field.getName(), memberTypeName(field.getTypeName())));
        }

        if (members.isEmpty()) {
            log.debug("Skipping struct {}: no members with a known type", name);
            return Optional.empty();
        }
        return Optional.of(DataTypeDecl.named(name).child(new StructTypeSpec().children(members)));
    }

    private String memberTypeName(String typeName) {
        if (parameters.isOutputXmlOmron() && typeName.toLowerCase(Locale.ROOT).contains("string")) {
            return SmcSchema.STRING_PLACEHOLDER_TYPE;
        }
        return typeName;
    }

    private DataTypeDecl translateEnum(String name, EnumType enumType) {
        List<EnumeratorCandidate> candidates = extractCandidates(enumType.getElements());
        return DataTypeDecl.named(name)
                .child(EnumTypeWithNamedValueSpec.finish(enumResolver.resolve(candidates), enumType.getNumericType()));
    }

    /**
     * Members from a single assignment or a list of assignments, with values as decimal text.
     * Elements without an integer literal value are left out.
     */
    static List<EnumeratorCandidate> extractCandidates(Expression elements) {
        List<EnumeratorCandidate> candidates = new ArrayList<>();
        if (elements instanceof ExpressionList list) {
            for (Expression element : list.getElements()) {
                toCandidate(element).ifPresent(candidates::add);
            }
        } else if (elements != null) {
            toCandidate(elements).ifPresent(candidates::add);
        }
        return candidates;
    }

    private static Optional<EnumeratorCandidate> toCandidate(Expression element) {
        if (element instanceof AssignmentExpression assignment
                && assignment.getLeft() instanceof ReferenceExpression reference) {
            return ExpressionValues.enumValue(assignment.getRight())
                    .map(value -> EnumeratorCandidate.of(reference.getName(), value));
        }
        return Optional.empty();
    }
}
