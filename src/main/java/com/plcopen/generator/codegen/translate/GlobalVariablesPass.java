package com.plcopen.generator.codegen.translate;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.core.context.GenerationStats;
import com.plcopen.generator.codegen.model.input.CompilationUnit;
import com.plcopen.generator.codegen.model.input.VariableBlock;
import com.plcopen.generator.codegen.model.input.VariableBlockType;
import com.plcopen.generator.codegen.model.input.VariableDeclaration;
import com.plcopen.generator.codegen.xml.XmlNode;
import com.plcopen.generator.codegen.xml.smc.Configuration;
import com.plcopen.generator.codegen.xml.smc.GlobalVars;
import com.plcopen.generator.codegen.xml.smc.Resource;
import com.plcopen.generator.codegen.xml.smc.Variable;

/**
 * Appends a unit's global variables under {@code Instances} as
 * {@code Configuration/Resource/GlobalVars}.
 *
 * Variables are split into four containers by their block's constant and retain flags:
 * constant+retain, constant, retain, plain. All four are written even when empty.
 */
public class GlobalVariablesPass {

    private static final Logger log = LoggerFactory.getLogger(GlobalVariablesPass.class);

    private final VariableElementFactory variableFactory;
    private final GenerationStats stats;

    public GlobalVariablesPass(VariableElementFactory variableFactory, GenerationStats stats) {
        this.variableFactory = variableFactory;
        this.stats = stats;
    }

    public void apply(XmlNode document, CompilationUnit unit) throws AnchorNotFoundException {
        XmlNode instances = DocumentAnchors.instances(document);

        GlobalVars constantRetain = GlobalVars.bucket(true, true);
        GlobalVars constant = GlobalVars.bucket(true, false);
        GlobalVars retain = GlobalVars.bucket(false, true);
        GlobalVars plain = GlobalVars.bucket(false, false);

        int emitted = 0;
        for (VariableBlock block : unit.getGlobalVariableBlocks()) {
            if (block.getType() != VariableBlockType.GLOBAL) {
                log.debug("Skipping {} block in globals of {}", block.getType(), unit.getFileName());
                stats.countSkipped(block.getVariables().size());
                continue;
            }

            GlobalVars bucket;
            if (block.isConstant()) {
                bucket = block.isRetain() ? constantRetain : constant;
            } else {
                bucket = block.isRetain() ? retain : plain;
            }

            for (VariableDeclaration declaration : block.getVariables()) {
                Optional<Variable> element = variableFactory.create(declaration);
                if (element.isEmpty()) {
                    stats.countSkipped();
                    continue;
                }
                bucket.child(element.get());
                stats.countGlobalVariable();
                emitted++;
            }
        }

        String unitName = unit.getBaseName();
        instances.child(Configuration.forUnit(unitName,
                Resource.forUnit(unitName, List.of(constantRetain, constant, retain, plain))));
        log.debug("Wrote {} global variables for {}", emitted, unitName);
    }
}
