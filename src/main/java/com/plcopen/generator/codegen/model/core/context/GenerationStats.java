package com.plcopen.generator.codegen.model.core.context;

import lombok.Data;

/**
 * Counters for a generation run.
 */
@Data
public class GenerationStats {

    private int unitsTranslated;
    private int globalVariables;
    private int dataTypes;
    private int pous;
    private int skipped;

    public void countUnit() {
        unitsTranslated++;
    }

    public void countGlobalVariable() {
        globalVariables++;
    }

    public void countDataType() {
        dataTypes++;
    }

    public void countPou() {
        pous++;
    }

    public void countSkipped() {
        skipped++;
    }

    public void countSkipped(int count) {
        skipped += count;
    }
}
