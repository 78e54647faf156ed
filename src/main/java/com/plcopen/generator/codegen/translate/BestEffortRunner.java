package com.plcopen.generator.codegen.translate;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.core.context.ToolDiagnostics;

/**
 * Runs one translation pass so that a missing anchor aborts only that pass.
 * IO failures are not caught and end the run.
 */
public class BestEffortRunner {

    private static final Logger log = LoggerFactory.getLogger(BestEffortRunner.class);

    private final ToolDiagnostics diagnostics;

    @FunctionalInterface
    public interface Pass {
        void run() throws AnchorNotFoundException, IOException;
    }

    public BestEffortRunner(ToolDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @return {@code true} if the pass completed
     */
    public boolean run(String description, Pass pass) throws IOException {
        try {
            pass.run();
            return true;
        } catch (AnchorNotFoundException e) {
            log.warn("Skipping {}: {}", description, e.getMessage());
            diagnostics.warning(description + " skipped: " + e.getMessage());
            return false;
        }
    }
}
