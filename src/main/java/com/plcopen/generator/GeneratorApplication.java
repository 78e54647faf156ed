package com.plcopen.generator;

import com.plcopen.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the PLCopenXML generator.
 * Writes a Sysmac Studio project file, or copies the XML produced by an earlier
 * compiler step to the requested output path.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
