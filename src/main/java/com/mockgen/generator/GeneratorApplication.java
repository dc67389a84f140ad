package com.mockgen.generator;

import com.mockgen.generator.cli.MockgenCommand;
import picocli.CommandLine;

/**
 * Main entry point for mockgen.
 * Generates mock implementations and argument matchers for Java interfaces.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MockgenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
