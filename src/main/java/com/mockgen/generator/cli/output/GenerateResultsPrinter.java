package com.mockgen.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.cli.model.GenerateOptions;
import com.mockgen.generator.cli.model.ValidatedGenerateOptions;
import com.mockgen.generator.codegen.GeneratorResult;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("mockgen");
        log.info("=================================================");
        log.info("Request: {}", v.getRequest().describe());
        log.info("Backend: {}", o.isUseSourceParser() || v.getRequest() instanceof SourceFileRequest
                ? "source parser" : "reflection");
        log.info("Package: {}", v.getPackageName().isEmpty() ? "(unnamed)" : v.getPackageName());
        if (v.getOutputFile() != null) {
            log.info("Output File: {}", v.getOutputFile());
        } else {
            log.info("Output Directory: {}", v.getOutputDir() != null ? v.getOutputDir() : v.getWorkingDirectory());
        }
        if (o.getSelfPackage() != null) {
            log.info("Self Package: {}", o.getSelfPackage());
        }
        log.info("Matchers: {}", o.isGenerateMatchers()
                ? (o.getMatchersDir() != null ? o.getMatchersDir().toString() : "matchers/ next to the mock")
                : "off");
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Interfaces Processed: {}", result.getInterfacesProcessed());
        for (Path mock : result.getMockFiles()) {
            log.info("  Mock:    {}", mock);
        }
        for (Path matcher : result.getMatcherFiles()) {
            log.info("  Matcher: {}", matcher);
        }
        log.info("Files Changed: {}", result.getFilesWritten());
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
