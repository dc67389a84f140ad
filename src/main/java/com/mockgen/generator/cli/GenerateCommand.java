package com.mockgen.generator.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.cli.exception.OptionsValidationException;
import com.mockgen.generator.cli.model.GenerateOptions;
import com.mockgen.generator.cli.model.ValidatedGenerateOptions;
import com.mockgen.generator.cli.output.GenerateResultsPrinter;
import com.mockgen.generator.cli.validation.GenerateOptionsValidator;
import com.mockgen.generator.codegen.GeneratorConfig;
import com.mockgen.generator.codegen.GeneratorResult;
import com.mockgen.generator.codegen.MockGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating mocks for the interfaces of a package or a source file.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Generates mocks for the given interfaces: <package> <Interface>... or <File.java>."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator;
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    public GenerateCommand() {
        this(new GenerateOptionsValidator());
    }

    GenerateCommand(GenerateOptionsValidator validator) {
        this.validator = validator;
    }

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid options:{}{}", System.lineSeparator(), e.toReport());
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .request(validated.getRequest())
                .outputFile(validated.getOutputFile())
                .outputDir(validated.getOutputDir())
                .packageName(validated.getPackageName())
                .selfPackage(options.getSelfPackage())
                .debug(options.isDebug())
                .useSyntacticBackend(options.isUseSourceParser())
                .generateMatchers(options.isGenerateMatchers())
                .matchersDir(options.getMatchersDir() == null
                        ? null
                        : validated.getWorkingDirectory().resolve(options.getMatchersDir()).normalize())
                .classpath(validated.getClasspath())
                .sourceRoots(options.getSourceRoots().stream().map(Path::toAbsolutePath).toList())
                .workingDirectory(validated.getWorkingDirectory())
                .build();

        GeneratorResult result = new MockGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }
}
