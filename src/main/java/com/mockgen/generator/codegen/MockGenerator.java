package com.mockgen.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.destination.DestinationResolver;
import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.exception.MockGenException;
import com.mockgen.generator.codegen.extract.InterfaceExtractor;
import com.mockgen.generator.codegen.extract.ReflectiveInterfaceExtractor;
import com.mockgen.generator.codegen.extract.SyntacticInterfaceExtractor;
import com.mockgen.generator.codegen.generator.MatcherGenerator;
import com.mockgen.generator.codegen.generator.MockClassGenerator;
import com.mockgen.generator.codegen.model.GenerationOptions;
import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.output.GeneratedArtifact;
import com.mockgen.generator.codegen.model.output.GeneratedFile;
import com.mockgen.generator.codegen.model.output.MatcherArtifact;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;
import com.mockgen.generator.codegen.util.FileWriteUtil;

/**
 * Runs one generation: extract the interfaces, render their mocks (and matchers), write the files.
 *
 * Every file is rendered before the first one is written, so a failing interface leaves the
 * destination untouched.
 */
public class MockGenerator {
    private static final Logger log = LoggerFactory.getLogger(MockGenerator.class);

    private final GeneratorConfig config;
    private final InterfaceExtractor reflectiveExtractor;
    private final InterfaceExtractor syntacticExtractor;
    private final DestinationResolver destinationResolver;
    private final MockClassGenerator mockClassGenerator = new MockClassGenerator();
    private final MatcherGenerator matcherGenerator = new MatcherGenerator();

    public MockGenerator(GeneratorConfig config) {
        this(config, null, null);
    }

    /**
     * @param reflectiveExtractor extractor for package requests; null builds one from the configured classpath
     * @param syntacticExtractor  extractor for source files and {@code useSyntacticBackend}; null builds one from
     *                            the configured source roots
     */
    public MockGenerator(GeneratorConfig config, InterfaceExtractor reflectiveExtractor,
                         InterfaceExtractor syntacticExtractor) {
        this.config = config;
        this.reflectiveExtractor = reflectiveExtractor;
        this.syntacticExtractor = syntacticExtractor;
        this.destinationResolver = new DestinationResolver(config.getWorkingDirectory());
    }

    public GeneratorResult generate() {
        try {
            log.info("Extracting {}", config.getRequest().describe());
            List<InterfaceModel> models = selectExtractor().extract(config.getRequest());
            if (config.isDebug()) {
                models.forEach(model -> log.info("Extracted model: {}", model));
            }
            if (config.getOutputFile() != null && models.size() != 1) {
                throw new ExtractionException("--output names a single file but " + models.size()
                        + " interfaces were requested");
            }

            List<GeneratedArtifact> mocks = new ArrayList<>();
            for (InterfaceModel model : models) {
                mocks.add(mockClassGenerator.generate(model, optionsFor(model)));
            }

            List<MatcherArtifact> matchers = List.of();
            if (config.isGenerateMatchers()) {
                GeneratedArtifact first = mocks.get(0);
                Path matchersDir = destinationResolver.resolveMatchersDir(config.getMatchersDir(),
                        first.getDestinationPath().toAbsolutePath().getParent());
                String matchersPackage = DestinationResolver.resolveMatchersPackage(config.getMatchersPackage(),
                        first.getPackageName());
                matchers = matcherGenerator.generate(mocks, matchersPackage, matchersDir);
            }

            List<GeneratedFile> files = new ArrayList<>();
            mocks.forEach(mock -> files.add(mock.toGeneratedFile()));
            matchers.forEach(matcher -> files.add(matcher.toGeneratedFile()));
            int written = writeAll(files);

            log.info("Generated {} mock(s) and {} matcher(s); {} file(s) changed",
                    mocks.size(), matchers.size(), written);
            return GeneratorResult.builder()
                    .success(true)
                    .interfacesProcessed(models.size())
                    .mockFiles(mocks.stream().map(GeneratedArtifact::getDestinationPath).toList())
                    .matcherFiles(matchers.stream().map(MatcherArtifact::getDestinationPath).toList())
                    .filesWritten(written)
                    .build();
        } catch (MockGenException e) {
            log.debug("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (IOException e) {
            log.debug("Generation failed", e);
            return GeneratorResult.failure("I/O error: " + e.getMessage());
        }
    }

    private InterfaceExtractor selectExtractor() {
        boolean syntactic = config.isUseSyntacticBackend() || config.getRequest() instanceof SourceFileRequest;
        if (syntactic) {
            return syntacticExtractor != null
                    ? syntacticExtractor
                    : new SyntacticInterfaceExtractor(config.getSourceRoots(), config.getClasspath());
        }
        return reflectiveExtractor != null
                ? reflectiveExtractor
                : ReflectiveInterfaceExtractor.forClasspath(config.getClasspath());
    }

    private GenerationOptions optionsFor(InterfaceModel model) {
        String defaultName = config.getRequest() instanceof SourceFileRequest fileRequest
                ? fileRequest.getFileStem()
                : model.getInterfaceName();
        String mockClassName = config.getOutputFile() != null
                ? DestinationResolver.classNameOf(config.getOutputFile())
                : DestinationResolver.defaultMockClassName(defaultName);
        Path destination = destinationResolver.resolveMockPath(mockClassName, config.getOutputFile(), config.getOutputDir());

        return GenerationOptions.builder()
                .packageName(config.getPackageName() != null ? config.getPackageName() : model.getSourcePackage())
                .selfPackagePath(config.getSelfPackage())
                .mockClassName(mockClassName)
                .destinationPath(destination)
                .build();
    }

    private int writeAll(List<GeneratedFile> files) throws IOException {
        int written = 0;
        for (GeneratedFile file : files) {
            try {
                if (FileWriteUtil.writeIfChanged(file.getPath(), file.getContents())) {
                    log.debug("Wrote {} {}", file.getType(), file.getPath());
                    written++;
                } else {
                    log.debug("Unchanged {}", file.getPath());
                }
            } catch (IOException e) {
                throw new IOException("Cannot write " + file.getPath() + ": " + e.getMessage(), e);
            }
        }
        return written;
    }
}
