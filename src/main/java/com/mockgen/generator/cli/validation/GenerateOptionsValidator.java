package com.mockgen.generator.cli.validation;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.lang.model.SourceVersion;

import com.mockgen.generator.cli.exception.OptionsValidationException;
import com.mockgen.generator.cli.model.GenerateOptions;
import com.mockgen.generator.cli.model.ValidatedGenerateOptions;
import com.mockgen.generator.codegen.destination.DestinationResolver;
import com.mockgen.generator.codegen.model.request.ExtractionRequest;
import com.mockgen.generator.codegen.model.request.PackageRequest;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;

public class GenerateOptionsValidator {

	private final Path workingDirectory;

	public GenerateOptionsValidator() {
		this(Path.of("").toAbsolutePath());
	}

	public GenerateOptionsValidator(Path workingDirectory) {
		this.workingDirectory = workingDirectory;
	}

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<String> args = o.getArgs() == null ? List.of() : o.getArgs();
		ExtractionRequest request = null;
		int interfaceCount = 0;

		if (args.isEmpty()) {
			errors.add("Expected a package and interface names, or a single .java file.");
		} else if (args.size() == 1 && args.get(0).endsWith(".java")) {
			Path sourceFile = workingDirectory.resolve(args.get(0)).normalize();
			if (!Files.isRegularFile(sourceFile)) {
				errors.add("Source file does not exist: " + sourceFile);
			}
			request = new SourceFileRequest(sourceFile);
			interfaceCount = 1;
		} else if (args.size() == 1) {
			errors.add("Missing interface names after package " + args.get(0) + ".");
		} else {
			String packageName = args.get(0);
			List<String> interfaceNames = args.subList(1, args.size());
			if (!isQualifiedName(packageName)) {
				errors.add("Not a valid package name: " + packageName);
			}
			for (String name : interfaceNames) {
				if (!isQualifiedName(name)) {
					errors.add("Not a valid interface name: " + name);
				}
			}
			request = PackageRequest.builder().packageName(packageName).interfaceNames(interfaceNames).build();
			interfaceCount = interfaceNames.size();
		}

		if (o.getOutput() != null && o.getOutputDir() != null) {
			errors.add("--output and --output-dir are mutually exclusive.");
		}
		if (o.getOutput() != null && interfaceCount > 1) {
			errors.add("--output names a single file; it cannot be used with " + interfaceCount + " interfaces. Use --output-dir.");
		}
		if (o.getOutput() != null && !o.getOutput().toString().endsWith(".java")) {
			errors.add("--output must name a .java file: " + o.getOutput());
		}
		if (o.isUseSourceParser() && interfaceCount > 1) {
			errors.add("--use-source-parser handles exactly one interface per run, got " + interfaceCount + ".");
		}
		if (o.getMatchersDir() != null && !o.isGenerateMatchers()) {
			errors.add("--matchers-dir requires --generate-matchers.");
		}
		if (o.getPackageName() != null && !o.getPackageName().isEmpty() && !isQualifiedName(o.getPackageName())) {
			errors.add("Not a valid package name: " + o.getPackageName());
		}

		for (Path root : o.getSourceRoots()) {
			if (!Files.isDirectory(root)) {
				errors.add("Source root does not exist or is not a directory: " + root);
			}
		}
		List<Path> classpath = parseClasspath(o.getClasspath(), errors);

		Path outputFile = o.getOutput() == null ? null : workingDirectory.resolve(o.getOutput()).normalize();
		Path outputDir = o.getOutputDir() == null ? null : workingDirectory.resolve(o.getOutputDir()).normalize();

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path packageDir = outputFile != null ? outputFile.getParent() : outputDir;
		String packageName = new DestinationResolver(workingDirectory).resolvePackage(o.getPackageName(), packageDir);

		return new ValidatedGenerateOptions(request, outputFile, outputDir, packageName, classpath, workingDirectory);
	}

	private static boolean isQualifiedName(String name) {
		return name != null && SourceVersion.isName(name);
	}

	private static List<Path> parseClasspath(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}

		List<Path> result = Arrays.stream(raw.split(File.pathSeparator)).map(String::trim).filter(s -> !s.isEmpty())
				.map(Path::of).toList();

		for (Path p : result) {
			if (!Files.exists(p)) {
				errors.add("Classpath entry does not exist: " + p);
			}
		}

		return result;
	}
}
