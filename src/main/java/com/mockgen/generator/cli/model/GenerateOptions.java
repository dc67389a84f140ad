package com.mockgen.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(arity = "1..*", paramLabel = "ARGS", description = "A package followed by one or more interface names, or a single .java file")
	private List<String> args = new ArrayList<>();

	@Option(names = { "--output", "-o" }, description = "Output file; only valid with a single interface")
	private Path output;

	@Option(names = { "--output-dir" }, description = "Output directory; mocks are named after their interfaces")
	private Path outputDir;

	@Option(names = { "--package" }, description = "Package of the generated mock (default: current directory name + _test, or the output directory name)")
	private String packageName;

	@Option(names = { "--self-package" }, description = "Full package the mock will be part of; its types are referenced without imports")
	private String selfPackage;

	@Option(names = { "--debug", "-d" }, description = "Log the extracted interface models")
	private boolean debug;

	@Option(names = { "--use-source-parser" }, description = "Extract from source instead of compiled classes (single interface only)")
	private boolean useSourceParser;

	@Option(names = { "--generate-matchers", "-m" }, description = "Generate argument matchers for the types the mocks reference")
	private boolean generateMatchers;

	@Option(names = { "--matchers-dir", "-p" }, description = "Directory for generated matchers (default: matchers/ next to the mock)")
	private Path matchersDir;

	@Option(names = { "--classpath", "-cp" }, description = "Class directories and jars to load interfaces and types from, separated by the platform path separator")
	private String classpath;

	@Option(names = { "--source-root", "-s" }, description = "Source root for resolving types when parsing source (repeatable)")
	private List<Path> sourceRoots = new ArrayList<>();

}
