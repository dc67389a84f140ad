package com.mockgen.generator.codegen.destination;

import java.nio.file.Path;

import com.mockgen.generator.codegen.util.NamingUtil;

/**
 * Computes where mocks and matchers go and which packages they declare, from the
 * command-line flags and the caller's working directory.
 */
public class DestinationResolver {

    public static final String TEST_PACKAGE_SUFFIX = "_test";
    public static final String MATCHERS = "matchers";

    private final Path workingDirectory;

    public DestinationResolver(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    /**
     * Explicit package if given; otherwise the output directory's name, or the working
     * directory's name with a test suffix.
     */
    public String resolvePackage(String explicitPackage, Path outputDir) {
        if (explicitPackage != null) {
            return explicitPackage;
        }
        if (outputDir != null) {
            return NamingUtil.sanitizeIdentifier(fileName(outputDir.toAbsolutePath().normalize()));
        }
        return NamingUtil.sanitizeIdentifier(fileName(workingDirectory)) + TEST_PACKAGE_SUFFIX;
    }

    /**
     * {@code Display} gives {@code MockDisplay}; nested names use the innermost part.
     */
    public static String defaultMockClassName(String interfaceOrFileStem) {
        return "Mock" + interfaceOrFileStem.substring(interfaceOrFileStem.lastIndexOf('.') + 1);
    }

    public Path resolveMockPath(String mockClassName, Path outputFile, Path outputDir) {
        if (outputFile != null) {
            return outputFile;
        }
        Path directory = outputDir != null ? outputDir : workingDirectory;
        return directory.resolve(mockClassName + ".java");
    }

    /**
     * The mock class is named after its file.
     */
    public static String classNameOf(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".java") ? name.substring(0, name.length() - ".java".length()) : name;
    }

    public Path resolveMatchersDir(Path explicitDir, Path mockDirectory) {
        if (explicitDir != null) {
            return explicitDir;
        }
        Path base = mockDirectory != null ? mockDirectory : workingDirectory;
        return base.resolve(MATCHERS);
    }

    public static String resolveMatchersPackage(String explicitPackage, String mockPackage) {
        if (explicitPackage != null) {
            return explicitPackage;
        }
        return mockPackage.isEmpty() ? MATCHERS : mockPackage + "." + MATCHERS;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? "root" : name.toString();
    }
}
