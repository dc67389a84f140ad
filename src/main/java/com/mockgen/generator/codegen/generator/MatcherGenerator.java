package com.mockgen.generator.codegen.generator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.exception.GenerationException;
import com.mockgen.generator.codegen.model.TypeKind;
import com.mockgen.generator.codegen.model.TypeRef;
import com.mockgen.generator.codegen.model.output.GeneratedArtifact;
import com.mockgen.generator.codegen.model.output.MatcherArtifact;
import com.mockgen.generator.codegen.util.ImportManager;
import com.mockgen.generator.codegen.util.NamingUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Generates one matcher class per distinct non-built-in parameter type referenced by a set of mocks.
 */
public class MatcherGenerator {
    private static final Logger log = LoggerFactory.getLogger(MatcherGenerator.class);

    private static final String TEMPLATE = "matchers.ftl";
    private static final String OWNER_PREFIX = "// Matchers for ";

    private final Configuration freemarkerConfig;

    public MatcherGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Collects the referenced types of all artifacts and renders their matchers.
     * A type referenced from several mocks yields a single matcher.
     *
     * A matcher is named after the simple names in its type. When several types share that name, or
     * {@code directory} already holds a matcher of that name for another type, the package-qualified
     * name is used instead. A type keeps the plain name it already owns on disk.
     *
     * @param packageName package of the matcher classes, "" for the unnamed package
     * @param directory   directory the matcher files are written to
     */
    public List<MatcherArtifact> generate(Collection<GeneratedArtifact> artifacts, String packageName, Path directory) {
        Map<String, TypeRef> distinct = new TreeMap<>();
        for (GeneratedArtifact artifact : artifacts) {
            for (TypeRef type : artifact.getReferencedTypes()) {
                if (needsMatcher(type)) {
                    distinct.putIfAbsent(type.getCanonicalName(), type);
                }
            }
        }

        Map<String, List<TypeRef>> byStem = new TreeMap<>();
        distinct.values().forEach(type -> byStem.computeIfAbsent(NamingUtil.matcherStem(type), k -> new ArrayList<>()).add(type));

        Map<TypeRef, String> stems = new LinkedHashMap<>();
        Set<String> usedNames = new HashSet<>();
        for (Map.Entry<String, List<TypeRef>> entry : byStem.entrySet()) {
            String stem = entry.getKey();
            Optional<String> owner = existingOwner(directory.resolve(stem + "Matchers.java"));
            TypeRef plain = null;
            if (owner.isPresent()) {
                plain = entry.getValue().stream()
                        .filter(type -> type.getCanonicalName().equals(owner.get()))
                        .findFirst()
                        .orElse(null);
            } else if (entry.getValue().size() == 1) {
                plain = entry.getValue().get(0);
            }
            if (plain != null) {
                stems.put(plain, stem);
                usedNames.add(stem);
            }
        }
        for (TypeRef type : distinct.values()) {
            if (!stems.containsKey(type)) {
                String stem = NamingUtil.disambiguateClassName(NamingUtil.qualifiedMatcherStem(type), usedNames);
                stems.put(type, stem);
                usedNames.add(stem);
            }
        }

        List<MatcherArtifact> result = new ArrayList<>();
        for (TypeRef type : distinct.values()) {
            String stem = stems.get(type);
            String className = stem + "Matchers";
            log.debug("Rendering {} for {}", className, type);
            result.add(MatcherArtifact.builder()
                    .typeRef(type)
                    .className(className)
                    .destinationPath(directory.resolve(className + ".java"))
                    .sourceText(render(type, stem, className, packageName))
                    .build());
        }
        return result;
    }

    /**
     * The type a previously generated matcher file was written for, read from its header.
     */
    private static Optional<String> existingOwner(Path matcherFile) {
        if (!Files.isRegularFile(matcherFile)) {
            return Optional.empty();
        }
        try (Stream<String> lines = Files.lines(matcherFile, StandardCharsets.UTF_8)) {
            return lines.limit(3)
                    .filter(line -> line.startsWith(OWNER_PREFIX))
                    .map(line -> line.substring(OWNER_PREFIX.length()).trim())
                    .findFirst();
        } catch (IOException | UncheckedIOException e) {
            throw new GenerationException("Cannot read existing matcher " + matcherFile + ": " + e.getMessage(), e);
        }
    }

    static boolean needsMatcher(TypeRef type) {
        return !type.isBuiltIn() && type.getKind() != TypeKind.WILDCARD && !type.containsTypeVariable();
    }

    private String render(TypeRef type, String stem, String className, String packageName) {
        ImportManager importManager = new ImportManager(packageName);
        importManager.reserve(className);
        importManager.bind("com.mockgen.runtime.ArgumentMatcher");
        importManager.bind("com.mockgen.runtime.Matchers");
        TypeRenderer renderer = new TypeRenderer(importManager);

        String argumentMatcher = importManager.reference("com.mockgen.runtime.ArgumentMatcher");
        String matchers = importManager.reference("com.mockgen.runtime.Matchers");
        String typeName = renderer.renderBoxed(type);

        Map<String, Object> model = new HashMap<>();
        model.put("marker", GeneratedFileMarker.MARKER);
        model.put("canonicalName", type.getCanonicalName());
        model.put("packageName", packageName);
        model.put("imports", importManager.generateImports());
        model.put("className", className);
        model.put("stem", stem);
        model.put("typeName", typeName);
        model.put("argumentMatcher", argumentMatcher);
        model.put("matchers", matchers);

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new GenerationException("Cannot render matchers for " + type.getCanonicalName() + ": " + e.getMessage(), e);
        }
    }
}
