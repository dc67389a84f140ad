package com.mockgen.generator.codegen.extract;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.AccessSpecifier;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.ReferenceType;
import com.github.javaparser.resolution.UnsolvedSymbolException;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedParameterDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedTypeParameterDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.javaparsermodel.declarations.JavaParserInterfaceDeclaration;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ClassLoaderTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.github.javaparser.utils.Pair;
import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.exception.MockGenException;
import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.MethodSignature;
import com.mockgen.generator.codegen.model.Parameter;
import com.mockgen.generator.codegen.model.TypeParameter;
import com.mockgen.generator.codegen.model.TypeRef;
import com.mockgen.generator.codegen.model.request.ExtractionRequest;
import com.mockgen.generator.codegen.model.request.PackageRequest;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;

/**
 * Extracts interface models by parsing source with JavaParser and resolving every type through
 * the symbol solver (JDK, source roots, classpath).
 *
 * Keeps declared parameter names. Handles exactly one interface per run. Own methods come
 * first in declaration order, followed by the methods of each extended interface.
 */
public class SyntacticInterfaceExtractor implements InterfaceExtractor {
    private static final Logger log = LoggerFactory.getLogger(SyntacticInterfaceExtractor.class);

    private final List<Path> sourceRoots;
    private final List<Path> classpath;
    private final ResolvedTypeMapper typeMapper = new ResolvedTypeMapper();

    public SyntacticInterfaceExtractor(List<Path> sourceRoots, List<Path> classpath) {
        this.sourceRoots = List.copyOf(sourceRoots);
        this.classpath = List.copyOf(classpath);
    }

    @Override
    public List<InterfaceModel> extract(ExtractionRequest request) {
        if (request instanceof PackageRequest packageRequest) {
            return List.of(extractFromPackage(packageRequest));
        }
        if (request instanceof SourceFileRequest fileRequest) {
            return List.of(extractFromFile(fileRequest.getSourceFile()));
        }
        throw new ExtractionException("Unsupported extraction request: " + request.describe());
    }

    private InterfaceModel extractFromPackage(PackageRequest request) {
        if (request.getInterfaceNames().size() != 1) {
            throw new ExtractionException("The source parser handles exactly one interface per run, got "
                    + request.getInterfaceNames().size() + ": " + String.join(", ", request.getInterfaceNames()));
        }
        String interfaceName = request.getInterfaceNames().get(0);
        String topLevelName = interfaceName.contains(".")
                ? interfaceName.substring(0, interfaceName.indexOf('.'))
                : interfaceName;
        Path relative = Path.of(request.getPackageName().replace('.', '/')).resolve(topLevelName + ".java");

        Path sourceFile = sourceRoots.stream()
                .map(root -> root.resolve(relative))
                .filter(Files::isRegularFile)
                .findFirst()
                .orElseThrow(() -> new ExtractionException("Interface not found: no " + relative
                        + " below source roots " + sourceRoots));

        JavaParser parser = createParser(sourceRoots);
        CompilationUnit unit = parse(parser, sourceFile);
        ClassOrInterfaceDeclaration declaration = findNested(unit, interfaceName)
                .orElseThrow(() -> new ExtractionException("Interface not found: " + interfaceName + " in " + sourceFile));
        return buildModel(declaration, request.getPackageName(), interfaceName);
    }

    private InterfaceModel extractFromFile(Path sourceFile) {
        if (!Files.isRegularFile(sourceFile)) {
            throw new ExtractionException("Source file not found: " + sourceFile);
        }
        List<Path> roots = new ArrayList<>(sourceRoots);
        JavaParser probe = createParser(List.of());
        CompilationUnit probeUnit = parse(probe, sourceFile);
        String packageName = probeUnit.getPackageDeclaration().map(PackageDeclaration::getNameAsString).orElse("");
        Path inferredRoot = inferSourceRoot(sourceFile, packageName);
        if (inferredRoot != null && !roots.contains(inferredRoot)) {
            roots.add(inferredRoot);
        }

        CompilationUnit unit = parse(createParser(roots), sourceFile);
        List<ClassOrInterfaceDeclaration> interfaces = new ArrayList<>();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            if (type instanceof ClassOrInterfaceDeclaration candidate && candidate.isInterface()) {
                interfaces.add(candidate);
            }
        }
        if (interfaces.isEmpty()) {
            throw new ExtractionException("No interface declared in " + sourceFile);
        }
        if (interfaces.size() > 1) {
            throw new ExtractionException("Ambiguous source file " + sourceFile + ": it declares "
                    + interfaces.size() + " interfaces, but the source parser handles exactly one");
        }
        ClassOrInterfaceDeclaration declaration = interfaces.get(0);
        return buildModel(declaration, packageName, declaration.getNameAsString());
    }

    private JavaParser createParser(List<Path> roots) {
        // Shared with the source-root solvers so that super-interfaces they parse resolve their types too
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        CombinedTypeSolver typeSolver = new CombinedTypeSolver(new ReflectionTypeSolver());
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                typeSolver.add(new JavaParserTypeSolver(root, configuration));
            } else {
                log.warn("Ignoring source root that is not a directory: {}", root);
            }
        }
        List<URL> classDirectories = new ArrayList<>();
        for (Path entry : classpath) {
            try {
                if (Files.isDirectory(entry)) {
                    classDirectories.add(entry.toUri().toURL());
                } else if (entry.toString().endsWith(".jar")) {
                    typeSolver.add(new JarTypeSolver(entry));
                }
            } catch (IOException e) {
                throw new ExtractionException("Cannot read classpath entry " + entry + ": " + e.getMessage(), e);
            }
        }
        if (!classDirectories.isEmpty()) {
            typeSolver.add(new ClassLoaderTypeSolver(new URLClassLoader(classDirectories.toArray(new URL[0]),
                    SyntacticInterfaceExtractor.class.getClassLoader())));
        }

        configuration.setSymbolResolver(new JavaSymbolSolver(typeSolver));
        return new JavaParser(configuration);
    }

    private CompilationUnit parse(JavaParser parser, Path sourceFile) {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(sourceFile);
        } catch (IOException e) {
            throw new ExtractionException("Cannot read source file " + sourceFile + ": " + e.getMessage(), e);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ExtractionException("Unparseable source " + sourceFile + ": " + result.getProblems());
        }
        return result.getResult().get();
    }

    private static Optional<ClassOrInterfaceDeclaration> findNested(CompilationUnit unit, String dottedName) {
        String[] parts = dottedName.split("\\.");
        List<? extends BodyDeclaration<?>> candidates = unit.getTypes();
        ClassOrInterfaceDeclaration found = null;
        for (String part : parts) {
            found = null;
            for (BodyDeclaration<?> candidate : candidates) {
                if (candidate instanceof ClassOrInterfaceDeclaration type && type.getNameAsString().equals(part)) {
                    found = type;
                    break;
                }
            }
            if (found == null) {
                return Optional.empty();
            }
            candidates = found.getMembers();
        }
        return found != null && found.isInterface() ? Optional.of(found) : Optional.empty();
    }

    private static Path inferSourceRoot(Path sourceFile, String packageName) {
        Path root = sourceFile.toAbsolutePath().normalize().getParent();
        if (!packageName.isEmpty()) {
            for (int i = 0; i < packageName.split("\\.").length && root != null; i++) {
                root = root.getParent();
            }
        }
        return root;
    }

    private InterfaceModel buildModel(ClassOrInterfaceDeclaration declaration, String packageName, String interfaceName) {
        String qualifiedName = packageName.isEmpty() ? interfaceName : packageName + "." + interfaceName;
        log.debug("Parsing interface {}", qualifiedName);
        try {
            List<TypeParameter> typeParameters = new ArrayList<>();
            declaration.getTypeParameters().forEach(tp -> typeParameters.add(mapTypeParameter(tp)));

            MethodSetCollector collector = new MethodSetCollector(qualifiedName);
            collectFromAst(declaration, qualifiedName, Map.of(), collector, new LinkedHashSet<>());

            return InterfaceModel.builder()
                    .interfaceName(interfaceName)
                    .sourcePackage(packageName)
                    .typeParameters(typeParameters)
                    .methods(collector.methods())
                    .build()
                    .validate();
        } catch (UnsolvedSymbolException e) {
            throw new ExtractionException("Unresolved type '" + e.getName() + "' in " + qualifiedName
                    + "; check imports and source roots", e);
        } catch (MockGenException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionException("Cannot resolve the types of " + qualifiedName + ": " + e.getMessage(), e);
        }
    }

    private void collectFromAst(ClassOrInterfaceDeclaration declaration, String declaringType,
                                Map<String, TypeRef> bindings, MethodSetCollector collector, Set<String> visited) {
        if (!visited.add(declaringType)) {
            return;
        }
        for (MethodDeclaration method : declaration.getMethods()) {
            if (method.isStatic() || method.isPrivate()) {
                continue;
            }
            MethodSignature signature = toSignature(method);
            if (ObjectMethods.isObjectMethod(signature.getName(), signature.getParameterTypes())) {
                continue;
            }
            collector.add(signature.substitute(bindings), declaringType);
        }
        for (ClassOrInterfaceType extended : declaration.getExtendedTypes()) {
            ResolvedType resolved = extended.resolve();
            collectFromSuperType(resolved.asReferenceType(), bindings, collector, visited);
        }
    }

    private void collectFromSuperType(ResolvedReferenceType superType, Map<String, TypeRef> outer,
                                      MethodSetCollector collector, Set<String> visited) {
        if ("java.lang.Object".equals(superType.getQualifiedName())) {
            return;
        }
        Map<String, TypeRef> bindings = new HashMap<>();
        for (Pair<ResolvedTypeParameterDeclaration, ResolvedType> pair : superType.getTypeParametersMap()) {
            bindings.put(pair.a.getName(), typeMapper.map(pair.b).substitute(outer));
        }

        ResolvedReferenceTypeDeclaration declaration = superType.getTypeDeclaration()
                .orElseThrow(() -> new ExtractionException("Unresolved super-interface " + superType.describe()));
        if (declaration instanceof JavaParserInterfaceDeclaration sourceDeclaration) {
            collectFromAst(sourceDeclaration.getWrappedNode(), declaration.getQualifiedName(), bindings, collector, visited);
            return;
        }
        if (!visited.add(declaration.getQualifiedName())) {
            return;
        }

        List<ResolvedMethodDeclaration> methods = new ArrayList<>(declaration.getDeclaredMethods());
        methods.sort(Comparator.comparing(ResolvedMethodDeclaration::getName)
                .thenComparing(ResolvedMethodDeclaration::getQualifiedSignature));
        for (ResolvedMethodDeclaration method : methods) {
            if (method.isStatic() || method.accessSpecifier() == AccessSpecifier.PRIVATE) {
                continue;
            }
            MethodSignature signature = toSignature(method);
            if (ObjectMethods.isObjectMethod(signature.getName(), signature.getParameterTypes())) {
                continue;
            }
            collector.add(signature.substitute(bindings), declaration.getQualifiedName());
        }
        for (ResolvedReferenceType ancestor : declaration.getAncestors()) {
            collectFromSuperType(ancestor, bindings, collector, visited);
        }
    }

    private MethodSignature toSignature(MethodDeclaration method) {
        MethodSignature.MethodSignatureBuilder builder = MethodSignature.builder().name(method.getNameAsString());
        method.getTypeParameters().forEach(tp -> builder.typeParameter(mapTypeParameter(tp)));

        for (com.github.javaparser.ast.body.Parameter parameter : method.getParameters()) {
            TypeRef type = typeMapper.map(parameter.getType().resolve());
            if (parameter.isVarArgs()) {
                type = TypeRef.array(type).asVariadic();
            }
            builder.param(Parameter.of(parameter.getNameAsString(), type));
        }
        if (!method.getType().isVoidType()) {
            builder.result(typeMapper.map(method.getType().resolve()));
        }
        for (ReferenceType thrown : method.getThrownExceptions()) {
            builder.thrownType(typeMapper.map(thrown.resolve()));
        }
        return builder.build();
    }

    private MethodSignature toSignature(ResolvedMethodDeclaration method) {
        MethodSignature.MethodSignatureBuilder builder = MethodSignature.builder().name(method.getName());
        method.getTypeParameters().forEach(tp -> builder.typeParameter(typeMapper.mapTypeParameter(tp)));

        for (int i = 0; i < method.getNumberOfParams(); i++) {
            ResolvedParameterDeclaration parameter = method.getParam(i);
            TypeRef type = typeMapper.map(parameter.getType());
            if (parameter.isVariadic()) {
                type = type.asVariadic();
            }
            builder.param(Parameter.of(parameter.hasName() ? parameter.getName() : "p" + i, type));
        }
        if (!method.getReturnType().isVoid()) {
            builder.result(typeMapper.map(method.getReturnType()));
        }
        for (ResolvedType thrown : method.getSpecifiedExceptions()) {
            builder.thrownType(typeMapper.map(thrown));
        }
        return builder.build();
    }

    private TypeParameter mapTypeParameter(com.github.javaparser.ast.type.TypeParameter typeParameter) {
        List<TypeRef> bounds = new ArrayList<>();
        for (ClassOrInterfaceType bound : typeParameter.getTypeBound()) {
            TypeRef mapped = typeMapper.map(bound.resolve());
            if (!ResolvedTypeMapper.isObject(mapped)) {
                bounds.add(mapped);
            }
        }
        return TypeParameter.of(typeParameter.getNameAsString(), bounds);
    }
}
