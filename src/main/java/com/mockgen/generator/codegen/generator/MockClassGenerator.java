package com.mockgen.generator.codegen.generator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.exception.GenerationException;
import com.mockgen.generator.codegen.model.GenerationOptions;
import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.MethodSignature;
import com.mockgen.generator.codegen.model.Parameter;
import com.mockgen.generator.codegen.model.TypeKind;
import com.mockgen.generator.codegen.model.TypeRef;
import com.mockgen.generator.codegen.model.output.GeneratedArtifact;
import com.mockgen.generator.codegen.util.ImportManager;
import com.mockgen.generator.codegen.util.NamingUtil;

/**
 * Renders the source of a mock class from an {@link InterfaceModel}.
 *
 * The output depends only on the model and the options, so regenerating from an unchanged
 * interface yields byte-identical text.
 */
public class MockClassGenerator {
    private static final Logger log = LoggerFactory.getLogger(MockClassGenerator.class);

    private static final String RUNTIME_PACKAGE = "com.mockgen.runtime";
    private static final List<String> FRAMEWORK_CLASSES = List.of(
            RUNTIME_PACKAGE + ".ArgumentMatcher",
            RUNTIME_PACKAGE + ".InvocationCount",
            RUNTIME_PACKAGE + ".Matchers",
            RUNTIME_PACKAGE + ".MockController",
            RUNTIME_PACKAGE + ".RecordedCall",
            RUNTIME_PACKAGE + ".ReturnValues",
            RUNTIME_PACKAGE + ".Stubbing",
            RUNTIME_PACKAGE + ".StubbingPolicy",
            RUNTIME_PACKAGE + ".Varargs",
            "java.util.List",
            "java.lang.Object",
            "java.lang.Override",
            "java.lang.SuppressWarnings");

    private static final Set<String> LOCAL_NAMES = Set.of("mockController", "mockResults", "expected", "stubbingPolicy");

    private static final Map<String, String> PRIMITIVE_DEFAULTS = Map.of(
            "boolean", "false",
            "byte", "(byte) 0",
            "short", "(short) 0",
            "char", "'\\0'",
            "int", "0",
            "long", "0L",
            "float", "0.0f",
            "double", "0.0d");

    private static final String INDENT = "    ";

    public GeneratedArtifact generate(InterfaceModel model, GenerationOptions options) {
        log.debug("Rendering {} for {}", options.getMockClassName(), model.getQualifiedName());
        checkSelfPackage(options);
        checkHelperNames(model);

        ImportManager importManager = new ImportManager(options.getPackageName());
        importManager.reserve(options.getMockClassName());
        model.getTypeParameters().forEach(tp -> importManager.reserve(tp.getName()));
        model.getMethods().forEach(m -> m.getTypeParameters().forEach(tp -> importManager.reserve(tp.getName())));
        FRAMEWORK_CLASSES.forEach(importManager::bind);

        TypeRenderer renderer = new TypeRenderer(importManager);
        Set<TypeRef> referencedTypes = new LinkedHashSet<>();

        StringBuilder body = new StringBuilder();
        appendClassHeader(body, model, options, renderer);
        for (MethodSignature method : model.getMethods()) {
            List<Parameter> params = safeParameters(method);
            params.forEach(p -> referencedTypes.add(p.getType().matcherType()));

            body.append('\n');
            appendImplementation(body, method, params, renderer);
            appendWhen(body, method, params, renderer);
            appendVerify(body, method, params, renderer);
            appendCountCalls(body, method, params, renderer);
            appendCalls(body, method, params, renderer);
        }
        body.append("}\n");

        StringBuilder sb = new StringBuilder();
        sb.append(GeneratedFileMarker.MARKER).append('\n');
        sb.append("// Source: ").append(model.getQualifiedName()).append("\n\n");
        if (!options.getPackageName().isEmpty()) {
            sb.append("package ").append(options.getPackageName()).append(";\n\n");
        }
        String imports = importManager.generateImports();
        if (!imports.isEmpty()) {
            sb.append(imports).append('\n');
        }
        sb.append(body);

        return GeneratedArtifact.builder()
                .destinationPath(options.getDestinationPath())
                .packageName(options.getPackageName())
                .className(options.getMockClassName())
                .sourceText(sb.toString())
                .referencedTypes(referencedTypes)
                .build();
    }

    private void appendClassHeader(StringBuilder sb, InterfaceModel model, GenerationOptions options, TypeRenderer renderer) {
        String mockName = options.getMockClassName();
        String mockController = renderer.render(runtimeType("MockController"));
        String stubbingPolicy = renderer.render(runtimeType("StubbingPolicy"));
        String interfaceName = renderer.render(TypeRef.classType(model.getSourcePackage(), model.getInterfaceName()));

        sb.append("/**\n");
        sb.append(" * Mock implementation of {@code ").append(model.getInterfaceName()).append("}.\n");
        sb.append(" */\n");
        sb.append("@SuppressWarnings(\"unchecked\")\n");
        sb.append("public class ").append(mockName).append(renderer.renderTypeParameters(model.getTypeParameters()))
                .append(" implements ").append(interfaceName).append(renderer.renderTypeArguments(model.getTypeParameters()))
                .append(" {\n\n");

        sb.append(INDENT).append("private final ").append(mockController).append(" mockController;\n\n");

        sb.append(INDENT).append("public ").append(mockName).append("() {\n");
        sb.append(INDENT).append(INDENT).append("this(").append(stubbingPolicy).append(".DEFAULT_VALUES);\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append("public ").append(mockName).append("(").append(stubbingPolicy).append(" stubbingPolicy) {\n");
        sb.append(INDENT).append(INDENT).append("this.mockController = new ").append(mockController)
                .append("(\"").append(mockName).append("\", stubbingPolicy);\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append("public ").append(mockController).append(" getMockController() {\n");
        sb.append(INDENT).append(INDENT).append("return mockController;\n");
        sb.append(INDENT).append("}\n");
    }

    private void appendImplementation(StringBuilder sb, MethodSignature method, List<Parameter> params, TypeRenderer renderer) {
        if (method.getResults().size() > 1) {
            throw new GenerationException("Method " + method.getName() + " declares " + method.getResults().size()
                    + " results; a Java method returns at most one value");
        }
        String returnType = method.isVoid() ? "void" : renderer.render(method.getResults().get(0));
        String returnValues = renderer.render(runtimeType("ReturnValues"));

        sb.append(INDENT).append("@Override\n");
        sb.append(INDENT).append("public ").append(typeParameterPrefix(method, renderer)).append(returnType).append(' ')
                .append(method.getName()).append('(').append(declareParameters(params, renderer)).append(')')
                .append(throwsClause(method, renderer)).append(" {\n");

        String invoke = "mockController.invoke(\"" + method.getName() + "\", " + argumentArray(params, renderer) + ", "
                + defaults(method, returnValues) + ");\n";
        if (method.isVoid()) {
            sb.append(INDENT).append(INDENT).append(invoke);
        } else {
            sb.append(INDENT).append(INDENT).append(returnValues).append(" mockResults = ").append(invoke);
            sb.append(INDENT).append(INDENT).append("return (").append(returnType).append(") mockResults.get(0);\n");
        }
        sb.append(INDENT).append("}\n\n");
    }

    private void appendWhen(StringBuilder sb, MethodSignature method, List<Parameter> params, TypeRenderer renderer) {
        String helper = "when" + NamingUtil.toPascalCase(method.getName());
        String stubbing = renderer.render(runtimeType("Stubbing")) + "<"
                + (method.isVoid() ? "Void" : renderer.renderBoxed(method.getResults().get(0))) + ">";
        String matchers = renderer.render(runtimeType("Matchers"));

        if (!allParametersAreMatchers(params)) {
            String equalities = params.stream()
                    .map(p -> matchers + ".eq(" + argumentExpression(p, renderer) + ")")
                    .collect(Collectors.joining(", "));
            sb.append(INDENT).append("public ").append(typeParameterPrefix(method, renderer)).append(stubbing).append(' ')
                    .append(helper).append('(').append(declareParameters(params, renderer)).append(") {\n");
            sb.append(INDENT).append(INDENT).append("return mockController.when(\"").append(method.getName()).append('"')
                    .append(equalities.isEmpty() ? "" : ", " + equalities).append(");\n");
            sb.append(INDENT).append("}\n\n");
        }

        if (!params.isEmpty()) {
            sb.append(INDENT).append("public ").append(typeParameterPrefix(method, renderer)).append(stubbing).append(' ')
                    .append(helper).append('(').append(declareMatchers(params, renderer)).append(") {\n");
            sb.append(INDENT).append(INDENT).append("return mockController.when(\"").append(method.getName()).append("\", ")
                    .append(parameterNames(params)).append(");\n");
            sb.append(INDENT).append("}\n\n");
        }
    }

    private void appendVerify(StringBuilder sb, MethodSignature method, List<Parameter> params, TypeRenderer renderer) {
        String helper = "verify" + NamingUtil.toPascalCase(method.getName());
        String invocationCount = renderer.render(runtimeType("InvocationCount"));

        sb.append(INDENT).append("public void ").append(helper).append('(').append(invocationCount).append(" expected) {\n");
        sb.append(INDENT).append(INDENT).append("mockController.verify(\"").append(method.getName()).append("\", expected);\n");
        sb.append(INDENT).append("}\n\n");

        if (!params.isEmpty()) {
            sb.append(INDENT).append("public ").append(typeParameterPrefix(method, renderer)).append("void ").append(helper)
                    .append('(').append(invocationCount).append(" expected, ").append(declareMatchers(params, renderer))
                    .append(") {\n");
            sb.append(INDENT).append(INDENT).append("mockController.verify(\"").append(method.getName())
                    .append("\", expected, ").append(parameterNames(params)).append(");\n");
            sb.append(INDENT).append("}\n\n");
        }
    }

    private void appendCountCalls(StringBuilder sb, MethodSignature method, List<Parameter> params, TypeRenderer renderer) {
        String helper = "countCallsTo" + NamingUtil.toPascalCase(method.getName());

        sb.append(INDENT).append("public int ").append(helper).append("() {\n");
        sb.append(INDENT).append(INDENT).append("return mockController.countCalls(\"").append(method.getName()).append("\");\n");
        sb.append(INDENT).append("}\n\n");

        if (!params.isEmpty()) {
            sb.append(INDENT).append("public ").append(typeParameterPrefix(method, renderer)).append("int ").append(helper)
                    .append('(').append(declareMatchers(params, renderer)).append(") {\n");
            sb.append(INDENT).append(INDENT).append("return mockController.countCalls(\"").append(method.getName())
                    .append("\", ").append(parameterNames(params)).append(");\n");
            sb.append(INDENT).append("}\n\n");
        }
    }

    private void appendCalls(StringBuilder sb, MethodSignature method, List<Parameter> params, TypeRenderer renderer) {
        String helper = "callsTo" + NamingUtil.toPascalCase(method.getName());
        String callList = renderer.render(TypeRef.classType("java.util", "List", runtimeType("RecordedCall")));

        sb.append(INDENT).append("public ").append(callList).append(' ').append(helper).append("() {\n");
        sb.append(INDENT).append(INDENT).append("return mockController.calls(\"").append(method.getName()).append("\");\n");
        sb.append(INDENT).append("}\n");

        if (!params.isEmpty()) {
            sb.append('\n');
            sb.append(INDENT).append("public ").append(typeParameterPrefix(method, renderer)).append(callList).append(' ')
                    .append(helper).append('(').append(declareMatchers(params, renderer)).append(") {\n");
            sb.append(INDENT).append(INDENT).append("return mockController.calls(\"").append(method.getName())
                    .append("\", ").append(parameterNames(params)).append(");\n");
            sb.append(INDENT).append("}\n");
        }
    }

    private static void checkSelfPackage(GenerationOptions options) {
        // Only the mock's own package is visible without imports
        if (!options.getEffectiveSelfPackage().equals(options.getPackageName())) {
            throw new GenerationException("Self package " + options.getSelfPackagePath()
                    + " differs from the mock's package '" + options.getPackageName()
                    + "'; its types could not be referenced unqualified");
        }
    }

    private static void checkHelperNames(InterfaceModel model) {
        Set<String> methodNames = new HashSet<>();
        model.getMethods().forEach(m -> methodNames.add(m.getName()));
        Map<String, String> suffixOwners = new HashMap<>();
        for (MethodSignature method : model.getMethods()) {
            String suffix = NamingUtil.toPascalCase(method.getName());
            String owner = suffixOwners.putIfAbsent(suffix, method.getName());
            if (owner != null) {
                throw new GenerationException("Methods '" + owner + "' and '" + method.getName() + "' of "
                        + model.getQualifiedName() + " would both get the helpers when" + suffix + " and verify" + suffix);
            }
            for (String helper : List.of("when" + suffix, "verify" + suffix, "countCallsTo" + suffix, "callsTo" + suffix)) {
                if (methodNames.contains(helper)) {
                    throw new GenerationException("Interface " + model.getQualifiedName() + " declares method '" + helper
                            + "', which clashes with the helper generated for '" + method.getName() + "'");
                }
            }
        }
        if (model.getMethods().stream().anyMatch(m -> m.getName().equals("getMockController"))) {
            throw new GenerationException("Interface " + model.getQualifiedName()
                    + " declares method 'getMockController', which clashes with the generated accessor");
        }
    }

    private static List<Parameter> safeParameters(MethodSignature method) {
        Set<String> taken = new HashSet<>(LOCAL_NAMES);
        List<Parameter> result = new ArrayList<>();
        for (Parameter param : method.getParams()) {
            String name = NamingUtil.safeParameterName(param.getName(), taken);
            taken.add(name);
            result.add(param.toBuilder().name(name).build());
        }
        return result;
    }

    private static boolean allParametersAreMatchers(List<Parameter> params) {
        return !params.isEmpty() && params.stream()
                .map(Parameter::getType)
                .allMatch(t -> t.getKind() == TypeKind.CLASS
                        && t.getQualifiedName().equals(RUNTIME_PACKAGE + ".ArgumentMatcher"));
    }

    private static String typeParameterPrefix(MethodSignature method, TypeRenderer renderer) {
        String typeParameters = renderer.renderTypeParameters(method.getTypeParameters());
        return typeParameters.isEmpty() ? "" : typeParameters + " ";
    }

    private static String declareParameters(List<Parameter> params, TypeRenderer renderer) {
        return params.stream()
                .map(p -> renderer.renderParameter(p.getType()) + " " + p.getName())
                .collect(Collectors.joining(", "));
    }

    private static String declareMatchers(List<Parameter> params, TypeRenderer renderer) {
        String argumentMatcher = renderer.render(runtimeType("ArgumentMatcher"));
        return params.stream()
                .map(p -> argumentMatcher + "<? super " + renderer.renderBoxed(p.getType().matcherType()) + "> " + p.getName())
                .collect(Collectors.joining(", "));
    }

    private static String parameterNames(List<Parameter> params) {
        return params.stream().map(Parameter::getName).collect(Collectors.joining(", "));
    }

    private static String argumentArray(List<Parameter> params, TypeRenderer renderer) {
        if (params.isEmpty()) {
            return "new Object[0]";
        }
        return params.stream()
                .map(p -> argumentExpression(p, renderer))
                .collect(Collectors.joining(", ", "new Object[] {", "}"));
    }

    private static String argumentExpression(Parameter param, TypeRenderer renderer) {
        if (param.getType().isVariadic()) {
            return renderer.render(runtimeType("Varargs")) + ".toList(" + param.getName() + ")";
        }
        return param.getName();
    }

    private static String defaults(MethodSignature method, String returnValues) {
        if (method.isVoid()) {
            return returnValues + ".empty()";
        }
        TypeRef result = method.getResults().get(0);
        String value = result.isPrimitive() ? PRIMITIVE_DEFAULTS.get(result.getBaseName()) : "(Object) null";
        return returnValues + ".of(" + value + ")";
    }

    private static String throwsClause(MethodSignature method, TypeRenderer renderer) {
        if (method.getThrownTypes().isEmpty()) {
            return "";
        }
        return method.getThrownTypes().stream().map(renderer::render).collect(Collectors.joining(", ", " throws ", ""));
    }

    private static TypeRef runtimeType(String simpleName) {
        return TypeRef.classType(RUNTIME_PACKAGE, simpleName);
    }
}
