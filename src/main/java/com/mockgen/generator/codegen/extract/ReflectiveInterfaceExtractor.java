package com.mockgen.generator.codegen.extract;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.MethodSignature;
import com.mockgen.generator.codegen.model.Parameter;
import com.mockgen.generator.codegen.model.TypeRef;
import com.mockgen.generator.codegen.model.request.ExtractionRequest;
import com.mockgen.generator.codegen.model.request.PackageRequest;

/**
 * Extracts interface models from compiled classes.
 *
 * Compiled metadata carries no parameter names, so parameters are named {@code p0, p1, ...}.
 * Reflection does not guarantee declaration order either; methods are therefore ordered
 * lexicographically by name, which keeps the generated text stable across runs and JVMs.
 */
public class ReflectiveInterfaceExtractor implements InterfaceExtractor {
    private static final Logger log = LoggerFactory.getLogger(ReflectiveInterfaceExtractor.class);

    private final ClassLoader classLoader;
    private final ReflectionTypeMapper typeMapper = new ReflectionTypeMapper();

    public ReflectiveInterfaceExtractor(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Loads interfaces from the given class directories and jars, falling back to the tool's own classpath.
     */
    public static ReflectiveInterfaceExtractor forClasspath(List<Path> classpath) {
        URL[] urls = new URL[classpath.size()];
        for (int i = 0; i < urls.length; i++) {
            try {
                urls[i] = classpath.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new ExtractionException("Invalid classpath entry: " + classpath.get(i), e);
            }
        }
        ClassLoader parent = ReflectiveInterfaceExtractor.class.getClassLoader();
        return new ReflectiveInterfaceExtractor(urls.length == 0 ? parent : new URLClassLoader(urls, parent));
    }

    @Override
    public List<InterfaceModel> extract(ExtractionRequest request) {
        if (!(request instanceof PackageRequest packageRequest)) {
            throw new ExtractionException("Compiled classes cannot be extracted from a source file: "
                    + request.describe() + ". Use the source parser for source files.");
        }
        if (packageRequest.getInterfaceNames().isEmpty()) {
            throw new ExtractionException("No interface name given for package " + packageRequest.getPackageName());
        }

        List<InterfaceModel> models = new ArrayList<>();
        for (String interfaceName : packageRequest.getInterfaceNames()) {
            Class<?> type = loadInterface(packageRequest.getPackageName(), interfaceName);
            models.add(buildModel(packageRequest.getPackageName(), interfaceName, type));
        }
        return models;
    }

    private Class<?> loadInterface(String packageName, String interfaceName) {
        String binaryName = (packageName.isEmpty() ? "" : packageName + ".") + interfaceName.replace('.', '$');
        Class<?> type;
        try {
            type = Class.forName(binaryName, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ExtractionException("Interface not found: " + binaryName.replace('$', '.'), e);
        }
        if (!type.isInterface() || type.isAnnotation()) {
            throw new ExtractionException(type.getName() + " is not an interface");
        }
        return type;
    }

    private InterfaceModel buildModel(String packageName, String interfaceName, Class<?> type) {
        log.debug("Reflecting on {}", type.getName());

        MethodSetCollector collector = new MethodSetCollector(type.getName());
        collectMethods(type, Map.of(), collector);

        List<MethodSignature> methods = collector.methods();
        methods.sort(Comparator.comparing(MethodSignature::getName));

        return InterfaceModel.builder()
                .interfaceName(interfaceName)
                .sourcePackage(packageName)
                .typeParameters(typeMapper.mapTypeParameters(type.getTypeParameters()))
                .methods(methods)
                .build()
                .validate();
    }

    private void collectMethods(Class<?> type, Map<String, TypeRef> bindings, MethodSetCollector collector) {
        Method[] declared = type.getDeclaredMethods();
        Arrays.sort(declared, Comparator.comparing(Method::getName).thenComparing(Method::toGenericString));
        for (Method method : declared) {
            if (!isMockable(method)) {
                continue;
            }
            MethodSignature signature = toSignature(method);
            if (ObjectMethods.isObjectMethod(signature.getName(), signature.getParameterTypes())) {
                continue;
            }
            collector.add(signature.substitute(bindings), type.getName());
        }

        for (Type superInterface : type.getGenericInterfaces()) {
            if (superInterface instanceof ParameterizedType parameterized) {
                Class<?> raw = (Class<?>) parameterized.getRawType();
                collectMethods(raw, bindingsFor(raw, parameterized, bindings), collector);
            } else if (superInterface instanceof Class<?> raw) {
                collectMethods(raw, Map.of(), collector);
            }
        }
    }

    private Map<String, TypeRef> bindingsFor(Class<?> raw, ParameterizedType parameterized, Map<String, TypeRef> outer) {
        TypeVariable<?>[] variables = raw.getTypeParameters();
        Type[] arguments = parameterized.getActualTypeArguments();
        Map<String, TypeRef> bindings = new HashMap<>();
        for (int i = 0; i < variables.length && i < arguments.length; i++) {
            bindings.put(variables[i].getName(), typeMapper.map(arguments[i]).substitute(outer));
        }
        return bindings;
    }

    private static boolean isMockable(Method method) {
        int modifiers = method.getModifiers();
        return !Modifier.isStatic(modifiers) && !Modifier.isPrivate(modifiers) && !method.isSynthetic() && !method.isBridge();
    }

    private MethodSignature toSignature(Method method) {
        MethodSignature.MethodSignatureBuilder builder = MethodSignature.builder()
                .name(method.getName())
                .typeParameters(typeMapper.mapTypeParameters(method.getTypeParameters()));

        Type[] parameterTypes = method.getGenericParameterTypes();
        for (int i = 0; i < parameterTypes.length; i++) {
            TypeRef type = typeMapper.map(parameterTypes[i]);
            if (method.isVarArgs() && i == parameterTypes.length - 1) {
                type = type.asVariadic();
            }
            builder.param(Parameter.of("p" + i, type));
        }

        if (method.getReturnType() != void.class) {
            builder.result(typeMapper.map(method.getGenericReturnType()));
        }
        for (Type thrown : method.getGenericExceptionTypes()) {
            builder.thrownType(typeMapper.map(thrown));
        }
        return builder.build();
    }
}
