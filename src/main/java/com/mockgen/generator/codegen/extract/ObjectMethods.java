package com.mockgen.generator.codegen.extract;

import java.util.List;

import com.mockgen.generator.codegen.model.TypeKind;
import com.mockgen.generator.codegen.model.TypeRef;

/**
 * Recognizes interface re-declarations of {@code java.lang.Object}'s public methods, which are never mocked.
 */
final class ObjectMethods {

    private ObjectMethods() {
        // Utility class
    }

    static boolean isObjectMethod(String name, List<TypeRef> parameterTypes) {
        switch (name) {
            case "hashCode":
            case "toString":
            case "getClass":
            case "notify":
            case "notifyAll":
                return parameterTypes.isEmpty();
            case "equals":
                return parameterTypes.size() == 1 && isObject(parameterTypes.get(0));
            case "wait":
                return isWaitSignature(parameterTypes);
            default:
                return false;
        }
    }

    private static boolean isWaitSignature(List<TypeRef> parameterTypes) {
        switch (parameterTypes.size()) {
            case 0:
                return true;
            case 1:
                return isPrimitive(parameterTypes.get(0), "long");
            case 2:
                return isPrimitive(parameterTypes.get(0), "long") && isPrimitive(parameterTypes.get(1), "int");
            default:
                return false;
        }
    }

    private static boolean isPrimitive(TypeRef type, String keyword) {
        return type.isPrimitive() && keyword.equals(type.getBaseName());
    }

    private static boolean isObject(TypeRef type) {
        return type.getKind() == TypeKind.CLASS && "java.lang.Object".equals(type.getQualifiedName());
    }
}
