package com.mockgen.generator.codegen.model.request;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A package plus one or more interface names declared in it.
 */
@Value
@Builder
public class PackageRequest implements ExtractionRequest {

    @NonNull
    String packageName;

    @Singular
    List<String> interfaceNames;

    public static PackageRequest of(String packageName, String... interfaceNames) {
        return PackageRequest.builder().packageName(packageName).interfaceNames(List.of(interfaceNames)).build();
    }

    @Override
    public String describe() {
        return packageName + " " + String.join(" ", interfaceNames);
    }
}
