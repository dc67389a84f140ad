package com.mockgen.generator.codegen.generator;

/**
 * First line of every generated file. The remove command deletes only files that start with it,
 * so the text must stay stable.
 */
public final class GeneratedFileMarker {

    public static final String MARKER = "// Code generated by mockgen. DO NOT EDIT.";

    private GeneratedFileMarker() {
    }

    public static boolean isMarker(String firstLine) {
        return firstLine != null && firstLine.strip().equals(MARKER);
    }
}
