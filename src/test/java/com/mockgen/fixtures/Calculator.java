package com.mockgen.fixtures;

import java.util.List;
import java.util.Map;

public interface Calculator {

    int add(int a, int b);

    long total();

    boolean ready();

    double ratio(double[] samples);

    char grade(Map<String, ? extends Number> scores);

    <T extends Comparable<T>> T max(List<T> values);

    default String describe() {
        return "calculator";
    }
}
