package com.mockgen.fixtures;

import java.util.Objects;

public class Widget {

    private final String name;

    public Widget(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Widget && Objects.equals(name, ((Widget) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "Widget(" + name + ")";
    }
}
