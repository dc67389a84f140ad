package com.mockgen.fixtures;

public interface Waiter {

    void wait(String reason);

    int size();

    String toString();
}
