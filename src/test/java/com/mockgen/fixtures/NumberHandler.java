package com.mockgen.fixtures;

public interface NumberHandler {

    void handle(int value);
}
