package com.rlang.script.parser;

/** Receives one line of text per executed {@code print}. */
@FunctionalInterface
public interface OutputSink {
    void println(String line);
}
