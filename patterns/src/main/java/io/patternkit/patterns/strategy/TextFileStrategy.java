package io.patternkit.patterns.strategy;

public final class TextFileStrategy implements SaveStrategy {
    @Override public String save(String fileName) { return fileName + ".txt"; }
}
