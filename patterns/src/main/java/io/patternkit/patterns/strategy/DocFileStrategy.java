package io.patternkit.patterns.strategy;

public final class DocFileStrategy implements SaveStrategy {
    @Override public String save(String fileName) { return fileName + ".doc"; }
}
