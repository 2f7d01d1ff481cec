package io.patternkit.patterns.strategy;

/** Decides where (under which name) a file gets saved. */
public interface SaveStrategy {
    /** @return the path the file is saved to */
    String save(String fileName);
}
