package io.patternkit.patterns.strategy;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Save dialog whose file naming is delegated to a {@link SaveStrategy}
 * chosen by the caller at construction time.
 */
public final class SaveFileDialog {
    private static final Logger log = Logger.getLogger(SaveFileDialog.class.getName());

    private final SaveStrategy strategy;

    public SaveFileDialog(SaveStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * @return the path chosen by the strategy
     * @throws IllegalArgumentException if fileName is null or blank
     */
    public String save(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
        String path = strategy.save(fileName);
        log.info("Saved in " + path);
        return path;
    }
}
