package io.patternkit.patterns.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SaveFileDialogTest {

    @Test
    void strategy_decides_extension() {
        assertEquals("file.doc", new SaveFileDialog(new DocFileStrategy()).save("file"));
        assertEquals("file.txt", new SaveFileDialog(new TextFileStrategy()).save("file"));
    }

    @Test
    void custom_strategy_can_be_plugged_in() {
        var dialog = new SaveFileDialog(name -> "/tmp/" + name + ".md");
        assertEquals("/tmp/notes.md", dialog.save("notes"));
    }

    @Test
    void blank_names_rejected() {
        var dialog = new SaveFileDialog(new TextFileStrategy());
        assertThrows(IllegalArgumentException.class, () -> dialog.save(" "));
        assertThrows(IllegalArgumentException.class, () -> dialog.save(null));
    }
}
