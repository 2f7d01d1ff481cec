package io.patternkit.patterns.iterator;

import java.util.List;

/**
 * A collection of songs that can be walked with a for-each loop without the
 * caller knowing how the library stores them.
 */
public interface MusicLibrary extends Iterable<Song> {

    /** Read-only view of the songs, in play order. */
    List<Song> songs();

    @Override
    MusicLibraryIterator iterator();
}
