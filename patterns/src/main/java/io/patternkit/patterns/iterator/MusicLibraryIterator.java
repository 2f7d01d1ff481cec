// file: src/main/java/io/patternkit/patterns/iterator/MusicLibraryIterator.java
package io.patternkit.patterns.iterator;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only cursor over a snapshot of a library's songs.
 * Changes made to the library after the iterator was created are not seen.
 */
public class MusicLibraryIterator implements Iterator<Song> {

    private final List<Song> songs;
    private int current;

    public MusicLibraryIterator(List<Song> songs) {
        this.songs = List.copyOf(songs);
    }

    @Override
    public boolean hasNext() {
        return current < songs.size();
    }

    @Override
    public Song next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more songs (size=" + songs.size() + ")");
        }
        return songs.get(current++);
    }
}
