package io.patternkit.patterns.iterator;

import java.util.List;

/** Iterator handed out by {@link Pandora}. */
public final class PandoraIterator extends MusicLibraryIterator {
    PandoraIterator(List<Song> songs) {
        super(songs);
    }
}
