package io.patternkit.patterns.iterator;

import java.util.List;

/** Iterator handed out by {@link Spotify}. */
public final class SpotifyIterator extends MusicLibraryIterator {
    SpotifyIterator(List<Song> songs) {
        super(songs);
    }
}
