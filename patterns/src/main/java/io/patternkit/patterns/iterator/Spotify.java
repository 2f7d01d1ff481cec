package io.patternkit.patterns.iterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Spotify implements MusicLibrary {

    private final List<Song> songs;

    public Spotify(List<Song> songs) {
        this.songs = new ArrayList<>(songs);
    }

    public void add(Song song) {
        songs.add(song);
    }

    @Override
    public List<Song> songs() {
        return Collections.unmodifiableList(songs);
    }

    @Override
    public SpotifyIterator iterator() {
        return new SpotifyIterator(songs);
    }
}
