package io.patternkit.patterns.iterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Pandora implements MusicLibrary {

    private final List<Song> songs;

    public Pandora(List<Song> songs) {
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
    public PandoraIterator iterator() {
        return new PandoraIterator(songs);
    }
}
