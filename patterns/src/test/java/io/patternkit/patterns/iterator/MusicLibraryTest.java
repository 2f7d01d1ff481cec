package io.patternkit.patterns.iterator;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class MusicLibraryTest {

    private static final List<Song> SONGS = List.of(new Song("Foo"), new Song("Bar"));

    @Test
    void for_each_walks_songs_in_order() {
        var spotify = new Spotify(SONGS);
        var seen = new ArrayList<String>();
        for (Song s : spotify) {
            seen.add(s.title());
        }
        assertEquals(List.of("Foo", "Bar"), seen);
    }

    @Test
    void each_library_hands_out_its_own_iterator() {
        assertInstanceOf(SpotifyIterator.class, new Spotify(SONGS).iterator());
        assertInstanceOf(PandoraIterator.class, new Pandora(SONGS).iterator());
    }

    @Test
    void next_past_end_throws() {
        var it = new Pandora(List.of(new Song("Only"))).iterator();
        assertTrue(it.hasNext());
        assertEquals("Only", it.next().title());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void iterator_is_a_snapshot() {
        var library = new Spotify(SONGS);
        var it = library.iterator();
        library.add(new Song("Baz"));

        int count = 0;
        while (it.hasNext()) { it.next(); count++; }
        assertEquals(2, count);
        assertEquals(3, library.songs().size());
        assertThrows(UnsupportedOperationException.class, () -> library.songs().clear());
    }
}
