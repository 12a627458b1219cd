package org.zarumet.data;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class LazyLibraryTest {

    private FakeDaemonClient daemon;
    private LazyLibrary library;

    @Before
    public void setUp() throws IOException {
        daemon = new FakeDaemonClient();
        daemon.songs.add(FakeDaemonClient.song("b/1.flac", "First", "Bob", "Hits", "bob", 1, 1));
        daemon.songs.add(FakeDaemonClient.song("b/2.flac", "Second", "Bob", "Hits", "bob", 1, 2));
        daemon.songs.add(FakeDaemonClient.song("a/1.flac", "Only", "Ann", "Hits", "Ann", 1, 1));
        daemon.songs.add(FakeDaemonClient.song("a/2.flac", "Other", "Ann", "Demos", "Ann", 1, 1));
        daemon.songs.add(FakeDaemonClient.song("x/1.flac", "Untagged", "Nobody", "Loose", null, 1, 1));
        library = new LibraryLoader().initLazyLibrary(daemon);
    }

    private static List<String> indexNames(List<AlbumEntry> index) {
        final List<String> result = new ArrayList<>();
        for (AlbumEntry entry : index) {
            result.add(entry.album.name + "/" + entry.artistName);
        }
        return result;
    }

    @Test
    public void startsWithSortedDistinctArtistsNoneLoaded() {
        assertEquals(2, library.size());
        assertEquals("Ann", library.getArtist(0).name);
        assertEquals("bob", library.getArtist(1).name);
        assertSame(LazyArtist.NotLoaded.INSTANCE, library.getArtist(0).getAlbumState());
        assertFalse(library.isLoaded(0));
        assertTrue(library.getAlbumsFor(0).isEmpty());
        assertTrue(library.getAlbumIndex().isEmpty());
        assertFalse(library.isFullyLoaded());
        assertEquals(0, daemon.findRequests.get());
    }

    @Test
    public void loadingAnArtistGroupsAndSortsItsSongs() throws IOException {
        assertTrue(library.loadArtist(1));
        assertTrue(library.isLoaded(1));
        final List<Album> albums = library.getAlbumsFor(1);
        assertEquals(1, albums.size());
        assertEquals("Hits", albums.get(0).name);
        assertEquals("First", albums.get(0).tracks.get(0).title);
        assertEquals("Second", albums.get(0).tracks.get(1).title);
        assertEquals(Arrays.asList("Hits/bob"), indexNames(library.getAlbumIndex()));
        assertFalse(library.isFullyLoaded());
    }

    @Test
    public void loadingTwiceQueriesOnce() throws IOException {
        assertTrue(library.loadArtist(0));
        assertFalse(library.loadArtist(0));
        assertEquals(1, daemon.findRequests.get());
        assertEquals(2, library.getAlbumIndex().size());
    }

    @Test
    public void indexStaysSortedAcrossLoads() throws IOException {
        library.loadArtist(1);
        library.loadArtist(0);
        assertEquals(Arrays.asList("Demos/Ann", "Hits/Ann", "Hits/bob"), indexNames(library.getAlbumIndex()));
        assertTrue(library.isFullyLoaded());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsIndexPastEnd() throws IOException {
        library.loadArtist(2);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsNegativeIndex() throws IOException {
        library.loadArtist(-1);
    }

    @Test
    public void queryFailureLeavesArtistUnloaded() {
        daemon.findFails = true;
        try {
            library.loadArtist(0);
            fail("Expected the load to fail");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("Ann"));
        }
        assertFalse(library.isLoaded(0));
        assertTrue(library.getAlbumIndex().isEmpty());
    }

    @Test
    public void materializeLoadsEverythingRemaining() throws IOException {
        library.loadArtist(0);
        final Library complete = library.materialize();
        assertTrue(library.isFullyLoaded());
        assertEquals(2, daemon.findRequests.get());
        assertEquals(2, complete.getArtists().size());
        assertEquals(4, complete.getTrackCount());
        assertEquals(Arrays.asList("Demos/Ann", "Hits/Ann", "Hits/bob"), indexNames(complete.getAlbumIndex()));
    }

    @Test
    public void materializeLeavesOutArtistsWithoutSongs() throws IOException {
        final Track vanished = FakeDaemonClient.song("g/1.flac", "Gone", "Ghost", "Echoes", "Ghost", 1, 1);
        daemon.songs.add(vanished);
        final LazyLibrary withGhost = new LibraryLoader().initLazyLibrary(daemon);
        assertEquals(3, withGhost.size());
        daemon.songs.remove(vanished);

        final Library complete = withGhost.materialize();
        assertTrue(withGhost.isFullyLoaded());
        final List<String> names = new ArrayList<>();
        for (Artist artist : complete.getArtists()) {
            names.add(artist.name);
            assertFalse(artist.albums.isEmpty());
        }
        assertEquals(Arrays.asList("Ann", "bob"), names);
        assertEquals(4, complete.getTrackCount());
    }

    @Test
    public void emptyLibraryIsAlreadyComplete() throws IOException {
        final LazyLibrary empty = new LibraryLoader().initLazyLibrary(new FakeDaemonClient());
        assertEquals(0, empty.size());
        assertTrue(empty.isFullyLoaded());
        assertTrue(empty.materialize().getArtists().isEmpty());
    }
}
