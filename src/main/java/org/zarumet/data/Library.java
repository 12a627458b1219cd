package org.zarumet.data;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * <p>A fully loaded library hierarchy: every artist, their albums, and the albums' tracks, along with a flattened
 * index of albums for album-centric browsing.</p>
 *
 * <p>Libraries are immutable. They are built either all at once from the daemon's whole catalog by
 * {@link LibraryLoader#loadLibrary(DaemonClient)}, or by materializing a {@link LazyLibrary}.</p>
 */
@API(status = API.Status.STABLE)
public class Library {

    /**
     * The artists, ordered case-insensitively by name.
     */
    private final List<Artist> artists;

    /**
     * Every album paired with its artist, ordered case-insensitively by album name then artist name.
     */
    private final List<AlbumEntry> albumIndex;

    /**
     * Create a library from artists that have already been grouped and sorted.
     *
     * @param artists the artists, in display order
     */
    Library(List<Artist> artists) {
        this.artists = Collections.unmodifiableList(new ArrayList<>(artists));
        final List<AlbumEntry> index = new ArrayList<>();
        for (Artist artist : artists) {
            for (Album album : artist.albums) {
                index.add(new AlbumEntry(artist.name, album));
            }
        }
        index.sort(LibraryGrouping.ALBUM_ENTRY_ORDER);
        this.albumIndex = Collections.unmodifiableList(index);
    }

    /**
     * Build a library from a flat, unordered catalog of songs, resolving one canonical artist per album.
     *
     * @param catalog every song to be included
     *
     * @return the corresponding library
     */
    @API(status = API.Status.STABLE)
    public static Library fromCatalog(Collection<Track> catalog) {
        return new Library(LibraryGrouping.buildArtists(catalog));
    }

    /**
     * @return the artists, in display order
     */
    @API(status = API.Status.STABLE)
    public List<Artist> getArtists() {
        return artists;
    }

    /**
     * Get the artist at a position in the display order.
     *
     * @param index the position of the artist
     *
     * @return the artist found there
     *
     * @throws IndexOutOfBoundsException if there is no artist at that position
     */
    @API(status = API.Status.STABLE)
    public Artist getArtist(int index) {
        return artists.get(index);
    }

    /**
     * Get the albums of the artist at a position in the display order.
     *
     * @param index the position of the artist
     *
     * @return that artist's albums
     *
     * @throws IndexOutOfBoundsException if there is no artist at that position
     */
    @API(status = API.Status.STABLE)
    public List<Album> getAlbumsFor(int index) {
        return artists.get(index).albums;
    }

    /**
     * @return the flattened album index
     */
    @API(status = API.Status.STABLE)
    public List<AlbumEntry> getAlbumIndex() {
        return albumIndex;
    }

    /**
     * @return how many tracks the library holds across all artists
     */
    @API(status = API.Status.STABLE)
    public int getTrackCount() {
        int count = 0;
        for (AlbumEntry entry : albumIndex) {
            count += entry.album.tracks.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "Library[artists=" + artists.size() + ", albums=" + albumIndex.size() + "]";
    }
}
