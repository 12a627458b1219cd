package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>A library hierarchy that is filled in one artist at a time, as the user browses, instead of fetching the
 * daemon's whole catalog up front. It starts out knowing only the artist names; each artist's albums are fetched
 * the first time {@link #loadArtist(int)} is called for it.</p>
 *
 * <p>The flattened album index only ever grows, and always covers every artist loaded so far.</p>
 *
 * <p>Instances are not thread-safe; they belong to the UI loop.</p>
 */
@API(status = API.Status.STABLE)
public class LazyLibrary {

    private static final Logger logger = LoggerFactory.getLogger(LazyLibrary.class);

    /**
     * The tag whose values name the artists, and which is matched when fetching an artist's songs.
     */
    @API(status = API.Status.STABLE)
    public static final String ARTIST_TAG = "AlbumArtist";

    /**
     * The daemon from which artists are loaded.
     */
    private final DaemonClient client;

    /**
     * The artists, ordered case-insensitively by name.
     */
    private final List<LazyArtist> artists;

    /**
     * Albums of every loaded artist, ordered case-insensitively by album name then artist name.
     */
    private final List<AlbumEntry> albumIndex = new ArrayList<>();

    /**
     * Set once every artist has been loaded.
     */
    private boolean fullyLoaded;

    /**
     * Create a library with no albums loaded yet.
     *
     * @param client the daemon from which artists will be loaded
     * @param artistNames the distinct artist names, already filtered and sorted
     */
    LazyLibrary(DaemonClient client, List<String> artistNames) {
        this.client = client;
        final List<LazyArtist> created = new ArrayList<>(artistNames.size());
        for (String name : artistNames) {
            created.add(new LazyArtist(name));
        }
        artists = Collections.unmodifiableList(created);
        fullyLoaded = artists.isEmpty();
    }

    /**
     * Fetch the albums of the artist at a position in the display order, unless they have already been fetched.
     *
     * @param index the position of the artist
     *
     * @return {@code true} if albums were fetched, {@code false} if the artist was already loaded
     *
     * @throws IndexOutOfBoundsException if there is no artist at that position
     * @throws IOException if the daemon could not supply the artist's songs; the artist stays unloaded
     */
    @API(status = API.Status.STABLE)
    public boolean loadArtist(int index) throws IOException {
        Objects.checkIndex(index, artists.size());
        final LazyArtist artist = artists.get(index);
        if (artist.isLoaded()) {
            return false;
        }
        final List<Track> tracks;
        try {
            tracks = client.find(ARTIST_TAG, artist.name, null);
        } catch (IOException e) {
            throw new IOException("Unable to load albums for artist " + artist.name, e);
        }
        final List<Track> filed = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            filed.add(track.withAlbumArtist(artist.name));
        }
        final List<Album> albums = LibraryGrouping.groupIntoAlbums(filed);
        artist.load(albums);
        final int added = LibraryGrouping.mergeIntoIndex(albumIndex, artist.name, albums);
        fullyLoaded = artists.stream().allMatch(LazyArtist::isLoaded);
        logger.debug("Loaded {} albums ({} new in index) for artist {}, fully loaded: {}", albums.size(), added,
                artist.name, fullyLoaded);
        return true;
    }

    /**
     * Load every artist that has not been loaded yet, one after another, and return the complete hierarchy.
     *
     * @return a library with the same shape the eager loader builds, so artists whose songs have all gone are left
     *         out
     *
     * @throws IOException if any artist could not be loaded; artists loaded before the failure stay loaded
     */
    @API(status = API.Status.STABLE)
    public Library materialize() throws IOException {
        for (int i = 0; i < artists.size(); i++) {
            loadArtist(i);
        }
        final List<Artist> complete = new ArrayList<>(artists.size());
        for (LazyArtist artist : artists) {
            final List<Album> albums = ((LazyArtist.Loaded) artist.getAlbumState()).albums;
            if (albums.isEmpty()) {
                logger.debug("Leaving out artist {}, who no longer has any songs.", artist.name);
            } else {
                complete.add(new Artist(artist.name, albums));
            }
        }
        return new Library(complete);
    }

    /**
     * @return how many artists the library knows about
     */
    @API(status = API.Status.STABLE)
    public int size() {
        return artists.size();
    }

    /**
     * @return the artists, in display order
     */
    @API(status = API.Status.STABLE)
    public List<LazyArtist> getArtists() {
        return artists;
    }

    /**
     * Get the artist at a position in the display order.
     *
     * @param index the position of the artist
     *
     * @return the artist, which may not be loaded yet
     *
     * @throws IndexOutOfBoundsException if there is no artist at that position
     */
    @API(status = API.Status.STABLE)
    public LazyArtist getArtist(int index) {
        return artists.get(index);
    }

    /**
     * Get the albums of the artist at a position in the display order, if they have been loaded.
     *
     * @param index the position of the artist
     *
     * @return the artist's albums, or an empty list if they have not been loaded yet
     *
     * @throws IndexOutOfBoundsException if there is no artist at that position
     */
    @API(status = API.Status.STABLE)
    public List<Album> getAlbumsFor(int index) {
        final LazyArtist.AlbumState state = artists.get(index).getAlbumState();
        if (state instanceof LazyArtist.Loaded) {
            return ((LazyArtist.Loaded) state).albums;
        }
        return Collections.emptyList();
    }

    /**
     * Check whether the albums of the artist at a position have been loaded.
     *
     * @param index the position of the artist
     *
     * @return {@code true} if they have
     *
     * @throws IndexOutOfBoundsException if there is no artist at that position
     */
    @API(status = API.Status.STABLE)
    public boolean isLoaded(int index) {
        return artists.get(index).isLoaded();
    }

    /**
     * @return {@code true} once every artist has been loaded
     */
    @API(status = API.Status.STABLE)
    public boolean isFullyLoaded() {
        return fullyLoaded;
    }

    /**
     * @return an unmodifiable view of the flattened index of every loaded album
     */
    @API(status = API.Status.STABLE)
    public List<AlbumEntry> getAlbumIndex() {
        return Collections.unmodifiableList(albumIndex);
    }

    @Override
    public String toString() {
        return "LazyLibrary[artists=" + artists.size() + ", albums=" + albumIndex.size() + ", fullyLoaded=" +
                fullyLoaded + "]";
    }
}
