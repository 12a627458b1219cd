package org.zarumet.data;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An artist in a {@link LazyLibrary}, whose albums may not have been fetched yet. The album state is always exactly
 * one of {@link NotLoaded} or {@link Loaded}, and moves from the first to the second at most once.
 */
@API(status = API.Status.STABLE)
public class LazyArtist {

    /**
     * Whether an artist's albums have been fetched, and what they are if so.
     */
    @API(status = API.Status.STABLE)
    public abstract static class AlbumState {

        private AlbumState() {
            // Only the two nested states exist.
        }

        /**
         * @return {@code true} if the albums have been fetched
         */
        @API(status = API.Status.STABLE)
        public abstract boolean isLoaded();
    }

    /**
     * The albums have not been fetched from the daemon yet.
     */
    @API(status = API.Status.STABLE)
    public static final class NotLoaded extends AlbumState {

        /**
         * There is nothing to distinguish one unloaded state from another.
         */
        @API(status = API.Status.STABLE)
        public static final NotLoaded INSTANCE = new NotLoaded();

        private NotLoaded() {
        }

        @Override
        public boolean isLoaded() {
            return false;
        }

        @Override
        public String toString() {
            return "NotLoaded";
        }
    }

    /**
     * The albums have been fetched.
     */
    @API(status = API.Status.STABLE)
    public static final class Loaded extends AlbumState {

        /**
         * The artist's albums, ordered case-insensitively by name.
         */
        @API(status = API.Status.STABLE)
        public final List<Album> albums;

        Loaded(List<Album> albums) {
            this.albums = Collections.unmodifiableList(new ArrayList<>(albums));
        }

        @Override
        public boolean isLoaded() {
            return true;
        }

        @Override
        public String toString() {
            return "Loaded[albums=" + albums.size() + "]";
        }
    }

    @API(status = API.Status.STABLE)
    public final String name;

    /**
     * Only ever replaced once, from not loaded to loaded; the owning library is confined to the UI loop.
     */
    private AlbumState albumState = NotLoaded.INSTANCE;

    LazyArtist(String name) {
        this.name = name;
    }

    /**
     * @return the current album state
     */
    @API(status = API.Status.STABLE)
    public AlbumState getAlbumState() {
        return albumState;
    }

    /**
     * @return {@code true} if the albums have been fetched
     */
    @API(status = API.Status.STABLE)
    public boolean isLoaded() {
        return albumState.isLoaded();
    }

    /**
     * Record the albums fetched for this artist, unless they were already recorded.
     *
     * @param albums the albums, already sorted
     *
     * @return {@code true} if the state changed, {@code false} if the artist was already loaded
     */
    boolean load(List<Album> albums) {
        if (albumState instanceof Loaded) {
            return false;
        }
        albumState = new Loaded(albums);
        return true;
    }

    @Override
    public String toString() {
        return "LazyArtist[name=" + name + ", " + albumState + "]";
    }
}
