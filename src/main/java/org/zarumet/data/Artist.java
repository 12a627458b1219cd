package org.zarumet.data;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An artist in a fully loaded library hierarchy, with albums ordered case-insensitively by name.
 */
@API(status = API.Status.STABLE)
public class Artist {

    @API(status = API.Status.STABLE)
    public final String name;

    @API(status = API.Status.STABLE)
    public final List<Album> albums;

    /**
     * Create an artist, sorting the supplied albums by name.
     *
     * @param name the artist name
     * @param albums the artist's albums, in any order
     */
    @API(status = API.Status.STABLE)
    public Artist(String name, Collection<Album> albums) {
        this.name = name;
        final List<Album> sorted = new ArrayList<>(albums);
        sorted.sort(LibraryGrouping.ALBUM_ORDER);
        this.albums = Collections.unmodifiableList(sorted);
    }

    @Override
    public String toString() {
        return "Artist[name=" + name + ", albums=" + albums.size() + "]";
    }
}
