package org.zarumet.data;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An album in the library hierarchy: a name and its tracks, which are always kept ordered by disc number,
 * then track number, then title.
 */
@API(status = API.Status.STABLE)
public class Album {

    /**
     * The album name, as tagged.
     */
    @API(status = API.Status.STABLE)
    public final String name;

    /**
     * The tracks of the album, in playback order.
     */
    @API(status = API.Status.STABLE)
    public final List<Track> tracks;

    /**
     * Create an album, sorting the supplied tracks into playback order.
     *
     * @param name the album name
     * @param tracks the album's tracks, in any order
     */
    @API(status = API.Status.STABLE)
    public Album(String name, Collection<Track> tracks) {
        this.name = name;
        final List<Track> sorted = new ArrayList<>(tracks);
        sorted.sort(LibraryGrouping.TRACK_ORDER);
        this.tracks = Collections.unmodifiableList(sorted);
    }

    @Override
    public String toString() {
        return "Album[name=" + name + ", tracks=" + tracks.size() + "]";
    }
}
