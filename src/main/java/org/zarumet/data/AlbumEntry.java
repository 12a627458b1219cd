package org.zarumet.data;

import org.apiguardian.api.API;

/**
 * One row of the flattened album index used for album-centric browsing: an album together with the name of the
 * artist it is filed under.
 */
@API(status = API.Status.STABLE)
public class AlbumEntry {

    @API(status = API.Status.STABLE)
    public final String artistName;

    @API(status = API.Status.STABLE)
    public final Album album;

    @API(status = API.Status.STABLE)
    public AlbumEntry(String artistName, Album album) {
        this.artistName = artistName;
        this.album = album;
    }

    /**
     * Check whether this entry describes the same artist and album name as another, which is how duplicates are
     * recognized when albums are merged into the index.
     *
     * @param artistName the artist name to compare
     * @param albumName the album name to compare
     *
     * @return {@code true} if both names match exactly
     */
    boolean matches(String artistName, String albumName) {
        return this.artistName.equals(artistName) && album.name.equals(albumName);
    }

    @Override
    public String toString() {
        return "AlbumEntry[artist=" + artistName + ", album=" + album.name + "]";
    }
}
