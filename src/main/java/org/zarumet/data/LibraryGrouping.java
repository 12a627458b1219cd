package org.zarumet.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The grouping and ordering rules shared by the eager and lazy library loading strategies, so that both build
 * exactly the same hierarchy from the same songs.
 */
final class LibraryGrouping {

    /**
     * Tracks within an album play by disc, then track number, then title.
     */
    static final Comparator<Track> TRACK_ORDER = Comparator.<Track>comparingInt(track -> track.disc)
            .thenComparingInt(track -> track.trackNumber)
            .thenComparing(track -> track.title);

    /**
     * Names are ordered ignoring case, with an exact comparison only to keep the order total.
     */
    static final Comparator<String> NAME_ORDER = String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    static final Comparator<Album> ALBUM_ORDER = Comparator.<Album, String>comparing(album -> album.name, NAME_ORDER);

    static final Comparator<Artist> ARTIST_ORDER =
            Comparator.<Artist, String>comparing(artist -> artist.name, NAME_ORDER);

    /**
     * The flattened index is ordered by album name, then by artist name.
     */
    static final Comparator<AlbumEntry> ALBUM_ENTRY_ORDER =
            Comparator.<AlbumEntry, String>comparing(entry -> entry.album.name, NAME_ORDER)
                    .thenComparing(entry -> entry.artistName, NAME_ORDER);

    /**
     * Group tracks into albums by album name.
     *
     * @param tracks the tracks to group, in any order
     *
     * @return the albums, each with its tracks in playback order, sorted by album name
     */
    static List<Album> groupIntoAlbums(Collection<Track> tracks) {
        final Map<String, List<Track>> byAlbum = new LinkedHashMap<>();
        for (Track track : tracks) {
            byAlbum.computeIfAbsent(track.album, name -> new ArrayList<>()).add(track);
        }
        final List<Album> albums = new ArrayList<>(byAlbum.size());
        for (Map.Entry<String, List<Track>> entry : byAlbum.entrySet()) {
            albums.add(new Album(entry.getKey(), entry.getValue()));
        }
        albums.sort(ALBUM_ORDER);
        return albums;
    }

    /**
     * Decide which artist each album should be filed under. If any track of an album carries an explicit album
     * artist tag, that tag wins (the most common one, should the tracks disagree); otherwise the most common track
     * artist is used. Ties are broken by the lexicographically smallest name, so the result never depends on the
     * order in which the daemon listed the songs.
     *
     * @param tracks every song in the catalog
     *
     * @return the canonical artist for each album name
     */
    static Map<String, String> resolveCanonicalArtists(Collection<Track> tracks) {
        final Map<String, Map<String, Integer>> explicitCounts = new HashMap<>();
        final Map<String, Map<String, Integer>> artistCounts = new HashMap<>();
        for (Track track : tracks) {
            if (track.explicitAlbumArtist) {
                explicitCounts.computeIfAbsent(track.album, album -> new HashMap<>())
                        .merge(track.albumArtist, 1, Integer::sum);
            }
            artistCounts.computeIfAbsent(track.album, album -> new HashMap<>()).merge(track.artist, 1, Integer::sum);
        }
        final Map<String, String> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Integer>> entry : artistCounts.entrySet()) {
            final Map<String, Integer> explicit = explicitCounts.get(entry.getKey());
            result.put(entry.getKey(), mostFrequent(explicit != null ? explicit : entry.getValue()));
        }
        return result;
    }

    /**
     * Find the name with the highest count, preferring the lexicographically smallest name on ties.
     */
    private static String mostFrequent(Map<String, Integer> counts) {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : new TreeMap<>(counts).entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Build the artist hierarchy from a flat catalog, in two passes: first resolve the canonical artist of each
     * album, then file every track under its album's canonical artist. Filing each track under its own tag would
     * split an album across several artists whenever only some of its tracks carry an album artist tag.
     *
     * @param catalog every song known to the daemon
     *
     * @return the artists, sorted by name, each with its albums and tracks sorted
     */
    static List<Artist> buildArtists(Collection<Track> catalog) {
        final Map<String, String> canonical = resolveCanonicalArtists(catalog);
        final Map<String, List<Track>> byArtist = new HashMap<>();
        for (Track track : catalog) {
            final String artist = canonical.get(track.album);
            byArtist.computeIfAbsent(artist, name -> new ArrayList<>()).add(track.withAlbumArtist(artist));
        }
        final List<Artist> artists = new ArrayList<>(byArtist.size());
        for (Map.Entry<String, List<Track>> entry : byArtist.entrySet()) {
            artists.add(new Artist(entry.getKey(), groupIntoAlbums(entry.getValue())));
        }
        artists.sort(ARTIST_ORDER);
        return artists;
    }

    /**
     * Add an artist's albums to a flattened album index, skipping any artist and album name pair that is already
     * present, then restore the index order.
     *
     * @param index the index to grow
     * @param artistName the artist the albums are filed under
     * @param albums the albums to add
     *
     * @return how many entries were actually added
     */
    static int mergeIntoIndex(List<AlbumEntry> index, String artistName, Collection<Album> albums) {
        int added = 0;
        for (Album album : albums) {
            boolean present = false;
            for (AlbumEntry entry : index) {
                if (entry.matches(artistName, album.name)) {
                    present = true;
                    break;
                }
            }
            if (!present) {
                index.add(new AlbumEntry(artistName, album));
                ++added;
            }
        }
        index.sort(ALBUM_ENTRY_ORDER);
        return added;
    }

    /**
     * Prevent instantiation.
     */
    private LibraryGrouping() {
        // Nothing to do.
    }
}
