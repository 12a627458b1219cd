package org.zarumet.data;

import org.apiguardian.api.API;
import org.zarumet.Util;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <p>Represents a song known to the daemon, as found in the queue, the current song report, or the library
 * catalog. The descriptive fields are immutable; the playback progress fields are refreshed in place each time
 * the status is polled while this is the current song, so they are only meaningful for that track.</p>
 */
@API(status = API.Status.STABLE)
public class Track {

    /**
     * Used when the daemon reports no title.
     */
    @API(status = API.Status.STABLE)
    public static final String UNKNOWN_TITLE = "Unknown Title";

    /**
     * Used when the daemon reports no artist.
     */
    @API(status = API.Status.STABLE)
    public static final String UNKNOWN_ARTIST = "Unknown Artist";

    /**
     * Used when the daemon reports no album.
     */
    @API(status = API.Status.STABLE)
    public static final String UNKNOWN_ALBUM = "Unknown Album";

    /**
     * The title of the song.
     */
    @API(status = API.Status.STABLE)
    public final String title;

    /**
     * The artist credited for the song itself.
     */
    @API(status = API.Status.STABLE)
    public final String artist;

    /**
     * The album on which the song appears.
     */
    @API(status = API.Status.STABLE)
    public final String album;

    /**
     * The artist under which the song's album is filed. When a library is built this is the canonical artist
     * resolved for the whole album, which may differ from what the song's own tags say.
     */
    @API(status = API.Status.STABLE)
    public final String albumArtist;

    /**
     * Whether the song's own tags carried an album artist, rather than it being inferred from the artist.
     */
    @API(status = API.Status.STABLE)
    public final boolean explicitAlbumArtist;

    /**
     * The path-like identifier the daemon uses for this song; unique, and used as the cover art cache key.
     */
    @API(status = API.Status.STABLE)
    public final String file;

    /**
     * The audio format, like {@code 44100:24:2}, or {@code null} if the daemon did not report one.
     */
    @API(status = API.Status.STABLE)
    public final String format;

    /**
     * The disc number within a multi-disc album, or 0 if not tagged.
     */
    @API(status = API.Status.STABLE)
    public final int disc;

    /**
     * The track number within its disc, or 0 if not tagged.
     */
    @API(status = API.Status.STABLE)
    public final int trackNumber;

    /**
     * Seconds elapsed, refreshed while this is the current song.
     */
    private volatile Double elapsed;

    /**
     * Length of the song in seconds, if known.
     */
    private volatile Double duration;

    /**
     * Fraction of the song played, from 0.0 to 1.0, refreshed while this is the current song.
     */
    private volatile Double progress;

    /**
     * Playback state, refreshed while this is the current song.
     */
    private volatile PlayState playState;

    /**
     * Constructor sets all the immutable fields.
     *
     * @param title the song title
     * @param artist the song artist
     * @param album the album name
     * @param albumArtist the artist the album is filed under
     * @param explicitAlbumArtist whether the album artist came from the song's own tags
     * @param file the daemon's identifier for the song
     * @param format the audio format, if known
     * @param disc the disc number, or 0
     * @param trackNumber the track number, or 0
     * @param duration the length in seconds, if known
     */
    @API(status = API.Status.STABLE)
    public Track(String title, String artist, String album, String albumArtist, boolean explicitAlbumArtist,
                 String file, String format, int disc, int trackNumber, Double duration) {
        this.title = Objects.requireNonNull(title, "title");
        this.artist = Objects.requireNonNull(artist, "artist");
        this.album = Objects.requireNonNull(album, "album");
        this.albumArtist = Objects.requireNonNull(albumArtist, "albumArtist");
        this.explicitAlbumArtist = explicitAlbumArtist;
        this.file = Objects.requireNonNull(file, "file");
        this.format = format;
        this.disc = disc;
        this.trackNumber = trackNumber;
        this.duration = duration;
    }

    /**
     * Build a track from the tag values the daemon sent for one song record. Tag names are matched
     * case-insensitively, missing descriptive tags get placeholder values, and a missing album artist falls back
     * to the artist.
     *
     * @param tags the keys and values of one song record, which must include {@code file}
     *
     * @return the corresponding track
     *
     * @throws IllegalArgumentException if the record has no {@code file} value
     */
    @API(status = API.Status.STABLE)
    public static Track fromTags(Map<String, String> tags) {
        final Map<String, String> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(tags);
        final String file = lookup.get("file");
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Song record has no file: " + tags);
        }
        final String artist = valueOr(lookup.get("Artist"), UNKNOWN_ARTIST);
        final String taggedAlbumArtist = lookup.get("AlbumArtist");
        final boolean explicit = taggedAlbumArtist != null && !taggedAlbumArtist.isEmpty();
        Double duration = Util.parseSeconds(lookup.get("duration"));
        if (duration == null) {
            duration = Util.parseSeconds(lookup.get("Time"));
        }
        return new Track(valueOr(lookup.get("Title"), UNKNOWN_TITLE), artist,
                valueOr(lookup.get("Album"), UNKNOWN_ALBUM), explicit ? taggedAlbumArtist : artist, explicit,
                file, lookup.get("Format"), Util.parseLeadingNumber(lookup.get("Disc")),
                Util.parseLeadingNumber(lookup.get("Track")), duration);
    }

    private static String valueOr(String value, String fallback) {
        return (value == null || value.isEmpty()) ? fallback : value;
    }

    /**
     * Create a copy of this track filed under a different album artist, as happens when a library resolves one
     * canonical artist for an album whose songs are tagged inconsistently.
     *
     * @param canonicalArtist the artist the album should be filed under
     *
     * @return this track if the artist is unchanged, otherwise a copy with the new album artist
     */
    @API(status = API.Status.STABLE)
    public Track withAlbumArtist(String canonicalArtist) {
        if (albumArtist.equals(canonicalArtist)) {
            return this;
        }
        return new Track(title, artist, album, canonicalArtist, explicitAlbumArtist, file, format, disc,
                trackNumber, duration);
    }

    /**
     * Get the directory containing the song, which is the part of the file identifier before its last slash.
     *
     * @return the album directory, or an empty string for songs at the top of the music directory
     */
    @API(status = API.Status.STABLE)
    public String getAlbumDirectory() {
        final int slash = file.lastIndexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }

    /**
     * Get the sample rate of the song, which is the first field of its format.
     *
     * @return the sample rate in Hz, or 0 if unknown (including for DSD streams, whose format is not numeric)
     */
    @API(status = API.Status.STABLE)
    public int getSampleRate() {
        if (format == null) {
            return 0;
        }
        final int colon = format.indexOf(':');
        final String rate = colon < 0 ? format : format.substring(0, colon);
        try {
            return Math.max(0, Integer.parseInt(rate));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Refresh the playback progress fields from a status report about this song.
     *
     * @param status the latest status reported by the daemon
     */
    @API(status = API.Status.STABLE)
    public void updatePlayback(Status status) {
        playState = status.state;
        elapsed = status.elapsed;
        if (status.duration != null) {
            duration = status.duration;
        }
        final Double length = duration;
        if (status.elapsed != null && length != null && length > 0.0) {
            progress = Math.min(1.0, Math.max(0.0, status.elapsed / length));
        } else {
            progress = null;
        }
    }

    /**
     * @return seconds elapsed, or {@code null} if not known
     */
    @API(status = API.Status.STABLE)
    public Double getElapsed() {
        return elapsed;
    }

    /**
     * @return the song length in seconds, or {@code null} if not known
     */
    @API(status = API.Status.STABLE)
    public Double getDuration() {
        return duration;
    }

    /**
     * @return the fraction of the song played, or {@code null} if not known
     */
    @API(status = API.Status.STABLE)
    public Double getProgress() {
        return progress;
    }

    /**
     * @return the playback state last reported while this was the current song, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public PlayState getPlayState() {
        return playState;
    }

    @Override
    public String toString() {
        return "Track[file=" + file + ", title=" + title + ", artist=" + artist + ", album=" + album +
                ", albumArtist=" + albumArtist + ", disc=" + disc + ", track=" + trackNumber + "]";
    }
}
