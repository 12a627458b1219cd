package org.zarumet.data;

import org.apiguardian.api.API;

import java.io.IOException;
import java.util.List;

/**
 * <p>The requests the core makes of the music daemon. Each call is a blocking round trip, so callers on the UI loop
 * should only make the cheap ones; album art is always requested from background tasks by the
 * {@link CoverLoader}.</p>
 *
 * <p>Implementations must be safe to call from several threads at once.</p>
 */
@API(status = API.Status.STABLE)
public interface DaemonClient {

    /**
     * Fetch the album art for a song.
     *
     * @param file the daemon's identifier for the song
     *
     * @return the raw image bytes, or {@code null} if the daemon has no art for the song
     *
     * @throws IOException if there is a problem communicating with the daemon
     */
    byte[] albumArt(String file) throws IOException;

    /**
     * List the distinct values of a tag across the whole database.
     *
     * @param tag the tag name, like {@code AlbumArtist}
     *
     * @return the values, in the order the daemon sent them
     *
     * @throws IOException if there is a problem communicating with the daemon, or it rejected the request
     */
    List<String> listTagValues(String tag) throws IOException;

    /**
     * Find the songs whose tag exactly matches a value.
     *
     * @param tag the tag to match, like {@code AlbumArtist}
     * @param value the value it must have
     * @param sortTag the tag to sort the results by, or {@code null} to leave them in database order
     *
     * @return the matching songs
     *
     * @throws IOException if there is a problem communicating with the daemon, or it rejected the request
     */
    List<Track> find(String tag, String value, String sortTag) throws IOException;

    /**
     * Fetch every song in the database as one flat, unordered list.
     *
     * @return the whole catalog
     *
     * @throws IOException if there is a problem communicating with the daemon, or it rejected the request
     */
    List<Track> listAllSongs() throws IOException;

    /**
     * Fetch the current playback status.
     *
     * @return the status
     *
     * @throws IOException if there is a problem communicating with the daemon
     */
    Status status() throws IOException;

    /**
     * Set the largest binary chunk the daemon will send in a single response, which bounds how long one album art
     * request can occupy the connection.
     *
     * @param bytes the maximum chunk size
     *
     * @throws IOException if there is a problem communicating with the daemon, or it rejected the size
     */
    void setBinaryLimit(int bytes) throws IOException;

    /**
     * Fetch the song currently selected for playback.
     *
     * @return the current song, or {@code null} if there is none
     *
     * @throws IOException if there is a problem communicating with the daemon
     */
    Track currentSong() throws IOException;

    /**
     * Fetch the play queue.
     *
     * @return the queued songs, in queue order
     *
     * @throws IOException if there is a problem communicating with the daemon
     */
    List<Track> queue() throws IOException;
}
