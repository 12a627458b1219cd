package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <p>Called by the user interface loop after each status poll. Refreshes the current song's progress, and when
 * the current song has changed, starts loading its album art and prefetching the art of its queue neighbors. When
 * a {@link SampleRateReactor} is configured, it is given the poll too.</p>
 *
 * <p>Not thread-safe; it belongs to the user interface loop.</p>
 */
@API(status = API.Status.STABLE)
public class SongChangeReactor {

    private static final Logger logger = LoggerFactory.getLogger(SongChangeReactor.class);

    private final CoverLoader coverLoader;

    private final ArtDisplay display;

    private final SampleRateReactor rateReactor;

    /**
     * The file identifier of the current song as of the last poll, or {@code null} if there was none.
     */
    private String currentFile;

    /**
     * Create a reactor that does not manage the device sample rate.
     *
     * @param coverLoader loads art for the current song and its neighbors
     * @param display told to clear its art when there is no current song
     */
    @API(status = API.Status.STABLE)
    public SongChangeReactor(CoverLoader coverLoader, ArtDisplay display) {
        this(coverLoader, display, null);
    }

    /**
     * Create a reactor.
     *
     * @param coverLoader loads art for the current song and its neighbors
     * @param display told to clear its art when there is no current song
     * @param rateReactor manages the device sample rate, or {@code null} where that is not supported
     */
    @API(status = API.Status.STABLE)
    public SongChangeReactor(CoverLoader coverLoader, ArtDisplay display, SampleRateReactor rateReactor) {
        this.coverLoader = coverLoader;
        this.display = display;
        this.rateReactor = rateReactor;
    }

    /**
     * Process the results of a status poll.
     *
     * @param status the daemon's status, or {@code null} if it could not be obtained
     * @param current the current song, or {@code null} if there is none
     * @param queue the play queue
     *
     * @return {@code true} if the current song changed since the previous poll
     */
    @API(status = API.Status.STABLE)
    public boolean poll(Status status, Track current, List<Track> queue) {
        if (current != null && status != null) {
            current.updatePlayback(status);
        }
        final boolean changed = checkSongChange(current, queue, status == null ? null : status.songPosition);
        if (rateReactor != null) {
            rateReactor.handleStateChange(status, current);
        }
        return changed;
    }

    /**
     * See whether the current song has changed, and if so start loading the art that will be needed.
     *
     * @param current the current song, or {@code null} if there is none
     * @param queue the play queue
     * @param reportedPosition the queue position the daemon reported for the current song, if any
     *
     * @return {@code true} if the current song changed
     */
    boolean checkSongChange(Track current, List<Track> queue, Integer reportedPosition) {
        final String newFile = (current == null) ? null : current.file;
        if (Objects.equals(newFile, currentFile)) {
            return false;
        }
        logger.debug("Song changed: {} -> {}", currentFile, newFile);

        if (current == null) {
            display.clearArt();
        } else {
            coverLoader.loadCover(newFile);
        }

        final Integer index = PrefetchPlanner.findCurrentIndex(queue, current, reportedPosition);
        final Set<String> targets = PrefetchPlanner.prefetchTargets(queue, index);
        if (!targets.isEmpty()) {
            coverLoader.prefetch(targets);
        }

        currentFile = newFile;
        return true;
    }

    /**
     * Get the song whose art should be on display, for discarding stale {@link CoverArtUpdate}s.
     *
     * @return the current song's file identifier as of the last poll, or {@code null} if there is none
     */
    @API(status = API.Status.STABLE)
    public String getCurrentFile() {
        return currentFile;
    }

    @Override
    public String toString() {
        return "SongChangeReactor[currentFile:" + currentFile + ", rateReactor:" + rateReactor + "]";
    }
}
