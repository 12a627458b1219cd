package org.zarumet.data;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which songs' album art is worth fetching before it is needed: the few songs just after the current one
 * in the queue, which are likely to be played next, and the one just before it, in case the user skips back.
 */
@API(status = API.Status.STABLE)
public final class PrefetchPlanner {

    /**
     * How many songs after the current one are prefetched.
     */
    @API(status = API.Status.STABLE)
    public static final int PREFETCH_AHEAD = 2;

    /**
     * How many songs before the current one are prefetched.
     */
    @API(status = API.Status.STABLE)
    public static final int PREFETCH_BEHIND = 1;

    /**
     * Determine the songs whose art should be prefetched.
     *
     * @param queue the play queue
     * @param currentIndex the position of the current song in the queue, or {@code null} if there is none
     *
     * @return the file identifiers of the neighboring songs, nearest first, never including the current song's own
     *         identifier; empty if there is no current song or the index is outside the queue
     */
    @API(status = API.Status.STABLE)
    public static Set<String> prefetchTargets(List<Track> queue, Integer currentIndex) {
        if (currentIndex == null || currentIndex < 0 || currentIndex >= queue.size()) {
            return Collections.emptySet();
        }
        final String currentFile = queue.get(currentIndex).file;
        final Set<String> targets = new LinkedHashSet<>();
        for (int distance = 1; distance <= Math.max(PREFETCH_AHEAD, PREFETCH_BEHIND); distance++) {
            if (distance <= PREFETCH_AHEAD && currentIndex + distance < queue.size()) {
                targets.add(queue.get(currentIndex + distance).file);
            }
            if (distance <= PREFETCH_BEHIND && currentIndex - distance >= 0) {
                targets.add(queue.get(currentIndex - distance).file);
            }
        }
        targets.remove(currentFile);
        return Collections.unmodifiableSet(targets);
    }

    /**
     * Find the position of the current song in the queue.
     *
     * @param queue the play queue
     * @param current the current song, or {@code null} if there is none
     * @param reportedPosition the queue position the daemon reported for the current song, or {@code null}
     *
     * @return the reported position if it holds the current song, otherwise the first position holding a song with
     *         the same file identifier, or {@code null} if the song is not in the queue
     */
    @API(status = API.Status.STABLE)
    public static Integer findCurrentIndex(List<Track> queue, Track current, Integer reportedPosition) {
        if (current == null) {
            return null;
        }
        if (reportedPosition != null && reportedPosition >= 0 && reportedPosition < queue.size() &&
                queue.get(reportedPosition).file.equals(current.file)) {
            return reportedPosition;
        }
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).file.equals(current.file)) {
                return i;
            }
        }
        return null;
    }

    /**
     * Prevent instantiation.
     */
    private PrefetchPlanner() {
        // Nothing to do.
    }
}
