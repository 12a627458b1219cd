package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;

/**
 * <p>The album art cache shared by the user interface loop and every background art fetch. It maps song file
 * identifiers to the {@link CoverArt} found for them (which may record that there is none), and keeps a separate set
 * of the identifiers whose art is currently being fetched, so that no song's art is ever requested twice at once.</p>
 *
 * <p>Every operation is atomic with respect to every other; in particular {@link #claim(String)} performs the whole
 * check-cache, check-pending, mark-pending sequence as one step. A key is only pending between being claimed (or
 * {@link #markPending(String) marked}) and the matching {@link #insert(String, byte[])}.</p>
 *
 * <p>The number of cached entries is bounded. When the cache is full, the least recently used art is discarded
 * using the "clock" or "second-chance" approximation of least-recently-used eviction. Songs whose art is pending
 * are not entries yet, so they can never be evicted.</p>
 */
@API(status = API.Status.STABLE)
public class CoverCache {

    private static final Logger logger = LoggerFactory.getLogger(CoverCache.class);

    /**
     * The maximum number of artwork results we retain unless configured otherwise.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_MAX_ENTRIES = 100;

    /**
     * What {@link #claim(String)} found when it examined a key.
     */
    @API(status = API.Status.STABLE)
    public enum ClaimState {
        /**
         * The art is already cached; {@link Claim#cached} holds it.
         */
        CACHED,
        /**
         * Another task is already fetching the art.
         */
        PENDING,
        /**
         * Nothing was known, so the key is now pending and the caller must fetch the art and then
         * {@link #insert(String, byte[])} the result.
         */
        CLAIMED
    }

    /**
     * The outcome of a {@link #claim(String)}.
     */
    @API(status = API.Status.STABLE)
    public static class Claim {

        @API(status = API.Status.STABLE)
        public final ClaimState state;

        /**
         * The cached art when {@link #state} is {@link ClaimState#CACHED}, otherwise {@code null}.
         */
        @API(status = API.Status.STABLE)
        public final CoverArt cached;

        private Claim(ClaimState state, CoverArt cached) {
            this.state = state;
            this.cached = cached;
        }

        @Override
        public String toString() {
            return "Claim[state=" + state + ", cached=" + cached + "]";
        }
    }

    private static final Claim PENDING_CLAIM = new Claim(ClaimState.PENDING, null);

    private static final Claim CLAIMED_CLAIM = new Claim(ClaimState.CLAIMED, null);

    /**
     * The cached art, by song file identifier.
     */
    private final Map<String, CoverArt> entries = new HashMap<>();

    /**
     * Song keys in insertion order; the clock hand always points at the head.
     */
    private final LinkedList<String> evictionQueue = new LinkedList<>();

    /**
     * Keys read since insertion or since the clock hand last passed them.
     */
    private final Set<String> recentlyUsed = new HashSet<>();

    /**
     * The song file identifiers whose art is currently being fetched.
     */
    private final Set<String> pending = new HashSet<>();

    /**
     * Establishes how many artwork results we retain.
     */
    private int maxEntries = DEFAULT_MAX_ENTRIES;

    /**
     * Look up the cached art for a song, counting this as a use of the art.
     *
     * @param key the song file identifier
     *
     * @return the cached art (which may record that there is none), or {@code null} if nothing is known yet
     */
    @API(status = API.Status.STABLE)
    public synchronized CoverArt get(String key) {
        final CoverArt found = entries.get(key);
        if (found != null) {
            recentlyUsed.add(key);
        }
        return found;
    }

    /**
     * Check whether anything is known about a song's art, without counting this as a use.
     *
     * @param key the song file identifier
     *
     * @return {@code true} if a result (even a negative one) is cached
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    /**
     * Check whether a song's art is currently being fetched.
     *
     * @param key the song file identifier
     *
     * @return {@code true} if the key has been marked pending and no result has been inserted since
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean isPending(String key) {
        return pending.contains(key);
    }

    /**
     * Record that a song's art is being fetched. Prefer {@link #claim(String)}, which also checks that nobody else
     * is already fetching it.
     *
     * @param key the song file identifier
     */
    @API(status = API.Status.STABLE)
    public synchronized void markPending(String key) {
        pending.add(key);
    }

    /**
     * Atomically check whether a song's art is cached or being fetched, and if neither, mark it pending on behalf of
     * the caller.
     *
     * @param key the song file identifier
     *
     * @return what was found; if the state is {@link ClaimState#CLAIMED}, the caller now owns the fetch
     */
    @API(status = API.Status.STABLE)
    public synchronized Claim claim(String key) {
        final CoverArt found = get(key);
        if (found != null) {
            return new Claim(ClaimState.CACHED, found);
        }
        if (pending.contains(key)) {
            return PENDING_CLAIM;
        }
        pending.add(key);
        return CLAIMED_CLAIM;
    }

    /**
     * Store the result of fetching a song's art, clearing its pending mark. A later insert for the same key
     * replaces the earlier result.
     *
     * @param key the song file identifier
     * @param data the image bytes, or {@code null} if there is no art (or it could not be fetched)
     *
     * @return the art now cached for the key
     */
    @API(status = API.Status.STABLE)
    public synchronized CoverArt insert(String key, byte[] data) {
        pending.remove(key);
        final CoverArt art = new CoverArt(key, data);
        if (entries.containsKey(key)) {
            entries.put(key, art);
            return art;
        }
        while (entries.size() >= maxEntries) {
            evict();
        }
        entries.put(key, art);
        evictionQueue.addLast(key);
        return art;
    }

    /**
     * Give up on a fetch that was claimed but could not be started, so that a later request can try again.
     *
     * @param key the song file identifier
     */
    synchronized void abandon(String key) {
        pending.remove(key);
    }

    /**
     * Removes an element from the cache. Looks for the first item in the eviction queue that has not been used
     * since it was added or considered for eviction and removes that. Any items which are found to have been used
     * are instead moved to the end of the queue and marked unused. Must be called by one of the synchronized
     * methods that manipulate the cache.
     */
    private void evict() {
        boolean evicted = false;
        while (!evicted && !evictionQueue.isEmpty()) {
            final String candidate = evictionQueue.removeFirst();
            if (recentlyUsed.remove(candidate)) {
                // This art has been used, give it a second chance.
                evictionQueue.addLast(candidate);
            } else {
                entries.remove(candidate);
                logger.debug("Evicted cover art for {}", candidate);
                evicted = true;
            }
        }
    }

    /**
     * Set how many artwork results can be kept in the cache.
     *
     * @param size the maximum number of songs whose art results are kept; if smaller than the number currently
     *             present, older results are discarded immediately so that only the number specified remain
     *
     * @throws IllegalArgumentException if {@code size} is less than 1
     */
    @API(status = API.Status.STABLE)
    public synchronized void setMaxEntries(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be at least 1");
        }
        maxEntries = size;
        while (entries.size() > size) {
            evict();
        }
    }

    /**
     * @return the maximum number of songs whose art results are kept
     */
    @API(status = API.Status.STABLE)
    public synchronized int getMaxEntries() {
        return maxEntries;
    }

    /**
     * @return how many songs currently have art results cached
     */
    @API(status = API.Status.STABLE)
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Discard every cached result and pending mark. Fetches still in flight will insert their results when they
     * complete.
     */
    @API(status = API.Status.STABLE)
    public synchronized void clear() {
        entries.clear();
        evictionQueue.clear();
        recentlyUsed.clear();
        pending.clear();
    }

    @Override
    public synchronized String toString() {
        return "CoverCache[entries:" + entries.size() + ", pending:" + pending.size() + ", maxEntries:" +
                maxEntries + "]";
    }
}
