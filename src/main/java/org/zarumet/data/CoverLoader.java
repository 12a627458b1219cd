package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zarumet.Util;

import java.util.Collection;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * <p>Loads album art in the background, through the shared {@link CoverCache}, so that the user interface never
 * waits on the daemon.</p>
 *
 * <p>{@link #loadCover(String)} is used for the song being displayed: its result is delivered over the
 * {@link CoverArtChannel}. {@link #prefetch(Collection)} warms the cache for songs likely to be displayed soon, and
 * delivers nothing.</p>
 *
 * <p>Each fetch runs as its own detached task. Tasks are never cancelled, even when the song they were started for
 * is no longer current; they simply run to completion and cache their result, which is harmless because inserting
 * the same song's art again just replaces it.</p>
 */
@API(status = API.Status.STABLE)
public class CoverLoader {

    private static final Logger logger = LoggerFactory.getLogger(CoverLoader.class);

    /**
     * Runs each fetch on a new daemon thread unless another executor was supplied.
     */
    private static final Executor DETACHED_THREADS = task -> Util.startDetached("Cover art fetch", task);

    private final DaemonClient client;

    private final CoverCache cache;

    private final CoverArtChannel channel;

    private final Executor executor;

    /**
     * Create a loader that runs each fetch on its own thread.
     *
     * @param client the daemon to fetch art from
     * @param cache the cache shared with any other loaders
     * @param channel where results of {@link #loadCover(String)} are delivered
     */
    @API(status = API.Status.STABLE)
    public CoverLoader(DaemonClient client, CoverCache cache, CoverArtChannel channel) {
        this(client, cache, channel, DETACHED_THREADS);
    }

    /**
     * Create a loader that runs fetches using the specified executor.
     *
     * @param client the daemon to fetch art from
     * @param cache the cache shared with any other loaders
     * @param channel where results of {@link #loadCover(String)} are delivered
     * @param executor runs the fetch tasks; it should not run them on the calling thread if the caller is the user
     *                 interface loop
     */
    @API(status = API.Status.STABLE)
    public CoverLoader(DaemonClient client, CoverCache cache, CoverArtChannel channel, Executor executor) {
        this.client = client;
        this.cache = cache;
        this.channel = channel;
        this.executor = executor;
    }

    /**
     * @return the cache this loader works through
     */
    @API(status = API.Status.STABLE)
    public CoverCache getCache() {
        return cache;
    }

    /**
     * Load the art for the song being displayed. If it is cached, the cached result is delivered right away. If
     * another task is already fetching it, nothing is delivered; the next song change check will ask again and
     * find it cached. Otherwise a background fetch is started, and its result cached and delivered.
     *
     * @param file the daemon's identifier for the song
     */
    @API(status = API.Status.STABLE)
    public void loadCover(final String file) {
        final CoverCache.Claim claim = cache.claim(file);
        switch (claim.state) {
            case CACHED:
                logger.debug("Cover art cache hit: {}", file);
                channel.deliver(new CoverArtUpdate(file, claim.cached));
                return;

            case PENDING:
                logger.debug("Cover art already pending: {}", file);
                return;

            default:
                submit(file, () -> channel.deliver(new CoverArtUpdate(file, fetchAndStore(file))));
        }
    }

    /**
     * Start fetching art for songs that are likely to be displayed soon, skipping any whose art is already cached
     * or being fetched. Nothing is delivered; the art simply waits in the cache.
     *
     * @param files the daemon's identifiers for the songs
     */
    @API(status = API.Status.STABLE)
    public void prefetch(Collection<String> files) {
        for (final String file : files) {
            if (cache.claim(file).state == CoverCache.ClaimState.CLAIMED) {
                submit(file, () -> {
                    final CoverArt art = fetchAndStore(file);
                    logger.debug("Prefetched cover art: {}", art);
                });
            }
        }
    }

    /**
     * Hand a claimed fetch to the executor, releasing the claim if the executor refuses it.
     */
    private void submit(String file, Runnable fetch) {
        try {
            executor.execute(fetch);
        } catch (RejectedExecutionException e) {
            logger.warn("Unable to start cover art fetch for {}", file, e);
            cache.abandon(file);
        }
    }

    /**
     * Ask the daemon for a song's art and cache the result. Failures are cached as "no art" so they are not
     * repeated every time the song comes around.
     *
     * @param file the daemon's identifier for the song
     *
     * @return the art now cached for the song
     */
    private CoverArt fetchAndStore(String file) {
        byte[] data = null;
        try {
            data = client.albumArt(file);
        } catch (Exception e) {
            logger.debug("Failed to load cover art for {}", file, e);
        }
        return cache.insert(file, data);
    }

    @Override
    public String toString() {
        return "CoverLoader[cache:" + cache + ", channel:" + channel + "]";
    }
}
