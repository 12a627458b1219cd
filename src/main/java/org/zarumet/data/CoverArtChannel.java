package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>Carries album art results from background fetch tasks to the user interface loop, which drains it between
 * input polls. Delivery is best effort: it never blocks the fetching task. Updates offered after the channel has
 * been closed are discarded, and when it is backed up the oldest waiting update makes room for the new one, since
 * the newest is usually for the song now playing.</p>
 */
@API(status = API.Status.STABLE)
public class CoverArtChannel {

    private static final Logger logger = LoggerFactory.getLogger(CoverArtChannel.class);

    /**
     * How many undelivered updates can wait in the channel unless configured otherwise.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_CAPACITY = 32;

    private final LinkedBlockingDeque<CoverArtUpdate> updates;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a channel with the default capacity.
     */
    @API(status = API.Status.STABLE)
    public CoverArtChannel() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Create a channel.
     *
     * @param capacity how many undelivered updates can wait before the oldest ones are discarded
     */
    @API(status = API.Status.STABLE)
    public CoverArtChannel(int capacity) {
        updates = new LinkedBlockingDeque<>(capacity);
    }

    /**
     * Offer an update to the user interface.
     *
     * @param update the art that has become available
     *
     * @return {@code true} if it was queued for delivery, {@code false} if the channel has been closed
     */
    boolean deliver(CoverArtUpdate update) {
        if (closed.get()) {
            logger.debug("Discarding {} because the channel has been closed.", update);
            return false;
        }
        while (!updates.offerLast(update)) {
            final CoverArtUpdate dropped = updates.pollFirst();
            if (dropped != null) {
                logger.warn("Discarding oldest cover art update, for {}, because our queue is backed up.",
                        dropped.file);
            }
        }
        return true;
    }

    /**
     * Retrieve the oldest waiting update without blocking.
     *
     * @return the update, or {@code null} if none is waiting
     */
    @API(status = API.Status.STABLE)
    public CoverArtUpdate poll() {
        return updates.pollFirst();
    }

    /**
     * Wait up to a limited time for an update.
     *
     * @param timeout how long to wait
     * @param unit the units of {@code timeout}
     *
     * @return the update, or {@code null} if none arrived in time
     *
     * @throws InterruptedException if interrupted while waiting
     */
    @API(status = API.Status.STABLE)
    public CoverArtUpdate poll(long timeout, TimeUnit unit) throws InterruptedException {
        return updates.pollFirst(timeout, unit);
    }

    /**
     * Retrieve every waiting update without blocking.
     *
     * @return the updates, oldest first, possibly empty
     */
    @API(status = API.Status.STABLE)
    public List<CoverArtUpdate> drain() {
        final List<CoverArtUpdate> result = new ArrayList<>();
        updates.drainTo(result);
        return result;
    }

    /**
     * Stop accepting updates, and discard any that are waiting. Fetches still in progress will complete and cache
     * their results, but will no longer deliver them.
     */
    @API(status = API.Status.STABLE)
    public void close() {
        closed.set(true);
        updates.clear();
    }

    /**
     * @return {@code true} if the channel has been closed
     */
    @API(status = API.Status.STABLE)
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "CoverArtChannel[waiting:" + updates.size() + ", closed:" + closed.get() + "]";
    }
}
