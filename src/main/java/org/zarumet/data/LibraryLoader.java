package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <p>Builds the library hierarchy from the daemon, using one of two strategies.</p>
 *
 * <p>{@link #loadLibrary(DaemonClient)} fetches the whole catalog in one request and builds a complete
 * {@link Library}, resolving one canonical artist per album. Because that request can be slow and large, it is
 * retried with exponential backoff.</p>
 *
 * <p>{@link #initLazyLibrary(DaemonClient)} fetches only the artist names, returning a {@link LazyLibrary} whose
 * artists are filled in on demand.</p>
 */
@API(status = API.Status.STABLE)
public class LibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(LibraryLoader.class);

    /**
     * How many times the catalog request is attempted unless configured otherwise.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * How many milliseconds to wait before the first retry unless configured otherwise; each further retry waits
     * twice as long as the one before.
     */
    @API(status = API.Status.STABLE)
    public static final long DEFAULT_RETRY_BASE_DELAY = 1000;

    /**
     * The longest wait between two attempts at the catalog request. Doubling stops once a delay would exceed this.
     */
    @API(status = API.Status.STABLE)
    public static final long MAX_RETRY_DELAY = 300000;

    private final AtomicInteger maxAttempts = new AtomicInteger(DEFAULT_MAX_ATTEMPTS);

    private final AtomicLong retryBaseDelay = new AtomicLong(DEFAULT_RETRY_BASE_DELAY);

    /**
     * Set how many times the catalog request is attempted before giving up.
     *
     * @param attempts the number of attempts, including the first
     *
     * @throws IllegalArgumentException if {@code attempts} is less than 1
     */
    @API(status = API.Status.STABLE)
    public void setMaxAttempts(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        maxAttempts.set(attempts);
    }

    /**
     * @return how many times the catalog request is attempted before giving up
     */
    @API(status = API.Status.STABLE)
    public int getMaxAttempts() {
        return maxAttempts.get();
    }

    /**
     * Set how long to wait before the first retry of the catalog request. Later retries double the wait each time.
     *
     * @param millis the delay before the first retry
     *
     * @throws IllegalArgumentException if {@code millis} is negative or greater than {@link #MAX_RETRY_DELAY}
     */
    @API(status = API.Status.STABLE)
    public void setRetryBaseDelay(long millis) {
        if (millis < 0 || millis > MAX_RETRY_DELAY) {
            throw new IllegalArgumentException("millis must be between 0 and " + MAX_RETRY_DELAY);
        }
        retryBaseDelay.set(millis);
    }

    /**
     * @return how many milliseconds are waited before the first retry
     */
    @API(status = API.Status.STABLE)
    public long getRetryBaseDelay() {
        return retryBaseDelay.get();
    }

    /**
     * Calculate the delay before a retry.
     *
     * @param failedAttempt the number of the attempt that just failed, starting at 1
     *
     * @return the base delay doubled once for each attempt after the first, but never more than
     *         {@link #MAX_RETRY_DELAY}
     */
    long backoffDelay(int failedAttempt) {
        final long base = retryBaseDelay.get();
        final int doublings = failedAttempt - 1;
        if (base == 0) {
            return 0;
        }
        if (doublings >= Long.SIZE - 1 || base > (MAX_RETRY_DELAY >> doublings)) {
            return MAX_RETRY_DELAY;
        }
        return base << doublings;
    }

    /**
     * Wait before retrying a failed catalog request.
     *
     * @param millis how long to wait
     *
     * @throws InterruptedException if the loading thread is interrupted while waiting
     */
    void sleepBeforeRetry(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    /**
     * Build a complete library from the daemon's whole catalog.
     *
     * @param client the daemon to load from
     *
     * @return the library
     *
     * @throws IOException if the daemon does not answer a status request, or the catalog could not be fetched
     *                     after every attempt
     */
    @API(status = API.Status.STABLE)
    public Library loadLibrary(DaemonClient client) throws IOException {
        try {
            client.status();
        } catch (IOException e) {
            throw new IOException("Daemon connection is not responding to status requests, unable to load library", e);
        }

        final List<Track> catalog = fetchCatalog(client);
        final Library library = Library.fromCatalog(catalog);
        logger.info("Loaded library of {} songs: {}", catalog.size(), library);
        return library;
    }

    /**
     * Fetch the whole catalog, retrying with exponential backoff when the request fails.
     *
     * @param client the daemon to load from
     *
     * @return every song in the database
     *
     * @throws IOException describing the last failure, once every attempt has failed
     */
    private List<Track> fetchCatalog(DaemonClient client) throws IOException {
        final int attempts = maxAttempts.get();
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return client.listAllSongs();
            } catch (IOException e) {
                lastFailure = e;
                logger.warn("Failed fetching song catalog (attempt {} of {}): {}", attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    final long delay = backoffDelay(attempt);
                    try {
                        sleepBeforeRetry(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        final InterruptedIOException interrupted =
                                new InterruptedIOException("Interrupted waiting to retry song catalog request");
                        interrupted.initCause(e);
                        throw interrupted;
                    }
                }
            }
        }
        logger.error("Giving up on fetching song catalog after {} attempts.", attempts);
        throw new IOException("Unable to fetch song catalog after " + attempts + " attempts", lastFailure);
    }

    /**
     * Start a lazily loaded library, fetching only the names of the artists.
     *
     * @param client the daemon to load from; the returned library keeps using it to load artists
     *
     * @return a library in which no artist has been loaded yet
     *
     * @throws IOException if the daemon could not list the artist names
     */
    @API(status = API.Status.STABLE)
    public LazyLibrary initLazyLibrary(DaemonClient client) throws IOException {
        final List<String> values;
        try {
            values = client.listTagValues(LazyLibrary.ARTIST_TAG);
        } catch (IOException e) {
            throw new IOException("Unable to list artists for library", e);
        }
        final Set<String> distinct = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                distinct.add(value);
            }
        }
        final List<String> names = new ArrayList<>(distinct);
        names.sort(LibraryGrouping.NAME_ORDER);
        logger.info("Initialized lazy library with {} artists", names.size());
        return new LazyLibrary(client, names);
    }

    @Override
    public String toString() {
        return "LibraryLoader[maxAttempts:" + maxAttempts.get() + ", retryBaseDelay:" + retryBaseDelay.get() + "]";
    }
}
