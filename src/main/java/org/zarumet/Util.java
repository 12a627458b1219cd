package org.zarumet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Small helpers used by several packages, mostly listener bookkeeping and reading the loosely formatted numbers
 * the daemon sends.
 */
@SuppressWarnings("WeakerAccess")
public class Util {

    private static final Logger logger = LoggerFactory.getLogger(Util.class);

    /**
     * Add a listener to a list of weakly-held listeners, unless it is {@code null} or already present.
     * Entries whose listeners have been garbage collected are pruned along the way.
     *
     * @param listeners the list of weak references to which the listener should be added
     * @param listener the listener to add
     * @param <T> the type of listener being managed
     */
    public static <T> void addListener(List<WeakReference<T>> listeners, T listener) {
        if (listener == null) {
            return;
        }
        for (Iterator<WeakReference<T>> iterator = listeners.iterator(); iterator.hasNext(); ) {
            final T existing = iterator.next().get();
            if (existing == null) {
                iterator.remove();
            } else if (existing == listener) {
                return;
            }
        }
        listeners.add(new WeakReference<>(listener));
    }

    /**
     * Remove a listener from a list of weakly-held listeners, if it is present.
     *
     * @param listeners the list of weak references from which the listener should be removed
     * @param listener the listener to remove
     * @param <T> the type of listener being managed
     */
    public static <T> void removeListener(List<WeakReference<T>> listeners, T listener) {
        if (listener == null) {
            return;
        }
        listeners.removeIf(reference -> reference.get() == null || reference.get() == listener);
    }

    /**
     * Gather the listeners which are still reachable from a list of weakly-held listeners.
     *
     * @param listeners the list of weak references to examine
     * @param <T> the type of listener being managed
     *
     * @return a new set containing every listener that has not yet been garbage collected
     */
    public static <T> Set<T> gatherListeners(List<WeakReference<T>> listeners) {
        final Set<T> result = new HashSet<>();
        for (WeakReference<T> reference : listeners) {
            final T listener = reference.get();
            if (listener != null) {
                result.add(listener);
            }
        }
        return result;
    }

    /**
     * Parse the leading decimal number of a tag value like {@code 3/12} (track three of twelve), which is how
     * the daemon reports track and disc numbers.
     *
     * @param value the raw tag value, may be {@code null}
     *
     * @return the number before any slash, or 0 if there is no parsable number
     */
    public static int parseLeadingNumber(String value) {
        if (value == null) {
            return 0;
        }
        String trimmed = value.trim();
        final int slash = trimmed.indexOf('/');
        if (slash >= 0) {
            trimmed = trimmed.substring(0, slash).trim();
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring unparsable number {}", value);
            return 0;
        }
    }

    /**
     * Parse a floating point number of seconds, as used for elapsed time and duration in daemon responses.
     *
     * @param value the raw value, may be {@code null}
     *
     * @return the parsed value, or {@code null} if absent or unparsable
     */
    public static Double parseSeconds(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring unparsable time value {}", value);
            return null;
        }
    }

    /**
     * Start a detached daemon thread to perform some best-effort background work.
     *
     * @param name the name to give the thread, which shows up in thread dumps
     * @param work the activity to perform
     */
    public static void startDetached(String name, Runnable work) {
        final Thread thread = new Thread(work, name);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Prevent instantiation.
     */
    private Util() {
        // Nothing to do.
    }
}
