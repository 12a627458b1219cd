package org.zarumet;

import org.apiguardian.api.API;
import org.slf4j.Logger;

import java.lang.ref.WeakReference;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * Base for components that are started and stopped, like the daemon connection manager, and that tell
 * interested parties when that happens.
 *
 * <p>Listeners are held weakly: registering does not keep a listener alive. Announcements are made from a
 * detached thread, after the transition is complete, so subclasses can announce from inside their synchronized
 * {@code start} and {@code stop} methods and listeners may call back into the participant.</p>
 */
@API(status = API.Status.STABLE)
public abstract class LifecycleParticipant {

    private final List<WeakReference<LifecycleListener>> lifecycleListeners = new LinkedList<>();

    /**
     * Start announcing starts and stops to a listener. Adding {@code null}, or a listener that is already
     * registered, has no effect.
     *
     * @param listener the listener to register
     */
    @API(status = API.Status.STABLE)
    public synchronized void addLifecycleListener(LifecycleListener listener) {
        Util.addListener(lifecycleListeners, listener);
    }

    /**
     * Stop announcing to a listener. Removing one that is not registered has no effect.
     *
     * @param listener the listener to unregister
     */
    @API(status = API.Status.STABLE)
    public synchronized void removeLifecycleListener(LifecycleListener listener) {
        Util.removeListener(lifecycleListeners, listener);
    }

    /**
     * @return a snapshot of the listeners currently registered
     */
    @API(status = API.Status.STABLE)
    public synchronized Set<LifecycleListener> getLifecycleListeners() {
        return Collections.unmodifiableSet(Util.gatherListeners(lifecycleListeners));
    }

    /**
     * Tell every registered listener about a transition. A listener that throws is logged and skipped.
     *
     * @param logger the subclass logger, so problems are attributed to the participant that announced them
     * @param starting {@code true} for a start, {@code false} for a stop
     */
    protected void deliverLifecycleAnnouncement(final Logger logger, final boolean starting) {
        final Set<LifecycleListener> listeners = getLifecycleListeners();
        if (listeners.isEmpty()) {
            return;
        }
        logger.debug("Announcing that {} has {}", this, starting ? "started" : "stopped");
        Util.startDetached("Lifecycle announcement delivery", () -> {
            for (final LifecycleListener listener : listeners) {
                try {
                    if (starting) {
                        listener.started(this);
                    } else {
                        listener.stopped(this);
                    }
                } catch (Throwable t) {
                    logger.warn("Problem delivering lifecycle announcement to {}", listener, t);
                }
            }
        });
    }

    /**
     * @return {@code true} if the participant has started and is ready to offer its service
     */
    @API(status = API.Status.STABLE)
    public abstract boolean isRunning();
}
