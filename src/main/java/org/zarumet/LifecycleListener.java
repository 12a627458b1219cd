package org.zarumet;

import org.apiguardian.api.API;

/**
 * Hears when a {@link LifecycleParticipant} starts or stops. A daemon client, for example, forgets per-connection
 * settings when the {@link org.zarumet.mpd.ConnectionManager} it uses stops, because every connection is closed
 * then. Both callbacks do nothing unless overridden, so a listener only implements the transitions it needs.
 */
@API(status = API.Status.STABLE)
public interface LifecycleListener {

    /**
     * The participant has started and is offering its service.
     *
     * @param sender the participant that started
     */
    default void started(LifecycleParticipant sender) {
    }

    /**
     * The participant has stopped, and anything obtained from it while it was running is no longer valid.
     *
     * @param sender the participant that stopped
     */
    default void stopped(LifecycleParticipant sender) {
    }
}
