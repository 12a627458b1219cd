package org.zarumet.data;

import org.apiguardian.api.API;

/**
 * The playback states the daemon reports in its {@code state} status field.
 */
@API(status = API.Status.STABLE)
public enum PlayState {

    PLAYING("play"),
    PAUSED("pause"),
    STOPPED("stop");

    /**
     * The value the daemon uses for this state.
     */
    @API(status = API.Status.STABLE)
    public final String protocolValue;

    PlayState(String protocolValue) {
        this.protocolValue = protocolValue;
    }

    /**
     * Look up the state corresponding to a status value sent by the daemon.
     *
     * @param value the raw {@code state} value
     *
     * @return the matching state, or {@code null} if the value is missing or not recognized
     */
    @API(status = API.Status.STABLE)
    public static PlayState lookup(String value) {
        for (PlayState state : values()) {
            if (state.protocolValue.equals(value)) {
                return state;
            }
        }
        return null;
    }
}
