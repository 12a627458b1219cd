package org.zarumet.data;

import org.apiguardian.api.API;
import org.zarumet.Util;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Captures the playback status reported by the daemon at a moment in time, as an immutable value class.
 */
@API(status = API.Status.STABLE)
public class Status {

    /**
     * Whether the daemon is playing, paused, or stopped; {@code null} if it did not say.
     */
    @API(status = API.Status.STABLE)
    public final PlayState state;

    /**
     * Seconds elapsed in the current song, or {@code null} if there is no current song.
     */
    @API(status = API.Status.STABLE)
    public final Double elapsed;

    /**
     * Duration of the current song in seconds, or {@code null} if unknown.
     */
    @API(status = API.Status.STABLE)
    public final Double duration;

    /**
     * The position of the current song within the queue, or {@code null} if there is no current song.
     */
    @API(status = API.Status.STABLE)
    public final Integer songPosition;

    /**
     * The mixer volume, from 0 to 100, or -1 if the daemon has no mixer.
     */
    @API(status = API.Status.STABLE)
    public final int volume;

    /**
     * Create an instance to represent a particular playback status.
     *
     * @param state the playback state, if known
     * @param elapsed seconds into the current song, if any
     * @param duration length of the current song in seconds, if known
     * @param songPosition queue position of the current song, if any
     * @param volume the mixer volume, or -1
     */
    @API(status = API.Status.STABLE)
    public Status(PlayState state, Double elapsed, Double duration, Integer songPosition, int volume) {
        this.state = state;
        this.elapsed = elapsed;
        this.duration = duration;
        this.songPosition = songPosition;
        this.volume = volume;
    }

    /**
     * Build a status from the values of a {@code status} response.
     *
     * @param values the keys and values the daemon sent
     *
     * @return the corresponding status
     */
    @API(status = API.Status.STABLE)
    public static Status fromValues(Map<String, String> values) {
        final Map<String, String> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(values);
        final String position = lookup.get("song");
        final String volume = lookup.get("volume");
        return new Status(PlayState.lookup(lookup.get("state")),
                Util.parseSeconds(lookup.get("elapsed")),
                Util.parseSeconds(lookup.get("duration")),
                position == null ? null : Util.parseLeadingNumber(position),
                volume == null ? -1 : Util.parseLeadingNumber(volume));
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Status)) {
            return false;
        }
        final Status other = (Status) obj;
        return state == other.state && Objects.equals(elapsed, other.elapsed) &&
                Objects.equals(duration, other.duration) && Objects.equals(songPosition, other.songPosition) &&
                volume == other.volume;
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, elapsed, duration, songPosition, volume);
    }

    @Override
    public String toString() {
        return "Status[state=" + state + ", elapsed=" + elapsed + ", duration=" + duration +
                ", songPosition=" + songPosition + ", volume=" + volume + "]";
    }
}
