package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zarumet.Util;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>Keeps the audio device running at the current song's sample rate while playing ("bit-perfect" playback), and
 * hands rate selection back to the device when playback pauses or stops.</p>
 *
 * <p>Rate changes are requested as detached tasks whose failures are only logged: they are a refinement, and must
 * never hold up or interrupt playback state handling. For the same reason the controller is asked whether it is
 * available, and which rates it supports, only once, by a detached task started with {@link #initialize()}. Polls
 * arriving before that task finishes are ignored.</p>
 */
@API(status = API.Status.EXPERIMENTAL)
public class SampleRateReactor {

    private static final Logger logger = LoggerFactory.getLogger(SampleRateReactor.class);

    private static final Executor DETACHED_THREADS = task -> Util.startDetached("Sample rate switch", task);

    private final RateController controller;

    private final Executor executor;

    private final AtomicBoolean bitPerfectEnabled = new AtomicBoolean(true);

    private final AtomicBoolean initializationStarted = new AtomicBoolean(false);

    /**
     * Set once the controller has been checked; until then polls are ignored.
     */
    private volatile boolean initialized;

    private volatile boolean controllerAvailable;

    /**
     * What the controller reported as its supported rates, {@code null} if it could not tell us.
     */
    private volatile Set<Integer> supportedRates;

    /**
     * The play state seen on the previous poll; {@code null} when unknown, including before the first poll.
     */
    private PlayState lastPlayState;

    /**
     * The current song's sample rate seen on the previous poll, or 0 if unknown.
     */
    private int lastSampleRate;

    @API(status = API.Status.EXPERIMENTAL)
    public SampleRateReactor(RateController controller) {
        this(controller, DETACHED_THREADS);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public SampleRateReactor(RateController controller, Executor executor) {
        this.controller = controller;
        this.executor = executor;
    }

    /**
     * Turn bit-perfect rate following on or off. While off, polls are ignored entirely.
     *
     * @param enabled whether the device rate should follow the current song
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setBitPerfectEnabled(boolean enabled) {
        bitPerfectEnabled.set(enabled);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public boolean isBitPerfectEnabled() {
        return bitPerfectEnabled.get();
    }

    /**
     * Start asking the controller, on a detached task, whether it is available and which rates it supports. Only
     * the first call has any effect; {@link #handleStateChange(Status, Track)} makes that call itself if needed.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void initialize() {
        if (initializationStarted.compareAndSet(false, true)) {
            detach(() -> {
                try {
                    controllerAvailable = controller.isAvailable();
                    if (controllerAvailable) {
                        supportedRates = controller.getSupportedRates();
                        logger.info("Device sample rate control ready, supported rates: {}", supportedRates);
                    }
                } finally {
                    initialized = true;
                }
            }, "checking device sample rate control");
        }
    }

    /**
     * @return {@code true} once the controller has been checked, whatever the outcome
     */
    @API(status = API.Status.EXPERIMENTAL)
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Choose the device rate to use for a song.
     *
     * @param songRate the song's sample rate in Hz
     * @param supportedRates the rates the device supports
     *
     * @return the song's rate if supported, otherwise the smallest supported whole multiple of it, otherwise the
     *         highest supported rate; the song's rate if nothing is known about supported rates
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static int resolveTargetRate(int songRate, Set<Integer> supportedRates) {
        if (supportedRates == null || supportedRates.isEmpty() || supportedRates.contains(songRate)) {
            return songRate;
        }
        final TreeSet<Integer> sorted = new TreeSet<>(supportedRates);
        for (int rate : sorted) {
            if (rate > songRate && rate % songRate == 0) {
                return rate;
            }
        }
        return sorted.last();
    }

    /**
     * React to the latest status poll. Never waits on the controller: rate changes happen on detached tasks, and
     * what the controller supports is taken from the results of {@link #initialize()}.
     *
     * @param status the daemon's status, or {@code null} if it could not be obtained
     * @param current the current song, or {@code null} if there is none
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void handleStateChange(Status status, Track current) {
        if (!bitPerfectEnabled.get()) {
            return;
        }
        initialize();
        if (!initialized || !controllerAvailable) {
            return;
        }
        final PlayState state = (status == null) ? null : status.state;
        final int sampleRate = (current == null) ? 0 : current.getSampleRate();

        if (state == PlayState.PLAYING) {
            final boolean stateChanged = state != lastPlayState;
            final boolean rateChanged = sampleRate != lastSampleRate;
            if ((stateChanged || rateChanged) && sampleRate > 0) {
                final Set<Integer> supported = supportedRates;
                if (supported != null) {
                    final int target = resolveTargetRate(sampleRate, supported);
                    logger.debug("Setting device sample rate to {} (song rate: {})", target, sampleRate);
                    detach(() -> controller.setRate(target), "setting device sample rate to " + target);
                }
            }
        } else if (lastPlayState == PlayState.PLAYING || lastPlayState == null) {
            logger.debug("Resetting device sample rate (playback {}, last state {})", state, lastPlayState);
            detach(controller::resetRate, "resetting device sample rate");
        }

        lastPlayState = state;
        lastSampleRate = sampleRate;
    }

    /**
     * A rate change that may fail.
     */
    private interface RateChange {
        void apply() throws Exception;
    }

    private void detach(RateChange change, String description) {
        try {
            executor.execute(() -> {
                try {
                    change.apply();
                } catch (Exception e) {
                    logger.warn("Problem {}", description, e);
                }
            });
        } catch (RuntimeException e) {
            logger.warn("Unable to start {}", description, e);
        }
    }

    @Override
    public String toString() {
        return "SampleRateReactor[enabled:" + bitPerfectEnabled.get() + ", initialized:" + initialized +
                ", available:" + controllerAvailable + ", lastPlayState:" + lastPlayState +
                ", lastSampleRate:" + lastSampleRate + "]";
    }
}
