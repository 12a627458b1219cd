package org.zarumet.data;

import org.apiguardian.api.API;

import java.io.IOException;
import java.util.Set;

/**
 * Controls the sample rate of the local audio device, so that songs can be played without resampling. Only some
 * platforms offer this; everywhere else {@link #isAvailable()} reports {@code false} and the rest is never called.
 * Every method may run an external tool and take a while to answer.
 */
@API(status = API.Status.EXPERIMENTAL)
public interface RateController {

    /**
     * @return {@code true} if the device rate can be controlled on this system
     */
    boolean isAvailable();

    /**
     * Find the sample rates the device supports.
     *
     * @return the supported rates in Hz, or {@code null} if they could not be determined
     */
    Set<Integer> getSupportedRates();

    /**
     * Force the device to run at a particular rate.
     *
     * @param rate the rate in Hz
     *
     * @throws IOException if the rate could not be set
     */
    void setRate(int rate) throws IOException;

    /**
     * Let the device choose its own rate again.
     *
     * @throws IOException if the rate could not be reset
     */
    void resetRate() throws IOException;
}
