package org.zarumet.pipewire;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zarumet.data.RateController;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controls the PipeWire graph clock through the {@code settings} metadata object, using the {@code pw-metadata}
 * command line tool that ships with PipeWire.
 */
@API(status = API.Status.EXPERIMENTAL)
public class PipeWireRateController implements RateController {

    private static final Logger logger = LoggerFactory.getLogger(PipeWireRateController.class);

    /**
     * Runs an external command and returns what it printed.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public interface CommandRunner {
        /**
         * Run a command to completion.
         *
         * @param command the program and its arguments
         *
         * @return the standard output of the command
         *
         * @throws IOException if the command could not be run, failed, or took too long
         */
        String run(List<String> command) throws IOException;
    }

    /**
     * How long a {@code pw-metadata} invocation may take, in milliseconds, unless configured otherwise.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int DEFAULT_COMMAND_TIMEOUT = 2000;

    /**
     * The metadata key holding the list of rates the graph may switch between.
     */
    static final String ALLOWED_RATES_KEY = "clock.allowed-rates";

    /**
     * The metadata key which, when nonzero, pins the graph to a rate.
     */
    static final String FORCE_RATE_KEY = "clock.force-rate";

    private static final Pattern ALLOWED_RATES_PATTERN =
            Pattern.compile("key:'" + Pattern.quote(ALLOWED_RATES_KEY) + "'\\s+value:'\\[([^\\]]*)\\]'");

    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+");

    private final AtomicInteger commandTimeout = new AtomicInteger(DEFAULT_COMMAND_TIMEOUT);

    private final CommandRunner runner;

    /**
     * Whether we have already checked for the tool, and what we found.
     */
    private Boolean available;

    /**
     * The supported rates, once read; stays {@code null} if the read failed.
     */
    private Set<Integer> supportedRates;

    /**
     * Whether we have already tried to read the supported rates, successfully or not.
     */
    private boolean supportedRatesRead;

    /**
     * Create a controller which runs {@code pw-metadata} as a child process.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public PipeWireRateController() {
        this.runner = this::runProcess;
    }

    /**
     * Create a controller which runs its commands through the supplied runner.
     *
     * @param runner runs the {@code pw-metadata} commands
     */
    @API(status = API.Status.EXPERIMENTAL)
    public PipeWireRateController(CommandRunner runner) {
        this.runner = runner;
    }

    /**
     * Set how long a single {@code pw-metadata} invocation may take before it is abandoned.
     *
     * @param timeout the limit in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setCommandTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        commandTimeout.set(timeout);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public int getCommandTimeout() {
        return commandTimeout.get();
    }

    @Override
    public synchronized boolean isAvailable() {
        if (available == null) {
            if (!System.getProperty("os.name", "").toLowerCase().contains("linux")) {
                logger.info("PipeWire sample rate control is only available on Linux.");
                available = false;
            } else {
                try {
                    runner.run(settingsCommand());
                    available = true;
                } catch (IOException e) {
                    logger.info("PipeWire sample rate control is unavailable: {}", e.getMessage());
                    available = false;
                }
            }
        }
        return available;
    }

    @Override
    public synchronized Set<Integer> getSupportedRates() {
        if (!supportedRatesRead) {
            supportedRatesRead = true;
            try {
                final Set<Integer> rates = parseAllowedRates(runner.run(settingsCommand()));
                if (rates.isEmpty()) {
                    logger.warn("PipeWire did not report any allowed sample rates.");
                } else {
                    supportedRates = Collections.unmodifiableSet(rates);
                    logger.info("PipeWire allows sample rates {}", supportedRates);
                }
            } catch (IOException e) {
                logger.warn("Problem reading PipeWire allowed sample rates, will not ask again", e);
            }
        }
        return supportedRates;
    }

    @Override
    public void setRate(int rate) throws IOException {
        if (rate < 1) {
            throw new IllegalArgumentException("rate must be positive");
        }
        forceRate(rate);
        logger.info("Forced PipeWire clock rate to {} Hz", rate);
    }

    @Override
    public void resetRate() throws IOException {
        forceRate(0);
        logger.info("Released PipeWire clock rate");
    }

    private void forceRate(int rate) throws IOException {
        runner.run(Arrays.asList("pw-metadata", "-n", "settings", "0", FORCE_RATE_KEY, Integer.toString(rate)));
    }

    private static List<String> settingsCommand() {
        return Arrays.asList("pw-metadata", "-n", "settings");
    }

    /**
     * Find the allowed clock rates in a listing of the {@code settings} metadata, which contains a line like
     * {@code update: id:0 key:'clock.allowed-rates' value:'[ 44100, 48000 ]' type:''}.
     *
     * @param listing the output of {@code pw-metadata -n settings}
     *
     * @return the allowed rates, empty if none were listed
     */
    static Set<Integer> parseAllowedRates(String listing) {
        final Set<Integer> result = new TreeSet<>();
        final Matcher matcher = ALLOWED_RATES_PATTERN.matcher(listing);
        if (matcher.find()) {
            final Matcher numbers = NUMBER_PATTERN.matcher(matcher.group(1));
            while (numbers.find()) {
                try {
                    result.add(Integer.parseInt(numbers.group()));
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring unreasonable sample rate {}", numbers.group());
                }
            }
        }
        return result;
    }

    private String runProcess(List<String> command) throws IOException {
        final Process process = new ProcessBuilder(new ArrayList<>(command)).redirectErrorStream(true).start();
        try {
            // The settings listing is only a few lines, so it fits in the pipe while we wait.
            if (!process.waitFor(commandTimeout.get(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException(command.get(0) + " did not finish within " + commandTimeout.get() + " ms");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for " + command.get(0));
        }
        final StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append('\n');
            }
        }
        if (process.exitValue() != 0) {
            throw new IOException(command.get(0) + " exited with status " + process.exitValue() + ": " +
                    output.toString().trim());
        }
        return output.toString();
    }

    @Override
    public String toString() {
        return "PipeWireRateController[available:" + available + ", supportedRates:" + supportedRates + "]";
    }
}
