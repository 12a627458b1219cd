package org.zarumet.mpd;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <p>Encapsulates a complete response read from the daemon: the ordered {@code key: value} lines it sent, any
 * binary payload that accompanied them, and whether the response ended with {@code OK} or with an {@code ACK}
 * error line.</p>
 *
 * <p>Responses are immutable once read.</p>
 */
@API(status = API.Status.STABLE)
public class Response {

    private static final Logger logger = LoggerFactory.getLogger(Response.class);

    /**
     * The line which terminates a successful response.
     */
    public static final String OK = "OK";

    /**
     * The prefix of the line which terminates a failed response.
     */
    public static final String ACK_PREFIX = "ACK ";

    /**
     * The key announcing that a binary payload of the stated length follows on the next line.
     */
    public static final String BINARY_KEY = "binary";

    /**
     * The error code the daemon uses to report that a requested object does not exist.
     */
    public static final int ERROR_NO_EXIST = 50;

    /**
     * Parses {@code ACK [error@command_listNum] {current_command} message_text}.
     */
    private static final Pattern ACK_PATTERN = Pattern.compile("ACK \\[(\\d+)@(\\d+)] \\{([^}]*)} ?(.*)");

    /**
     * A single {@code key: value} line of a response.
     */
    @API(status = API.Status.STABLE)
    public static class Pair {

        /**
         * The key, as sent by the daemon (case is preserved, since tag names are mixed case).
         */
        @API(status = API.Status.STABLE)
        public final String key;

        /**
         * The value following the colon and space.
         */
        @API(status = API.Status.STABLE)
        public final String value;

        @API(status = API.Status.STABLE)
        public Pair(String key, String value) {
            this.key = key;
            this.value = value;
        }

        @Override
        public String toString() {
            return key + ": " + value;
        }
    }

    /**
     * The lines of the response, in the order they were received.
     */
    @API(status = API.Status.STABLE)
    public final List<Pair> pairs;

    /**
     * The binary payload that came with the response, or {@code null} if there was none.
     */
    private final byte[] binary;

    /**
     * The error code reported by an {@code ACK} line, or 0 if the response was successful.
     */
    @API(status = API.Status.STABLE)
    public final int errorCode;

    /**
     * The error message reported by an {@code ACK} line, or {@code null} if the response was successful.
     */
    @API(status = API.Status.STABLE)
    public final String errorMessage;

    /**
     * Constructor sets all the immutable fields.
     *
     * @param pairs the lines that were received
     * @param binary the binary payload, if any
     * @param errorCode the {@code ACK} error code, or 0 for success
     * @param errorMessage the {@code ACK} message, or {@code null} for success
     */
    @API(status = API.Status.STABLE)
    public Response(List<Pair> pairs, byte[] binary, int errorCode, String errorMessage) {
        this.pairs = Collections.unmodifiableList(new ArrayList<>(pairs));
        this.binary = (binary == null) ? null : binary.clone();
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    /**
     * Check whether the daemon rejected the command.
     *
     * @return {@code true} if the response ended with an {@code ACK} line
     */
    @API(status = API.Status.STABLE)
    public boolean isError() {
        return errorMessage != null;
    }

    /**
     * Get the binary payload that accompanied the response.
     *
     * @return a copy of the payload bytes, or {@code null} if none was sent
     */
    @API(status = API.Status.STABLE)
    public byte[] getBinary() {
        return (binary == null) ? null : binary.clone();
    }

    /**
     * Find the first value sent with the specified key.
     *
     * @param key the key of interest, compared case-insensitively
     *
     * @return the value, or {@code null} if the key was not present
     */
    @API(status = API.Status.STABLE)
    public String getFirst(String key) {
        for (Pair pair : pairs) {
            if (pair.key.equalsIgnoreCase(key)) {
                return pair.value;
            }
        }
        return null;
    }

    /**
     * Gather every value sent with the specified key, in the order received.
     *
     * @param key the key of interest, compared case-insensitively
     *
     * @return the values found, possibly empty
     */
    @API(status = API.Status.STABLE)
    public List<String> getAll(String key) {
        final List<String> result = new LinkedList<>();
        for (Pair pair : pairs) {
            if (pair.key.equalsIgnoreCase(key)) {
                result.add(pair.value);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Split the response into records, each of which begins with one of the specified keys, and keep only those
     * which begin with the first of them. This is how song lists are separated from the directory and playlist
     * entries that can be interleaved with them. Within a record, the first value sent for a key wins.
     *
     * @param wantedKey the key that starts the records of interest, like {@code file}
     * @param otherKeys keys that start records that should be skipped, like {@code directory}
     *
     * @return the records of interest, each mapping keys to values in the order received
     */
    @API(status = API.Status.STABLE)
    public List<Map<String, String>> records(String wantedKey, String... otherKeys) {
        final List<String> skipped = Arrays.asList(otherKeys);
        final List<Map<String, String>> result = new LinkedList<>();
        Map<String, String> current = null;
        for (Pair pair : pairs) {
            if (pair.key.equalsIgnoreCase(wantedKey)) {
                current = new LinkedHashMap<>();
                result.add(current);
            } else if (skipped.stream().anyMatch(pair.key::equalsIgnoreCase)) {
                current = null;
            }
            if (current != null) {
                current.putIfAbsent(pair.key, pair.value);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Read a single line from the daemon, which is always UTF-8 and terminated by a newline.
     *
     * @param is the stream connected to the daemon
     *
     * @return the line, without its terminator
     *
     * @throws IOException if there is a problem reading, or the stream ends before the line does
     */
    static String readLine(DataInputStream is) throws IOException {
        final ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int b = is.read();
        while (b != '\n') {
            if (b < 0) {
                throw new EOFException("Connection closed by daemon while reading a response line");
            }
            line.write(b);
            b = is.read();
        }
        return line.toString(StandardCharsets.UTF_8);
    }

    /**
     * Read a complete response from the daemon.
     *
     * @param is the stream connected to the daemon
     *
     * @return the response, which may report an error if the daemon rejected the command
     *
     * @throws IOException if there is a problem reading, or the response is malformed
     */
    @API(status = API.Status.STABLE)
    public static Response read(DataInputStream is) throws IOException {
        final List<Pair> pairs = new LinkedList<>();
        byte[] binary = null;
        while (true) {
            final String line = readLine(is);
            if (line.equals(OK)) {
                return new Response(pairs, binary, 0, null);
            }
            if (line.startsWith(ACK_PREFIX)) {
                final Matcher matcher = ACK_PATTERN.matcher(line);
                if (matcher.matches()) {
                    logger.debug("Daemon rejected command {{}}: {}", matcher.group(3), matcher.group(4));
                    return new Response(pairs, binary, Integer.parseInt(matcher.group(1)), matcher.group(4));
                }
                return new Response(pairs, binary, -1, line.substring(ACK_PREFIX.length()));
            }
            final int colon = line.indexOf(": ");
            if (colon < 1) {
                throw new IOException("Malformed response line from daemon: " + line);
            }
            final Pair pair = new Pair(line.substring(0, colon), line.substring(colon + 2));
            if (pair.key.equals(BINARY_KEY)) {
                final int length;
                try {
                    length = Integer.parseInt(pair.value);
                } catch (NumberFormatException e) {
                    throw new IOException("Malformed binary length from daemon: " + pair.value, e);
                }
                binary = new byte[length];
                is.readFully(binary);
                if (is.read() != '\n') {
                    throw new IOException("Binary payload from daemon was not followed by a newline");
                }
            }
            pairs.add(pair);
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Response[pairs:").append(pairs.size());
        if (binary != null) {
            sb.append(", binary:").append(binary.length).append(" bytes");
        }
        if (isError()) {
            sb.append(", error:").append(errorCode).append(" ").append(errorMessage);
        }
        return sb.append("]").toString();
    }
}
