package org.zarumet.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zarumet.LifecycleListener;
import org.zarumet.LifecycleParticipant;
import org.zarumet.mpd.Client;
import org.zarumet.mpd.ConnectionManager;
import org.zarumet.mpd.Response;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers the core's requests by sending commands to the daemon over connections obtained from a
 * {@link ConnectionManager}, and turning the responses into tracks and statuses.
 */
@API(status = API.Status.STABLE)
public class MpdDaemonClient implements DaemonClient {

    private static final Logger logger = LoggerFactory.getLogger(MpdDaemonClient.class);

    /**
     * The largest binary chunk we ask the daemon to send unless configured otherwise. Larger chunks mean fewer
     * round trips for big cover images, at the cost of holding the connection longer per response.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_BINARY_LIMIT = 1024 * 1024;

    private final ConnectionManager connectionManager;

    /**
     * The chunk size to configure on each connection, or 0 to leave the daemon's default alone.
     */
    private final AtomicInteger binaryLimit = new AtomicInteger(DEFAULT_BINARY_LIMIT);

    /**
     * The connections on which the binary limit has already been set. The limit is a per-connection setting, so
     * it must be sent again whenever the connection manager opens a new one.
     */
    private final Set<Client> configuredClients = Collections.newSetFromMap(new WeakHashMap<>());

    /**
     * Forget about configured connections when the connection manager stops, since they have all been closed.
     */
    private final LifecycleListener lifecycleListener = new LifecycleListener() {
        @Override
        public void stopped(LifecycleParticipant sender) {
            logger.info("Forgetting configured daemon connections because {} stopped.", sender);
            synchronized (configuredClients) {
                configuredClients.clear();
            }
        }
    };

    /**
     * Create a client that talks to the daemon through the specified connection manager, which must be started
     * before any requests are made.
     *
     * @param connectionManager supplies connections to the daemon
     */
    @API(status = API.Status.STABLE)
    public MpdDaemonClient(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
        connectionManager.addLifecycleListener(lifecycleListener);
    }

    /**
     * Perform a task with a daemon connection, configuring the connection first if it is new.
     */
    private <T> T withClient(ConnectionManager.ClientTask<T> task, String description) throws IOException {
        try {
            return connectionManager.invokeWithClientSession(client -> {
                configure(client);
                return task.useClient(client);
            }, description);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Problem " + description, e);
        }
    }

    private void configure(Client client) throws IOException {
        final int limit = binaryLimit.get();
        synchronized (configuredClients) {
            if (limit < 1 || configuredClients.contains(client)) {
                return;
            }
            configuredClients.add(client);
        }
        final Response response = client.sendCommand("binarylimit", Integer.toString(limit));
        if (response.isError()) {
            logger.info("Daemon does not support binarylimit, using its default chunk size: {}", response.errorMessage);
        }
    }

    @Override
    public byte[] albumArt(final String file) throws IOException {
        return withClient(client -> {
            final byte[] embedded = readChunks(client, "readpicture", file);
            if (embedded != null) {
                return embedded;
            }
            return readChunks(client, "albumart", file);
        }, "requesting album art for " + file);
    }

    /**
     * Read a complete picture using one of the chunked picture commands, requesting successive offsets until the
     * reported size has been received.
     *
     * @param client the connection to use
     * @param command {@code readpicture} for art embedded in the song, or {@code albumart} for a cover file
     * @param file the daemon's identifier for the song
     *
     * @return the picture bytes, or {@code null} if the daemon has no such picture or does not know the command
     *
     * @throws IOException if there is a problem communicating, or the daemon reports an unexpected error
     */
    private byte[] readChunks(Client client, String command, String file) throws IOException {
        final ByteArrayOutputStream picture = new ByteArrayOutputStream();
        long size = -1;
        while (true) {
            final Response response = client.sendCommand(command, file, Integer.toString(picture.size()));
            if (response.isError()) {
                if (response.errorCode != Response.ERROR_NO_EXIST) {
                    logger.debug("{} failed for {}: {}", command, file, response.errorMessage);
                }
                return null;
            }
            final byte[] chunk = response.getBinary();
            if (chunk == null) {
                return null;
            }
            if (size < 0) {
                try {
                    size = Long.parseLong(response.getFirst("size"));
                } catch (NumberFormatException | NullPointerException e) {
                    throw new IOException(command + " response did not report a valid size: " + response, e);
                }
            }
            picture.write(chunk, 0, chunk.length);
            if (chunk.length == 0 || picture.size() >= size) {
                return picture.toByteArray();
            }
        }
    }

    @Override
    public List<String> listTagValues(final String tag) throws IOException {
        return withClient(client -> client.simpleRequest("list", tag).getAll(tag), "listing " + tag + " values");
    }

    /**
     * Build a filter expression matching songs whose tag has exactly the specified value.
     *
     * @param tag the tag to match
     * @param value the value it must have
     *
     * @return the expression, ready to be sent as a single command argument
     */
    static String equalityFilter(String tag, String value) {
        return "(" + tag + " == " + Client.quote(value) + ")";
    }

    @Override
    public List<Track> find(final String tag, final String value, final String sortTag) throws IOException {
        final String filter = equalityFilter(tag, value);
        final Response response = withClient(client -> (sortTag == null) ?
                client.simpleRequest("find", filter) : client.simpleRequest("find", filter, "sort", sortTag),
                "finding songs with " + tag + " " + value);
        return toTracks(response);
    }

    @Override
    public List<Track> listAllSongs() throws IOException {
        return toTracks(withClient(client -> client.simpleRequest("listallinfo"), "listing all songs"));
    }

    @Override
    public Status status() throws IOException {
        final Response response = withClient(client -> client.simpleRequest("status"), "requesting status");
        final Map<String, String> values = new LinkedHashMap<>();
        for (Response.Pair pair : response.pairs) {
            values.putIfAbsent(pair.key, pair.value);
        }
        return Status.fromValues(values);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The limit is remembered, and applied to any connection opened later as well.</p>
     */
    @Override
    public void setBinaryLimit(final int bytes) throws IOException {
        if (bytes < 64) {
            throw new IllegalArgumentException("binary limit must be at least 64 bytes");
        }
        binaryLimit.set(bytes);
        synchronized (configuredClients) {
            configuredClients.clear();
        }
        withClient(client -> null, "setting binary limit");
    }

    /**
     * @return the largest binary chunk the daemon is asked to send
     */
    @API(status = API.Status.STABLE)
    public int getBinaryLimit() {
        return binaryLimit.get();
    }

    @Override
    public Track currentSong() throws IOException {
        final List<Track> tracks = toTracks(withClient(client -> client.simpleRequest("currentsong"),
                "requesting current song"));
        return tracks.isEmpty() ? null : tracks.get(0);
    }

    @Override
    public List<Track> queue() throws IOException {
        return toTracks(withClient(client -> client.simpleRequest("playlistinfo"), "requesting queue"));
    }

    /**
     * Extract the songs from a response, skipping any directory and playlist records mixed in with them.
     *
     * @param response a response listing songs
     *
     * @return the songs, in the order they were listed
     */
    static List<Track> toTracks(Response response) {
        final List<Map<String, String>> records = response.records("file", "directory", "playlist");
        final List<Track> tracks = new ArrayList<>(records.size());
        for (Map<String, String> record : records) {
            tracks.add(Track.fromTags(record));
        }
        return tracks;
    }

    @Override
    public String toString() {
        return "MpdDaemonClient[connectionManager:" + connectionManager + ", binaryLimit:" + binaryLimit.get() + "]";
    }
}
