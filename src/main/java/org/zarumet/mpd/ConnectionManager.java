package org.zarumet.mpd;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zarumet.LifecycleParticipant;
import org.zarumet.Util;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <p>Owns the connection to the Music Player Daemon. Everything that needs to send commands borrows the one
 * open {@link Client} for the duration of a {@link ClientTask}; the daemon answers commands strictly in order,
 * so tasks running at the same time simply take turns on the socket.</p>
 *
 * <p>The connection is opened when first needed, reopened if the daemon drops it, and closed again once no task
 * has used it for {@link #getIdleLimit()} seconds, since the daemon itself disconnects idle clients.</p>
 */
@API(status = API.Status.STABLE)
public class ConnectionManager extends LifecycleParticipant {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    /**
     * Work that is performed with a borrowed daemon connection.
     *
     * @param <T> the result of the work
     */
    @API(status = API.Status.STABLE)
    public interface ClientTask<T> {
        T useClient(Client client) throws Exception;
    }

    /**
     * Where the daemon is found unless configured otherwise.
     */
    @API(status = API.Status.STABLE)
    public static final String DEFAULT_HOST = "localhost";

    /**
     * The daemon's standard command port.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_PORT = 6600;

    /**
     * Milliseconds allowed for connecting, and for each read, unless configured otherwise.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_SOCKET_TIMEOUT = 10000;

    /**
     * Seconds an unused connection stays open unless configured otherwise.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_IDLE_LIMIT = 10;

    /**
     * How often the idle closer checks the connection, in milliseconds.
     */
    private static final long IDLE_CHECK_INTERVAL = 500;

    private final AtomicReference<String> host = new AtomicReference<>(DEFAULT_HOST);

    private final AtomicInteger port = new AtomicInteger(DEFAULT_PORT);

    private final AtomicInteger socketTimeout = new AtomicInteger(DEFAULT_SOCKET_TIMEOUT);

    private final AtomicInteger idleLimit = new AtomicInteger(DEFAULT_IDLE_LIMIT);

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * The connection being shared, or {@code null} when none is open.
     */
    private Client openClient;

    /**
     * Number of tasks currently holding {@link #openClient}.
     */
    private int borrowers;

    /**
     * When the last borrower gave the connection back.
     */
    private long lastReturned;

    /**
     * Change where the daemon is found. Connections already open are not affected.
     *
     * @param host the daemon's host name or address
     *
     * @throws IllegalArgumentException if {@code host} is {@code null} or empty
     */
    @API(status = API.Status.STABLE)
    public void setHost(String host) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        this.host.set(host);
    }

    @API(status = API.Status.STABLE)
    public String getHost() {
        return host.get();
    }

    /**
     * Change the port the daemon listens on. Connections already open are not affected.
     *
     * @param port the daemon's command port
     *
     * @throws IllegalArgumentException if {@code port} is not a valid TCP port
     */
    @API(status = API.Status.STABLE)
    public void setPort(int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        this.port.set(port);
    }

    @API(status = API.Status.STABLE)
    public int getPort() {
        return port.get();
    }

    /**
     * Change how long an unused connection is kept for the next task. With a limit of zero the connection is
     * closed as soon as the last task using it finishes.
     *
     * @param seconds the idle limit
     *
     * @throws IllegalArgumentException if {@code seconds} is negative
     */
    @API(status = API.Status.STABLE)
    public void setIdleLimit(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("idle limit cannot be negative");
        }
        idleLimit.set(seconds);
    }

    @API(status = API.Status.STABLE)
    public int getIdleLimit() {
        return idleLimit.get();
    }

    /**
     * Change how long to wait for the daemon to accept a connection or answer a command. Applies to connections
     * opened afterwards.
     *
     * @param timeout the limit in milliseconds, 0 to wait forever
     */
    @API(status = API.Status.STABLE)
    public void setSocketTimeout(int timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout cannot be negative");
        }
        socketTimeout.set(timeout);
    }

    @API(status = API.Status.STABLE)
    public int getSocketTimeout() {
        return socketTimeout.get();
    }

    /**
     * Hand out the shared connection, opening one first if necessary.
     *
     * @param description what the borrower is doing, for the error message if the daemon cannot be reached
     *
     * @return the connection, which must be given back with {@link #giveBack(Client)}
     *
     * @throws IOException if no connection could be opened
     */
    private synchronized Client borrow(String description) throws IOException {
        if (openClient != null && !openClient.isConnected()) {
            logger.info("Daemon connection was lost, reconnecting: {}", openClient);
            openClient = null;
            borrowers = 0;
        }
        if (openClient == null) {
            openClient = connect(description);
            logger.info("Connected to daemon: {}", openClient);
        }
        ++borrowers;
        return openClient;
    }

    private Client connect(String description) throws IOException {
        final Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host.get(), port.get()), socketTimeout.get());
            socket.setSoTimeout(socketTimeout.get());
            return new Client(socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeProblem) {
                logger.warn("Problem closing socket after failing to connect", closeProblem);
            }
            throw new IOException("Unable to connect to daemon at " + host.get() + ":" + port.get() + " while " +
                    description, e);
        }
    }

    /**
     * Return a borrowed connection. The last borrower closes it when idle connections are not being kept.
     *
     * @param client the connection that was handed out by {@link #borrow(String)}
     */
    private synchronized void giveBack(Client client) {
        if (client != openClient) {
            logger.debug("Connection was replaced or closed while borrowed: {}", client);
            return;
        }
        lastReturned = System.currentTimeMillis();
        if (--borrowers <= 0) {
            borrowers = 0;
            if (idleLimit.get() == 0) {
                disconnect("no idle limit");
            }
        }
    }

    private void disconnect(String reason) {
        logger.debug("Closing daemon connection ({}): {}", reason, openClient);
        openClient.close();
        openClient = null;
        borrowers = 0;
    }

    /**
     * Run a task with the daemon connection, opening it if needed, and give the connection back afterwards no
     * matter how the task ends.
     *
     * @param task the work to perform
     * @param description a verb phrase like "requesting status" naming the work, for error messages
     * @param <T> the result of the work
     *
     * @return what the task returned
     *
     * @throws IllegalStateException if the manager has not been started
     * @throws IOException if the daemon cannot be reached or a command fails
     * @throws Exception anything else thrown by {@code task}
     */
    @API(status = API.Status.STABLE)
    public <T> T invokeWithClientSession(ClientTask<T> task, String description) throws Exception {
        if (!isRunning()) {
            throw new IllegalStateException("Daemon connection manager is not running, cannot perform " + description);
        }
        final Client client = borrow(description);
        try {
            return task.useClient(client);
        } finally {
            giveBack(client);
        }
    }

    private synchronized void closeIfIdle() {
        if (openClient != null && borrowers == 0 &&
                System.currentTimeMillis() - lastReturned >= idleLimit.get() * 1000L) {
            disconnect("idle for " + idleLimit.get() + " seconds");
        }
    }

    @Override
    @API(status = API.Status.STABLE)
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Begin offering daemon connections, and start watching for idle ones. Has no effect if already running.
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            Util.startDetached("Idle daemon connection closer", () -> {
                while (isRunning()) {
                    try {
                        Thread.sleep(IDLE_CHECK_INTERVAL);
                    } catch (InterruptedException e) {
                        logger.warn("Idle connection closer interrupted, stopping early");
                        Thread.currentThread().interrupt();
                        return;
                    }
                    closeIfIdle();
                }
                logger.debug("Idle connection closer finished.");
            });
            logger.info("Daemon connection manager started for {}:{}", host.get(), port.get());
            deliverLifecycleAnnouncement(logger, true);
        }
    }

    /**
     * Stop offering connections and close the open one, if any. Tasks still holding it will see it fail.
     */
    @API(status = API.Status.STABLE)
    public synchronized void stop() {
        if (running.compareAndSet(true, false)) {
            if (openClient != null) {
                disconnect("stopping");
            }
            logger.info("Daemon connection manager stopped.");
            deliverLifecycleAnnouncement(logger, false);
        }
    }

    @Override
    public synchronized String toString() {
        return "ConnectionManager[running:" + isRunning() + ", host:" + host.get() + ", port:" + port.get() +
                ", openClient:" + openClient + ", borrowers:" + borrowers + ", idleLimit:" + idleLimit.get() + "]";
    }
}
