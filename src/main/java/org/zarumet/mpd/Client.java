package org.zarumet.mpd;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Manages a connection to the daemon's command port, allowing commands to be sent, and their responses to be
 * read. Commands are serialized, since the daemon answers them strictly in order over the one socket.
 */
@API(status = API.Status.STABLE)
public class Client {

    private static final Logger logger = LoggerFactory.getLogger(Client.class.getName());

    /**
     * The prefix of the greeting line the daemon sends as soon as a connection is opened.
     */
    public static final String GREETING_PREFIX = "OK MPD ";

    /**
     * The socket on which we are communicating with the daemon.
     */
    final Socket socket;

    /**
     * The stream used to read responses from the daemon.
     */
    final DataInputStream is;

    /**
     * The stream used to send commands to the daemon.
     */
    final OutputStream os;

    /**
     * The protocol version announced by the daemon in its greeting.
     */
    private final String protocolVersion;

    /**
     * The client must be constructed with a freshly-opened socket to the daemon. It must be in charge of all
     * communication with that socket.
     *
     * @param socket the newly opened network socket to the daemon
     *
     * @throws IOException if there is a problem setting up the streams, or the daemon did not greet us properly
     */
    @API(status = API.Status.STABLE)
    public Client(Socket socket) throws IOException {
        this.socket = socket;
        is = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        os = socket.getOutputStream();

        try {
            final String greeting = Response.readLine(is);
            if (!greeting.startsWith(GREETING_PREFIX)) {
                throw new IOException("Did not receive expected greeting from daemon, instead got: " + greeting);
            }
            protocolVersion = greeting.substring(GREETING_PREFIX.length()).trim();
            logger.debug("Connected to daemon speaking protocol version {}", protocolVersion);
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    /**
     * Get the protocol version the daemon announced when we connected.
     *
     * @return a version string like {@code 0.23.5}
     */
    @API(status = API.Status.STABLE)
    public String getProtocolVersion() {
        return protocolVersion;
    }

    /**
     * Check whether our connection is still available for use. We will close it if there is ever a problem
     * communicating with the daemon.
     *
     * @return {@code true} if this instance can still be used to send commands
     */
    @API(status = API.Status.STABLE)
    public boolean isConnected() {
        return socket.isConnected() && !socket.isClosed();
    }

    /**
     * Closes the connection to the daemon. This instance can no longer be used after this action.
     */
    @API(status = API.Status.STABLE)
    public void close() {
        try {
            os.close();
        } catch (IOException e) {
            logger.warn("Problem closing daemon client output stream", e);
        }
        try {
            is.close();
        } catch (IOException e) {
            logger.warn("Problem closing daemon client input stream", e);
        }
        try {
            socket.close();
        } catch (IOException e) {
            logger.warn("Problem closing daemon client socket", e);
        }
    }

    /**
     * Quote a command argument so that spaces, quotation marks and backslashes survive the trip to the daemon.
     *
     * @param argument the raw argument
     *
     * @return the argument wrapped in double quotes, with embedded quotes and backslashes escaped
     */
    @API(status = API.Status.STABLE)
    public static String quote(String argument) {
        final StringBuilder sb = new StringBuilder(argument.length() + 2).append('"');
        for (char c : argument.toCharArray()) {
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    /**
     * Build the command line that will be sent for a command and its arguments.
     *
     * @param command the command name
     * @param arguments the arguments, each of which will be quoted
     *
     * @return the complete line, without its terminating newline
     */
    static String buildCommandLine(String command, String... arguments) {
        final StringBuilder sb = new StringBuilder(command);
        for (String argument : arguments) {
            sb.append(' ').append(quote(argument));
        }
        return sb.toString();
    }

    /**
     * Send a command and read its response, whether it succeeded or was rejected by the daemon.
     *
     * @param command the command name
     * @param arguments the arguments to send with it
     *
     * @return the response, which may report an error
     *
     * @throws IOException if there is a problem communicating; the connection is closed when this happens
     */
    @API(status = API.Status.STABLE)
    public synchronized Response sendCommand(String command, String... arguments) throws IOException {
        if (!isConnected()) {
            throw new IOException("sendCommand() called after daemon connection was closed");
        }
        final String line = buildCommandLine(command, arguments);
        logger.debug("Sending> {}", line);
        try {
            os.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            os.flush();
            final Response response = Response.read(is);
            logger.debug("Received< {}", response);
            return response;
        } catch (IOException e) {
            logger.warn("Problem communicating with daemon, closing connection", e);
            close();
            throw e;
        }
    }

    /**
     * Send a command that is expected to succeed, then read and return its response.
     *
     * @param command the command name
     * @param arguments the arguments to send with it
     *
     * @return the successful response
     *
     * @throws IOException if there is a communication problem, or the daemon rejected the command
     */
    @API(status = API.Status.STABLE)
    public Response simpleRequest(String command, String... arguments) throws IOException {
        final Response response = sendCommand(command, arguments);
        if (response.isError()) {
            throw new IOException("Daemon rejected " + command + " command (error " + response.errorCode + "): " +
                    response.errorMessage);
        }
        return response;
    }

    @Override
    public String toString() {
        return "Client[address:" + socket.getRemoteSocketAddress() + ", protocolVersion:" + protocolVersion +
                ", connected:" + isConnected() + "]";
    }
}
