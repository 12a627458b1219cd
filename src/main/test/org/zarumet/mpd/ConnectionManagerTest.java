package org.zarumet.mpd;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zarumet.LifecycleListener;
import org.zarumet.LifecycleParticipant;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ConnectionManagerTest {

    private FakeMpdServer server;
    private ConnectionManager manager;

    @Before
    public void setUp() throws IOException {
        server = new FakeMpdServer();
        manager = new ConnectionManager();
        manager.setHost(InetAddress.getLoopbackAddress().getHostAddress());
        manager.setPort(server.getPort());
        manager.setSocketTimeout(2000);
    }

    @After
    public void tearDown() throws IOException {
        manager.stop();
        server.close();
    }

    private String status() throws Exception {
        return manager.invokeWithClientSession(client -> client.simpleRequest("status").getFirst("state"),
                "requesting status");
    }

    @Test(expected = IllegalStateException.class)
    public void refusesSessionsWhenStopped() throws Exception {
        status();
    }

    @Test
    public void sessionsShareOneConnection() throws Exception {
        server.respond("status", "state: play\nOK\n");
        manager.start();
        assertEquals("play", status());
        assertEquals("play", status());
        assertEquals(1, server.getConnectionCount());
        assertEquals(Arrays.asList("status", "status"), server.getCommands());
    }

    @Test
    public void zeroIdleLimitClosesAfterEachSession() throws Exception {
        manager.setIdleLimit(0);
        manager.start();
        status();
        status();
        assertEquals(2, server.getConnectionCount());
    }

    @Test
    public void connectionFailureIsReported() throws Exception {
        final int unusedPort;
        try (ServerSocket spare = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            unusedPort = spare.getLocalPort();
        }
        manager.setPort(unusedPort);
        manager.start();
        try {
            status();
            fail("Expected connection failure");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("Unable to connect"));
            assertTrue(e.getMessage().contains("requesting status"));
        }
    }

    @Test
    public void lifecycleListenersHearStartAndStop() throws InterruptedException {
        final BlockingQueue<String> events = new LinkedBlockingQueue<>();
        final LifecycleListener listener = new LifecycleListener() {
            @Override
            public void started(LifecycleParticipant sender) {
                events.add("started");
            }

            @Override
            public void stopped(LifecycleParticipant sender) {
                events.add("stopped");
            }
        };
        manager.addLifecycleListener(listener);
        manager.addLifecycleListener(listener);
        assertEquals(1, manager.getLifecycleListeners().size());

        manager.start();
        assertEquals("started", events.poll(5, TimeUnit.SECONDS));
        manager.start();
        assertTrue(manager.isRunning());
        manager.stop();
        assertEquals("stopped", events.poll(5, TimeUnit.SECONDS));
        assertFalse(manager.isRunning());

        manager.removeLifecycleListener(listener);
        assertTrue(manager.getLifecycleListeners().isEmpty());
        manager.start();
        assertNull("Repeated start and removed listener should produce nothing",
                events.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    public void stoppingClosesConnection() throws Exception {
        manager.start();
        final Client[] used = new Client[1];
        manager.invokeWithClientSession(client -> used[0] = client, "capturing client");
        assertTrue(used[0].isConnected());
        manager.stop();
        assertFalse(used[0].isConnected());
    }

    @Test
    public void validatesSettings() {
        try {
            manager.setPort(0);
            fail("Expected invalid port to be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals(server.getPort(), manager.getPort());
        }
        try {
            manager.setHost("");
            fail("Expected empty host to be rejected");
        } catch (IllegalArgumentException e) {
            assertNotNull(manager.getHost());
        }
        try {
            manager.setIdleLimit(-1);
            fail("Expected negative idle limit to be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals(ConnectionManager.DEFAULT_IDLE_LIMIT, manager.getIdleLimit());
        }
    }
}
