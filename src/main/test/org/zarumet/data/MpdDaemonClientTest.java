package org.zarumet.data;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zarumet.mpd.ConnectionManager;
import org.zarumet.mpd.FakeMpdServer;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.Assert.*;

public class MpdDaemonClientTest {

    private static final Pattern OFFSET = Pattern.compile("\"(\\d+)\"$");

    private FakeMpdServer server;
    private ConnectionManager manager;
    private MpdDaemonClient client;

    @Before
    public void setUp() throws IOException {
        server = new FakeMpdServer();
        manager = new ConnectionManager();
        manager.setHost(InetAddress.getLoopbackAddress().getHostAddress());
        manager.setPort(server.getPort());
        manager.setSocketTimeout(2000);
        manager.start();
        client = new MpdDaemonClient(manager);
    }

    @After
    public void tearDown() throws IOException {
        manager.stop();
        server.close();
    }

    /**
     * Serve a picture in chunks of at most the specified size, honoring the requested offset.
     */
    private static byte[] chunk(String line, byte[] picture, int chunkSize) {
        final Matcher matcher = OFFSET.matcher(line);
        assertTrue("No offset in " + line, matcher.find());
        final int offset = Integer.parseInt(matcher.group(1));
        final int length = Math.min(chunkSize, picture.length - offset);
        return FakeMpdServer.binaryResponse("size: " + picture.length + "\ntype: image/jpeg\n",
                Arrays.copyOfRange(picture, offset, offset + length));
    }

    @Test
    public void configuresBinaryLimitOncePerConnection() throws IOException {
        client.status();
        client.status();
        assertEquals(Arrays.asList("binarylimit \"" + MpdDaemonClient.DEFAULT_BINARY_LIMIT + "\"", "status", "status"),
                server.getCommands());
    }

    @Test
    public void newLimitIsSentImmediately() throws IOException {
        client.setBinaryLimit(4096);
        assertEquals(4096, client.getBinaryLimit());
        assertTrue(server.getCommands().contains("binarylimit \"4096\""));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsTinyBinaryLimit() throws IOException {
        client.setBinaryLimit(8);
    }

    @Test
    public void readsEmbeddedPictureInChunks() throws IOException {
        final byte[] picture = "0123456789\nJPEG".getBytes(StandardCharsets.UTF_8);
        server.respond("readpicture", line -> chunk(line, picture, 4));

        assertArrayEquals(picture, client.albumArt("music/a.flac"));
        long requests = server.getCommands().stream().filter(line -> line.startsWith("readpicture")).count();
        assertEquals(4, requests);
        assertTrue(server.getCommands().contains("readpicture \"music/a.flac\" \"12\""));
    }

    @Test
    public void fallsBackToCoverFileWithoutEmbeddedPicture() throws IOException {
        final byte[] picture = {1, 2, 3};
        server.respond("readpicture", "OK\n");
        server.respond("albumart", line -> chunk(line, picture, 1024));

        assertArrayEquals(picture, client.albumArt("music/b.flac"));
    }

    @Test
    public void missingArtIsNull() throws IOException {
        server.respond("readpicture", "ACK [50@0] {readpicture} No file exists\n");
        server.respond("albumart", "ACK [50@0] {albumart} No file exists\n");
        assertNull(client.albumArt("music/c.flac"));
    }

    @Test
    public void listsTagValues() throws IOException {
        server.respond("list", "AlbumArtist: Ann\nAlbumArtist: \nAlbumArtist: bob\nOK\n");
        assertEquals(Arrays.asList("Ann", "", "bob"), client.listTagValues("AlbumArtist"));
        assertEquals("list \"AlbumArtist\"", server.getCommands().get(1));
    }

    @Test
    public void findSendsEqualityFilter() throws IOException {
        server.respond("find", "file: a/1.flac\nTitle: One\nAlbumArtist: Ann\nOK\n");
        final List<Track> tracks = client.find("AlbumArtist", "Ann \"The\" Band", "Album");
        assertEquals(1, tracks.size());
        assertEquals("One", tracks.get(0).title);
        assertEquals("find \"(AlbumArtist == \\\"Ann \\\\\\\"The\\\\\\\" Band\\\")\" \"sort\" \"Album\"",
                server.getCommands().get(1));
    }

    @Test
    public void listsAllSongsSkippingDirectories() throws IOException {
        server.respond("listallinfo", "directory: a\nfile: a/1.flac\nTitle: One\nplaylist: a/p.m3u\n" +
                "file: a/2.flac\nTitle: Two\nOK\n");
        final List<Track> songs = client.listAllSongs();
        assertEquals(2, songs.size());
        assertEquals("a/2.flac", songs.get(1).file);
    }

    @Test
    public void rejectedRequestIsIOException() {
        server.respond("listallinfo", "ACK [4@0] {listallinfo} you don't have permission\n");
        try {
            client.listAllSongs();
            fail("Expected failure");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("permission"));
        }
    }

    @Test
    public void readsStatusAndPlaybackPosition() throws IOException {
        server.respond("status", "volume: 55\nstate: play\nsong: 2\nelapsed: 10.5\nduration: 42.0\nOK\n");
        server.respond("currentsong", "file: q/3.flac\nTitle: Three\nFormat: 48000:24:2\nOK\n");
        server.respond("playlistinfo", "file: q/1.flac\nfile: q/2.flac\nfile: q/3.flac\nOK\n");

        assertEquals(new Status(PlayState.PLAYING, 10.5, 42.0, 2, 55), client.status());
        final Track current = client.currentSong();
        assertEquals(48000, current.getSampleRate());
        final List<Track> queue = client.queue();
        assertEquals(Integer.valueOf(2), PrefetchPlanner.findCurrentIndex(queue, current, 2));
    }

    @Test
    public void noCurrentSongIsNull() throws IOException {
        server.respond("currentsong", "OK\n");
        assertNull(client.currentSong());
    }

    @Test
    public void reconfiguresAfterRestart() throws IOException {
        client.status();
        manager.stop();
        manager.start();
        client.status();
        assertEquals(2, server.getConnectionCount());
        long limits = server.getCommands().stream().filter(line -> line.startsWith("binarylimit")).count();
        assertEquals(2, limits);
    }
}
