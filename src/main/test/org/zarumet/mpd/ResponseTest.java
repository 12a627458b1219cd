package org.zarumet.mpd;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ResponseTest {

    private static Response parse(String text) throws IOException {
        return parse(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Response parse(byte[] bytes) throws IOException {
        return Response.read(new DataInputStream(new ByteArrayInputStream(bytes)));
    }

    @Test
    public void readsPairsUntilOk() throws IOException {
        final Response response = parse("volume: 80\nstate: play\nOK\n");
        assertFalse(response.isError());
        assertEquals(2, response.pairs.size());
        assertEquals("play", response.getFirst("state"));
        assertEquals("80", response.getFirst("VOLUME"));
        assertNull(response.getFirst("song"));
        assertNull(response.getBinary());
    }

    @Test
    public void valuesMayContainColons() throws IOException {
        assertEquals("Title: Subtitle", parse("Title: Title: Subtitle\nOK\n").getFirst("Title"));
    }

    @Test
    public void parsesErrorResponse() throws IOException {
        final Response response = parse("ACK [50@0] {albumart} No file exists\n");
        assertTrue(response.isError());
        assertEquals(Response.ERROR_NO_EXIST, response.errorCode);
        assertEquals("No file exists", response.errorMessage);
    }

    @Test
    public void unrecognizedErrorFormatIsStillAnError() throws IOException {
        final Response response = parse("ACK something odd\n");
        assertTrue(response.isError());
        assertEquals(-1, response.errorCode);
    }

    @Test
    public void readsBinaryPayload() throws IOException {
        final byte[] payload = {'\n', 0, (byte) 0xff, 'O', 'K', '\n'};
        final Response response = parse(FakeMpdServer.binaryResponse("size: 6\ntype: image/png\n", payload));
        assertArrayEquals(payload, response.getBinary());
        assertEquals("6", response.getFirst("size"));
        assertEquals("image/png", response.getFirst("type"));
    }

    @Test(expected = EOFException.class)
    public void truncatedResponseFails() throws IOException {
        parse("state: play\n");
    }

    @Test(expected = IOException.class)
    public void malformedLineFails() throws IOException {
        parse("garbage\nOK\n");
    }

    @Test
    public void collectsRepeatedValues() throws IOException {
        final List<String> values = parse("Artist: A\nArtist: B\nartist: C\nOK\n").getAll("Artist");
        assertEquals(Arrays.asList("A", "B", "C"), values);
    }

    @Test
    public void splitsSongRecordsSkippingDirectories() throws IOException {
        final Response response = parse("directory: music\n" +
                "file: music/a.flac\nTitle: A\nArtist: X\nArtist: Y\n" +
                "playlist: music/list.m3u\n" +
                "file: music/b.flac\nTitle: B\nOK\n");
        final List<Map<String, String>> records = response.records("file", "directory", "playlist");
        assertEquals(2, records.size());
        assertEquals("music/a.flac", records.get(0).get("file"));
        assertEquals("X", records.get(0).get("Artist"));
        assertEquals("B", records.get(1).get("Title"));
        assertFalse(records.get(1).containsKey("playlist"));
    }
}
