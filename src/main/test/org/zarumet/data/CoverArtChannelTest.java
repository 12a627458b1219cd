package org.zarumet.data;

import org.junit.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class CoverArtChannelTest {

    private static CoverArtUpdate update(String file) {
        return new CoverArtUpdate(file, new CoverArt(file, null));
    }

    @Test
    public void deliversInOrder() {
        final CoverArtChannel channel = new CoverArtChannel();
        assertTrue(channel.deliver(update("a")));
        assertTrue(channel.deliver(update("b")));
        final List<CoverArtUpdate> updates = channel.drain();
        assertEquals(2, updates.size());
        assertEquals("a", updates.get(0).file);
        assertEquals("b", updates.get(1).file);
        assertTrue(channel.drain().isEmpty());
    }

    @Test
    public void fullChannelDropsOldestUpdates() {
        final CoverArtChannel channel = new CoverArtChannel(2);
        assertTrue(channel.deliver(update("prefetched")));
        assertTrue(channel.deliver(update("earlier")));
        assertTrue(channel.deliver(update("playing")));
        final List<CoverArtUpdate> updates = channel.drain();
        assertEquals(2, updates.size());
        assertEquals("earlier", updates.get(0).file);
        assertEquals("playing", updates.get(1).file);
    }

    @Test
    public void closedChannelDiscardsEverything() throws InterruptedException {
        final CoverArtChannel channel = new CoverArtChannel();
        channel.deliver(update("a"));
        channel.close();
        assertTrue(channel.isClosed());
        assertFalse(channel.deliver(update("b")));
        assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void updatesKnowWhichSongTheyBelongTo() {
        final CoverArtUpdate update = update("music/a.flac");
        assertTrue(update.isFor("music/a.flac"));
        assertFalse(update.isFor("music/b.flac"));
        assertFalse(update.isFor(null));
    }
}
