package org.zarumet.data;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class CoverCacheTest {

    private CoverCache cache;

    @Before
    public void setUp() {
        cache = new CoverCache();
    }

    @Test
    public void firstClaimWinsAndLaterClaimsSeePending() {
        assertEquals(CoverCache.ClaimState.CLAIMED, cache.claim("a.flac").state);
        assertTrue(cache.isPending("a.flac"));
        assertEquals(CoverCache.ClaimState.PENDING, cache.claim("a.flac").state);
        assertFalse(cache.contains("a.flac"));
    }

    @Test
    public void insertClearsPendingAndIsReturnedByClaim() {
        cache.markPending("a.flac");
        final CoverArt art = cache.insert("a.flac", new byte[] {1, 2, 3});
        assertFalse(cache.isPending("a.flac"));
        assertTrue(cache.contains("a.flac"));

        final CoverCache.Claim claim = cache.claim("a.flac");
        assertEquals(CoverCache.ClaimState.CACHED, claim.state);
        assertSame(art, claim.cached);
        assertArrayEquals(new byte[] {1, 2, 3}, claim.cached.getBytes());
    }

    @Test
    public void missingArtIsCachedSoItIsNotRequestedAgain() {
        cache.claim("none.flac");
        final CoverArt art = cache.insert("none.flac", null);
        assertFalse(art.hasArt());
        assertNull(art.getRawBytes());

        final CoverCache.Claim claim = cache.claim("none.flac");
        assertEquals(CoverCache.ClaimState.CACHED, claim.state);
        assertFalse(claim.cached.hasArt());
    }

    @Test
    public void insertingAgainReplacesTheEntry() {
        cache.insert("a.flac", null);
        cache.insert("a.flac", new byte[] {9});
        assertEquals(1, cache.size());
        assertTrue(cache.get("a.flac").hasArt());
    }

    @Test
    public void sizeNeverExceedsMaximum() {
        cache.setMaxEntries(3);
        for (int i = 0; i < 10; i++) {
            cache.insert("song" + i + ".flac", new byte[] {(byte) i});
            assertTrue(cache.size() <= 3);
        }
        assertEquals(3, cache.size());
        assertTrue(cache.contains("song9.flac"));
        assertFalse(cache.contains("song0.flac"));
    }

    @Test
    public void recentlyUsedEntriesGetASecondChance() {
        cache.setMaxEntries(2);
        cache.insert("a.flac", new byte[] {1});
        cache.insert("b.flac", new byte[] {2});
        assertNotNull(cache.get("a.flac"));

        cache.insert("c.flac", new byte[] {3});
        assertTrue(cache.contains("a.flac"));
        assertFalse(cache.contains("b.flac"));
        assertTrue(cache.contains("c.flac"));
    }

    @Test
    public void shrinkingEvictsImmediately() {
        for (int i = 0; i < 5; i++) {
            cache.insert("song" + i + ".flac", null);
        }
        cache.setMaxEntries(2);
        assertEquals(2, cache.size());
        assertEquals(2, cache.getMaxEntries());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyCapacity() {
        cache.setMaxEntries(0);
    }

    @Test
    public void abandonedClaimCanBeRetried() {
        cache.claim("a.flac");
        cache.abandon("a.flac");
        assertEquals(CoverCache.ClaimState.CLAIMED, cache.claim("a.flac").state);
    }

    @Test
    public void clearForgetsEverything() {
        cache.insert("a.flac", null);
        cache.markPending("b.flac");
        cache.clear();
        assertEquals(0, cache.size());
        assertFalse(cache.isPending("b.flac"));
    }

    @Test
    public void artBytesAreIsolatedFromCaller() {
        final byte[] data = {4, 5, 6};
        final CoverArt art = cache.insert("a.flac", data);
        data[0] = 0;
        assertEquals(4, art.getBytes()[0]);
        art.getBytes()[1] = 0;
        assertEquals(5, art.getRawBytes().get(1));
    }
}
