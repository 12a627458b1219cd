package org.zarumet.data;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TrackTest {

    private static Map<String, String> tags(String... keysAndValues) {
        final Map<String, String> result = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            result.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return result;
    }

    @Test
    public void missingTagsGetPlaceholders() {
        final Track track = Track.fromTags(tags("file", "music/song.mp3"));
        assertEquals(Track.UNKNOWN_TITLE, track.title);
        assertEquals(Track.UNKNOWN_ARTIST, track.artist);
        assertEquals(Track.UNKNOWN_ALBUM, track.album);
        assertEquals(Track.UNKNOWN_ARTIST, track.albumArtist);
        assertFalse(track.explicitAlbumArtist);
        assertEquals(0, track.disc);
        assertEquals(0, track.trackNumber);
        assertNull(track.getDuration());
    }

    @Test
    public void albumArtistFallsBackToArtist() {
        final Track track = Track.fromTags(tags("file", "a.flac", "Artist", "X"));
        assertEquals("X", track.albumArtist);
        assertFalse(track.explicitAlbumArtist);

        final Track tagged = Track.fromTags(tags("file", "a.flac", "Artist", "X", "AlbumArtist", "Z"));
        assertEquals("Z", tagged.albumArtist);
        assertTrue(tagged.explicitAlbumArtist);
    }

    @Test
    public void numbersAreReadFromFractions() {
        final Track track = Track.fromTags(tags("file", "a.flac", "Track", "3/12", "Disc", "2/2"));
        assertEquals(3, track.trackNumber);
        assertEquals(2, track.disc);
    }

    @Test
    public void tagNamesAreCaseInsensitive() {
        final Track track = Track.fromTags(tags("file", "a.flac", "title", "Lower", "ALBUM", "Upper"));
        assertEquals("Lower", track.title);
        assertEquals("Upper", track.album);
    }

    @Test
    public void durationPrefersPreciseValue() {
        assertEquals(201.5, Track.fromTags(tags("file", "a", "duration", "201.5", "Time", "202")).getDuration(),
                1e-9);
        assertEquals(202.0, Track.fromTags(tags("file", "a", "Time", "202")).getDuration(), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void recordWithoutFileIsRejected() {
        Track.fromTags(tags("Title", "Ghost"));
    }

    @Test
    public void sampleRateComesFromFormat() {
        assertEquals(44100, Track.fromTags(tags("file", "a", "Format", "44100:16:2")).getSampleRate());
        assertEquals(0, Track.fromTags(tags("file", "a", "Format", "dsd64:2")).getSampleRate());
        assertEquals(0, Track.fromTags(tags("file", "a")).getSampleRate());
    }

    @Test
    public void albumDirectoryIsParentOfFile() {
        assertEquals("Artist/Album", Track.fromTags(tags("file", "Artist/Album/01.flac")).getAlbumDirectory());
        assertEquals("", Track.fromTags(tags("file", "loose.flac")).getAlbumDirectory());
    }

    @Test
    public void progressIsClampedToSong() {
        final Track track = Track.fromTags(tags("file", "a", "duration", "100"));
        track.updatePlayback(new Status(PlayState.PLAYING, 150.0, null, 0, -1));
        assertEquals(1.0, track.getProgress(), 1e-9);
        track.updatePlayback(new Status(PlayState.PAUSED, 25.0, null, 0, -1));
        assertEquals(0.25, track.getProgress(), 1e-9);
        assertEquals(PlayState.PAUSED, track.getPlayState());
    }

    @Test
    public void progressIsUnknownWithoutDuration() {
        final Track track = Track.fromTags(tags("file", "stream"));
        track.updatePlayback(new Status(PlayState.PLAYING, 12.0, null, 0, -1));
        assertNull(track.getProgress());
        assertEquals(12.0, track.getElapsed(), 1e-9);
    }

    @Test
    public void rehomingKeepsOtherFields() {
        final Track track = Track.fromTags(tags("file", "a", "Artist", "X", "Title", "T", "Track", "4"));
        final Track moved = track.withAlbumArtist("Z");
        assertEquals("Z", moved.albumArtist);
        assertEquals("X", moved.artist);
        assertEquals(4, moved.trackNumber);
        assertSame(track, track.withAlbumArtist("X"));
    }

    @Test
    public void statusParsesDaemonValues() {
        final Map<String, String> values = tags("state", "play", "elapsed", "12.5", "duration", "200.0",
                "song", "3", "volume", "75");
        assertEquals(new Status(PlayState.PLAYING, 12.5, 200.0, 3, 75), Status.fromValues(values));

        final Status stopped = Status.fromValues(tags("state", "stop"));
        assertEquals(PlayState.STOPPED, stopped.state);
        assertNull(stopped.songPosition);
        assertEquals(-1, stopped.volume);
    }
}
