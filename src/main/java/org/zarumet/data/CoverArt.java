package org.zarumet.data;

import org.apiguardian.api.API;

import java.nio.ByteBuffer;

/**
 * <p>The result of asking the daemon for a song's album art: either the raw image bytes, or the knowledge that the
 * daemon has no art for the song. The latter is remembered too, so songs without art are not asked about again
 * every time they come around.</p>
 *
 * <p>Decoding and scaling the image for display is left to the user interface.</p>
 */
@API(status = API.Status.STABLE)
public class CoverArt {

    /**
     * The daemon's identifier for the song whose art this is.
     */
    @API(status = API.Status.STABLE)
    public final String file;

    /**
     * The raw bytes of the artwork as returned by the daemon, or {@code null} if there is none.
     */
    private final ByteBuffer rawBytes;

    /**
     * Constructor simply sets the immutable value fields, copying the bytes so later changes to the caller's
     * array cannot affect us.
     *
     * @param file the daemon's identifier for the song
     * @param bytes the image data, or {@code null} if the daemon has no art for the song
     */
    @API(status = API.Status.STABLE)
    public CoverArt(String file, byte[] bytes) {
        this.file = file;
        this.rawBytes = (bytes == null) ? null : ByteBuffer.wrap(bytes.clone()).asReadOnlyBuffer();
    }

    /**
     * Check whether any art was found.
     *
     * @return {@code false} if this records that the daemon has no art for the song
     */
    @API(status = API.Status.STABLE)
    public boolean hasArt() {
        return rawBytes != null;
    }

    /**
     * Get the raw bytes of the artwork image as returned by the daemon.
     *
     * @return a read-only view of the bytes that make up the album art, or {@code null} if there is none
     */
    @API(status = API.Status.STABLE)
    public ByteBuffer getRawBytes() {
        if (rawBytes == null) {
            return null;
        }
        return rawBytes.duplicate().rewind();
    }

    /**
     * Get a copy of the artwork image bytes, for handing to an image decoder.
     *
     * @return the bytes, or {@code null} if there is no art
     */
    @API(status = API.Status.STABLE)
    public byte[] getBytes() {
        final ByteBuffer buffer = getRawBytes();
        if (buffer == null) {
            return null;
        }
        final byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    @Override
    public String toString() {
        return "CoverArt[file=" + file + ", " + (hasArt() ? "size=" + rawBytes.capacity() + " bytes" : "no art") + "]";
    }
}
