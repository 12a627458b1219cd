package org.zarumet.data;

import org.apiguardian.api.API;

/**
 * Delivered to the user interface when album art requested for a song becomes available. Fetches complete in any
 * order, so by the time this arrives the user may have moved on to another song; check {@link #isFor(String)}
 * against the song being displayed before showing the art.
 */
@API(status = API.Status.STABLE)
public class CoverArtUpdate {

    /**
     * The daemon's identifier for the song whose art was requested.
     */
    @API(status = API.Status.STABLE)
    public final String file;

    /**
     * The art found, which reports {@link CoverArt#hasArt()} as {@code false} if the song has none.
     */
    @API(status = API.Status.STABLE)
    public final CoverArt art;

    CoverArtUpdate(String file, CoverArt art) {
        this.file = file;
        this.art = art;
    }

    /**
     * Check whether this update is still relevant.
     *
     * @param currentFile the identifier of the song currently displayed, or {@code null} if there is none
     *
     * @return {@code true} if this update carries art for that song
     */
    @API(status = API.Status.STABLE)
    public boolean isFor(String currentFile) {
        return file.equals(currentFile);
    }

    @Override
    public String toString() {
        return "CoverArtUpdate[file:" + file + ", art:" + art + "]";
    }
}
