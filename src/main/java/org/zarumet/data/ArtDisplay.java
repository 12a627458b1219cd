package org.zarumet.data;

import org.apiguardian.api.API;

/**
 * Implemented by the user interface component that shows album art, so the {@link SongChangeReactor} can tell it to
 * stop showing art when there is no longer a current song. New art arrives separately, through the
 * {@link CoverArtChannel}.
 */
@API(status = API.Status.STABLE)
@FunctionalInterface
public interface ArtDisplay {

    /**
     * Called on the user interface loop when there is no longer a current song.
     */
    void clearArt();
}
