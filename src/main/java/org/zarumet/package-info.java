/**
 * <p>The core of a terminal client for the Music Player Daemon. It keeps the interface responsive while the
 * music library is loaded and cover art is fetched in the background.</p>
 *
 * <p>Protocol handling lives in {@link org.zarumet.mpd}. The library model and cover art machinery built on top
 * of it live in {@link org.zarumet.data}.</p>
 */
package org.zarumet;
