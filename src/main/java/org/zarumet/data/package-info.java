/**
 * <p>Builds the artist and album view of the daemon's music library, either all at once or one artist at a time,
 * and manages cover art for the current and upcoming songs.</p>
 *
 * <p>Cover images are fetched by background tasks and delivered through a
 * {@link org.zarumet.data.CoverArtChannel}, which the interface drains whenever it is ready to redraw. The
 * {@link org.zarumet.data.CoverCache} makes sure each image is fetched only once no matter how many callers ask
 * for it, and remembers songs that have no art at all.</p>
 */
package org.zarumet.data;
