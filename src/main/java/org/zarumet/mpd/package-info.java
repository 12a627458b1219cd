/**
 * Communicates with the Music Player Daemon using its line-oriented text protocol, sharing a single connection
 * among everything that needs one and closing it once it has been idle for a while.
 */
package org.zarumet.mpd;
