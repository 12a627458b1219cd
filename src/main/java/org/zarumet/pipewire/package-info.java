/**
 * Sample rate control for systems whose audio goes through PipeWire.
 */
package org.zarumet.pipewire;
