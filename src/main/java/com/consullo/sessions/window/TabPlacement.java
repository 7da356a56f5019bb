package com.consullo.sessions.window;

/**
 * Horizontal position of a window's tab within its workspace's tab strip.
 *
 * @param offset distance from the start of the strip, in logical units
 * @param width tab width, in logical units
 * @since 1.0
 */
public record TabPlacement(double offset, double width) {
}
