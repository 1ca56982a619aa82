package com.flowbridge.core.model;

/**
 * A 2-D canvas position for a component in the target runtime's editor.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Position(double x, double y) {

    /** Origin of the canvas. */
    public static final Position ORIGIN = new Position(0, 0);

    /**
     * Returns a position shifted by the given offsets.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @return translated position
     */
    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
