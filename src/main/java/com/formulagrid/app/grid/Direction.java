package com.formulagrid.app.grid;

/**
 * Directions for moving from one cell to its neighbor.
 */
public enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT
}
