package com.unhuman.iconforge.render;

/**
 * A source/mask pair does not line up, or would land outside the destination canvas.
 * Never expected with the fixed size table; indicates a layout bug.
 */
public class CompositeBoundsException extends IllegalStateException {
    public CompositeBoundsException(String message) {
        super(message);
    }
}
