package com.unhuman.iconforge.render;

/**
 * A renderer was asked for a non-positive or otherwise impossible size.
 * Always a programming or configuration error, so callers let it abort the batch.
 */
public class InvalidSizeException extends IllegalArgumentException {
    private final int requestedSize;

    public InvalidSizeException(String message, int requestedSize) {
        super(message);
        this.requestedSize = requestedSize;
    }

    public int getRequestedSize() {
        return requestedSize;
    }

    static int requirePositive(int size, String what) {
        if (size <= 0) {
            throw new InvalidSizeException(what + " must be positive but was " + size, size);
        }
        return size;
    }
}
