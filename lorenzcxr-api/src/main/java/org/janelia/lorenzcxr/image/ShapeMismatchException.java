package org.janelia.lorenzcxr.image;

import java.util.Arrays;

/**
 * Thrown when two images that must be combined pixel by pixel do not have the same shape.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    private final long[] expectedShape;
    private final long[] actualShape;

    public ShapeMismatchException(long[] expectedShape, long[] actualShape) {
        super("Image shape " + Arrays.toString(actualShape) + " does not match " + Arrays.toString(expectedShape));
        this.expectedShape = expectedShape.clone();
        this.actualShape = actualShape.clone();
    }

    public long[] getExpectedShape() {
        return expectedShape.clone();
    }

    public long[] getActualShape() {
        return actualShape.clone();
    }
}
