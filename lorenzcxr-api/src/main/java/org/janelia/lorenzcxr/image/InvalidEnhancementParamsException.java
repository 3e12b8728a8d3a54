package org.janelia.lorenzcxr.image;

/**
 * Thrown when an enhancement parameter has no numeric or geometric meaning,
 * e.g. a non-positive time step or kernel size.
 */
public class InvalidEnhancementParamsException extends IllegalArgumentException {

    public InvalidEnhancementParamsException(String message) {
        super(message);
    }
}
