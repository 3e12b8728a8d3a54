package org.janelia.lorenzcxr.enhance;

import org.janelia.lorenzcxr.image.InvalidEnhancementParamsException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EnhancementParamsTest {

    @Test
    public void defaults() {
        GlobalStretchParams globalStretchParams = new GlobalStretchParams();
        assertEquals(0.1, globalStretchParams.getDt(), 0);
        assertEquals(250, globalStretchParams.getX(), 0);
        assertEquals(250, globalStretchParams.getY(), 0);
        assertEquals(8.0 / 3.0, globalStretchParams.getBeta(), 0);

        AdaptiveStretchParams adaptiveStretchParams = new AdaptiveStretchParams();
        assertEquals(25, adaptiveStretchParams.getWindowSize());
        assertEquals(0.1, adaptiveStretchParams.getDt(), 0);
        assertEquals(8.0 / 3.0, adaptiveStretchParams.getBeta(), 0);

        assertEquals(21, new MaskSolidificationParams().getKernelSize());
    }

    @Test
    public void copiesLeaveTheOriginalUnchanged() {
        GlobalStretchParams globalStretchParams = new GlobalStretchParams();
        GlobalStretchParams updatedParams = globalStretchParams.withDrivers(100, 120).withDt(0.2).withBeta(1);
        assertEquals(250, globalStretchParams.getX(), 0);
        assertEquals(100, updatedParams.getX(), 0);
        assertEquals(120, updatedParams.getY(), 0);
        assertEquals(0.2, updatedParams.getDt(), 0);
        assertEquals(1, updatedParams.getBeta(), 0);

        AdaptiveStretchParams adaptiveStretchParams = new AdaptiveStretchParams().withWindowSize(24);
        assertEquals(24, adaptiveStretchParams.getWindowSize());
        assertTrue(adaptiveStretchParams.toString().contains("windowSize=24"));
    }

    @Test
    public void rejectInvalidParams() {
        Runnable[] validations = new Runnable[] {
                () -> new GlobalStretchParams().withDt(0).validate(),
                () -> new GlobalStretchParams().withDt(Double.NaN).validate(),
                () -> new GlobalStretchParams().withDrivers(Double.POSITIVE_INFINITY, 1).validate(),
                () -> new GlobalStretchParams().withBeta(Double.NaN).validate(),
                () -> new AdaptiveStretchParams().withWindowSize(0).validate(),
                () -> new AdaptiveStretchParams().withWindowSize(-25).validate(),
                () -> new AdaptiveStretchParams().withDt(-1).validate(),
                () -> new MaskSolidificationParams(0).validate(),
        };
        for (Runnable validation : validations) {
            try {
                validation.run();
                fail("Expected invalid parameters to be rejected");
            } catch (InvalidEnhancementParamsException e) {
                assertTrue(e.getMessage().contains("must be"));
            }
        }
    }
}
