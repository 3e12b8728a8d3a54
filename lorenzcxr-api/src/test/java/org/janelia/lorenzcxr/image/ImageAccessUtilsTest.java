package org.janelia.lorenzcxr.image;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ImageAccessUtilsTest {

    @Test
    public void windowBounds() {
        class TestData {
            final int windowSize;
            final int expectedStart;
            final int expectedEnd;

            TestData(int windowSize, int expectedStart, int expectedEnd) {
                this.windowSize = windowSize;
                this.expectedStart = expectedStart;
                this.expectedEnd = expectedEnd;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(1, 0, 0),
                new TestData(2, -1, 0),
                new TestData(3, -1, 1),
                new TestData(4, -2, 1),
                new TestData(21, -10, 10),
                new TestData(25, -12, 12),
        };
        for (TestData td : testData) {
            assertEquals(td.expectedStart, ImageAccessUtils.windowStart(td.windowSize));
            assertEquals(td.expectedEnd, ImageAccessUtils.windowEnd(td.windowSize));
            assertEquals(td.windowSize, ImageAccessUtils.windowEnd(td.windowSize) - ImageAccessUtils.windowStart(td.windowSize) + 1);
        }
    }

    @Test
    public void shapeChecks() {
        Img<UnsignedByteType> img1 = ArrayImgs.unsignedBytes(4, 3);
        Img<UnsignedByteType> img2 = ArrayImgs.unsignedBytes(4, 3);
        Img<UnsignedByteType> img3 = ArrayImgs.unsignedBytes(3, 4);
        assertTrue(ImageAccessUtils.sameShape(img1, img2));
        assertTrue(ImageAccessUtils.differentShape(img1, img3));
        ImageAccessUtils.checkSameShape(img1, img2);
        try {
            ImageAccessUtils.checkSameShape(img1, img3);
            fail("Expected a shape mismatch");
        } catch (ShapeMismatchException e) {
            assertArrayEquals(new long[] {4, 3}, e.getExpectedShape());
            assertArrayEquals(new long[] {3, 4}, e.getActualShape());
        }
    }

    @Test
    public void rejectNon2DImages() {
        try {
            ImageAccessUtils.check2D(ArrayImgs.unsignedBytes(2, 2, 2));
            fail("Expected 3D image to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("2D"));
        }
    }

    @Test
    public void parameterChecks() {
        ImageAccessUtils.checkPositive("dt", 0.1);
        ImageAccessUtils.checkPositive("kernelSize", 1);
        double[] invalidPositiveValues = new double[] {0, -0.1, Double.NaN, Double.POSITIVE_INFINITY};
        for (double v : invalidPositiveValues) {
            try {
                ImageAccessUtils.checkPositive("dt", v);
                fail("Expected " + v + " to be rejected");
            } catch (InvalidEnhancementParamsException e) {
                assertTrue(e.getMessage().startsWith("dt"));
            }
        }
        try {
            ImageAccessUtils.checkPositive("windowSize", 0);
            fail("Expected 0 to be rejected");
        } catch (InvalidEnhancementParamsException e) {
            assertTrue(e.getMessage().startsWith("windowSize"));
        }
        try {
            ImageAccessUtils.checkFinite("beta", Double.NaN);
            fail("Expected NaN to be rejected");
        } catch (InvalidEnhancementParamsException e) {
            assertTrue(e.getMessage().startsWith("beta"));
        }
    }

    @Test
    public void histogramAndCounts() {
        Img<UnsignedByteType> img = TestUtils.createImage(new int[][] {
                {0, 0, 255},
                {7, 255, 255}
        });
        int[] hist = ImageAccessUtils.histogram(img, 256);
        assertEquals(2, hist[0]);
        assertEquals(1, hist[7]);
        assertEquals(3, hist[255]);
        assertEquals(3, ImageAccessUtils.countPixelsWithValue(img, 255));
        assertEquals(255., ImageAccessUtils.max(img), 0);
        assertFalse(ImageAccessUtils.countPixelsWithValue(img, 1) > 0);
    }

    @Test
    public void maxOfRealValuedImages() {
        Img<DoubleType> negativeImg = ArrayImgs.doubles(new double[] {-3.5, -1.25, -7}, 3, 1);
        assertEquals(-1.25, ImageAccessUtils.max(negativeImg), 0);

        Img<DoubleType> unboundedImg = ArrayImgs.doubles(new double[] {2, Double.POSITIVE_INFINITY, 5, 1}, 2, 2);
        assertEquals(Double.POSITIVE_INFINITY, ImageAccessUtils.max(unboundedImg), 0);

        // the first pixel is not the largest
        Img<DoubleType> img = ArrayImgs.doubles(new double[] {1, 9, 4, 9.5, 0, 2}, 3, 2);
        assertEquals(9.5, ImageAccessUtils.max(img), 0);
    }
}
