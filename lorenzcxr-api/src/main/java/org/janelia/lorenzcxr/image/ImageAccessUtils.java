package org.janelia.lorenzcxr.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.stats.ComputeMinMax;
import net.imglib2.img.Img;
import net.imglib2.img.ImgFactory;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static long getMaxSize(long[] shape) {
        return Arrays.stream(shape).reduce(1, (a, d) -> a * d);
    }

    public static boolean sameShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        long[] refShape = ref.dimensionsAsLongArray();
        long[] imgShape = img.dimensionsAsLongArray();
        if (refShape.length != imgShape.length)
            return false;
        for (int d = 0; d < refShape.length; d++) {
            if (refShape[d] != imgShape[d])
                return false;
        }
        return true;
    }

    public static boolean differentShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        return !sameShape(ref, img);
    }

    /**
     * @throws ShapeMismatchException if the two images have different dimensions
     */
    public static void checkSameShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        if (differentShape(ref, img)) {
            throw new ShapeMismatchException(ref.dimensionsAsLongArray(), img.dimensionsAsLongArray());
        }
    }

    public static void check2D(RandomAccessibleInterval<?> img) {
        if (img == null) {
            throw new IllegalArgumentException("Image is required");
        }
        if (img.numDimensions() != 2) {
            throw new IllegalArgumentException("Image must be a 2D-image but it has " + img.numDimensions() + " dimensions");
        }
    }

    public static void checkPositive(String paramName, int value) {
        if (value <= 0) {
            throw new InvalidEnhancementParamsException(paramName + " must be a positive integer but was " + value);
        }
    }

    public static void checkPositive(String paramName, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidEnhancementParamsException(paramName + " must be a positive finite number but was " + value);
        }
    }

    public static void checkFinite(String paramName, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidEnhancementParamsException(paramName + " must be a finite number but was " + value);
        }
    }

    public static <T extends NativeType<T>> Img<T> createImg(RandomAccessibleInterval<?> shape, T pxType) {
        ImgFactory<T> imgFactory = new ArrayImgFactory<>(pxType);
        return imgFactory.create(shape.dimensionsAsLongArray());
    }

    /**
     * Offset of the first sample of a window of the given size relative to its anchor.
     * The anchor is at size / 2, so an even size has one more sample before the anchor than after it.
     */
    public static int windowStart(int windowSize) {
        return -(windowSize / 2);
    }

    /**
     * Offset of the last sample (inclusive) of a window of the given size relative to its anchor.
     */
    public static int windowEnd(int windowSize) {
        return windowSize - 1 - windowSize / 2;
    }

    public static <T extends IntegerType<T>> int[] histogram(RandomAccessibleInterval<T> image, int nbins) {
        int[] bins = new int[nbins];
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        while (cursor.hasNext()) {
            int val = cursor.next().getInteger();
            if (val < 0) {
                val = 0;
            } else if (val >= nbins) {
                val = nbins - 1;
            }
            bins[val] = bins[val] + 1;
        }
        return bins;
    }

    public static <T extends RealType<T>> long countPixelsWithValue(RandomAccessibleInterval<T> image, double value) {
        long count = 0;
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        while (cursor.hasNext()) {
            if (cursor.next().getRealDouble() == value) {
                count++;
            }
        }
        return count;
    }

    public static <T extends RealType<T>> double max(RandomAccessibleInterval<T> image) {
        T minValue = Util.getTypeFromInterval(image).createVariable();
        T maxValue = minValue.createVariable();
        ComputeMinMax.computeMinMax(image, minValue, maxValue);
        return maxValue.getRealDouble();
    }
}
