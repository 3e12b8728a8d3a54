package org.janelia.lorenzcxr.image;

import java.util.Random;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;

public class TestUtils {

    /**
     * @param rows pixel values indexed as rows[y][x]
     */
    public static Img<UnsignedByteType> createImage(int[][] rows) {
        int height = rows.length;
        int width = rows[0].length;
        Img<UnsignedByteType> img = ArrayImgs.unsignedBytes(width, height);
        RandomAccess<UnsignedByteType> imgRA = img.randomAccess();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                imgRA.setPositionAndGet(x, y).set(rows[y][x]);
            }
        }
        return img;
    }

    public static Img<UnsignedByteType> createUniformImage(int width, int height, int value) {
        Img<UnsignedByteType> img = ArrayImgs.unsignedBytes(width, height);
        for (UnsignedByteType px : img) {
            px.set(value);
        }
        return img;
    }

    public static Img<UnsignedByteType> createRandomImage(int width, int height, long seed) {
        Random random = new Random(seed);
        Img<UnsignedByteType> img = ArrayImgs.unsignedBytes(width, height);
        for (UnsignedByteType px : img) {
            px.set(random.nextInt(256));
        }
        return img;
    }

    /**
     * Fill the inclusive rectangle [x0, x1] x [y0, y1] with the given value.
     */
    public static void fillRect(Img<UnsignedByteType> img, int x0, int y0, int x1, int y1, int value) {
        RandomAccess<UnsignedByteType> imgRA = img.randomAccess();
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                imgRA.setPositionAndGet(x, y).set(value);
            }
        }
    }

    public static <T extends RealType<T>> double getValue(RandomAccessibleInterval<T> img, int x, int y) {
        return img.randomAccess().setPositionAndGet(x, y).getRealDouble();
    }

    public static <T extends RealType<T>> double[] toArray(RandomAccessibleInterval<T> img) {
        int n = (int) ImageAccessUtils.getMaxSize(img.dimensionsAsLongArray());
        double[] values = new double[n];
        Cursor<T> cursor = Views.flatIterable(img).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            values[i++] = cursor.next().getRealDouble();
        }
        return values;
    }

    public static <S extends RealType<S>, T extends RealType<T>> long countDiffs(RandomAccessibleInterval<S> refImage,
                                                                                RandomAccessibleInterval<T> testImage) {
        double[] refValues = toArray(refImage);
        double[] testValues = toArray(testImage);
        long res = 0;
        for (int i = 0; i < refValues.length; i++) {
            if (Double.compare(refValues[i], testValues[i]) != 0) {
                res++;
            }
        }
        return res;
    }
}
