package org.janelia.lorenzcxr.image.algorithms;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

/**
 * Separable N x N box (mean) filter.
 *
 * Samples outside the image are taken with a reflect-101 border policy, i.e. the image is
 * mirrored around its first and last samples without repeating them: <code>gfedcb|abcdefgh|gfedcba</code>.
 * The reflection is applied repeatedly for windows larger than the image and a dimension of size 1
 * repeats its only sample. The window spans offsets windowStart..windowEnd around each pixel,
 * which is asymmetric for even sizes.
 */
public class BoxMeanFilterAlgorithm {

    public static <T extends RealType<T>> Img<DoubleType> meanFilter(RandomAccessibleInterval<T> input, int windowSize) {
        ImageAccessUtils.check2D(input);
        ImageAccessUtils.checkPositive("windowSize", windowSize);

        Img<DoubleType> temp = ImageAccessUtils.createImg(input, new DoubleType());
        Img<DoubleType> output = ImageAccessUtils.createImg(input, new DoubleType());
        meanFilterInX(input, temp, windowSize);
        meanFilterInY(temp, output, windowSize);
        return output;
    }

    public static <S extends RealType<S>, T extends RealType<T>> void meanFilterInX(RandomAccessibleInterval<S> input,
                                                                                   RandomAccessibleInterval<T> output,
                                                                                   int windowSize) {
        int width = (int) input.dimension(0);
        int height = (int) input.dimension(1);
        long minx = input.min(0);
        long miny = input.min(1);
        int start = ImageAccessUtils.windowStart(windowSize);
        int end = ImageAccessUtils.windowEnd(windowSize);

        RandomAccess<S> inputRA = input.randomAccess();
        RandomAccess<T> outputRA = output.randomAccess();

        for (int y = 0; y < height; y++) {
            inputRA.setPosition(miny + y, 1);
            outputRA.setPosition(output.min(1) + y, 1);
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int r = start; r <= end; r++) {
                    inputRA.setPosition(minx + reflect101(x + r, width), 0);
                    sum += inputRA.get().getRealDouble();
                }
                outputRA.setPosition(output.min(0) + x, 0);
                outputRA.get().setReal(sum / windowSize);
            }
        }
    }

    public static <S extends RealType<S>, T extends RealType<T>> void meanFilterInY(RandomAccessibleInterval<S> input,
                                                                                   RandomAccessibleInterval<T> output,
                                                                                   int windowSize) {
        int width = (int) input.dimension(0);
        int height = (int) input.dimension(1);
        long minx = input.min(0);
        long miny = input.min(1);
        int start = ImageAccessUtils.windowStart(windowSize);
        int end = ImageAccessUtils.windowEnd(windowSize);

        RandomAccess<S> inputRA = input.randomAccess();
        RandomAccess<T> outputRA = output.randomAccess();

        for (int x = 0; x < width; x++) {
            inputRA.setPosition(minx + x, 0);
            outputRA.setPosition(output.min(0) + x, 0);
            for (int y = 0; y < height; y++) {
                double sum = 0;
                for (int r = start; r <= end; r++) {
                    inputRA.setPosition(miny + reflect101(y + r, height), 1);
                    sum += inputRA.get().getRealDouble();
                }
                outputRA.setPosition(output.min(1) + y, 1);
                outputRA.get().setReal(sum / windowSize);
            }
        }
    }

    /**
     * Map a possibly out of bounds coordinate into [0, size) by mirroring around the edge samples.
     */
    static int reflect101(int p, int size) {
        if (size == 1) {
            return 0;
        }
        int pos = p;
        while (pos < 0 || pos >= size) {
            if (pos < 0) {
                pos = -pos;
            } else {
                pos = 2 * (size - 1) - pos;
            }
        }
        return pos;
    }
}
