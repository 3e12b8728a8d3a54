package org.janelia.lorenzcxr.image.algorithms;

import java.util.function.IntBinaryOperator;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.view.Views;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

/**
 * Grayscale dilation, erosion and closing with a square k x k structuring element.
 * The square is separable, so every operation is a pass along x followed by a pass along y.
 * Neighbors outside the image do not take part in the max or the min.
 *
 * Dilation looks at offsets windowStart..windowEnd and erosion at the reflected offsets
 * -windowEnd..-windowStart. The two only differ for even kernel sizes and the reflection
 * keeps the closing extensive (the closed image always contains its input).
 */
public class MorphologyAlgorithm {

    public static <T extends IntegerType<T> & NativeType<T>> Img<T> dilate(RandomAccessibleInterval<T> input, int kernelSize) {
        ImageAccessUtils.checkPositive("kernelSize", kernelSize);
        return separableFilter(input,
                ImageAccessUtils.windowStart(kernelSize), ImageAccessUtils.windowEnd(kernelSize),
                Math::max, 0);
    }

    public static <T extends IntegerType<T> & NativeType<T>> Img<T> erode(RandomAccessibleInterval<T> input, int kernelSize) {
        ImageAccessUtils.checkPositive("kernelSize", kernelSize);
        return separableFilter(input,
                -ImageAccessUtils.windowEnd(kernelSize), -ImageAccessUtils.windowStart(kernelSize),
                Math::min, Integer.MAX_VALUE);
    }

    /**
     * Dilation followed by an erosion with the same square.
     */
    public static <T extends IntegerType<T> & NativeType<T>> Img<T> close(RandomAccessibleInterval<T> input, int kernelSize) {
        return erode(dilate(input, kernelSize), kernelSize);
    }

    private static <T extends IntegerType<T> & NativeType<T>> Img<T> separableFilter(RandomAccessibleInterval<T> input,
                                                                                    int start, int end,
                                                                                    IntBinaryOperator op,
                                                                                    int identity) {
        ImageAccessUtils.check2D(input);
        T pxType = Views.flatIterable(input).firstElement().createVariable();
        Img<T> temp = ImageAccessUtils.createImg(input, pxType);
        Img<T> output = ImageAccessUtils.createImg(input, pxType);
        rankFilterInDim(input, temp, 0, start, end, op, identity);
        rankFilterInDim(temp, output, 1, start, end, op, identity);
        return output;
    }

    private static <T extends IntegerType<T>> void rankFilterInDim(RandomAccessibleInterval<T> input,
                                                                   RandomAccessibleInterval<T> output,
                                                                   int filterDim,
                                                                   int start, int end,
                                                                   IntBinaryOperator op,
                                                                   int identity) {
        int otherDim = 1 - filterDim;
        int filterDimSize = (int) input.dimension(filterDim);
        int otherDimSize = (int) input.dimension(otherDim);

        RandomAccess<T> inputRA = input.randomAccess();
        RandomAccess<T> outputRA = output.randomAccess();

        for (int j = 0; j < otherDimSize; j++) {
            inputRA.setPosition(input.min(otherDim) + j, otherDim);
            outputRA.setPosition(output.min(otherDim) + j, otherDim);
            for (int i = 0; i < filterDimSize; i++) {
                int result = identity;
                for (int r = start; r <= end; r++) {
                    int ii = i + r;
                    if (ii >= 0 && ii < filterDimSize) {
                        inputRA.setPosition(input.min(filterDim) + ii, filterDim);
                        result = op.applyAsInt(result, inputRA.get().getInteger());
                    }
                }
                outputRA.setPosition(output.min(filterDim) + i, filterDim);
                outputRA.get().setInteger(result);
            }
        }
    }
}
