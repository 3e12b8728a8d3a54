package org.janelia.lorenzcxr.image.algorithms;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

public class MaskedFusionAlgorithm {

    /**
     * Keep the detail pixels where the mask is foreground (255) and set everything else to 0.
     *
     * @throws org.janelia.lorenzcxr.image.ShapeMismatchException if detail and mask differ in shape
     */
    public static <S extends IntegerType<S>, M extends IntegerType<M>> Img<UnsignedByteType> fuse(RandomAccessibleInterval<S> detail,
                                                                                                 RandomAccessibleInterval<M> mask) {
        ImageAccessUtils.check2D(detail);
        ImageAccessUtils.checkSameShape(detail, mask);

        Img<UnsignedByteType> output = ImageAccessUtils.createImg(detail, new UnsignedByteType());
        Cursor<S> detailCursor = Views.flatIterable(detail).cursor();
        Cursor<M> maskCursor = Views.flatIterable(mask).cursor();
        Cursor<UnsignedByteType> outputCursor = Views.flatIterable(output).cursor();
        while (outputCursor.hasNext()) {
            int detailValue = detailCursor.next().getInteger();
            int maskValue = maskCursor.next().getInteger();
            outputCursor.next().set(maskValue == OtsuThresholdAlgorithm.FOREGROUND ? detailValue : 0);
        }
        return output;
    }
}
