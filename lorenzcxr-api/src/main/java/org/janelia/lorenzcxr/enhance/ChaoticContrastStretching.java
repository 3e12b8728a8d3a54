package org.janelia.lorenzcxr.enhance;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.lorenzcxr.image.algorithms.LorenzStretchAlgorithm;
import org.janelia.lorenzcxr.image.algorithms.MaskSolidificationAlgorithm;
import org.janelia.lorenzcxr.image.algorithms.MaskedFusionAlgorithm;

/**
 * Entry points of the enhancement core. Every operation is a pure function that
 * allocates a new image of the same shape as its input.
 */
public class ChaoticContrastStretching {

    /**
     * High gain enhancement that drives most of the body towards saturation; used for the body silhouette.
     */
    public static <T extends RealType<T>> Img<UnsignedByteType> globalStretch(RandomAccessibleInterval<T> img,
                                                                              GlobalStretchParams params) {
        params.validate();
        return LorenzStretchAlgorithm.globalStretch(img, params.getDt(), params.getX(), params.getY(), params.getBeta());
    }

    /**
     * Detail preserving enhancement with drivers derived from the local mean.
     */
    public static <T extends RealType<T>> Img<UnsignedByteType> adaptiveStretch(RandomAccessibleInterval<T> img,
                                                                                AdaptiveStretchParams params) {
        params.validate();
        return LorenzStretchAlgorithm.adaptiveStretch(img, params.getWindowSize(), params.getDt(), params.getBeta());
    }

    /**
     * @return a {0, 255} mask without holes narrower than the kernel
     */
    public static <T extends IntegerType<T>> Img<UnsignedByteType> solidifyMask(RandomAccessibleInterval<T> img,
                                                                               MaskSolidificationParams params) {
        params.validate();
        return MaskSolidificationAlgorithm.solidifyMask(img, params.getKernelSize());
    }

    public static <S extends IntegerType<S>, M extends IntegerType<M>> Img<UnsignedByteType> fuse(RandomAccessibleInterval<S> detail,
                                                                                                 RandomAccessibleInterval<M> mask) {
        return MaskedFusionAlgorithm.fuse(detail, mask);
    }
}
