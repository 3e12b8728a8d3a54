package org.janelia.lorenzcxr.image.algorithms;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.lorenzcxr.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a saturated, high-gain enhancement into a solid binary region: Otsu binarization
 * followed by a morphological closing that fills interior holes narrower than the kernel.
 */
public class MaskSolidificationAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(MaskSolidificationAlgorithm.class);

    public static <T extends IntegerType<T>> Img<UnsignedByteType> solidifyMask(RandomAccessibleInterval<T> img, int kernelSize) {
        ImageAccessUtils.check2D(img);
        ImageAccessUtils.checkPositive("kernelSize", kernelSize);

        int threshold = OtsuThresholdAlgorithm.computeThreshold(img);
        LOG.debug("Binarize {} image using threshold {}", img.dimensionsAsLongArray(), threshold);
        Img<UnsignedByteType> binaryImg = OtsuThresholdAlgorithm.binarize(img, threshold);
        return MorphologyAlgorithm.close(binaryImg, kernelSize);
    }
}
