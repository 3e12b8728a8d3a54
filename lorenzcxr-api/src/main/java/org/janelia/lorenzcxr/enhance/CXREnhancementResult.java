package org.janelia.lorenzcxr.enhance;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.lorenzcxr.image.ImageAccessUtils;
import org.janelia.lorenzcxr.image.algorithms.OtsuThresholdAlgorithm;

/**
 * All images produced by one run of the enhancement pipeline.
 */
public class CXREnhancementResult {
    private final Img<UnsignedByteType> bodySilhouette;
    private final Img<UnsignedByteType> bodyMask;
    private final Img<UnsignedByteType> internalDetail;
    private final Img<UnsignedByteType> localizedDetail;
    private final long processingTimeMillis;

    CXREnhancementResult(Img<UnsignedByteType> bodySilhouette,
                         Img<UnsignedByteType> bodyMask,
                         Img<UnsignedByteType> internalDetail,
                         Img<UnsignedByteType> localizedDetail,
                         long processingTimeMillis) {
        this.bodySilhouette = bodySilhouette;
        this.bodyMask = bodyMask;
        this.internalDetail = internalDetail;
        this.localizedDetail = localizedDetail;
        this.processingTimeMillis = processingTimeMillis;
    }

    /**
     * @return output of the global stretching
     */
    public Img<UnsignedByteType> getBodySilhouette() {
        return bodySilhouette;
    }

    /**
     * @return solidified {0, 255} mask derived from the body silhouette
     */
    public Img<UnsignedByteType> getBodyMask() {
        return bodyMask;
    }

    /**
     * @return output of the adaptive stretching
     */
    public Img<UnsignedByteType> getInternalDetail() {
        return internalDetail;
    }

    /**
     * @return internal detail restricted to the body mask
     */
    public Img<UnsignedByteType> getLocalizedDetail() {
        return localizedDetail;
    }

    public long getProcessingTimeMillis() {
        return processingTimeMillis;
    }

    /**
     * @return fraction of the image covered by the body mask
     */
    public double getMaskCoverage() {
        long maskPixels = ImageAccessUtils.countPixelsWithValue(bodyMask, OtsuThresholdAlgorithm.FOREGROUND);
        return (double) maskPixels / ImageAccessUtils.getMaxSize(bodyMask.dimensionsAsLongArray());
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("shape", bodyMask.dimensionsAsLongArray())
                .append("processingTimeMillis", processingTimeMillis)
                .toString();
    }
}
