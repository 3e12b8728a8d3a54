package org.janelia.lorenzcxr.image.algorithms;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

/**
 * Otsu's automatic threshold for 8-bit images.
 */
public class OtsuThresholdAlgorithm {

    public static final int NBINS = 256;
    public static final int FOREGROUND = 255;
    public static final int BACKGROUND = 0;

    public static <T extends IntegerType<T>> int computeThreshold(RandomAccessibleInterval<T> img) {
        ImageAccessUtils.check2D(img);
        return computeThreshold(ImageAccessUtils.histogram(img, NBINS));
    }

    /**
     * Select the level t that maximizes the between-class variance of the two classes [0, t] and (t, nbins).
     * Levels that leave one of the classes empty are not considered and on ties the lowest level wins.
     * If no level splits the histogram in two populations the result is 0.
     *
     * @param hist intensity histogram
     * @return threshold level; values above it are foreground.
     */
    public static int computeThreshold(int[] hist) {
        long totalCount = 0;
        double totalSum = 0;
        for (int i = 0; i < hist.length; i++) {
            totalCount += hist[i];
            totalSum += (double) i * hist[i];
        }

        int threshold = 0;
        double maxVariance = 0;
        long backgroundCount = 0;
        double backgroundSum = 0;
        for (int t = 0; t < hist.length; t++) {
            backgroundCount += hist[t];
            backgroundSum += (double) t * hist[t];
            long foregroundCount = totalCount - backgroundCount;
            if (backgroundCount == 0 || foregroundCount == 0) {
                continue;
            }
            double backgroundMean = backgroundSum / backgroundCount;
            double foregroundMean = (totalSum - backgroundSum) / foregroundCount;
            double meanDiff = backgroundMean - foregroundMean;
            double betweenClassVariance = (double) backgroundCount * (double) foregroundCount * meanDiff * meanDiff;
            if (betweenClassVariance > maxVariance) {
                maxVariance = betweenClassVariance;
                threshold = t;
            }
        }
        return threshold;
    }

    public static <T extends IntegerType<T>> Img<UnsignedByteType> binarize(RandomAccessibleInterval<T> img, int threshold) {
        ImageAccessUtils.check2D(img);
        Img<UnsignedByteType> output = ImageAccessUtils.createImg(img, new UnsignedByteType());
        Cursor<T> imgCursor = Views.flatIterable(img).cursor();
        Cursor<UnsignedByteType> outputCursor = Views.flatIterable(output).cursor();
        while (imgCursor.hasNext()) {
            int value = imgCursor.next().getInteger();
            outputCursor.next().set(value > threshold ? FOREGROUND : BACKGROUND);
        }
        return output;
    }
}
