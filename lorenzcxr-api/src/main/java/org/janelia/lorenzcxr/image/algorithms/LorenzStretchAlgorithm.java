package org.janelia.lorenzcxr.image.algorithms;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.lorenzcxr.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chaotic contrast stretching based on a single explicit Euler step of the z-equation of the Lorenz system:
 * <pre>
 *     dz/dt = x*y - beta*z
 * </pre>
 * Pixel intensities are mapped to the z coordinate, advanced by one step of size dt and
 * the result is normalized back to the 8-bit intensity range using the global maximum.
 * The global variant uses constant drivers (x, y) for the whole image. The adaptive variant
 * derives x = y = sqrt(2 * localMean(z)) from a box neighborhood of every pixel.
 */
public class LorenzStretchAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(LorenzStretchAlgorithm.class);

    public static final double Z_SCALE = 50.0;
    public static final int MAX_INTENSITY = 255;

    /**
     * Map 8-bit intensities to the Lorenz z domain [0, Z_SCALE].
     */
    public static <T extends RealType<T>> Img<DoubleType> toLorenzState(RandomAccessibleInterval<T> img) {
        ImageAccessUtils.check2D(img);
        Img<DoubleType> state = ImageAccessUtils.createImg(img, new DoubleType());
        Cursor<T> imgCursor = Views.flatIterable(img).cursor();
        Cursor<DoubleType> stateCursor = Views.flatIterable(state).cursor();
        while (imgCursor.hasNext()) {
            double intensity = imgCursor.next().getRealDouble();
            stateCursor.next().set((intensity / MAX_INTENSITY) * Z_SCALE);
        }
        return state;
    }

    /**
     * Advance the state by one step using the same driver product x*y for every pixel.
     */
    public static Img<DoubleType> applyConstantDriverUpdate(RandomAccessibleInterval<DoubleType> state,
                                                            double x, double y,
                                                            double beta, double dt) {
        double forcing = x * y;
        Img<DoubleType> newState = ImageAccessUtils.createImg(state, new DoubleType());
        Cursor<DoubleType> stateCursor = Views.flatIterable(state).cursor();
        Cursor<DoubleType> newStateCursor = Views.flatIterable(newState).cursor();
        while (stateCursor.hasNext()) {
            double z = stateCursor.next().get();
            double dz = (forcing - beta * z) * dt;
            newStateCursor.next().set(z + dz);
        }
        return newState;
    }

    /**
     * Advance the state by one step using per pixel drivers x = y = sqrt(2 * max(localMean, 0)).
     */
    public static Img<DoubleType> applyAdaptiveDriverUpdate(RandomAccessibleInterval<DoubleType> state,
                                                            RandomAccessibleInterval<DoubleType> localMean,
                                                            double beta, double dt) {
        ImageAccessUtils.checkSameShape(state, localMean);
        Img<DoubleType> newState = ImageAccessUtils.createImg(state, new DoubleType());
        Cursor<DoubleType> stateCursor = Views.flatIterable(state).cursor();
        Cursor<DoubleType> meanCursor = Views.flatIterable(localMean).cursor();
        Cursor<DoubleType> newStateCursor = Views.flatIterable(newState).cursor();
        while (stateCursor.hasNext()) {
            double z = stateCursor.next().get();
            double m = meanCursor.next().get();
            double xAdaptive = Math.sqrt(Math.max(m, 0) * 2);
            double yAdaptive = xAdaptive;
            double dz = (xAdaptive * yAdaptive - beta * z) * dt;
            newStateCursor.next().set(z + dz);
        }
        return newState;
    }

    /**
     * @return the maximum of the state or 1 if the maximum is not a positive finite value.
     */
    public static double normalizationPeak(RandomAccessibleInterval<DoubleType> state) {
        double peak = ImageAccessUtils.max(state);
        if (!(peak > 0) || Double.isInfinite(peak)) {
            LOG.debug("Degenerate normalization peak {} - use 1 instead", peak);
            return 1;
        }
        return peak;
    }

    /**
     * Scale the state so that its peak maps to MAX_INTENSITY, then clip to [0, MAX_INTENSITY] and round.
     */
    public static Img<UnsignedByteType> normalizeToUnsignedByte(RandomAccessibleInterval<DoubleType> state) {
        double peak = normalizationPeak(state);
        Img<UnsignedByteType> output = ImageAccessUtils.createImg(state, new UnsignedByteType());
        Cursor<DoubleType> stateCursor = Views.flatIterable(state).cursor();
        Cursor<UnsignedByteType> outputCursor = Views.flatIterable(output).cursor();
        while (stateCursor.hasNext()) {
            double scaledValue = stateCursor.next().get() / peak * MAX_INTENSITY;
            if (scaledValue < 0) {
                scaledValue = 0;
            } else if (scaledValue > MAX_INTENSITY) {
                scaledValue = MAX_INTENSITY;
            }
            // NaN rounds to 0
            outputCursor.next().set((int) Math.round(scaledValue));
        }
        return output;
    }

    public static <T extends RealType<T>> Img<UnsignedByteType> globalStretch(RandomAccessibleInterval<T> img,
                                                                              double dt,
                                                                              double x,
                                                                              double y,
                                                                              double beta) {
        ImageAccessUtils.check2D(img);
        ImageAccessUtils.checkPositive("dt", dt);
        ImageAccessUtils.checkFinite("x", x);
        ImageAccessUtils.checkFinite("y", y);
        ImageAccessUtils.checkFinite("beta", beta);

        Img<DoubleType> state = toLorenzState(img);
        Img<DoubleType> newState = applyConstantDriverUpdate(state, x, y, beta, dt);
        return normalizeToUnsignedByte(newState);
    }

    public static <T extends RealType<T>> Img<UnsignedByteType> adaptiveStretch(RandomAccessibleInterval<T> img,
                                                                                int windowSize,
                                                                                double dt,
                                                                                double beta) {
        ImageAccessUtils.check2D(img);
        ImageAccessUtils.checkPositive("windowSize", windowSize);
        ImageAccessUtils.checkPositive("dt", dt);
        ImageAccessUtils.checkFinite("beta", beta);

        Img<DoubleType> state = toLorenzState(img);
        Img<DoubleType> localMean = BoxMeanFilterAlgorithm.meanFilter(state, windowSize);
        Img<DoubleType> newState = applyAdaptiveDriverUpdate(state, localMean, beta, dt);
        return normalizeToUnsignedByte(newState);
    }
}
