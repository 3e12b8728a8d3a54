package org.janelia.lorenzcxr.enhance;

import java.io.Serializable;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

/**
 * Parameters of the spatially adaptive chaotic contrast stretching.
 * The window size is the side of the square neighborhood used for the local mean;
 * even sizes are accepted but the neighborhood is then not centered on the pixel.
 */
public class AdaptiveStretchParams implements Serializable {
    public static final int DEFAULT_WINDOW_SIZE = 25;
    public static final double DEFAULT_DT = 0.1;
    public static final double DEFAULT_BETA = 8.0 / 3.0;

    private final int windowSize;
    private final double dt;
    private final double beta;

    public AdaptiveStretchParams() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_DT, DEFAULT_BETA);
    }

    public AdaptiveStretchParams(int windowSize, double dt, double beta) {
        this.windowSize = windowSize;
        this.dt = dt;
        this.beta = beta;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getDt() {
        return dt;
    }

    public double getBeta() {
        return beta;
    }

    public AdaptiveStretchParams withWindowSize(int windowSize) {
        return new AdaptiveStretchParams(windowSize, dt, beta);
    }

    public AdaptiveStretchParams withDt(double dt) {
        return new AdaptiveStretchParams(windowSize, dt, beta);
    }

    public AdaptiveStretchParams withBeta(double beta) {
        return new AdaptiveStretchParams(windowSize, dt, beta);
    }

    public AdaptiveStretchParams validate() {
        ImageAccessUtils.checkPositive("windowSize", windowSize);
        ImageAccessUtils.checkPositive("dt", dt);
        ImageAccessUtils.checkFinite("beta", beta);
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("windowSize", windowSize)
                .append("dt", dt)
                .append("beta", beta)
                .toString();
    }
}
