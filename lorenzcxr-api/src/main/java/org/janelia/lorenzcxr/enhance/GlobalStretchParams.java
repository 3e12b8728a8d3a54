package org.janelia.lorenzcxr.enhance;

import java.io.Serializable;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

/**
 * Parameters of the global (constant driver) chaotic contrast stretching.
 */
public class GlobalStretchParams implements Serializable {
    public static final double DEFAULT_DT = 0.1;
    public static final double DEFAULT_X = 250;
    public static final double DEFAULT_Y = 250;
    public static final double DEFAULT_BETA = 8.0 / 3.0;

    private final double dt;
    private final double x;
    private final double y;
    private final double beta;

    public GlobalStretchParams() {
        this(DEFAULT_DT, DEFAULT_X, DEFAULT_Y, DEFAULT_BETA);
    }

    public GlobalStretchParams(double dt, double x, double y, double beta) {
        this.dt = dt;
        this.x = x;
        this.y = y;
        this.beta = beta;
    }

    public double getDt() {
        return dt;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getBeta() {
        return beta;
    }

    public GlobalStretchParams withDt(double dt) {
        return new GlobalStretchParams(dt, x, y, beta);
    }

    /**
     * Replace the driver pair (x, y).
     */
    public GlobalStretchParams withDrivers(double x, double y) {
        return new GlobalStretchParams(dt, x, y, beta);
    }

    public GlobalStretchParams withBeta(double beta) {
        return new GlobalStretchParams(dt, x, y, beta);
    }

    public GlobalStretchParams validate() {
        ImageAccessUtils.checkPositive("dt", dt);
        ImageAccessUtils.checkFinite("x", x);
        ImageAccessUtils.checkFinite("y", y);
        ImageAccessUtils.checkFinite("beta", beta);
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("dt", dt)
                .append("x", x)
                .append("y", y)
                .append("beta", beta)
                .toString();
    }
}
