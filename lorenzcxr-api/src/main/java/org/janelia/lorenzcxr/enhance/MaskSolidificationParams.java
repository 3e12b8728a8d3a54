package org.janelia.lorenzcxr.enhance;

import java.io.Serializable;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

public class MaskSolidificationParams implements Serializable {
    public static final int DEFAULT_KERNEL_SIZE = 21;

    private final int kernelSize;

    public MaskSolidificationParams() {
        this(DEFAULT_KERNEL_SIZE);
    }

    public MaskSolidificationParams(int kernelSize) {
        this.kernelSize = kernelSize;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public MaskSolidificationParams validate() {
        ImageAccessUtils.checkPositive("kernelSize", kernelSize);
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("kernelSize", kernelSize)
                .toString();
    }
}
