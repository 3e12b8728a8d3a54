package org.janelia.lorenzcxr.dto;

import java.util.ArrayList;
import java.util.List;

import org.janelia.lorenzcxr.enhance.AdaptiveStretchParams;
import org.janelia.lorenzcxr.enhance.GlobalStretchParams;
import org.janelia.lorenzcxr.enhance.MaskSolidificationParams;

public class EnhancementSummary {
    private GlobalStretchParams globalStretchParams;
    private AdaptiveStretchParams adaptiveStretchParams;
    private MaskSolidificationParams maskSolidificationParams;
    private int workingWidth;
    private int workingHeight;
    private long totalProcessingTimeMillis;
    private final List<EnhancedImageEntry> images = new ArrayList<>();

    public GlobalStretchParams getGlobalStretchParams() {
        return globalStretchParams;
    }

    public EnhancementSummary setGlobalStretchParams(GlobalStretchParams globalStretchParams) {
        this.globalStretchParams = globalStretchParams;
        return this;
    }

    public AdaptiveStretchParams getAdaptiveStretchParams() {
        return adaptiveStretchParams;
    }

    public EnhancementSummary setAdaptiveStretchParams(AdaptiveStretchParams adaptiveStretchParams) {
        this.adaptiveStretchParams = adaptiveStretchParams;
        return this;
    }

    public MaskSolidificationParams getMaskSolidificationParams() {
        return maskSolidificationParams;
    }

    public EnhancementSummary setMaskSolidificationParams(MaskSolidificationParams maskSolidificationParams) {
        this.maskSolidificationParams = maskSolidificationParams;
        return this;
    }

    public int getWorkingWidth() {
        return workingWidth;
    }

    public int getWorkingHeight() {
        return workingHeight;
    }

    public EnhancementSummary setWorkingSize(int workingWidth, int workingHeight) {
        this.workingWidth = workingWidth;
        this.workingHeight = workingHeight;
        return this;
    }

    public long getTotalProcessingTimeMillis() {
        return totalProcessingTimeMillis;
    }

    public EnhancementSummary setTotalProcessingTimeMillis(long totalProcessingTimeMillis) {
        this.totalProcessingTimeMillis = totalProcessingTimeMillis;
        return this;
    }

    public List<EnhancedImageEntry> getImages() {
        return images;
    }

    public EnhancementSummary addImages(List<EnhancedImageEntry> entries) {
        images.addAll(entries);
        return this;
    }

    public long getProcessedCount() {
        return images.stream().filter(e -> !e.hasErrors()).count();
    }

    public long getFailedCount() {
        return images.stream().filter(EnhancedImageEntry::hasErrors).count();
    }
}
