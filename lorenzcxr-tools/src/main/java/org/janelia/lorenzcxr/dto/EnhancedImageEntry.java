package org.janelia.lorenzcxr.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Outcome of the enhancement of one input image.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnhancedImageEntry {
    private String inputImage;
    private String localizedDetailImage;
    private String bodySilhouetteImage;
    private String bodyMaskImage;
    private String internalDetailImage;
    private String montageImage;
    private Integer width;
    private Integer height;
    private Double maskCoverage;
    private Long processingTimeMillis;
    private String errorMessage;

    public String getInputImage() {
        return inputImage;
    }

    public EnhancedImageEntry setInputImage(String inputImage) {
        this.inputImage = inputImage;
        return this;
    }

    public String getLocalizedDetailImage() {
        return localizedDetailImage;
    }

    public EnhancedImageEntry setLocalizedDetailImage(String localizedDetailImage) {
        this.localizedDetailImage = localizedDetailImage;
        return this;
    }

    public String getBodySilhouetteImage() {
        return bodySilhouetteImage;
    }

    public EnhancedImageEntry setBodySilhouetteImage(String bodySilhouetteImage) {
        this.bodySilhouetteImage = bodySilhouetteImage;
        return this;
    }

    public String getBodyMaskImage() {
        return bodyMaskImage;
    }

    public EnhancedImageEntry setBodyMaskImage(String bodyMaskImage) {
        this.bodyMaskImage = bodyMaskImage;
        return this;
    }

    public String getInternalDetailImage() {
        return internalDetailImage;
    }

    public EnhancedImageEntry setInternalDetailImage(String internalDetailImage) {
        this.internalDetailImage = internalDetailImage;
        return this;
    }

    public String getMontageImage() {
        return montageImage;
    }

    public EnhancedImageEntry setMontageImage(String montageImage) {
        this.montageImage = montageImage;
        return this;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public EnhancedImageEntry setSize(int width, int height) {
        this.width = width;
        this.height = height;
        return this;
    }

    public Double getMaskCoverage() {
        return maskCoverage;
    }

    public EnhancedImageEntry setMaskCoverage(Double maskCoverage) {
        this.maskCoverage = maskCoverage;
        return this;
    }

    public Long getProcessingTimeMillis() {
        return processingTimeMillis;
    }

    public EnhancedImageEntry setProcessingTimeMillis(Long processingTimeMillis) {
        this.processingTimeMillis = processingTimeMillis;
        return this;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public EnhancedImageEntry setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        return this;
    }

    public boolean hasErrors() {
        return errorMessage != null;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("inputImage", inputImage)
                .append("localizedDetailImage", localizedDetailImage)
                .append("maskCoverage", maskCoverage)
                .append("errorMessage", errorMessage)
                .toString();
    }
}
