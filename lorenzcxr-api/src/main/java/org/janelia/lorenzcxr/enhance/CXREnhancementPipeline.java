package org.janelia.lorenzcxr.enhance;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.lorenzcxr.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chest radiograph enhancement and localization:
 * <pre>
 *     image -+-> global stretch -> solidify mask --+
 *            |                                     +-> fuse -> localized detail
 *            +-> adaptive stretch -----------------+
 * </pre>
 * The two stretching stages do not depend on each other so if an executor is available they run concurrently.
 */
public class CXREnhancementPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CXREnhancementPipeline.class);

    /**
     * Driver value used for the body silhouette in the reference pipeline; lower than the
     * global stretching default so that dense tissue is not fully saturated.
     */
    public static final double REFERENCE_SILHOUETTE_DRIVER = 100;

    private final GlobalStretchParams globalStretchParams;
    private final AdaptiveStretchParams adaptiveStretchParams;
    private final MaskSolidificationParams maskSolidificationParams;
    private final Executor executor;

    /**
     * @return the pipeline configured with x = y = 100 for the silhouette and defaults for everything else
     */
    public static CXREnhancementPipeline referencePipeline() {
        return new CXREnhancementPipeline(
                new GlobalStretchParams().withDrivers(REFERENCE_SILHOUETTE_DRIVER, REFERENCE_SILHOUETTE_DRIVER),
                new AdaptiveStretchParams(),
                new MaskSolidificationParams(),
                null);
    }

    /**
     * @param executor executor used for the stretching stages; if null all stages run in the caller's thread.
     */
    public CXREnhancementPipeline(GlobalStretchParams globalStretchParams,
                                  AdaptiveStretchParams adaptiveStretchParams,
                                  MaskSolidificationParams maskSolidificationParams,
                                  @Nullable Executor executor) {
        this.globalStretchParams = globalStretchParams.validate();
        this.adaptiveStretchParams = adaptiveStretchParams.validate();
        this.maskSolidificationParams = maskSolidificationParams.validate();
        this.executor = executor;
    }

    public CXREnhancementPipeline withExecutor(@Nullable Executor executor) {
        return new CXREnhancementPipeline(globalStretchParams, adaptiveStretchParams, maskSolidificationParams, executor);
    }

    public GlobalStretchParams getGlobalStretchParams() {
        return globalStretchParams;
    }

    public AdaptiveStretchParams getAdaptiveStretchParams() {
        return adaptiveStretchParams;
    }

    public MaskSolidificationParams getMaskSolidificationParams() {
        return maskSolidificationParams;
    }

    public <T extends RealType<T>> CXREnhancementResult enhance(RandomAccessibleInterval<T> img) {
        ImageAccessUtils.check2D(img);
        long startTime = System.currentTimeMillis();

        CompletableFuture<Img<UnsignedByteType>> bodySilhouetteComputation = runStage(
                () -> ChaoticContrastStretching.globalStretch(img, globalStretchParams));
        CompletableFuture<Img<UnsignedByteType>> internalDetailComputation = runStage(
                () -> ChaoticContrastStretching.adaptiveStretch(img, adaptiveStretchParams));

        awaitStages(bodySilhouetteComputation, internalDetailComputation);
        Img<UnsignedByteType> bodySilhouette = bodySilhouetteComputation.join();
        Img<UnsignedByteType> bodyMask = ChaoticContrastStretching.solidifyMask(bodySilhouette, maskSolidificationParams);
        Img<UnsignedByteType> internalDetail = internalDetailComputation.join();
        Img<UnsignedByteType> localizedDetail = ChaoticContrastStretching.fuse(internalDetail, bodyMask);

        long processingTime = System.currentTimeMillis() - startTime;
        LOG.debug("Enhanced {} image in {}ms", Arrays.toString(img.dimensionsAsLongArray()), processingTime);
        return new CXREnhancementResult(bodySilhouette, bodyMask, internalDetail, localizedDetail, processingTime);
    }

    private <R> CompletableFuture<R> runStage(Supplier<R> stage) {
        if (executor == null) {
            return CompletableFuture.completedFuture(stage.get());
        } else {
            return CompletableFuture.supplyAsync(stage, executor);
        }
    }

    /**
     * Wait for all stages to complete. If any of them failed, the first failure is rethrown
     * with the failures of the other stages attached as suppressed exceptions.
     */
    private void awaitStages(CompletableFuture<?>... stageComputations) {
        RuntimeException stagesFailure = null;
        for (CompletableFuture<?> stageComputation : stageComputations) {
            try {
                stageComputation.join();
            } catch (CompletionException e) {
                RuntimeException stageFailure = e.getCause() instanceof RuntimeException
                        ? (RuntimeException) e.getCause()
                        : new IllegalStateException(e.getCause());
                if (stagesFailure == null) {
                    stagesFailure = stageFailure;
                } else if (stagesFailure != stageFailure) {
                    stagesFailure.addSuppressed(stageFailure);
                }
            }
        }
        if (stagesFailure != null) {
            throw stagesFailure;
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("globalStretchParams", globalStretchParams)
                .append("adaptiveStretchParams", adaptiveStretchParams)
                .append("maskSolidificationParams", maskSolidificationParams)
                .toString();
    }
}
