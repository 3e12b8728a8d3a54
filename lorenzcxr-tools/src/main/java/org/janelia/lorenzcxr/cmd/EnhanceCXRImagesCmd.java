package org.janelia.lorenzcxr.cmd;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.janelia.lorenzcxr.config.Config;
import org.janelia.lorenzcxr.dto.EnhancedImageEntry;
import org.janelia.lorenzcxr.dto.EnhancementSummary;
import org.janelia.lorenzcxr.enhance.AdaptiveStretchParams;
import org.janelia.lorenzcxr.enhance.CXREnhancementPipeline;
import org.janelia.lorenzcxr.enhance.CXREnhancementResult;
import org.janelia.lorenzcxr.enhance.GlobalStretchParams;
import org.janelia.lorenzcxr.enhance.MaskSolidificationParams;
import org.janelia.lorenzcxr.image.io.ImageReader;
import org.janelia.lorenzcxr.image.io.ImageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Command that enhances chest radiographs: the body silhouette obtained with the global
 * chaotic stretch is turned into a solid mask that localizes the detail from the adaptive stretch.
 */
class EnhanceCXRImagesCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(EnhanceCXRImagesCmd.class);
    static final String SUMMARY_FILE_NAME = "enhancement-summary.json";

    @Parameters(commandDescription = "Enhance chest radiographs and localize the lung region using chaotic contrast stretching")
    static class EnhanceCXRImagesArgs extends AbstractCmdArgs {
        @Parameter(names = "--globalDt", description = "Integration step of the global stretch")
        Double globalDt;

        @Parameter(names = "--globalX", description = "X driver of the global stretch")
        Double globalX;

        @Parameter(names = "--globalY", description = "Y driver of the global stretch")
        Double globalY;

        @Parameter(names = "--globalBeta", description = "Damping coefficient of the global stretch")
        Double globalBeta;

        @Parameter(names = "--windowSize", description = "Local mean window size of the adaptive stretch")
        Integer windowSize;

        @Parameter(names = "--adaptiveDt", description = "Integration step of the adaptive stretch")
        Double adaptiveDt;

        @Parameter(names = "--adaptiveBeta", description = "Damping coefficient of the adaptive stretch")
        Double adaptiveBeta;

        @Parameter(names = "--kernelSize", description = "Square kernel size used for closing the body mask")
        Integer kernelSize;

        @Parameter(names = "--save-intermediates", description = "Also write the body silhouette, the body mask and the internal detail", arity = 0)
        boolean saveIntermediates = false;

        @Parameter(names = "--montage", description = "Write a side by side montage of the original, the mask, the detail and the result", arity = 0)
        boolean montage = false;

        EnhanceCXRImagesArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }
    }

    private final EnhanceCXRImagesArgs args;
    private final ObjectMapper mapper;

    EnhanceCXRImagesCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new EnhanceCXRImagesArgs(commonArgs);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Override
    EnhanceCXRImagesArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        Path outputDir = args.getOutputDirArg().orElseThrow(() -> new IllegalArgumentException("No output directory"));
        // the pipeline configuration is validated before any input is read
        CXREnhancementPipeline pipeline = createPipeline();
        int[] workingSize = getWorkingSize();
        List<Path> inputImages = CmdUtils.listInputImages(args.inputs);
        if (inputImages.isEmpty()) {
            LOG.info("No input images found in {}", args.inputs);
            return;
        }
        Map<Path, String> outputNames = CmdUtils.getOutputNames(inputImages);
        CmdUtils.createDirs(outputDir);
        LOG.info("Enhance {} images using {} - memory usage {}M out of {}M",
                inputImages.size(), pipeline,
                (Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory()) / _1M + 1, // round up
                (Runtime.getRuntime().totalMemory() / _1M));
        ExecutorService executorService = CmdUtils.createCmdExecutor(args.commonArgs);
        try {
            Scheduler scheduler = Schedulers.fromExecutorService(executorService);
            // every image is processed on a single worker so the pipeline itself runs its stages sequentially
            List<EnhancedImageEntry> enhancedImages = Flux.fromIterable(inputImages)
                    .parallel(CmdUtils.getTaskConcurrency(args.commonArgs))
                    .runOn(scheduler)
                    .map(inputImage -> enhanceImage(pipeline, inputImage, outputNames.get(inputImage), workingSize, outputDir))
                    .doOnNext(entry -> checkMemoryUsage())
                    .sequential()
                    .collectSortedList(Comparator.comparing(EnhancedImageEntry::getInputImage))
                    .block();
            EnhancementSummary summary = new EnhancementSummary()
                    .setGlobalStretchParams(pipeline.getGlobalStretchParams())
                    .setAdaptiveStretchParams(pipeline.getAdaptiveStretchParams())
                    .setMaskSolidificationParams(pipeline.getMaskSolidificationParams())
                    .setWorkingSize(workingSize[0], workingSize[1])
                    .addImages(enhancedImages)
                    .setTotalProcessingTimeMillis(System.currentTimeMillis() - startTime);
            writeSummary(summary, outputDir.resolve(SUMMARY_FILE_NAME));
            LOG.info("Finished enhancing {} images ({} failed) in {}s - memory usage {}M out of {}M",
                    summary.getProcessedCount(), summary.getFailedCount(),
                    (System.currentTimeMillis() - startTime) / 1000.,
                    (Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory()) / _1M + 1, // round up
                    (Runtime.getRuntime().totalMemory() / _1M));
        } finally {
            executorService.shutdown();
        }
    }

    CXREnhancementPipeline createPipeline() {
        Config config = getConfig();
        GlobalStretchParams globalStretchParams = new GlobalStretchParams(
                args.globalDt != null ? args.globalDt : config.getDoublePropertyValue("GlobalStretch.Dt", GlobalStretchParams.DEFAULT_DT),
                args.globalX != null ? args.globalX : config.getDoublePropertyValue("GlobalStretch.X", CXREnhancementPipeline.REFERENCE_SILHOUETTE_DRIVER),
                args.globalY != null ? args.globalY : config.getDoublePropertyValue("GlobalStretch.Y", CXREnhancementPipeline.REFERENCE_SILHOUETTE_DRIVER),
                args.globalBeta != null ? args.globalBeta : config.getDoublePropertyValue("GlobalStretch.Beta", GlobalStretchParams.DEFAULT_BETA)
        );
        AdaptiveStretchParams adaptiveStretchParams = new AdaptiveStretchParams(
                args.windowSize != null ? args.windowSize : config.getIntegerPropertyValue("AdaptiveStretch.WindowSize", AdaptiveStretchParams.DEFAULT_WINDOW_SIZE),
                args.adaptiveDt != null ? args.adaptiveDt : config.getDoublePropertyValue("AdaptiveStretch.Dt", AdaptiveStretchParams.DEFAULT_DT),
                args.adaptiveBeta != null ? args.adaptiveBeta : config.getDoublePropertyValue("AdaptiveStretch.Beta", AdaptiveStretchParams.DEFAULT_BETA)
        );
        MaskSolidificationParams maskSolidificationParams = new MaskSolidificationParams(
                args.kernelSize != null ? args.kernelSize : config.getIntegerPropertyValue("MaskSolidification.KernelSize", MaskSolidificationParams.DEFAULT_KERNEL_SIZE)
        );
        return new CXREnhancementPipeline(globalStretchParams, adaptiveStretchParams, maskSolidificationParams, null);
    }

    private EnhancedImageEntry enhanceImage(CXREnhancementPipeline pipeline,
                                            Path inputImage,
                                            String outputName,
                                            int[] workingSize,
                                            Path outputDir) {
        EnhancedImageEntry entry = new EnhancedImageEntry().setInputImage(inputImage.toString());
        Img<UnsignedByteType> img = ImageReader.read8BitGrayImage(inputImage.toString(), workingSize[0], workingSize[1]);
        if (img == null) {
            LOG.warn("Skip {} because it could not be read", inputImage);
            return entry.setErrorMessage("Image could not be read");
        }
        try {
            CXREnhancementResult result = pipeline.enhance(img);
            Path localizedDetailPath = outputDir.resolve(outputName + "_localized.png");
            ImageWriter.write8BitGrayImage(result.getLocalizedDetail(), outputName, localizedDetailPath);
            entry.setLocalizedDetailImage(localizedDetailPath.toString())
                    .setSize((int) img.dimension(0), (int) img.dimension(1))
                    .setMaskCoverage(result.getMaskCoverage())
                    .setProcessingTimeMillis(result.getProcessingTimeMillis());
            if (args.saveIntermediates) {
                Path silhouettePath = outputDir.resolve(outputName + "_silhouette.png");
                Path maskPath = outputDir.resolve(outputName + "_mask.png");
                Path detailPath = outputDir.resolve(outputName + "_detail.png");
                ImageWriter.write8BitGrayImage(result.getBodySilhouette(), outputName, silhouettePath);
                ImageWriter.write8BitGrayImage(result.getBodyMask(), outputName, maskPath);
                ImageWriter.write8BitGrayImage(result.getInternalDetail(), outputName, detailPath);
                entry.setBodySilhouetteImage(silhouettePath.toString())
                        .setBodyMaskImage(maskPath.toString())
                        .setInternalDetailImage(detailPath.toString());
            }
            if (args.montage) {
                Path montagePath = outputDir.resolve(outputName + "_montage.png");
                List<Pair<String, RandomAccessibleInterval<UnsignedByteType>>> panels = Arrays.asList(
                        ImmutablePair.of("Original CXR", img),
                        ImmutablePair.of("Body Mask (Global)", result.getBodyMask()),
                        ImmutablePair.of("Detail (Adaptive)", result.getInternalDetail()),
                        ImmutablePair.of("Final Localization", result.getLocalizedDetail())
                );
                ImageWriter.writeMontage(panels, outputName, montagePath);
                entry.setMontageImage(montagePath.toString());
            }
            LOG.info("Enhanced {} -> {} (mask coverage {}) in {}ms",
                    inputImage, localizedDetailPath, result.getMaskCoverage(), result.getProcessingTimeMillis());
            return entry;
        } catch (UncheckedIOException e) {
            LOG.error("Error writing the results for {}", inputImage, e);
            return entry.setErrorMessage(e.getMessage());
        }
    }

    private void writeSummary(EnhancementSummary summary, Path summaryPath) {
        try {
            mapper.writeValue(summaryPath.toFile(), summary);
            LOG.info("Wrote enhancement summary to {}", summaryPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + summaryPath, e);
        }
    }
}
