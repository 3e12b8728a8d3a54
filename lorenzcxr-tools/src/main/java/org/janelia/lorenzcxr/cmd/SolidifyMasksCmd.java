package org.janelia.lorenzcxr.cmd;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.lorenzcxr.enhance.ChaoticContrastStretching;
import org.janelia.lorenzcxr.enhance.MaskSolidificationParams;
import org.janelia.lorenzcxr.image.io.ImageReader;
import org.janelia.lorenzcxr.image.io.ImageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Command that turns existing 8-bit silhouettes into solid binary masks.
 */
class SolidifyMasksCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(SolidifyMasksCmd.class);

    @Parameters(commandDescription = "Binarize images with Otsu's threshold and close the result with a square kernel")
    static class SolidifyMasksArgs extends AbstractCmdArgs {
        @Parameter(names = "--kernelSize", description = "Square kernel size used for closing the mask")
        Integer kernelSize;

        SolidifyMasksArgs(CommonArgs commonArgs) {
            super(commonArgs);
            // masks are produced at the input resolution unless a working size is given explicitly
            width = 0;
            height = 0;
        }
    }

    private final SolidifyMasksArgs args;

    SolidifyMasksCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new SolidifyMasksArgs(commonArgs);
    }

    @Override
    SolidifyMasksArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        Path outputDir = args.getOutputDirArg().orElseThrow(() -> new IllegalArgumentException("No output directory"));
        MaskSolidificationParams maskSolidificationParams = new MaskSolidificationParams(
                args.kernelSize != null
                        ? args.kernelSize
                        : getConfig().getIntegerPropertyValue("MaskSolidification.KernelSize", MaskSolidificationParams.DEFAULT_KERNEL_SIZE))
                .validate();
        int[] workingSize = getWorkingSize();
        List<Path> inputImages = CmdUtils.listInputImages(args.inputs);
        if (inputImages.isEmpty()) {
            LOG.info("No input images found in {}", args.inputs);
            return;
        }
        Map<Path, String> outputNames = CmdUtils.getOutputNames(inputImages);
        CmdUtils.createDirs(outputDir);
        ExecutorService executorService = CmdUtils.createCmdExecutor(args.commonArgs);
        try {
            Long nMasks = Flux.fromIterable(inputImages)
                    .parallel(CmdUtils.getTaskConcurrency(args.commonArgs))
                    .runOn(Schedulers.fromExecutorService(executorService))
                    .filter(inputImage -> solidifyMask(inputImage, outputNames.get(inputImage), maskSolidificationParams, workingSize, outputDir))
                    .sequential()
                    .count()
                    .block();
            LOG.info("Finished solidifying {} out of {} masks in {}s", nMasks, inputImages.size(),
                    (System.currentTimeMillis() - startTime) / 1000.);
        } finally {
            executorService.shutdown();
        }
    }

    /**
     * @return true if the mask was written; images that cannot be read or written are logged and skipped
     */
    private boolean solidifyMask(Path inputImage,
                                 String outputName,
                                 MaskSolidificationParams maskSolidificationParams,
                                 int[] workingSize,
                                 Path outputDir) {
        Img<UnsignedByteType> img = ImageReader.read8BitGrayImage(inputImage.toString(), workingSize[0], workingSize[1]);
        if (img == null) {
            LOG.warn("Skip {} because it could not be read", inputImage);
            return false;
        }
        Path maskPath = outputDir.resolve(outputName + "_mask.png");
        try {
            ImageWriter.write8BitGrayImage(ChaoticContrastStretching.solidifyMask(img, maskSolidificationParams), outputName, maskPath);
        } catch (UncheckedIOException e) {
            LOG.error("Error writing the mask for {}", inputImage, e);
            return false;
        }
        LOG.info("Solidified {} -> {}", inputImage, maskPath);
        return true;
    }
}
