package org.janelia.lorenzcxr.image.io;

import java.awt.image.IndexColorModel;
import java.nio.file.Files;
import java.nio.file.Paths;

import javax.annotation.Nullable;

import ij.IJ;
import ij.ImagePlus;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads radiographs as single channel 8-bit images.
 */
public class ImageReader {

    private static final Logger LOG = LoggerFactory.getLogger(ImageReader.class);
    private static final double LUMA_RED = 0.299;
    private static final double LUMA_GREEN = 0.587;
    private static final double LUMA_BLUE = 0.114;

    /**
     * Read the image, convert it to 8-bit gray and resample it with bilinear interpolation to the working size.
     *
     * @param source image file
     * @param width working width; if width or height is not positive the original size is kept
     * @param height working height
     * @return the image or null if the source cannot be opened
     */
    @Nullable
    public static Img<UnsignedByteType> read8BitGrayImage(String source, int width, int height) {
        if (!Files.isReadable(Paths.get(source))) {
            LOG.error("Image {} does not exist or it is not readable", source);
            return null;
        }
        long startTime = System.currentTimeMillis();
        ImagePlus imp = IJ.openImage(source);
        if (imp == null) {
            LOG.error("Could not open image {}", source);
            return null;
        }
        ImageProcessor grayProcessor = imp.getProcessor().convertToByteProcessor();
        if (grayProcessor.isColorLut() || grayProcessor.isInvertedLut()) {
            // the pixels are palette indices
            applyLookupTable(grayProcessor);
        }
        if (width > 0 && height > 0 && (grayProcessor.getWidth() != width || grayProcessor.getHeight() != height)) {
            grayProcessor.setInterpolationMethod(ImageProcessor.BILINEAR);
            grayProcessor = grayProcessor.resize(width, height);
        }
        Img<UnsignedByteType> img = toImg((ByteProcessor) grayProcessor);
        LOG.debug("Read {} as a {}x{} 8-bit image in {}ms",
                source, grayProcessor.getWidth(), grayProcessor.getHeight(), System.currentTimeMillis() - startTime);
        return img;
    }

    /**
     * Replace every palette index with the luma of its color (ITU-R BT.601 weights).
     */
    static void applyLookupTable(ImageProcessor byteProcessor) {
        if (!(byteProcessor.getColorModel() instanceof IndexColorModel)) {
            return;
        }
        IndexColorModel lut = (IndexColorModel) byteProcessor.getColorModel();
        int[] grayTable = new int[256];
        for (int i = 0; i < grayTable.length; i++) {
            if (i < lut.getMapSize()) {
                double luma = LUMA_RED * lut.getRed(i) + LUMA_GREEN * lut.getGreen(i) + LUMA_BLUE * lut.getBlue(i);
                grayTable[i] = (int) Math.min(255, Math.round(luma));
            } else {
                grayTable[i] = i;
            }
        }
        byteProcessor.applyTable(grayTable);
        byteProcessor.setColorModel(byteProcessor.getDefaultColorModel());
    }

    static Img<UnsignedByteType> toImg(ByteProcessor byteProcessor) {
        // both ImageJ and the array img store pixels row by row so the data can be shared
        byte[] pixels = (byte[]) byteProcessor.getPixels();
        return ArrayImgs.unsignedBytes(pixels, byteProcessor.getWidth(), byteProcessor.getHeight());
    }
}
