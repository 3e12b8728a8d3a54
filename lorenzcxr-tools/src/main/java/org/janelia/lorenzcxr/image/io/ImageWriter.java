package org.janelia.lorenzcxr.image.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import ij.ImagePlus;
import ij.ImageStack;
import ij.plugin.MontageMaker;
import ij.plugin.PNG_Writer;
import ij.process.ByteProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.tuple.Pair;
import org.janelia.lorenzcxr.image.ImageAccessUtils;

public class ImageWriter {

    private static final int NO_TRANSPARENCY = -1;

    public static <T extends IntegerType<T>> void write8BitGrayImage(RandomAccessibleInterval<T> img, String title, Path outputPath) {
        savePNG(new ImagePlus(title, toByteProcessor(img)), outputPath);
    }

    /**
     * Write the labeled panels side by side in a single row.
     *
     * @param panels label and image of every panel; all images must have the same shape
     */
    public static <T extends IntegerType<T>> void writeMontage(List<Pair<String, RandomAccessibleInterval<T>>> panels,
                                                               String title,
                                                               Path outputPath) {
        RandomAccessibleInterval<T> firstPanel = panels.get(0).getRight();
        ImageStack panelsStack = new ImageStack((int) firstPanel.dimension(0), (int) firstPanel.dimension(1));
        for (Pair<String, RandomAccessibleInterval<T>> panel : panels) {
            ImageAccessUtils.checkSameShape(firstPanel, panel.getRight());
            panelsStack.addSlice(panel.getLeft(), toByteProcessor(panel.getRight()));
        }
        ImagePlus montage = new MontageMaker().makeMontage2(
                new ImagePlus(title, panelsStack),
                panels.size(), 1, // columns, rows
                1.0, // scale
                1, panels.size(), 1, // first, last, increment
                0, // border width
                true // use the slice labels
        );
        savePNG(montage, outputPath);
    }

    static <T extends IntegerType<T>> ByteProcessor toByteProcessor(RandomAccessibleInterval<T> img) {
        ImageAccessUtils.check2D(img);
        int width = (int) img.dimension(0);
        int height = (int) img.dimension(1);
        byte[] pixels = new byte[width * height];
        Cursor<T> imgCursor = Views.flatIterable(img).cursor();
        int i = 0;
        while (imgCursor.hasNext()) {
            pixels[i++] = (byte) imgCursor.next().getInteger();
        }
        return new ByteProcessor(width, height, pixels);
    }

    private static void savePNG(ImagePlus imp, Path outputPath) {
        // FileSaver.saveAsPng reports write errors through IJ.error and always returns true
        try {
            new PNG_Writer().writeImage(imp, outputPath.toString(), NO_TRANSPARENCY);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + outputPath, e);
        } catch (Exception e) {
            throw new UncheckedIOException("Error writing " + outputPath, new IOException(e));
        }
    }
}
