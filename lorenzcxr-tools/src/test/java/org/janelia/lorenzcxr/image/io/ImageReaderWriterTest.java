package org.janelia.lorenzcxr.image.io;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import javax.imageio.ImageIO;

import ij.IJ;
import ij.ImagePlus;
import ij.process.ByteProcessor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ImageReaderWriterTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void writeAndReadImage() throws Exception {
        Img<UnsignedByteType> img = createGradientImage(40, 30);
        File imageFile = new File(testFolder.getRoot(), "gradient.png");

        ImageWriter.write8BitGrayImage(img, "gradient", imageFile.toPath());

        Img<UnsignedByteType> readImg = ImageReader.read8BitGrayImage(imageFile.getAbsolutePath(), 0, 0);
        assertNotNull(readImg);
        assertEquals(40, readImg.dimension(0));
        assertEquals(30, readImg.dimension(1));
        RandomAccess<UnsignedByteType> expectedAccess = img.randomAccess();
        RandomAccess<UnsignedByteType> actualAccess = readImg.randomAccess();
        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 40; x++) {
                expectedAccess.setPosition(new int[]{x, y});
                actualAccess.setPosition(new int[]{x, y});
                assertEquals("Pixel " + x + "," + y, expectedAccess.get().get(), actualAccess.get().get());
            }
        }
    }

    @Test
    public void readImageWithResize() {
        Img<UnsignedByteType> img = ArrayImgs.unsignedBytes(50, 20);
        img.forEach(p -> p.set(77));
        File imageFile = new File(testFolder.getRoot(), "uniform.png");
        ImageWriter.write8BitGrayImage(img, "uniform", imageFile.toPath());

        Img<UnsignedByteType> readImg = ImageReader.read8BitGrayImage(imageFile.getAbsolutePath(), 16, 16);
        assertNotNull(readImg);
        assertEquals(16, readImg.dimension(0));
        assertEquals(16, readImg.dimension(1));
        // interpolating a constant image keeps it constant
        readImg.forEach(p -> assertEquals(77, p.get()));
    }

    @Test
    public void readMissingImage() {
        assertNull(ImageReader.read8BitGrayImage(new File(testFolder.getRoot(), "missing.png").getAbsolutePath(), 0, 0));
    }

    @Test
    public void writeMontage() {
        Img<UnsignedByteType> img = createGradientImage(32, 24);
        List<Pair<String, RandomAccessibleInterval<UnsignedByteType>>> panels = Arrays.asList(
                ImmutablePair.of("first", img),
                ImmutablePair.of("second", img),
                ImmutablePair.of("third", img)
        );
        File montageFile = new File(testFolder.getRoot(), "montage.png");

        ImageWriter.writeMontage(panels, "montage", montageFile.toPath());

        ImagePlus montage = IJ.openImage(montageFile.getAbsolutePath());
        assertNotNull(montage);
        assertEquals(3 * 32, montage.getWidth());
        assertEquals(24, montage.getHeight());
    }

    @Test
    public void readPalettedImage() throws Exception {
        // reversed gray palette: index i is displayed as 255 - i
        byte[] reversedGray = new byte[256];
        for (int i = 0; i < reversedGray.length; i++) {
            reversedGray[i] = (byte) (255 - i);
        }
        BufferedImage palettedImage = new BufferedImage(4, 3, BufferedImage.TYPE_BYTE_INDEXED,
                new IndexColorModel(8, 256, reversedGray, reversedGray, reversedGray));
        WritableRaster raster = palettedImage.getRaster();
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 4; x++) {
                raster.setSample(x, y, 0, 10 + 20 * x + 60 * y);
            }
        }
        File imageFile = new File(testFolder.getRoot(), "paletted.png");
        assertTrue(ImageIO.write(palettedImage, "png", imageFile));

        Img<UnsignedByteType> readImg = ImageReader.read8BitGrayImage(imageFile.getAbsolutePath(), 0, 0);
        assertNotNull(readImg);
        RandomAccess<UnsignedByteType> imgAccess = readImg.randomAccess();
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 4; x++) {
                imgAccess.setPosition(new int[]{x, y});
                assertEquals("Pixel " + x + "," + y, 255 - (10 + 20 * x + 60 * y), imgAccess.get().get());
            }
        }
    }

    @Test
    public void applyColorLookupTable() {
        byte[] reds = {0, (byte) 255, 0, 0};
        byte[] greens = {0, 0, (byte) 255, 0};
        byte[] blues = {0, 0, 0, (byte) 255};
        ByteProcessor byteProcessor = new ByteProcessor(4, 1, new byte[] {0, 1, 2, 3});
        byteProcessor.setColorModel(new IndexColorModel(8, 4, reds, greens, blues));

        ImageReader.applyLookupTable(byteProcessor);

        assertEquals(0, byteProcessor.get(0, 0));
        assertEquals(76, byteProcessor.get(1, 0));
        assertEquals(150, byteProcessor.get(2, 0));
        assertEquals(29, byteProcessor.get(3, 0));
    }

    @Test
    public void writeFailure() throws Exception {
        File blockingDir = testFolder.newFolder("blocked.png");
        assertTrue(new File(blockingDir, "content.txt").createNewFile());
        try {
            ImageWriter.write8BitGrayImage(createGradientImage(8, 8), "blocked", blockingDir.toPath());
            fail("Writing over a directory should have failed");
        } catch (UncheckedIOException e) {
            // expected
        }
    }

    private Img<UnsignedByteType> createGradientImage(int width, int height) {
        Img<UnsignedByteType> img = ArrayImgs.unsignedBytes(width, height);
        RandomAccess<UnsignedByteType> imgAccess = img.randomAccess();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                imgAccess.setPosition(new int[]{x, y});
                imgAccess.get().set((x * 5 + y * 3) % 256);
            }
        }
        return img;
    }
}
