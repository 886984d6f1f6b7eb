package pixeldreamer.editor.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.PixelBuffer;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferInt;
import java.awt.image.Raster;

/**
 * Converts between AWT images and {@link PixelBuffer}.
 * <p>
 * Conversion is pixel for pixel: the buffer always has the image's exact
 * dimensions and no scaling or smoothing is applied, which pixel art needs.
 *
 * @since 0.1.0
 */
public final class BufferedImageConverter {

    private static final Logger logger = LoggerFactory.getLogger(BufferedImageConverter.class);

    private BufferedImageConverter() {
        // Utility class - no instantiation
    }

    /**
     * Copies an image into a new buffer.
     * <p>
     * Images without alpha come out opaque. Grey images, with or without
     * alpha, keep their sample values: a grey level of 128 becomes (128, 128, 128).
     * Palette and other images are expanded through their colour model.
     *
     * @param image the source image
     * @return a buffer of the same size
     */
    public static PixelBuffer toPixelBuffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();

        logger.debug("Converting image {}x{} of type {} to pixel buffer",
                width, height, image.getType());

        int[] argb;
        if (isPlainIntArgb(image)) {
            argb = ((DataBufferInt) image.getRaster().getDataBuffer()).getData().clone();
        } else if (isComponentGray(image)) {
            argb = grayToArgb(image.getRaster());
        } else {
            // getRGB goes through the colour model, which handles every other layout.
            // It is not used for grey: the model maps linear grey to sRGB.
            argb = image.getRGB(0, 0, width, height, null, 0, width);
        }
        return PixelBuffer.fromArgb(width, height, argb);
    }

    /**
     * Copies a buffer into a new non-premultiplied ARGB image.
     *
     * @param buffer the source buffer
     * @return a {@link BufferedImage#TYPE_INT_ARGB} image
     */
    public static BufferedImage toBufferedImage(PixelBuffer buffer) {
        BufferedImage image = new BufferedImage(buffer.width(), buffer.height(), BufferedImage.TYPE_INT_ARGB);
        int[] data = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
        int[] pixels = buffer.toArgbArray();
        System.arraycopy(pixels, 0, data, 0, pixels.length);
        return image;
    }

    /**
     * Returns true when the raster's backing array is exactly the image's
     * packed pixels, so it can be copied without going through the colour model.
     */
    private static boolean isPlainIntArgb(BufferedImage image) {
        Raster raster = image.getRaster();
        DataBuffer dataBuffer = raster.getDataBuffer();
        return image.getType() == BufferedImage.TYPE_INT_ARGB
                && dataBuffer instanceof DataBufferInt
                && dataBuffer.getNumBanks() == 1
                && dataBuffer.getSize() == image.getWidth() * image.getHeight()
                && raster.getSampleModelTranslateX() == 0
                && raster.getSampleModelTranslateY() == 0;
    }

    /**
     * Returns true for 8 and 16 bit grey images, with an optional non-premultiplied alpha band.
     */
    private static boolean isComponentGray(BufferedImage image) {
        ColorModel cm = image.getColorModel();
        int transferType = cm.getTransferType();
        return cm instanceof ComponentColorModel
                && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY
                && !cm.isAlphaPremultiplied()
                && (transferType == DataBuffer.TYPE_BYTE || transferType == DataBuffer.TYPE_USHORT)
                && image.getRaster().getNumBands() == cm.getNumComponents();
    }

    private static int[] grayToArgb(Raster raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        boolean hasAlpha = raster.getNumBands() > 1;
        int grayBits = raster.getSampleModel().getSampleSize(0);
        int alphaBits = hasAlpha ? raster.getSampleModel().getSampleSize(1) : 8;

        int[] argb = new int[width * height];
        int[] gray = new int[width];
        int[] alpha = new int[width];
        for (int y = 0; y < height; y++) {
            raster.getSamples(raster.getMinX(), raster.getMinY() + y, width, 1, 0, gray);
            if (hasAlpha) {
                raster.getSamples(raster.getMinX(), raster.getMinY() + y, width, 1, 1, alpha);
            }
            for (int x = 0; x < width; x++) {
                int g = to8Bit(gray[x], grayBits);
                int a = hasAlpha ? to8Bit(alpha[x], alphaBits) : 255;
                argb[y * width + x] = (a << 24) | (g << 16) | (g << 8) | g;
            }
        }
        return argb;
    }

    private static int to8Bit(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        if (bits > 8) {
            return sample >>> (bits - 8);
        }
        return sample * 255 / ((1 << bits) - 1);
    }
}
