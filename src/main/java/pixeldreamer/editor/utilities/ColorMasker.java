package pixeldreamer.editor.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.Rgba;

import java.util.Objects;

/**
 * Background removal by colour keying ("magic wand").
 * <p>
 * Unlike {@link FloodFill}, masking is global: every pixel in the buffer whose
 * RGB is close enough to the key colour becomes transparent, whether or not it
 * touches the clicked pixel. Flat backgrounds in pixel art often show through
 * gaps as separate islands, and all of them should go.
 *
 * <h3>Matching rule</h3>
 * <ul>
 *   <li>Each of R, G and B may differ from the key by at most the tolerance</li>
 *   <li>Alpha is not compared</li>
 *   <li>Already transparent pixels (alpha 0) are never matched or changed</li>
 *   <li>Matched pixels keep their RGB, only alpha is set to 0</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ColorMasker {

    private static final Logger logger = LoggerFactory.getLogger(ColorMasker.class);

    /** Default per-channel tolerance. */
    public static final int DEFAULT_TOLERANCE = 15;

    /** Solid magenta, the usual chroma key behind generated sprites. */
    public static final Rgba MAGENTA = Rgba.opaque(255, 0, 255);

    private ColorMasker() {
        // Utility class - no instantiation
    }

    /**
     * Removes the seed pixel's colour with the default tolerance.
     *
     * @see #removeColor(PixelBuffer, int, int, int)
     */
    public static int removeColor(PixelBuffer buffer, int startX, int startY) {
        return removeColor(buffer, startX, startY, DEFAULT_TOLERANCE);
    }

    /**
     * Makes every pixel within {@code tolerance} of the seed pixel's colour transparent.
     * <p>
     * If the seed pixel is itself fully transparent there is no colour to key
     * on and the buffer is left unchanged.
     *
     * @param buffer    the buffer to modify in place
     * @param startX    seed x
     * @param startY    seed y
     * @param tolerance largest allowed difference per RGB channel, 0-255
     * @return the number of pixels made transparent
     * @throws pixeldreamer.editor.model.PixelOutOfBoundsException if the seed is outside the buffer
     */
    public static int removeColor(PixelBuffer buffer, int startX, int startY, int tolerance) {
        Objects.requireNonNull(buffer, "buffer");
        buffer.checkBounds(startX, startY);
        checkTolerance(tolerance);

        Rgba key = buffer.get(startX, startY);
        if (key.isTransparent()) {
            logger.debug("Seed ({},{}) is transparent, nothing to remove", startX, startY);
            return 0;
        }
        return maskMatching(buffer, key, tolerance);
    }

    /**
     * Makes every pixel within {@code tolerance} of an explicit key colour transparent.
     * <p>
     * A fully transparent key matches nothing.
     *
     * @param buffer    the buffer to modify in place
     * @param key       colour to remove, for example {@link #MAGENTA}
     * @param tolerance largest allowed difference per RGB channel, 0-255
     * @return the number of pixels made transparent
     */
    public static int removeColor(PixelBuffer buffer, Rgba key, int tolerance) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(key, "key");
        checkTolerance(tolerance);

        if (key.isTransparent()) {
            logger.debug("Key colour {} is transparent, nothing to remove", key);
            return 0;
        }
        return maskMatching(buffer, key, tolerance);
    }

    private static int maskMatching(PixelBuffer buffer, Rgba key, int tolerance) {
        int masked = 0;
        for (int y = 0; y < buffer.height(); y++) {
            for (int x = 0; x < buffer.width(); x++) {
                int argb = buffer.getArgb(x, y);
                if ((argb >>> 24) == 0) {
                    continue;
                }
                if (Rgba.fromArgb(argb).rgbWithin(key, tolerance)) {
                    buffer.setArgb(x, y, argb & 0x00FFFFFF);
                    masked++;
                }
            }
        }

        logger.debug("Masked {} of {} pixels matching {} (tolerance {})",
                masked, buffer.width() * buffer.height(), key, tolerance);
        return masked;
    }

    private static void checkTolerance(int tolerance) {
        if (tolerance < 0 || tolerance > 255) {
            throw new IllegalArgumentException("Tolerance must be between 0 and 255, was " + tolerance);
        }
    }
}
