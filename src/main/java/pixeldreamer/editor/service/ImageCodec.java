package pixeldreamer.editor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.preferences.EditorPreferences;
import pixeldreamer.editor.utilities.BufferedImageConverter;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Reads and writes images as {@link PixelBuffer}s.
 * <p>
 * Decoding keeps the image's exact pixel dimensions. Encoding always produces
 * PNG so per-pixel alpha survives unchanged. Besides files and streams, images
 * can be exchanged as {@code data:image/png;base64,...} URLs, the form used
 * by browser front ends and image-generation APIs.
 *
 * @since 0.1.0
 */
public class ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";
    private static final String PNG_FORMAT = "png";

    /**
     * Decodes a PNG, JPEG, GIF or BMP file.
     *
     * @param path the image file
     * @return the decoded pixels
     * @throws IOException if the file cannot be read or is not a supported image
     */
    public PixelBuffer read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            PixelBuffer buffer = decode(in, path.toString());
            logger.info("Loaded {} ({}x{})", path, buffer.width(), buffer.height());
            return buffer;
        }
    }

    /**
     * Decodes an image from encoded bytes.
     */
    public PixelBuffer decode(byte[] encoded) throws IOException {
        return decode(new ByteArrayInputStream(encoded), "byte array");
    }

    /**
     * Decodes an image from a stream. The stream is not closed.
     */
    public PixelBuffer decode(InputStream in) throws IOException {
        return decode(in, "stream");
    }

    /**
     * Decodes a {@code data:<mime>;base64,<payload>} URL.
     *
     * @param dataUrl the data URL
     * @return the decoded pixels
     * @throws IOException if the URL is not a base64 data URL or does not hold an image
     */
    public PixelBuffer decodeDataUrl(String dataUrl) throws IOException {
        if (dataUrl == null || !dataUrl.startsWith(DATA_URL_PREFIX)) {
            throw new IOException("Not a data URL");
        }
        int marker = dataUrl.indexOf(BASE64_MARKER);
        if (marker < 0) {
            throw new IOException("Data URL is not base64 encoded");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(dataUrl.substring(marker + BASE64_MARKER.length()).trim());
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid base64 payload in data URL: " + e.getMessage(), e);
        }
        return decode(new ByteArrayInputStream(bytes), "data URL");
    }

    /**
     * Encodes a buffer as PNG.
     */
    public byte[] encodePng(PixelBuffer buffer) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writePng(buffer, out);
        return out.toByteArray();
    }

    /**
     * Writes a buffer as PNG to a stream. The stream is not closed.
     */
    public void writePng(PixelBuffer buffer, OutputStream out) throws IOException {
        BufferedImage image = BufferedImageConverter.toBufferedImage(buffer);
        if (!ImageIO.write(image, PNG_FORMAT, out)) {
            throw new IOException("No PNG writer available");
        }
    }

    /**
     * Writes a buffer as a PNG file, creating parent directories as needed.
     */
    public void writePng(PixelBuffer buffer, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            writePng(buffer, out);
        }
        logger.info("Saved {} ({}x{})", path, buffer.width(), buffer.height());
    }

    /**
     * Encodes a buffer as a {@code data:image/png;base64,...} URL.
     */
    public String toDataUrl(PixelBuffer buffer) throws IOException {
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(encodePng(buffer));
    }

    /**
     * Returns the download file name for an export made at {@code epochMillis},
     * for example {@code pixel-dreamer-asset-1700000000000.png}.
     */
    public static String exportFileName(long epochMillis) {
        return EditorPreferences.getExportPrefix() + epochMillis + "." + PNG_FORMAT;
    }

    private PixelBuffer decode(InputStream in, String source) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new IOException("Unsupported or corrupt image: " + source);
        }
        return BufferedImageConverter.toPixelBuffer(image);
    }
}
