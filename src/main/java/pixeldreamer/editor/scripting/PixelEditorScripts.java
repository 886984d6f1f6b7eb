package pixeldreamer.editor.scripting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.controller.SpriteSheetWorkflow;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.preferences.EditorPreferences;
import pixeldreamer.editor.service.ImageCodec;
import pixeldreamer.editor.utilities.ColorMasker;
import pixeldreamer.editor.utilities.ColorParser;
import pixeldreamer.editor.utilities.FloodFill;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Scripting API for batch pixel editing.
 * <p>
 * Static, script-friendly entry points over the editor: colours are given as
 * hex strings and images as paths.
 *
 * <h3>Usage Examples</h3>
 * <pre>{@code
 * // Strip a magenta backdrop from every generated frame, then pack them
 * def frames = paths.collect { p ->
 *     def img = PixelEditorScripts.loadImage(p)
 *     PixelEditorScripts.removeChromaKey(img, "#FF00FF", 30)
 *     PixelEditorScripts.saveImage(img, p)
 *     p
 * }
 * PixelEditorScripts.assembleSheet(frames, SheetLayout.builder().columns(4).build(), out)
 * }</pre>
 *
 * @since 0.1.0
 */
public class PixelEditorScripts {

    private static final Logger logger = LoggerFactory.getLogger(PixelEditorScripts.class);
    private static final ImageCodec codec = new ImageCodec();

    private PixelEditorScripts() {
        // Utility class
    }

    /**
     * Loads an image file.
     *
     * @param path the image
     * @return the decoded pixels
     * @throws RuntimeException if the image cannot be read
     */
    public static PixelBuffer loadImage(Path path) {
        try {
            return codec.read(path);
        } catch (IOException e) {
            logger.error("Failed to load {}: {}", path, e.getMessage());
            throw new RuntimeException("Failed to load image: " + e.getMessage(), e);
        }
    }

    /**
     * Saves an image as PNG.
     *
     * @param buffer the pixels
     * @param path   destination file
     * @throws RuntimeException if the image cannot be written
     */
    public static void saveImage(PixelBuffer buffer, Path path) {
        try {
            codec.writePng(buffer, path);
        } catch (IOException e) {
            logger.error("Failed to save {}: {}", path, e.getMessage());
            throw new RuntimeException("Failed to save image: " + e.getMessage(), e);
        }
    }

    /**
     * Flood fills from (x, y) with a hex colour.
     *
     * @return the number of pixels changed
     * @throws pixeldreamer.editor.utilities.InvalidColorException if {@code hexColor} is malformed
     */
    public static int floodFill(PixelBuffer buffer, int x, int y, String hexColor) {
        return FloodFill.floodFill(buffer, x, y, ColorParser.parseHex(hexColor));
    }

    /**
     * Removes the colour found at (x, y) using the preferred tolerance.
     *
     * @return the number of pixels made transparent
     */
    public static int removeBackground(PixelBuffer buffer, int x, int y) {
        return removeBackground(buffer, x, y, EditorPreferences.getDefaultTolerance());
    }

    /**
     * Removes the colour found at (x, y).
     *
     * @return the number of pixels made transparent
     */
    public static int removeBackground(PixelBuffer buffer, int x, int y, int tolerance) {
        int removed = ColorMasker.removeColor(buffer, x, y, tolerance);
        logger.info("Removed background at ({},{}): {} pixels", x, y, removed);
        return removed;
    }

    /**
     * Removes an explicit key colour everywhere in the image.
     *
     * @return the number of pixels made transparent
     * @throws pixeldreamer.editor.utilities.InvalidColorException if {@code hexColor} is malformed
     */
    public static int removeChromaKey(PixelBuffer buffer, String hexColor, int tolerance) {
        int removed = ColorMasker.removeColor(buffer, ColorParser.parseHex(hexColor), tolerance);
        logger.info("Removed chroma key {}: {} pixels", hexColor, removed);
        return removed;
    }

    /**
     * Loads frames from disk and exports them as a sprite sheet plus manifest.
     *
     * @param framePaths frame images in sheet order
     * @param layout     grid layout
     * @param output     sheet PNG to write
     * @return the assembled sheet
     * @throws pixeldreamer.editor.utilities.EmptyInputException if {@code framePaths} is empty
     * @throws RuntimeException if reading or writing fails
     */
    public static PixelBuffer assembleSheet(List<Path> framePaths, SheetLayout layout, Path output) {
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow();
        workflow.setLayout(layout);
        for (Path path : framePaths) {
            workflow.add(loadImage(path));
        }

        try {
            return workflow.export(output);
        } catch (IOException e) {
            logger.error("Sprite sheet export failed: {}", e.getMessage());
            throw new RuntimeException("Sprite sheet export failed: " + e.getMessage(), e);
        }
    }
}
