package pixeldreamer.editor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.EditorContext;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.Rgba;
import pixeldreamer.editor.preferences.EditorPreferences;
import pixeldreamer.editor.utilities.ColorMasker;
import pixeldreamer.editor.utilities.FloodFill;

import java.util.Objects;

/**
 * Routes a click on the canvas to the selected tool.
 * <p>
 * The controller holds no editor state. Tool, colour and tolerance come in
 * with the {@link EditorContext}, and the context to use for the next action
 * is returned. Only the picker changes the context; fill and magic wand change
 * the buffer.
 *
 * @since 0.1.0
 */
public class PixelEditorController {

    private static final Logger logger = LoggerFactory.getLogger(PixelEditorController.class);

    /**
     * Creates a context seeded from {@link EditorPreferences}.
     *
     * @param tool the initially selected tool
     * @return a new context
     */
    public static EditorContext defaultContext(EditorContext.Tool tool) {
        return EditorContext.builder()
                .tool(tool)
                .color(EditorPreferences.getDefaultColor())
                .tolerance(EditorPreferences.getDefaultTolerance())
                .build();
    }

    /**
     * Applies the context's tool at pixel (x, y).
     *
     * @param context current editor state
     * @param buffer  the image being edited, modified in place by FILL and MAGIC_WAND
     * @param x       clicked pixel x
     * @param y       clicked pixel y
     * @return the context for the next action
     * @throws pixeldreamer.editor.model.PixelOutOfBoundsException if (x, y) is outside the buffer
     *         and the tool reads pixels
     */
    public EditorContext apply(EditorContext context, PixelBuffer buffer, int x, int y) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(buffer, "buffer");

        switch (context.getTool()) {
            case FILL -> {
                int filled = FloodFill.floodFill(buffer, x, y, context.getColor());
                logger.debug("Fill @ ({},{}): {} pixels", x, y, filled);
                return context;
            }
            case MAGIC_WAND -> {
                int removed = ColorMasker.removeColor(buffer, x, y, context.getTolerance());
                logger.debug("Magic wand @ ({},{}): {} pixels cleared", x, y, removed);
                return context;
            }
            case PICKER -> {
                Rgba picked = buffer.get(x, y).withAlpha(255);
                logger.debug("Picked {} @ ({},{})", picked, x, y);
                return context.withColor(picked);
            }
            case VIEW -> {
                return context;
            }
            default -> {
                logger.warn("Unknown tool: {}", context.getTool());
                return context;
            }
        }
    }
}
