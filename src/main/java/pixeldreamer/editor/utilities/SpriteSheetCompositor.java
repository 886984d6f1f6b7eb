package pixeldreamer.editor.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.SheetLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Packs a sequence of frames into one sprite sheet on a regular grid.
 * <p>
 * Every cell is as large as the largest frame in each dimension. Frames are
 * placed row-major in input order, frame {@code i} going to column
 * {@code i % columns} and row {@code i / columns}. A frame smaller than its
 * cell is offset according to the layout's alignment.
 *
 * <h3>Canvas size</h3>
 * <ul>
 *   <li>Width: {@code columns * cellWidth + (columns - 1) * spacing}</li>
 *   <li>Height: {@code rows * cellHeight + (rows - 1) * spacing}</li>
 *   <li>A single frame gives a canvas of exactly {@code cellWidth x cellHeight}</li>
 * </ul>
 * Pixels outside every frame stay fully transparent. Frames are copied as-is,
 * alpha included, with no blending. Source buffers are only read.
 *
 * @since 0.1.0
 */
public final class SpriteSheetCompositor {

    private static final Logger logger = LoggerFactory.getLogger(SpriteSheetCompositor.class);

    private SpriteSheetCompositor() {
        // Utility class - no instantiation
    }

    /**
     * Computes where each frame goes without drawing anything.
     *
     * @param images frames in sheet order
     * @param layout grid parameters
     * @return the sheet geometry
     * @throws EmptyInputException if {@code images} is empty
     */
    public static SheetPlan plan(List<PixelBuffer> images, SheetLayout layout) {
        Objects.requireNonNull(images, "images");
        Objects.requireNonNull(layout, "layout");
        if (images.isEmpty()) {
            throw new EmptyInputException("Cannot assemble a sprite sheet from zero images");
        }

        int cellWidth = 0;
        int cellHeight = 0;
        for (PixelBuffer image : images) {
            Objects.requireNonNull(image, "images must not contain null");
            cellWidth = Math.max(cellWidth, image.width());
            cellHeight = Math.max(cellHeight, image.height());
        }

        int count = images.size();
        int columns = layout.getColumns();
        int spacing = layout.getSpacing();
        int rows = layout.rowsFor(count);

        int canvasWidth;
        int canvasHeight;
        if (count == 1) {
            canvasWidth = cellWidth;
            canvasHeight = cellHeight;
        } else {
            try {
                canvasWidth = Math.addExact(Math.multiplyExact(columns, cellWidth),
                        Math.multiplyExact(columns - 1, spacing));
                canvasHeight = Math.addExact(Math.multiplyExact(rows, cellHeight),
                        Math.multiplyExact(rows - 1, spacing));
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Sprite sheet too large: " + columns + " columns x "
                        + rows + " rows of " + cellWidth + "x" + cellHeight + " cells, spacing " + spacing, e);
            }
        }

        List<FramePlacement> placements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            PixelBuffer image = images.get(i);
            int col = i % columns;
            int row = i / columns;

            int cellX = col * (cellWidth + spacing);
            int cellY = row * (cellHeight + spacing);
            int offsetX = layout.getHorizontalAlignment().offset(cellWidth, image.width());
            int offsetY = layout.getVerticalAlignment().offset(cellHeight, image.height());

            placements.add(new FramePlacement(i, row, col,
                    cellX + offsetX, cellY + offsetY,
                    image.width(), image.height()));
        }

        logger.debug("Planned sheet: {} frames, grid {}x{}, cell {}x{}, canvas {}x{}",
                count, columns, rows, cellWidth, cellHeight, canvasWidth, canvasHeight);

        return new SheetPlan(canvasWidth, canvasHeight, cellWidth, cellHeight,
                columns, rows, Collections.unmodifiableList(placements));
    }

    /**
     * Draws the frames onto a new transparent canvas.
     *
     * @param images frames in sheet order, not modified
     * @param layout grid parameters
     * @return a new buffer owned by the caller
     * @throws EmptyInputException if {@code images} is empty
     */
    public static PixelBuffer assemble(List<PixelBuffer> images, SheetLayout layout) {
        return assemble(images, plan(images, layout));
    }

    /**
     * Draws the frames onto a new canvas using a precomputed plan.
     *
     * @param images frames in sheet order, the same list the plan was made from
     * @param plan   plan from {@link #plan(List, SheetLayout)}
     * @return a new buffer owned by the caller
     */
    public static PixelBuffer assemble(List<PixelBuffer> images, SheetPlan plan) {
        if (images.size() != plan.frames().size()) {
            throw new IllegalArgumentException("Plan has " + plan.frames().size() +
                    " frames but " + images.size() + " images were given");
        }

        PixelBuffer canvas = new PixelBuffer(plan.width(), plan.height());
        for (FramePlacement frame : plan.frames()) {
            blit(images.get(frame.index()), canvas, frame.x(), frame.y());
        }

        logger.debug("Assembled {} frames into {}", plan.frames().size(), canvas);
        return canvas;
    }

    /**
     * Copies every source pixel, alpha included, to the destination at (dx, dy).
     */
    private static void blit(PixelBuffer source, PixelBuffer dest, int dx, int dy) {
        for (int y = 0; y < source.height(); y++) {
            for (int x = 0; x < source.width(); x++) {
                dest.setArgb(dx + x, dy + y, source.getArgb(x, y));
            }
        }
    }

    /**
     * Geometry of an assembled sheet.
     *
     * @param width      canvas width
     * @param height     canvas height
     * @param cellWidth  width of each grid cell
     * @param cellHeight height of each grid cell
     * @param columns    grid columns
     * @param rows       grid rows
     * @param frames     one placement per input frame, in input order
     */
    public record SheetPlan(
            int width, int height,
            int cellWidth, int cellHeight,
            int columns, int rows,
            List<FramePlacement> frames
    ) {
    }

    /**
     * Where one frame was drawn.
     *
     * @param index  position in the input sequence
     * @param row    grid row
     * @param col    grid column
     * @param x      left edge of the drawn frame on the canvas
     * @param y      top edge of the drawn frame on the canvas
     * @param width  frame width
     * @param height frame height
     */
    public record FramePlacement(
            int index, int row, int col,
            int x, int y, int width, int height
    ) {
    }
}
