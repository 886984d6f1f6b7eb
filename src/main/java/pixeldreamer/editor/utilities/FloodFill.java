package pixeldreamer.editor.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.Rgba;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Bucket fill over 4-connected regions of one exact colour.
 * <p>
 * The region is the set of pixels reachable from the seed by up/down/left/right
 * steps through pixels whose RGBA value equals the seed's exactly. Diagonal
 * neighbours are not connected. Traversal uses an explicit stack, so the depth
 * of the Java call stack does not grow with the size of the region.
 *
 * @since 0.1.0
 */
public final class FloodFill {

    private static final Logger logger = LoggerFactory.getLogger(FloodFill.class);

    private FloodFill() {
        // Utility class - no instantiation
    }

    /**
     * Replaces the 4-connected region of the seed's colour with {@code newColor}.
     * <p>
     * Filling with the colour the seed already has leaves the buffer untouched,
     * so repeating a fill is a no-op.
     *
     * @param buffer   the buffer to modify in place
     * @param startX   seed x
     * @param startY   seed y
     * @param newColor replacement colour
     * @return the number of pixels changed
     * @throws pixeldreamer.editor.model.PixelOutOfBoundsException if the seed is outside the buffer
     */
    public static int floodFill(PixelBuffer buffer, int startX, int startY, Rgba newColor) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(newColor, "newColor");
        buffer.checkBounds(startX, startY);

        int target = buffer.getArgb(startX, startY);
        int replacement = newColor.toArgb();
        if (target == replacement) {
            logger.debug("Seed ({},{}) already has fill colour {}, nothing to do",
                    startX, startY, newColor);
            return 0;
        }

        int width = buffer.width();
        int height = buffer.height();

        // Pixels are recoloured as they are pushed. A recoloured pixel no longer
        // matches the target, so each one enters the stack at most once.
        Deque<int[]> stack = new ArrayDeque<>();
        buffer.setArgb(startX, startY, replacement);
        stack.push(new int[]{startX, startY});
        int filled = 1;

        while (!stack.isEmpty()) {
            int[] pos = stack.pop();

            int[][] neighbors = {
                    {pos[0] - 1, pos[1]},
                    {pos[0] + 1, pos[1]},
                    {pos[0], pos[1] - 1},
                    {pos[0], pos[1] + 1}
            };

            for (int[] n : neighbors) {
                int nx = n[0], ny = n[1];
                if (nx >= 0 && nx < width && ny >= 0 && ny < height &&
                        buffer.getArgb(nx, ny) == target) {
                    buffer.setArgb(nx, ny, replacement);
                    stack.push(n);
                    filled++;
                }
            }
        }

        logger.debug("Filled {} pixels from seed ({},{}) with {}", filled, startX, startY, newColor);
        return filled;
    }
}
