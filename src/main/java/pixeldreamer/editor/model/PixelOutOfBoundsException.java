package pixeldreamer.editor.model;

/**
 * Thrown when a pixel coordinate falls outside a {@link PixelBuffer}.
 * <p>
 * Operations check coordinates before touching the buffer, so a buffer is
 * never left partially modified when this is thrown.
 *
 * @since 0.1.0
 */
public class PixelOutOfBoundsException extends IndexOutOfBoundsException {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public PixelOutOfBoundsException(int x, int y, int width, int height) {
        super(String.format("Pixel (%d, %d) is outside buffer bounds %dx%d", x, y, width, height));
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getBufferWidth() {
        return width;
    }

    public int getBufferHeight() {
        return height;
    }
}
