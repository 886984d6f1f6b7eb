package pixeldreamer.editor.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A fixed-size grid of RGBA pixels.
 * <p>
 * Pixels are stored row-major as packed ARGB ints ({@code index = y * width + x},
 * origin top-left). Every accessor is bounds-checked and throws
 * {@link PixelOutOfBoundsException} rather than clamping.
 * <p>
 * Instances are not thread-safe. A buffer being edited must be confined to one
 * thread; copy it with {@link #copy()} before handing it to background work.
 *
 * @since 0.1.0
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Allocates a fully transparent buffer.
     *
     * @param width  width in pixels, at least 1
     * @param height height in pixels, at least 1
     */
    public PixelBuffer(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                    String.format("Buffer dimensions must be at least 1x1, got %dx%d", width, height));
        }
        this.width = width;
        this.height = height;
        this.pixels = new int[Math.multiplyExact(width, height)];
    }

    /**
     * Wraps a copy of row-major ARGB data.
     *
     * @param width  width in pixels
     * @param height height in pixels
     * @param argb   packed pixels, length must be {@code width * height}
     * @return a new buffer
     */
    public static PixelBuffer fromArgb(int width, int height, int[] argb) {
        PixelBuffer buffer = new PixelBuffer(width, height);
        if (argb.length != buffer.pixels.length) {
            throw new IllegalArgumentException(
                    "Expected " + buffer.pixels.length + " pixels, got " + argb.length);
        }
        System.arraycopy(argb, 0, buffer.pixels, 0, argb.length);
        return buffer;
    }

    /**
     * Creates a buffer where every pixel is {@code color}.
     */
    public static PixelBuffer filled(int width, int height, Rgba color) {
        PixelBuffer buffer = new PixelBuffer(width, height);
        Arrays.fill(buffer.pixels, color.toArgb());
        return buffer;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Throws {@link PixelOutOfBoundsException} unless (x, y) is inside this buffer.
     */
    public void checkBounds(int x, int y) {
        if (!contains(x, y)) {
            throw new PixelOutOfBoundsException(x, y, width, height);
        }
    }

    public Rgba get(int x, int y) {
        return Rgba.fromArgb(getArgb(x, y));
    }

    public void set(int x, int y, Rgba color) {
        Objects.requireNonNull(color, "color");
        setArgb(x, y, color.toArgb());
    }

    public int getArgb(int x, int y) {
        checkBounds(x, y);
        return pixels[y * width + x];
    }

    public void setArgb(int x, int y, int argb) {
        checkBounds(x, y);
        pixels[y * width + x] = argb;
    }

    /**
     * Returns a copy of the packed pixel data, row-major.
     */
    public int[] toArgbArray() {
        return pixels.clone();
    }

    /**
     * Returns an independent copy of this buffer.
     */
    public PixelBuffer copy() {
        return fromArgb(width, height, pixels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PixelBuffer that = (PixelBuffer) o;
        return width == that.width &&
                height == that.height &&
                Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return String.format("PixelBuffer{%dx%d}", width, height);
    }
}
