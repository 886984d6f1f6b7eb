package pixeldreamer.editor.model;

/**
 * An 8-bit-per-channel RGBA colour.
 * <p>
 * Equality is exact on all four channels, which is what flood fill matches on.
 * Tolerant comparison for masking is {@link #rgbWithin(Rgba, int)}.
 *
 * @param r red, 0-255
 * @param g green, 0-255
 * @param b blue, 0-255
 * @param a alpha, 0-255 (0 is fully transparent)
 * @since 0.1.0
 */
public record Rgba(int r, int g, int b, int a) {

    /** Fully transparent black, the value of a freshly allocated buffer. */
    public static final Rgba TRANSPARENT = new Rgba(0, 0, 0, 0);

    public static final Rgba BLACK = new Rgba(0, 0, 0, 255);
    public static final Rgba WHITE = new Rgba(255, 255, 255, 255);

    public Rgba {
        checkChannel("red", r);
        checkChannel("green", g);
        checkChannel("blue", b);
        checkChannel("alpha", a);
    }

    /**
     * Creates an opaque colour.
     */
    public static Rgba opaque(int r, int g, int b) {
        return new Rgba(r, g, b, 255);
    }

    /**
     * Unpacks a 32-bit ARGB value (the layout used by {@code BufferedImage.TYPE_INT_ARGB}).
     */
    public static Rgba fromArgb(int argb) {
        return new Rgba((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
    }

    /**
     * Packs this colour as a 32-bit ARGB value.
     */
    public int toArgb() {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public boolean isTransparent() {
        return a == 0;
    }

    /**
     * Returns this colour with a different alpha.
     */
    public Rgba withAlpha(int alpha) {
        return new Rgba(r, g, b, alpha);
    }

    /**
     * Tests whether every RGB channel differs from {@code other} by at most {@code tolerance}.
     * Alpha is not compared.
     */
    public boolean rgbWithin(Rgba other, int tolerance) {
        return Math.abs(r - other.r) <= tolerance
                && Math.abs(g - other.g) <= tolerance
                && Math.abs(b - other.b) <= tolerance;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel must be between 0 and 255, was " + value);
        }
    }
}
