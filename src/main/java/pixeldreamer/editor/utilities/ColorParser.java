package pixeldreamer.editor.utilities;

import pixeldreamer.editor.model.Rgba;

import java.util.Locale;

/**
 * Converts between hex colour strings and {@link Rgba}.
 * <p>
 * Accepted forms are {@code #RRGGBB}, {@code RRGGBB} and {@code #RRGGBBAA}
 * (case-insensitive). Without an alpha component the colour is opaque.
 *
 * @since 0.1.0
 */
public final class ColorParser {

    private ColorParser() {
        // Utility class - no instantiation
    }

    /**
     * Parses a hex colour.
     *
     * @param hex colour string
     * @return the colour
     * @throws InvalidColorException if the string is null or malformed
     */
    public static Rgba parseHex(String hex) {
        if (hex == null) {
            throw new InvalidColorException(null);
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.length() != 6 && digits.length() != 8) {
            throw new InvalidColorException(hex);
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isHexDigit(digits.charAt(i))) {
                throw new InvalidColorException(hex);
            }
        }

        int r = Integer.parseInt(digits.substring(0, 2), 16);
        int g = Integer.parseInt(digits.substring(2, 4), 16);
        int b = Integer.parseInt(digits.substring(4, 6), 16);
        int a = digits.length() == 8 ? Integer.parseInt(digits.substring(6, 8), 16) : 255;
        return new Rgba(r, g, b, a);
    }

    /**
     * Formats a colour as {@code #RRGGBB}, or {@code #RRGGBBAA} when it is not opaque.
     */
    public static String toHex(Rgba color) {
        if (color.a() == 255) {
            return String.format(Locale.ROOT, "#%02X%02X%02X", color.r(), color.g(), color.b());
        }
        return String.format(Locale.ROOT, "#%02X%02X%02X%02X", color.r(), color.g(), color.b(), color.a());
    }

    // ASCII hex digits only
    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
