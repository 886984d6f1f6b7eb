package pixeldreamer.editor.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.Rgba;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.model.SheetLayout.HorizontalAlignment;
import pixeldreamer.editor.model.SheetLayout.VerticalAlignment;
import pixeldreamer.editor.utilities.ColorMasker;
import pixeldreamer.editor.utilities.ColorParser;
import pixeldreamer.editor.utilities.InvalidColorException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Default settings for the pixel editor.
 * <p>
 * Each value starts from the JVM system property of the same key (for example
 * {@code -Dpixeleditor.defaultTolerance=24}) and falls back to a built-in
 * default when the property is missing or unusable. Values can be changed at
 * runtime but are not saved anywhere.
 *
 * @since 0.1.0
 */
public final class EditorPreferences {

    private static final Logger logger = LoggerFactory.getLogger(EditorPreferences.class);

    public static final String KEY_DEFAULT_TOLERANCE = "pixeleditor.defaultTolerance";
    public static final String KEY_DEFAULT_COLOR = "pixeleditor.defaultColor";
    public static final String KEY_SHEET_COLUMNS = "pixeleditor.sheetColumns";
    public static final String KEY_SHEET_SPACING = "pixeleditor.sheetSpacing";
    public static final String KEY_SHEET_HORIZONTAL_ALIGNMENT = "pixeleditor.sheetHorizontalAlignment";
    public static final String KEY_SHEET_VERTICAL_ALIGNMENT = "pixeleditor.sheetVerticalAlignment";
    public static final String KEY_EXPORT_PREFIX = "pixeleditor.exportPrefix";

    // Tool settings
    private static volatile int defaultTolerance = intProperty(KEY_DEFAULT_TOLERANCE,
            ColorMasker.DEFAULT_TOLERANCE, 0, 255);

    private static volatile Rgba defaultColor = colorProperty(KEY_DEFAULT_COLOR, Rgba.BLACK);

    // Sprite sheet settings
    private static volatile int sheetColumns = intProperty(KEY_SHEET_COLUMNS, 4, 1, Integer.MAX_VALUE);

    private static volatile int sheetSpacing = intProperty(KEY_SHEET_SPACING, 0, 0, Integer.MAX_VALUE);

    private static volatile HorizontalAlignment sheetHorizontalAlignment = enumProperty(
            KEY_SHEET_HORIZONTAL_ALIGNMENT, HorizontalAlignment.CENTER, HorizontalAlignment.class);

    private static volatile VerticalAlignment sheetVerticalAlignment = enumProperty(
            KEY_SHEET_VERTICAL_ALIGNMENT, VerticalAlignment.BOTTOM, VerticalAlignment.class);

    // Export settings
    private static volatile String exportPrefix = System.getProperty(KEY_EXPORT_PREFIX, "pixel-dreamer-asset-");

    private EditorPreferences() {
        // Utility class - no instantiation
    }

    // ==================== Tool Settings ====================

    public static int getDefaultTolerance() {
        return defaultTolerance;
    }

    public static void setDefaultTolerance(int tolerance) {
        if (tolerance < 0 || tolerance > 255) {
            throw new IllegalArgumentException("Tolerance must be between 0 and 255, was " + tolerance);
        }
        defaultTolerance = tolerance;
    }

    public static Rgba getDefaultColor() {
        return defaultColor;
    }

    public static void setDefaultColor(Rgba color) {
        if (color == null) {
            throw new IllegalArgumentException("Default colour must not be null");
        }
        defaultColor = color;
    }

    // ==================== Sprite Sheet Settings ====================

    public static int getSheetColumns() {
        return sheetColumns;
    }

    public static void setSheetColumns(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("Columns must be at least 1, was " + columns);
        }
        sheetColumns = columns;
    }

    public static int getSheetSpacing() {
        return sheetSpacing;
    }

    public static void setSheetSpacing(int spacing) {
        if (spacing < 0) {
            throw new IllegalArgumentException("Spacing must not be negative, was " + spacing);
        }
        sheetSpacing = spacing;
    }

    public static HorizontalAlignment getSheetHorizontalAlignment() {
        return sheetHorizontalAlignment;
    }

    public static void setSheetHorizontalAlignment(HorizontalAlignment alignment) {
        if (alignment == null) {
            throw new IllegalArgumentException("Alignment must not be null");
        }
        sheetHorizontalAlignment = alignment;
    }

    public static VerticalAlignment getSheetVerticalAlignment() {
        return sheetVerticalAlignment;
    }

    public static void setSheetVerticalAlignment(VerticalAlignment alignment) {
        if (alignment == null) {
            throw new IllegalArgumentException("Alignment must not be null");
        }
        sheetVerticalAlignment = alignment;
    }

    /**
     * Builds a sheet layout from the current sheet settings.
     */
    public static SheetLayout getDefaultSheetLayout() {
        return SheetLayout.builder()
                .columns(sheetColumns)
                .spacing(sheetSpacing)
                .horizontalAlignment(sheetHorizontalAlignment)
                .verticalAlignment(sheetVerticalAlignment)
                .build();
    }

    // ==================== Export Settings ====================

    public static String getExportPrefix() {
        return exportPrefix;
    }

    public static void setExportPrefix(String prefix) {
        exportPrefix = prefix == null ? "" : prefix;
    }

    // ==================== Property parsing ====================

    private static int intProperty(String key, int defaultValue, int min, int max) {
        String value = System.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < min || parsed > max) {
                logger.warn("Ignoring {}={}: outside [{}, {}], using {}", key, value, min, max, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static Rgba colorProperty(String key, Rgba defaultValue) {
        String value = System.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return ColorParser.parseHex(value);
        } catch (InvalidColorException e) {
            logger.warn("Ignoring {}={}: {}", key, value, e.getMessage());
            return defaultValue;
        }
    }

    private static <E extends Enum<E>> E enumProperty(String key, E defaultValue, Class<E> type) {
        String value = System.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {}={}: expected one of {}, using {}",
                    key, value, Arrays.toString(type.getEnumConstants()), defaultValue);
            return defaultValue;
        }
    }
}
