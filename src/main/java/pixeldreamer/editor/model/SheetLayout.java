package pixeldreamer.editor.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Grid parameters for assembling a sprite sheet.
 * <p>
 * Frames are laid out row-major in {@code columns} columns, with {@code spacing}
 * transparent pixels between neighbouring cells. A frame smaller than its cell
 * is anchored according to the horizontal and vertical alignment.
 *
 * @since 0.1.0
 */
public class SheetLayout {

    /**
     * Horizontal anchoring of a frame inside its cell.
     */
    public enum HorizontalAlignment {
        LEFT,
        CENTER,
        RIGHT;

        /**
         * Returns the x offset of a frame of width {@code imageWidth} inside a cell
         * of width {@code cellWidth}. Centering rounds down.
         */
        public int offset(int cellWidth, int imageWidth) {
            return switch (this) {
                case LEFT -> 0;
                case CENTER -> Math.floorDiv(cellWidth - imageWidth, 2);
                case RIGHT -> cellWidth - imageWidth;
            };
        }

        /**
         * Parses "left", "center" or "right", ignoring case.
         */
        public static HorizontalAlignment parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Vertical anchoring of a frame inside its cell.
     */
    public enum VerticalAlignment {
        TOP,
        CENTER,
        BOTTOM;

        /**
         * Returns the y offset of a frame of height {@code imageHeight} inside a cell
         * of height {@code cellHeight}. Centering rounds down.
         */
        public int offset(int cellHeight, int imageHeight) {
            return switch (this) {
                case TOP -> 0;
                case CENTER -> Math.floorDiv(cellHeight - imageHeight, 2);
                case BOTTOM -> cellHeight - imageHeight;
            };
        }

        /**
         * Parses "top", "center" or "bottom", ignoring case.
         */
        public static VerticalAlignment parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final int columns;
    private final int spacing;
    private final HorizontalAlignment horizontalAlignment;
    private final VerticalAlignment verticalAlignment;

    private SheetLayout(Builder builder) {
        this.columns = builder.columns;
        this.spacing = builder.spacing;
        this.horizontalAlignment = builder.horizontalAlignment;
        this.verticalAlignment = builder.verticalAlignment;
    }

    // Getters

    public int getColumns() {
        return columns;
    }

    public int getSpacing() {
        return spacing;
    }

    public HorizontalAlignment getHorizontalAlignment() {
        return horizontalAlignment;
    }

    public VerticalAlignment getVerticalAlignment() {
        return verticalAlignment;
    }

    /**
     * Returns the number of grid rows needed for {@code frameCount} frames.
     */
    public int rowsFor(int frameCount) {
        return frameCount <= 0 ? 0 : (frameCount - 1) / columns + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SheetLayout that = (SheetLayout) o;
        return columns == that.columns &&
                spacing == that.spacing &&
                horizontalAlignment == that.horizontalAlignment &&
                verticalAlignment == that.verticalAlignment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, spacing, horizontalAlignment, verticalAlignment);
    }

    @Override
    public String toString() {
        return String.format("SheetLayout{columns=%d, spacing=%d, align=%s/%s}",
                columns, spacing, horizontalAlignment, verticalAlignment);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SheetLayout.
     * <p>
     * Defaults: 4 columns, no spacing, frames centered horizontally and
     * anchored to the bottom of their cell (feet on the ground line).
     */
    public static class Builder {
        private int columns = 4;
        private int spacing = 0;
        private HorizontalAlignment horizontalAlignment = HorizontalAlignment.CENTER;
        private VerticalAlignment verticalAlignment = VerticalAlignment.BOTTOM;

        public Builder columns(int columns) {
            this.columns = columns;
            return this;
        }

        /**
         * Sets the gap between neighbouring cells in pixels.
         *
         * @param spacing spacing in pixels, 0 or more
         * @return this builder
         */
        public Builder spacing(int spacing) {
            this.spacing = spacing;
            return this;
        }

        public Builder horizontalAlignment(HorizontalAlignment alignment) {
            this.horizontalAlignment = alignment;
            return this;
        }

        public Builder verticalAlignment(VerticalAlignment alignment) {
            this.verticalAlignment = alignment;
            return this;
        }

        /**
         * Shorthand for setting both alignments.
         */
        public Builder align(HorizontalAlignment horizontal, VerticalAlignment vertical) {
            return horizontalAlignment(horizontal).verticalAlignment(vertical);
        }

        public SheetLayout build() {
            if (columns < 1) {
                throw new IllegalStateException("Columns must be at least 1, was " + columns);
            }
            if (spacing < 0) {
                throw new IllegalStateException("Spacing must not be negative, was " + spacing);
            }
            if (horizontalAlignment == null || verticalAlignment == null) {
                throw new IllegalStateException("Alignment must be set");
            }
            return new SheetLayout(this);
        }
    }
}
