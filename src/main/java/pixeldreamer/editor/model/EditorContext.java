package pixeldreamer.editor.model;

import java.util.Objects;

/**
 * Caller-held editor state: the selected tool, the current colour, the magic
 * wand tolerance and the view zoom.
 * <p>
 * The editing engine keeps no state of its own; callers pass this object into
 * each tool action and keep whatever context comes back. Instances are
 * immutable, so the {@code with*} methods return modified copies.
 *
 * @since 0.1.0
 */
public class EditorContext {

    /** Smallest zoom factor. */
    public static final int MIN_ZOOM = 1;
    /** Largest zoom factor. */
    public static final int MAX_ZOOM = 20;

    /**
     * Tools that act on a clicked pixel.
     */
    public enum Tool {
        /** Look only, clicks do nothing */
        VIEW,
        /** Flood fill the clicked region with the current colour */
        FILL,
        /** Make every pixel close to the clicked colour transparent */
        MAGIC_WAND,
        /** Take the clicked colour as the current colour */
        PICKER
    }

    private final Tool tool;
    private final Rgba color;
    private final int tolerance;
    private final int zoom;

    private EditorContext(Builder builder) {
        this.tool = builder.tool;
        this.color = builder.color;
        this.tolerance = builder.tolerance;
        this.zoom = builder.zoom;
    }

    public Tool getTool() {
        return tool;
    }

    public Rgba getColor() {
        return color;
    }

    public int getTolerance() {
        return tolerance;
    }

    public int getZoom() {
        return zoom;
    }

    public EditorContext withTool(Tool tool) {
        return toBuilder().tool(tool).build();
    }

    public EditorContext withColor(Rgba color) {
        return toBuilder().color(color).build();
    }

    public EditorContext withTolerance(int tolerance) {
        return toBuilder().tolerance(tolerance).build();
    }

    /**
     * Returns a copy with the zoom set, clamped to [{@value #MIN_ZOOM}, {@value #MAX_ZOOM}].
     */
    public EditorContext withZoom(int zoom) {
        return toBuilder().zoom(clampZoom(zoom)).build();
    }

    public EditorContext zoomIn() {
        return withZoom(zoom + 1);
    }

    public EditorContext zoomOut() {
        return withZoom(zoom - 1);
    }

    private static int clampZoom(int zoom) {
        return Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, zoom));
    }

    private Builder toBuilder() {
        return new Builder()
                .tool(tool)
                .color(color)
                .tolerance(tolerance)
                .zoom(zoom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EditorContext that = (EditorContext) o;
        return tolerance == that.tolerance &&
                zoom == that.zoom &&
                tool == that.tool &&
                color.equals(that.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tool, color, tolerance, zoom);
    }

    @Override
    public String toString() {
        return String.format("EditorContext{tool=%s, color=%s, tolerance=%d, zoom=%dx}",
                tool, color, tolerance, zoom);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EditorContext.
     */
    public static class Builder {
        private Tool tool = Tool.VIEW;
        private Rgba color = Rgba.BLACK;
        private int tolerance = 15;
        private int zoom = MIN_ZOOM;

        public Builder tool(Tool tool) {
            this.tool = tool;
            return this;
        }

        public Builder color(Rgba color) {
            this.color = color;
            return this;
        }

        public Builder tolerance(int tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder zoom(int zoom) {
            this.zoom = zoom;
            return this;
        }

        public EditorContext build() {
            if (tool == null) {
                throw new IllegalStateException("Tool must be set");
            }
            if (color == null) {
                throw new IllegalStateException("Color must be set");
            }
            if (tolerance < 0 || tolerance > 255) {
                throw new IllegalStateException("Tolerance must be between 0 and 255, was " + tolerance);
            }
            if (zoom < MIN_ZOOM || zoom > MAX_ZOOM) {
                throw new IllegalStateException(
                        "Zoom must be between " + MIN_ZOOM + " and " + MAX_ZOOM + ", was " + zoom);
            }
            return new EditorContext(this);
        }
    }
}
