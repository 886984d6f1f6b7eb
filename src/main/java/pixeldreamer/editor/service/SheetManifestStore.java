package pixeldreamer.editor.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.utilities.SpriteSheetCompositor.FramePlacement;
import pixeldreamer.editor.utilities.SpriteSheetCompositor.SheetPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves and loads the JSON manifest that accompanies an exported sprite sheet.
 * <p>
 * The manifest records the sheet image name, canvas and cell sizes, the layout
 * used and the rectangle of every frame, so game engines can slice the sheet
 * without guessing. Example:
 * <pre>{@code
 * {
 *   "version": "1.0",
 *   "image": "walk.png",
 *   "width": 52, "height": 34,
 *   "cell_width": 16, "cell_height": 16,
 *   "columns": 3, "rows": 2,
 *   "layout": {"spacing": 2, "horizontal_alignment": "CENTER", "vertical_alignment": "BOTTOM"},
 *   "frames": [{"index": 0, "row": 0, "col": 0, "x": 0, "y": 0, "width": 16, "height": 16}, ...]
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public class SheetManifestStore {

    private static final Logger logger = LoggerFactory.getLogger(SheetManifestStore.class);

    /** Manifest schema version */
    public static final String VERSION = "1.0";

    private final Gson gson;

    public SheetManifestStore() {
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    /**
     * Serializes a sheet description to JSON.
     *
     * @param imageName file name of the sheet image the manifest describes
     * @param layout    layout the sheet was assembled with
     * @param plan      the sheet geometry
     * @return pretty-printed JSON
     */
    public String toJson(String imageName, SheetLayout layout, SheetPlan plan) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", VERSION);
        root.put("image", imageName);
        root.put("width", plan.width());
        root.put("height", plan.height());
        root.put("cell_width", plan.cellWidth());
        root.put("cell_height", plan.cellHeight());
        root.put("columns", plan.columns());
        root.put("rows", plan.rows());

        Map<String, Object> layoutMap = new LinkedHashMap<>();
        layoutMap.put("spacing", layout.getSpacing());
        layoutMap.put("horizontal_alignment", layout.getHorizontalAlignment().name());
        layoutMap.put("vertical_alignment", layout.getVerticalAlignment().name());
        root.put("layout", layoutMap);

        List<Map<String, Object>> frames = new ArrayList<>();
        for (FramePlacement frame : plan.frames()) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("index", frame.index());
            f.put("row", frame.row());
            f.put("col", frame.col());
            f.put("x", frame.x());
            f.put("y", frame.y());
            f.put("width", frame.width());
            f.put("height", frame.height());
            frames.add(f);
        }
        root.put("frames", frames);

        return gson.toJson(root);
    }

    /**
     * Writes a manifest file.
     *
     * @param path      where to write
     * @param imageName file name of the sheet image
     * @param layout    layout the sheet was assembled with
     * @param plan      the sheet geometry
     * @throws IOException if writing fails
     */
    public void write(Path path, String imageName, SheetLayout layout, SheetPlan plan) throws IOException {
        Files.writeString(path, toJson(imageName, layout, plan));
        logger.info("Saved sheet manifest to: {}", path);
    }

    /**
     * Reads a manifest file.
     *
     * @param path the manifest
     * @return the parsed manifest
     * @throws IOException if the file cannot be read or is not a valid manifest
     */
    public SheetManifest read(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses manifest JSON.
     *
     * @param json manifest text
     * @return the parsed manifest
     * @throws IOException if the JSON is malformed or misses required fields
     */
    public SheetManifest parse(String json) throws IOException {
        try {
            JsonObject obj = requireObject(JsonParser.parseString(json), "manifest");

            String version = obj.has("version") ? obj.get("version").getAsString() : VERSION;
            if (!VERSION.equals(version)) {
                logger.warn("Manifest version {} differs from supported version {}", version, VERSION);
            }

            int columns = requireInt(obj, "columns");
            JsonObject layoutObj = obj.has("layout") ? requireObject(obj.get("layout"), "layout") : new JsonObject();
            SheetLayout.Builder layout = SheetLayout.builder().columns(columns);
            if (layoutObj.has("spacing")) {
                layout.spacing(layoutObj.get("spacing").getAsInt());
            }
            if (layoutObj.has("horizontal_alignment")) {
                layout.horizontalAlignment(SheetLayout.HorizontalAlignment.parse(
                        layoutObj.get("horizontal_alignment").getAsString()));
            }
            if (layoutObj.has("vertical_alignment")) {
                layout.verticalAlignment(SheetLayout.VerticalAlignment.parse(
                        layoutObj.get("vertical_alignment").getAsString()));
            }

            List<FramePlacement> frames = new ArrayList<>();
            if (obj.has("frames")) {
                JsonElement framesElement = obj.get("frames");
                if (!framesElement.isJsonArray()) {
                    throw new IOException("Invalid sheet manifest: 'frames' must be an array");
                }
                for (JsonElement e : framesElement.getAsJsonArray()) {
                    JsonObject f = requireObject(e, "frames[]");
                    frames.add(new FramePlacement(
                            requireInt(f, "index"),
                            requireInt(f, "row"),
                            requireInt(f, "col"),
                            requireInt(f, "x"),
                            requireInt(f, "y"),
                            requireInt(f, "width"),
                            requireInt(f, "height")));
                }
            }

            SheetPlan plan = new SheetPlan(
                    requireInt(obj, "width"),
                    requireInt(obj, "height"),
                    requireInt(obj, "cell_width"),
                    requireInt(obj, "cell_height"),
                    columns,
                    requireInt(obj, "rows"),
                    Collections.unmodifiableList(frames));
            String image = obj.has("image") && !obj.get("image").isJsonNull()
                    ? obj.get("image").getAsString() : "";

            return new SheetManifest(image, layout.build(), plan);
        } catch (JsonParseException | IllegalStateException
                 | UnsupportedOperationException | IllegalArgumentException e) {
            throw new IOException("Invalid sheet manifest: " + e.getMessage(), e);
        }
    }

    private static JsonObject requireObject(JsonElement element, String name) throws IOException {
        if (!element.isJsonObject()) {
            throw new IOException("Invalid sheet manifest: '" + name + "' must be an object");
        }
        return element.getAsJsonObject();
    }

    private static int requireInt(JsonObject obj, String key) throws IOException {
        JsonElement value = obj.get(key);
        if (value == null || value.isJsonNull()) {
            throw new IOException("Invalid sheet manifest: missing '" + key + "'");
        }
        return value.getAsInt();
    }

    /**
     * Path of the manifest that sits next to a sheet image: {@code walk.png} gives {@code walk.json}.
     */
    public static Path manifestPathFor(Path imagePath) {
        String name = imagePath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return imagePath.resolveSibling(base + ".json");
    }

    /**
     * A parsed manifest.
     *
     * @param image  sheet image file name
     * @param layout layout the sheet was assembled with
     * @param plan   sheet geometry and frame rectangles
     */
    public record SheetManifest(String image, SheetLayout layout, SheetPlan plan) {
    }
}
