package pixeldreamer.editor.service;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.Rgba;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.model.SheetLayout.HorizontalAlignment;
import pixeldreamer.editor.model.SheetLayout.VerticalAlignment;
import pixeldreamer.editor.service.SheetManifestStore.SheetManifest;
import pixeldreamer.editor.utilities.SpriteSheetCompositor;
import pixeldreamer.editor.utilities.SpriteSheetCompositor.SheetPlan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SheetManifestStoreTest {

    private final SheetManifestStore store = new SheetManifestStore();

    private final SheetLayout layout = SheetLayout.builder()
            .columns(3)
            .spacing(2)
            .align(HorizontalAlignment.RIGHT, VerticalAlignment.CENTER)
            .build();

    private SheetPlan plan() {
        return SpriteSheetCompositor.plan(List.of(
                PixelBuffer.filled(16, 16, Rgba.WHITE),
                PixelBuffer.filled(8, 8, Rgba.WHITE),
                PixelBuffer.filled(16, 12, Rgba.WHITE),
                PixelBuffer.filled(10, 16, Rgba.WHITE)), layout);
    }

    @Test
    void jsonDescribesSheetAndFrames() {
        JsonObject obj = JsonParser.parseString(store.toJson("walk.png", layout, plan())).getAsJsonObject();

        assertEquals("1.0", obj.get("version").getAsString());
        assertEquals("walk.png", obj.get("image").getAsString());
        assertEquals(52, obj.get("width").getAsInt());
        assertEquals(34, obj.get("height").getAsInt());
        assertEquals(16, obj.get("cell_width").getAsInt());
        assertEquals(2, obj.get("rows").getAsInt());
        assertEquals("RIGHT", obj.getAsJsonObject("layout").get("horizontal_alignment").getAsString());

        JsonObject second = obj.getAsJsonArray("frames").get(1).getAsJsonObject();
        assertEquals(18 + 8, second.get("x").getAsInt());
        assertEquals(4, second.get("y").getAsInt());
        assertEquals(8, second.get("width").getAsInt());
    }

    @Test
    void writtenManifestReadsBack(@TempDir Path dir) throws IOException {
        Path path = dir.resolve("walk.json");
        SheetPlan plan = plan();

        store.write(path, "walk.png", layout, plan);
        SheetManifest manifest = store.read(path);

        assertEquals("walk.png", manifest.image());
        assertEquals(layout, manifest.layout());
        assertEquals(plan, manifest.plan());
    }

    @Test
    void missingFieldsAreReported() {
        IOException e = assertThrows(IOException.class, () -> store.parse("{\"columns\": 2}"));
        assertTrue(e.getMessage().contains("width"), e.getMessage());

        assertThrows(IOException.class, () -> store.parse("not json"));
        assertThrows(IOException.class, () -> store.parse("[1, 2]"));
    }

    @Test
    void wronglyTypedSectionsAreReported() {
        String fields = "\"columns\": 2, \"rows\": 1, \"width\": 1, \"height\": 1,"
                + " \"cell_width\": 1, \"cell_height\": 1";

        IOException layout = assertThrows(IOException.class, () -> store.parse("{" + fields + ", \"layout\": 5}"));
        assertTrue(layout.getMessage().contains("layout"), layout.getMessage());
        IOException frames = assertThrows(IOException.class,
                () -> store.parse("{" + fields + ", \"frames\": {\"x\": 0}}"));
        assertTrue(frames.getMessage().contains("frames"), frames.getMessage());
        assertThrows(IOException.class, () -> store.parse("{" + fields + ", \"frames\": [3]}"));
    }

    @Test
    void invalidLayoutIsReported() {
        String json = "{\"columns\": 0, \"rows\": 1, \"width\": 1, \"height\": 1,"
                + " \"cell_width\": 1, \"cell_height\": 1}";
        assertThrows(IOException.class, () -> store.parse(json));
    }

    @Test
    void manifestSitsNextToImage() {
        Path image = Path.of("out", "sheets", "walk.png");
        assertEquals(Path.of("out", "sheets", "walk.json"), SheetManifestStore.manifestPathFor(image));
        assertEquals(Path.of("noext.json"), SheetManifestStore.manifestPathFor(Path.of("noext")));
    }
}
