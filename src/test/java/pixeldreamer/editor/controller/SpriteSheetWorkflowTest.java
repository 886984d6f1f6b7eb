package pixeldreamer.editor.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.Rgba;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.model.SheetLayout.HorizontalAlignment;
import pixeldreamer.editor.model.SheetLayout.VerticalAlignment;
import pixeldreamer.editor.service.ImageCodec;
import pixeldreamer.editor.service.SheetManifestStore;
import pixeldreamer.editor.utilities.EmptyInputException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpriteSheetWorkflowTest {

    private static final Rgba RED = Rgba.opaque(255, 0, 0);
    private static final Rgba GREEN = Rgba.opaque(0, 255, 0);
    private static final Rgba BLUE = Rgba.opaque(0, 0, 255);

    @Test
    void startsWithDefaultLayout() {
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow();

        assertTrue(workflow.isEmpty());
        assertNotNull(workflow.getLayout());
    }

    @Test
    void removingFrameKeepsOrderOfTheRest() {
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow();
        PixelBuffer red = PixelBuffer.filled(2, 2, RED);
        PixelBuffer green = PixelBuffer.filled(2, 2, GREEN);
        PixelBuffer blue = PixelBuffer.filled(2, 2, BLUE);
        workflow.addAll(List.of(red, green, blue));

        assertSame(green, workflow.remove(1));

        assertEquals(List.of(red, blue), workflow.getFrames());
        assertThrows(UnsupportedOperationException.class, () -> workflow.getFrames().clear());
        assertThrows(IndexOutOfBoundsException.class, () -> workflow.remove(5));
    }

    @Test
    void assemblesFramesInInsertionOrder() {
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow();
        workflow.setLayout(SheetLayout.builder().columns(3)
                .align(HorizontalAlignment.LEFT, VerticalAlignment.TOP).build());
        workflow.add(PixelBuffer.filled(2, 2, RED));
        workflow.add(PixelBuffer.filled(2, 2, GREEN));
        workflow.add(PixelBuffer.filled(2, 2, BLUE));

        PixelBuffer sheet = workflow.assemble();

        assertEquals(6, sheet.width());
        assertEquals(2, sheet.height());
        assertEquals(RED, sheet.get(0, 0));
        assertEquals(GREEN, sheet.get(2, 0));
        assertEquals(BLUE, sheet.get(5, 1));
    }

    @Test
    void emptyWorkflowCannotAssemble() {
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow();
        workflow.add(PixelBuffer.filled(1, 1, RED));
        workflow.clear();

        assertThrows(EmptyInputException.class, workflow::assemble);
    }

    @Test
    void exportWritesSheetAndManifest(@TempDir Path dir) throws IOException {
        ImageCodec codec = new ImageCodec();
        SheetManifestStore store = new SheetManifestStore();
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow(codec, store);
        workflow.setLayout(SheetLayout.builder().columns(2).spacing(1).build());
        workflow.add(PixelBuffer.filled(4, 4, RED));
        workflow.add(PixelBuffer.filled(2, 2, GREEN));
        Path png = dir.resolve("walk.png");

        PixelBuffer sheet = workflow.export(png);

        assertEquals(9, sheet.width());
        assertEquals(sheet, codec.read(png));
        Path json = dir.resolve("walk.json");
        assertTrue(Files.exists(json));
        SheetManifestStore.SheetManifest manifest = store.read(json);
        assertEquals("walk.png", manifest.image());
        assertEquals(workflow.plan(), manifest.plan());
    }

    @Test
    void failedManifestRemovesSheetImage(@TempDir Path dir) throws IOException {
        SpriteSheetWorkflow workflow = new SpriteSheetWorkflow();
        workflow.add(PixelBuffer.filled(2, 2, RED));
        // a directory where the manifest should go makes the manifest write fail
        Files.createDirectory(dir.resolve("walk.json"));
        Path png = dir.resolve("walk.png");

        assertThrows(IOException.class, () -> workflow.export(png));

        assertFalse(Files.exists(png));
    }
}
