package pixeldreamer.editor.utilities;

import org.junit.jupiter.api.Test;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.Rgba;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.model.SheetLayout.HorizontalAlignment;
import pixeldreamer.editor.model.SheetLayout.VerticalAlignment;
import pixeldreamer.editor.utilities.SpriteSheetCompositor.FramePlacement;
import pixeldreamer.editor.utilities.SpriteSheetCompositor.SheetPlan;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpriteSheetCompositorTest {

    private static final Rgba RED = Rgba.opaque(255, 0, 0);
    private static final Rgba GREEN = Rgba.opaque(0, 255, 0);
    private static final Rgba BLUE = Rgba.opaque(0, 0, 255);

    private static SheetLayout layout(int columns, int spacing,
                                      HorizontalAlignment h, VerticalAlignment v) {
        return SheetLayout.builder().columns(columns).spacing(spacing).align(h, v).build();
    }

    @Test
    void canvasSizeForFiveFramesInThreeColumns() {
        List<PixelBuffer> images = List.of(
                PixelBuffer.filled(16, 16, RED),
                PixelBuffer.filled(12, 10, GREEN),
                PixelBuffer.filled(16, 8, BLUE),
                PixelBuffer.filled(8, 16, RED),
                PixelBuffer.filled(4, 4, GREEN));

        PixelBuffer sheet = SpriteSheetCompositor.assemble(images,
                layout(3, 2, HorizontalAlignment.LEFT, VerticalAlignment.TOP));

        assertEquals(52, sheet.width());
        assertEquals(34, sheet.height());
    }

    @Test
    void singleImageIgnoresSpacing() {
        PixelBuffer image = PixelBuffer.filled(10, 10, RED);

        PixelBuffer sheet = SpriteSheetCompositor.assemble(List.of(image),
                layout(4, 5, HorizontalAlignment.CENTER, VerticalAlignment.BOTTOM));

        assertEquals(10, sheet.width());
        assertEquals(10, sheet.height());
        assertEquals(image, sheet);
    }

    @Test
    void centeredFrameIsOffsetByHalfTheSlack() {
        List<PixelBuffer> images = List.of(
                PixelBuffer.filled(16, 16, GREEN),
                PixelBuffer.filled(8, 8, RED));

        SheetPlan plan = SpriteSheetCompositor.plan(images,
                layout(2, 0, HorizontalAlignment.CENTER, VerticalAlignment.CENTER));
        FramePlacement small = plan.frames().get(1);

        assertEquals(16 + 4, small.x());
        assertEquals(4, small.y());
    }

    @Test
    void bottomRightFrameIsOffsetByFullSlack() {
        List<PixelBuffer> images = List.of(
                PixelBuffer.filled(16, 16, GREEN),
                PixelBuffer.filled(8, 8, RED));

        PixelBuffer sheet = SpriteSheetCompositor.assemble(images,
                layout(2, 0, HorizontalAlignment.RIGHT, VerticalAlignment.BOTTOM));

        // second cell starts at x=16, small frame occupies x 24..31, y 8..15
        assertEquals(RED, sheet.get(24, 8));
        assertEquals(RED, sheet.get(31, 15));
        assertEquals(Rgba.TRANSPARENT, sheet.get(23, 15));
        assertEquals(Rgba.TRANSPARENT, sheet.get(24, 7));
    }

    @Test
    void placesFramesRowMajorWithSpacing() {
        List<PixelBuffer> images = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            images.add(PixelBuffer.filled(4, 4, RED));
        }

        SheetPlan plan = SpriteSheetCompositor.plan(images,
                layout(2, 3, HorizontalAlignment.LEFT, VerticalAlignment.TOP));

        assertEquals(2, plan.columns());
        assertEquals(3, plan.rows());
        assertEquals(2 * 4 + 3, plan.width());
        assertEquals(3 * 4 + 2 * 3, plan.height());

        FramePlacement last = plan.frames().get(4);
        assertEquals(2, last.row());
        assertEquals(0, last.col());
        assertEquals(0, last.x());
        assertEquals(2 * (4 + 3), last.y());

        FramePlacement second = plan.frames().get(1);
        assertEquals(4 + 3, second.x());
        assertEquals(0, second.y());
    }

    @Test
    void gapsAndEmptyCellsStayTransparent() {
        List<PixelBuffer> images = List.of(
                PixelBuffer.filled(2, 2, RED),
                PixelBuffer.filled(2, 2, GREEN),
                PixelBuffer.filled(2, 2, BLUE));

        PixelBuffer sheet = SpriteSheetCompositor.assemble(images,
                layout(2, 1, HorizontalAlignment.LEFT, VerticalAlignment.TOP));

        assertEquals(5, sheet.width());
        assertEquals(5, sheet.height());
        assertEquals(Rgba.TRANSPARENT, sheet.get(2, 0), "spacing column");
        assertEquals(Rgba.TRANSPARENT, sheet.get(0, 2), "spacing row");
        assertEquals(Rgba.TRANSPARENT, sheet.get(4, 4), "unused fourth cell");
        assertEquals(GREEN, sheet.get(3, 0));
        assertEquals(BLUE, sheet.get(1, 4));
    }

    @Test
    void copiesAlphaWithoutBlending() {
        Rgba halfRed = new Rgba(255, 0, 0, 128);
        PixelBuffer frame = PixelBuffer.filled(2, 2, halfRed);
        frame.set(1, 1, Rgba.TRANSPARENT);

        PixelBuffer sheet = SpriteSheetCompositor.assemble(
                List.of(frame, PixelBuffer.filled(2, 2, GREEN)),
                layout(2, 0, HorizontalAlignment.LEFT, VerticalAlignment.TOP));

        assertEquals(halfRed, sheet.get(0, 0));
        assertEquals(Rgba.TRANSPARENT, sheet.get(1, 1));
    }

    @Test
    void fewerFramesThanColumnsStillUsesFullWidth() {
        List<PixelBuffer> images = List.of(
                PixelBuffer.filled(3, 3, RED),
                PixelBuffer.filled(3, 3, GREEN));

        PixelBuffer sheet = SpriteSheetCompositor.assemble(images,
                layout(4, 1, HorizontalAlignment.LEFT, VerticalAlignment.TOP));

        assertEquals(4 * 3 + 3, sheet.width());
        assertEquals(3, sheet.height());
    }

    @Test
    void sourcesAreNotModified() {
        PixelBuffer a = PixelBuffer.filled(3, 3, RED);
        PixelBuffer b = PixelBuffer.filled(5, 2, GREEN);
        PixelBuffer aBefore = a.copy();
        PixelBuffer bBefore = b.copy();

        PixelBuffer sheet = SpriteSheetCompositor.assemble(List.of(a, b), SheetLayout.builder().build());
        sheet.set(0, 0, BLUE);

        assertEquals(aBefore, a);
        assertEquals(bBefore, b);
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(EmptyInputException.class,
                () -> SpriteSheetCompositor.assemble(List.of(), SheetLayout.builder().build()));
    }

    @Test
    void oversizedSheetIsRejected() {
        List<PixelBuffer> images = List.of(PixelBuffer.filled(2, 2, RED), PixelBuffer.filled(2, 2, RED));
        SheetLayout wide = SheetLayout.builder().columns(Integer.MAX_VALUE).build();
        SheetLayout spaced = SheetLayout.builder().columns(2).spacing(Integer.MAX_VALUE).build();

        assertThrows(IllegalArgumentException.class, () -> SpriteSheetCompositor.plan(images, wide));
        assertThrows(IllegalArgumentException.class, () -> SpriteSheetCompositor.plan(images, spaced));
    }

    @Test
    void planMustMatchImages() {
        List<PixelBuffer> images = List.of(PixelBuffer.filled(2, 2, RED), PixelBuffer.filled(2, 2, RED));
        SheetPlan plan = SpriteSheetCompositor.plan(images, SheetLayout.builder().build());

        assertThrows(IllegalArgumentException.class,
                () -> SpriteSheetCompositor.assemble(List.of(images.get(0)), plan));
    }
}
