package pixeldreamer.editor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pixeldreamer.editor.model.PixelBuffer;
import pixeldreamer.editor.model.SheetLayout;
import pixeldreamer.editor.preferences.EditorPreferences;
import pixeldreamer.editor.service.ImageCodec;
import pixeldreamer.editor.service.SheetManifestStore;
import pixeldreamer.editor.utilities.SpriteSheetCompositor;
import pixeldreamer.editor.utilities.SpriteSheetCompositor.SheetPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects frames for a sprite sheet and assembles or exports them.
 * <p>
 * Frames keep the order they were added in, which is their order on the sheet.
 * The workflow stores references to the caller's buffers; they are read when
 * the sheet is assembled and never modified. Not thread-safe.
 *
 * @since 0.1.0
 */
public class SpriteSheetWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(SpriteSheetWorkflow.class);

    private final List<PixelBuffer> frames = new ArrayList<>();
    private final ImageCodec codec;
    private final SheetManifestStore manifestStore;
    private SheetLayout layout;

    public SpriteSheetWorkflow() {
        this(new ImageCodec(), new SheetManifestStore());
    }

    public SpriteSheetWorkflow(ImageCodec codec, SheetManifestStore manifestStore) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.manifestStore = Objects.requireNonNull(manifestStore, "manifestStore");
        this.layout = EditorPreferences.getDefaultSheetLayout();
    }

    public void add(PixelBuffer frame) {
        frames.add(Objects.requireNonNull(frame, "frame"));
    }

    public void addAll(Collection<PixelBuffer> newFrames) {
        for (PixelBuffer frame : newFrames) {
            add(frame);
        }
    }

    /**
     * Removes the frame at {@code index}; later frames move up one place.
     *
     * @return the removed frame
     * @throws IndexOutOfBoundsException if there is no frame at {@code index}
     */
    public PixelBuffer remove(int index) {
        return frames.remove(index);
    }

    public void clear() {
        frames.clear();
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * Returns the frames in sheet order, as an unmodifiable view.
     */
    public List<PixelBuffer> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public SheetLayout getLayout() {
        return layout;
    }

    public void setLayout(SheetLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * Computes the sheet geometry for the current frames and layout.
     *
     * @throws pixeldreamer.editor.utilities.EmptyInputException if no frames were added
     */
    public SheetPlan plan() {
        return SpriteSheetCompositor.plan(frames, layout);
    }

    /**
     * Assembles the current frames into a new sheet.
     *
     * @return a new buffer independent of the frames
     * @throws pixeldreamer.editor.utilities.EmptyInputException if no frames were added
     */
    public PixelBuffer assemble() {
        PixelBuffer sheet = SpriteSheetCompositor.assemble(frames, layout);
        logger.info("Assembled {} frames into {}x{} sheet ({})",
                frames.size(), sheet.width(), sheet.height(), layout);
        return sheet;
    }

    /**
     * Assembles the sheet and writes it as PNG, with a JSON manifest next to it
     * ({@code walk.png} gets {@code walk.json}). If the manifest cannot be
     * written the image is deleted again.
     *
     * @param pngPath where to write the sheet image
     * @return the assembled sheet
     * @throws IOException if writing either file fails
     * @throws pixeldreamer.editor.utilities.EmptyInputException if no frames were added
     */
    public PixelBuffer export(Path pngPath) throws IOException {
        SheetPlan plan = plan();
        PixelBuffer sheet = SpriteSheetCompositor.assemble(frames, plan);

        codec.writePng(sheet, pngPath);
        Path manifestPath = SheetManifestStore.manifestPathFor(pngPath);
        try {
            manifestStore.write(manifestPath, pngPath.getFileName().toString(), layout, plan);
        } catch (IOException e) {
            // A sheet is only exported together with its manifest
            logger.error("Failed to write manifest {}, removing {}", manifestPath, pngPath);
            try {
                Files.deleteIfExists(pngPath);
            } catch (IOException deleteError) {
                e.addSuppressed(deleteError);
            }
            throw e;
        }

        logger.info("Exported sprite sheet with {} frames to {}", frames.size(), pngPath);
        return sheet;
    }
}
