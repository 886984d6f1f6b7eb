package pixeldreamer.editor.utilities;

/**
 * Thrown when a sprite sheet is requested from zero frames.
 *
 * @since 0.1.0
 */
public class EmptyInputException extends IllegalArgumentException {

    public EmptyInputException(String message) {
        super(message);
    }
}
