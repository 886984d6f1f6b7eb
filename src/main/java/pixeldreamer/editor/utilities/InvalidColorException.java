package pixeldreamer.editor.utilities;

/**
 * Thrown when a colour string cannot be parsed.
 *
 * @since 0.1.0
 */
public class InvalidColorException extends IllegalArgumentException {

    private final String input;

    public InvalidColorException(String input) {
        super("Invalid colour: '" + input + "' (expected #RRGGBB or #RRGGBBAA)");
        this.input = input;
    }

    /**
     * Returns the string that failed to parse.
     */
    public String getInput() {
        return input;
    }
}
