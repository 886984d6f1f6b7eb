package pixeldreamer.editor.utilities;

import org.junit.jupiter.api.Test;
import pixeldreamer.editor.model.Rgba;

import static org.junit.jupiter.api.Assertions.*;

class ColorParserTest {

    @Test
    void parsesSixDigitHexAsOpaque() {
        assertEquals(new Rgba(0xFF, 0x00, 0xFF, 255), ColorParser.parseHex("#FF00FF"));
        assertEquals(new Rgba(0x12, 0xab, 0xCD, 255), ColorParser.parseHex("12abCD"));
    }

    @Test
    void parsesEightDigitHexWithAlpha() {
        assertEquals(new Rgba(0x10, 0x20, 0x30, 0x40), ColorParser.parseHex("#10203040"));
    }

    @Test
    void rejectsMalformedInput() {
        for (String bad : new String[]{"", "#", "#FFF", "#GGGGGG", "#12345", "#1234567", "red", "# 12345"}) {
            InvalidColorException e = assertThrows(InvalidColorException.class,
                    () -> ColorParser.parseHex(bad), bad);
            assertEquals(bad, e.getInput());
        }
        assertThrows(InvalidColorException.class, () -> ColorParser.parseHex(null));
    }

    @Test
    void rejectsNonAsciiDigits() {
        // Arabic-Indic 123456 and fullwidth FF00FF
        for (String bad : new String[]{"#\u0661\u0662\u0663\u0664\u0665\u0666",
                "\uFF26\uFF26\uFF10\uFF10\uFF26\uFF26"}) {
            assertThrows(InvalidColorException.class, () -> ColorParser.parseHex(bad), bad);
        }
    }

    @Test
    void invalidColorIsAnIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ColorParser.parseHex("nope"));
    }

    @Test
    void formatsHex() {
        assertEquals("#FF00FF", ColorParser.toHex(Rgba.opaque(255, 0, 255)));
        assertEquals("#0A0B0C80", ColorParser.toHex(new Rgba(10, 11, 12, 128)));
    }

    @Test
    void formatThenParseKeepsColor() {
        Rgba color = new Rgba(1, 2, 3, 4);
        assertEquals(color, ColorParser.parseHex(ColorParser.toHex(color)));
    }
}
