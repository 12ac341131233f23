package ai.p8ls.analyzer.lexer;

import java.util.Set;

/**
 * Non-ASCII characters PICO-8 accepts inside identifiers. These are the P8SCII glyphs as they appear in {@code .p8}
 * files (button constants such as {@code ⬅️} and {@code ❎} among them), the kana block, and the emoji variation
 * selector that editors append to some glyphs.
 */
final class Glyphs {
    private static final Set<Integer> SYMBOLS = Set.of(
            0x2588, 0x2592, 0x1F431, 0x2B07, 0x2591, 0x273D, 0x25CF, 0x2665, 0x2609, 0xC6C3, 0x2302, 0x2B05,
            0x1F610, 0x266A, 0x1F17E, 0x25C6, 0x2026, 0x27A1, 0x2605, 0x29D7, 0x2B06, 0x02C7, 0x2227, 0x274E,
            0x25A4, 0x25A5, 0x25AE, 0x25A0, 0x25A1, 0x2059, 0x2058, 0x2016, 0x25C0, 0x25B6, 0x300C, 0x300D,
            0x00A5, 0x2022, 0x3001, 0x3002, 0x00B9, 0x00B2, 0x00B3, 0x2074, 0x2075, 0x2076, 0x2077, 0x2078,
            0x2079);

    private static final int VARIATION_SELECTOR = 0xFE0F;

    private Glyphs() {}

    static boolean isGlyph(int cp) {
        if (cp < 0x80) {
            return false;
        }
        if (cp >= 0x3040 && cp <= 0x30FF) {
            return true;
        }
        return cp == VARIATION_SELECTOR || SYMBOLS.contains(cp);
    }
}
