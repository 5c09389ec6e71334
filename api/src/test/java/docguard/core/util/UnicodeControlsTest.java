package docguard.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UnicodeControls")
class UnicodeControlsTest {

    @Test
    @DisplayName("should classify directional controls")
    void shouldClassifyBiDi() {
        assertTrue(UnicodeControls.isBiDiControl('\u202E'));
        assertTrue(UnicodeControls.isBiDiControl('\u2066'));
        assertTrue(UnicodeControls.isBiDiControl('\u061C'));
        assertFalse(UnicodeControls.isBiDiControl('\u200B'));
        assertFalse(UnicodeControls.isBiDiControl('a'));
    }

    @Test
    @DisplayName("should classify zero-width characters")
    void shouldClassifyZeroWidth() {
        assertTrue(UnicodeControls.isZeroWidth('\u200B'));
        assertTrue(UnicodeControls.isZeroWidth('\u200D'));
        assertFalse(UnicodeControls.isZeroWidth('\u200E'));
    }

    @Test
    @DisplayName("should strip only the requested classes")
    void shouldStripRequestedClasses() {
        final var text = "a\u202Eb\u200Bc";

        assertEquals("ab\u200Bc", UnicodeControls.strip(text, true, false));
        assertEquals("a\u202Ebc", UnicodeControls.strip(text, false, true));
        assertEquals("abc", UnicodeControls.strip(text, true, true));
    }

    @Test
    @DisplayName("should return the input instance when nothing is removed")
    void shouldReturnSameInstance() {
        final var text = "plain text";

        assertSame(text, UnicodeControls.strip(text, true, true));
    }

    @Test
    @DisplayName("should detect presence of controls")
    void shouldDetectPresence() {
        assertTrue(UnicodeControls.containsBiDi("x\u200Fy"));
        assertFalse(UnicodeControls.containsBiDi("x\u200By"));
        assertTrue(UnicodeControls.containsZeroWidth("x\u200Cy"));
        assertFalse(UnicodeControls.containsZeroWidth("xy"));
    }
}
