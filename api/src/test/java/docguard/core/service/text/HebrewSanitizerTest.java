package docguard.core.service.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import docguard.core.config.HebrewSanitizerConfig;
import docguard.core.model.security.ErrorCode;
import docguard.core.model.security.HebrewSecurityException;
import docguard.core.model.text.Script;
import docguard.core.model.text.ScriptPair;

@DisplayName("HebrewSanitizer")
class HebrewSanitizerTest {

    private static final String SHALOM = "\u05E9\u05DC\u05D5\u05DD";
    private static final String CYRILLIC_A = "\u0430";
    private static final String RLO = "\u202E";
    private static final String PDF = "\u202C";
    private static final String ZWSP = "\u200B";
    private static final String ZWJ = "\u200D";

    private final HebrewSanitizer sanitizer = HebrewSanitizer.strict();

    @Nested
    @DisplayName("BiDi controls")
    class BiDiTests {

        @Test
        @DisplayName("should strip override and embedding controls")
        void shouldStripOverrides() {
            assertEquals("invoice.pdf", sanitizer.sanitize("invoice" + RLO + ".pdf" + PDF));
        }

        @ParameterizedTest
        @ValueSource(strings = {"\u202A", "\u202B", "\u202D", "\u2066", "\u2067", "\u2068", "\u2069", "\u200E", "\u200F", "\u061C"})
        @DisplayName("should strip every directional control")
        void shouldStripEveryControl(String control) {
            assertEquals(SHALOM + " abc", sanitizer.sanitize(SHALOM + control + " abc"));
        }

        @Test
        @DisplayName("should keep controls when stripping is disabled")
        void shouldKeepControlsWhenDisabled() {
            var lenient = new HebrewSanitizer(false, true, true, true, HebrewSanitizer.defaultPairs());

            assertEquals("a" + RLO + "b", lenient.sanitize("a" + RLO + "b"));
        }
    }

    @Nested
    @DisplayName("Zero-width characters")
    class ZeroWidthTests {

        @Test
        @DisplayName("should strip zero-width space, joiner and non-joiner")
        void shouldStripZeroWidth() {
            assertEquals("paypal", sanitizer.sanitize("pay" + ZWSP + "p\u200Cal" + ZWJ));
        }

        @Test
        @DisplayName("should keep zero-width characters when stripping is disabled")
        void shouldKeepWhenDisabled() {
            var lenient = new HebrewSanitizer(true, false, true, true, HebrewSanitizer.defaultPairs());

            assertEquals("a" + ZWSP + "b", lenient.sanitize("a" + ZWSP + "b"));
        }
    }

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("should compose combining sequences")
        void shouldComposeToNfc() {
            assertEquals("caf\u00E9", sanitizer.sanitize("cafe\u0301"));
        }

        @Test
        @DisplayName("should leave decomposed text alone when normalization is disabled")
        void shouldSkipWhenDisabled() {
            var raw = new HebrewSanitizer(true, true, false, true, HebrewSanitizer.defaultPairs());

            assertEquals("cafe\u0301", raw.sanitize("cafe\u0301"));
        }

        @Test
        @DisplayName("should return the same instance for clean text")
        void shouldReturnSameInstanceForCleanText() {
            var clean = SHALOM + " world 2024";

            assertSame(clean, sanitizer.sanitize(clean));
        }
    }

    @Nested
    @DisplayName("Homograph detection")
    class HomographTests {

        @Test
        @DisplayName("should reject Latin mixed with Cyrillic")
        void shouldRejectLatinCyrillic() {
            var e = assertThrows(HebrewSecurityException.class, () -> sanitizer.sanitize("p" + CYRILLIC_A + "ypal"));

            assertEquals(ErrorCode.HOMOGRAPH_ATTACK, e.code());
            assertEquals("Homograph attack detected: mixed scripts (Latin, Cyrillic)", e.getMessage());
            assertEquals(List.of(Script.LATIN, Script.CYRILLIC), e.detectedScripts());
        }

        @Test
        @DisplayName("should reject Hebrew mixed with Cyrillic")
        void shouldRejectHebrewCyrillic() {
            var e = assertThrows(HebrewSecurityException.class, () -> sanitizer.sanitize(SHALOM + " " + CYRILLIC_A));

            assertEquals(List.of(Script.HEBREW, Script.CYRILLIC), e.detectedScripts());
        }

        @Test
        @DisplayName("should list digits out of the reported scripts")
        void shouldOmitDigitsFromReport() {
            var e = assertThrows(HebrewSecurityException.class, () -> sanitizer.sanitize("42 p" + CYRILLIC_A + "y"));

            assertEquals(List.of(Script.LATIN, Script.CYRILLIC), e.detectedScripts());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "\u05D7\u05E9\u05D1\u05D5\u05E0\u05D9\u05EA 123 Invoice",
            "Order #4512, total: $30.00",
            "\u041F\u0440\u0438\u0432\u0435\u0442 123",
            "\u05E9\u05DC\u05D5\u05DD!"
        })
        @DisplayName("should allow single-script and Hebrew-Latin text")
        void shouldAllowLegitimateText(String text) {
            assertEquals(text, sanitizer.sanitize(text));
        }

        @Test
        @DisplayName("should detect mixing hidden behind a zero-width joiner")
        void shouldDetectAfterStripping() {
            assertThrows(HebrewSecurityException.class, () -> sanitizer.sanitize("p" + ZWJ + CYRILLIC_A));
        }

        @Test
        @DisplayName("should allow mixed scripts when detection is disabled")
        void shouldAllowWhenDisabled() {
            var lenient = new HebrewSanitizer(true, true, true, false, HebrewSanitizer.defaultPairs());

            assertEquals("p" + CYRILLIC_A, lenient.sanitize("p" + CYRILLIC_A));
        }

        @Test
        @DisplayName("should honor custom suspicious pairs")
        void shouldHonorCustomPairs() {
            var custom = new HebrewSanitizer(true, true, true, true, List.of(ScriptPair.parse("LATIN+HEBREW")));

            assertThrows(HebrewSecurityException.class, () -> custom.sanitize(SHALOM + " abc"));
            assertEquals("p" + CYRILLIC_A, custom.sanitize("p" + CYRILLIC_A));
        }
    }

    @Nested
    @DisplayName("General behaviour")
    class GeneralTests {

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            var once = sanitizer.sanitize(RLO + SHALOM + ZWSP + " cafe\u0301 " + "\u2067abc\u2069");

            assertEquals(once, sanitizer.sanitize(once));
        }

        @Test
        @DisplayName("should pass null and empty strings through")
        void shouldPassNullAndEmpty() {
            assertEquals(null, sanitizer.sanitize(null));
            assertEquals("", sanitizer.sanitize(""));
        }

        @Test
        @DisplayName("sanitizeBatch should keep order and stop at the first rejection")
        void sanitizeBatchShouldKeepOrder() {
            assertEquals(List.of("a", "b"), sanitizer.sanitizeBatch(List.of("a" + ZWSP, RLO + "b")));
            assertThrows(
                    HebrewSecurityException.class,
                    () -> sanitizer.sanitizeBatch(List.of("ok", "p" + CYRILLIC_A, "never")));
        }

        @Test
        @DisplayName("detectScripts should report scripts in order of first occurrence")
        void detectScriptsShouldKeepOrder() {
            var scripts = sanitizer.detectScripts("abc " + SHALOM + " 12");

            assertEquals(List.of(Script.LATIN, Script.HEBREW, Script.DIGIT), List.copyOf(scripts));
        }

        @Test
        @DisplayName("should build from configuration")
        void shouldBuildFromConfig() {
            var configured = new HebrewSanitizer(new TestHebrewSanitizerConfig(List.of("hebrew+cyrillic")));

            assertEquals("p" + CYRILLIC_A, configured.sanitize("p" + CYRILLIC_A));
            assertThrows(HebrewSecurityException.class, () -> configured.sanitize(SHALOM + CYRILLIC_A));
        }

        @Test
        @DisplayName("should fail fast on unknown script names")
        void shouldRejectUnknownScript() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new HebrewSanitizer(new TestHebrewSanitizerConfig(List.of("LATIN+KLINGON"))));
        }
    }

    private record TestHebrewSanitizerConfig(List<String> suspiciousScriptPairs) implements HebrewSanitizerConfig {

        @Override
        public boolean removeBidi() {
            return true;
        }

        @Override
        public boolean removeZeroWidth() {
            return true;
        }

        @Override
        public boolean normalizeUnicode() {
            return true;
        }

        @Override
        public boolean detectHomographs() {
            return true;
        }

        @Override
        public List<String> suspiciousScriptPairs() {
            return suspiciousScriptPairs;
        }
    }
}
