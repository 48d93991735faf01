package warden.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Nested
    @DisplayName("sha256Hex")
    class Sha256HexTests {

        @Test
        @DisplayName("should produce known digest for known input")
        void shouldProduceKnownDigest() {
            assertEquals(
                    "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", SecureHash.sha256Hex("hello"));
        }

        @Test
        @DisplayName("should change completely when one character changes")
        void shouldChangeWhenOneCharacterChanges() {
            final var original = SecureHash.sha256Hex("ak_test_abcdefghijklmnop");
            final var mutated = SecureHash.sha256Hex("ak_test_abcdefghijklmnoq");

            assertNotEquals(original, mutated);
            assertEquals(64, mutated.length());
        }
    }

    @Nested
    @DisplayName("truncatedSha256")
    class TruncatedSha256Tests {

        @Test
        @DisplayName("should truncate to specified length")
        void shouldTruncateToSpecifiedLength() {
            assertEquals(8, SecureHash.truncatedSha256("test-input", 8).length());
            assertEquals(64, SecureHash.truncatedSha256("test-input", 64).length());
            assertEquals("2cf24dba", SecureHash.truncatedSha256("hello", 8));
        }

        @Test
        @DisplayName("should reject out-of-range lengths")
        void shouldRejectOutOfRangeLengths() {
            assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("test-input", 65));
            assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("test-input", 0));
        }

        @Test
        @DisplayName("should produce valid hex string")
        void shouldProduceValidHexString() {
            assertTrue(SecureHash.truncatedSha256("", 16).matches("^[0-9a-f]{16}$"));
        }
    }

    @Nested
    @DisplayName("constantTimeEquals")
    class ConstantTimeEqualsTests {

        @Test
        @DisplayName("should match identical strings")
        void shouldMatchIdenticalStrings() {
            assertTrue(SecureHash.constantTimeEquals("a1b2c3", "a1b2c3"));
        }

        @Test
        @DisplayName("should reject strings differing in one character or length")
        void shouldRejectDifferentStrings() {
            assertFalse(SecureHash.constantTimeEquals("a1b2c3", "a1b2c4"));
            assertFalse(SecureHash.constantTimeEquals("a1b2c3", "a1b2c"));
        }

        @Test
        @DisplayName("should never match null")
        void shouldNeverMatchNull() {
            assertFalse(SecureHash.constantTimeEquals(null, "x"));
            assertFalse(SecureHash.constantTimeEquals("x", null));
            assertFalse(SecureHash.constantTimeEquals(null, null));
        }
    }
}
