package warden.core.model.credential;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExpiryPolicy")
class ExpiryPolicyTest {

    private static final Instant ISSUED = Instant.parse("2024-02-29T08:30:00Z");

    @Nested
    @DisplayName("fromCode")
    class FromCodeTests {

        @Test
        @DisplayName("should resolve known codes")
        void shouldResolveKnownCodes() {
            assertEquals(ExpiryPolicy.NEVER, ExpiryPolicy.fromCode("never"));
            assertEquals(ExpiryPolicy.SEVEN_DAYS, ExpiryPolicy.fromCode("7d"));
            assertEquals(ExpiryPolicy.THIRTY_DAYS, ExpiryPolicy.fromCode("30d"));
            assertEquals(ExpiryPolicy.NINETY_DAYS, ExpiryPolicy.fromCode("90D"));
            assertEquals(ExpiryPolicy.ONE_YEAR, ExpiryPolicy.fromCode(" 1y "));
        }

        @Test
        @DisplayName("should treat null or blank as never")
        void shouldTreatBlankAsNever() {
            assertEquals(ExpiryPolicy.NEVER, ExpiryPolicy.fromCode(null));
            assertEquals(ExpiryPolicy.NEVER, ExpiryPolicy.fromCode(""));
        }

        @Test
        @DisplayName("should fall back to 30 days for unknown codes")
        void shouldFallBackToThirtyDays() {
            assertEquals(ExpiryPolicy.THIRTY_DAYS, ExpiryPolicy.fromCode("2w"));
        }
    }

    @Nested
    @DisplayName("expiresAt")
    class ExpiresAtTests {

        @Test
        @DisplayName("should add whole days")
        void shouldAddDays() {
            assertEquals(Instant.parse("2024-03-07T08:30:00Z"), ExpiryPolicy.SEVEN_DAYS.expiresAt(ISSUED));
            assertEquals(Instant.parse("2024-05-29T08:30:00Z"), ExpiryPolicy.NINETY_DAYS.expiresAt(ISSUED));
        }

        @Test
        @DisplayName("should add one calendar year in UTC")
        void shouldAddCalendarYear() {
            assertEquals(Instant.parse("2025-02-28T08:30:00Z"), ExpiryPolicy.ONE_YEAR.expiresAt(ISSUED));
        }

        @Test
        @DisplayName("should return null for never")
        void shouldReturnNullForNever() {
            assertNull(ExpiryPolicy.NEVER.expiresAt(ISSUED));
        }
    }

    @Test
    @DisplayName("credential should expire strictly after its expiry instant")
    void credentialExpiryIsStrict() {
        final var expiresAt = ExpiryPolicy.SEVEN_DAYS.expiresAt(ISSUED);
        final var credential = Credential.builder("id-1", "hash")
                .userId("user-1")
                .createdAt(ISSUED)
                .expiresAt(expiresAt)
                .build();

        assertFalse(credential.isExpiredAt(expiresAt));
        assertTrue(credential.isExpiredAt(expiresAt.plusMillis(1)));
        assertEquals("id-1", credential.name());
    }
}
