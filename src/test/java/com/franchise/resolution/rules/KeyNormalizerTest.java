package com.franchise.resolution.rules;

import com.franchise.resolution.core.model.ResolutionKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyNormalizer Tests")
class KeyNormalizerTest {

    @Nested
    @DisplayName("Trimming mode")
    class TrimmingTests {

        private final KeyNormalizer normalizer = KeyNormalizer.trimming();

        @Test
        @DisplayName("Trims surrounding whitespace only")
        void trims() {
            assertEquals("F 1", normalizer.cleanId("  F 1 "));
            assertFalse(normalizer.isDigitsOnly());
        }

        @Test
        @DisplayName("Equal ids after trimming produce equal keys")
        void equalKeys() {
            assertEquals(normalizer.normalize(" 12", "34 "), normalizer.normalize("12", "34"));
        }

        @Test
        @DisplayName("Null or blank id yields no key")
        void blankYieldsEmpty() {
            assertEquals("", normalizer.cleanId(null));
            assertTrue(normalizer.normalize(null, "1").isEmpty());
            assertTrue(normalizer.normalize("1", "   ").isEmpty());
        }
    }

    @Nested
    @DisplayName("Digits-only mode")
    class DigitsOnlyTests {

        private final KeyNormalizer normalizer = KeyNormalizer.digitsOnly();

        @Test
        @DisplayName("Strips every non-digit character")
        void stripsNonDigits() {
            assertEquals("1203", normalizer.cleanId(" FR-12/03 "));
            assertTrue(normalizer.isDigitsOnly());
        }

        @Test
        @DisplayName("Id without digits yields no key")
        void noDigits() {
            assertEquals(Optional.empty(), normalizer.normalize("abc", "12"));
        }

        @Test
        @DisplayName("Normalizes to a key of cleaned ids")
        void normalizes() {
            assertEquals(Optional.of(new ResolutionKey("7", "9")), normalizer.normalize("#7", "outlet 9"));
        }
    }

    @Test
    @DisplayName("of() selects the shared instances")
    void factory() {
        assertSame(KeyNormalizer.digitsOnly(), KeyNormalizer.of(true));
        assertSame(KeyNormalizer.trimming(), KeyNormalizer.of(false));
    }
}
