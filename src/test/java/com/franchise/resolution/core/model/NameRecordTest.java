package com.franchise.resolution.core.model;

import com.franchise.resolution.rules.KeyNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameRecord Tests")
class NameRecordTest {

    @Test
    @DisplayName("Builds a normalized key from raw ids")
    void buildsKey() {
        NameRecord record = NameRecord.of(1, " F1 ", "O1 ", null, null);

        assertTrue(record.isResolvable());
        assertEquals(new ResolutionKey("F1", "O1"), record.key());
        assertFalse(record.hasExistingNames());
    }

    @Test
    @DisplayName("Missing id makes the record unresolvable")
    void missingIdUnresolvable() {
        assertFalse(NameRecord.of(1, null, "O1", null, null).isResolvable());
        assertFalse(NameRecord.of(2, "F1", "  ", null, null).isResolvable());
    }

    @Test
    @DisplayName("Blank persisted names count as absent")
    void blankExistingNames() {
        NameRecord record = NameRecord.of(1, "F1", "O1", "  ", "");

        assertNull(record.existingFranchiseName());
        assertNull(record.existingOutletName());
        assertFalse(record.hasExistingNames());
    }

    @Test
    @DisplayName("Either persisted name enables the fast path")
    void oneExistingName() {
        assertTrue(NameRecord.of(1, "F1", "O1", null, "Beta #3").hasExistingNames());
        assertTrue(NameRecord.of(2, "F1", "O1", "Acme", null).hasExistingNames());
    }

    @Test
    @DisplayName("Uses the supplied normalizer")
    void customNormalizer() {
        NameRecord record = NameRecord.of(1, "F-12", "#34", null, null, KeyNormalizer.digitsOnly());

        assertEquals(new ResolutionKey("12", "34"), record.key());
    }
}
