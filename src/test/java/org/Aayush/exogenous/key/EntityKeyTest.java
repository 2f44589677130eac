package org.Aayush.exogenous.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("EntityKey Tests")
class EntityKeyTest {

    @Test
    @DisplayName("Fine key truncates to its country prefix")
    void testCoarseOfFineKey() {
        assertEquals("ZWE", EntityKey.coarse("ZWE.2.2"));
        assertEquals("ZWE", EntityKey.coarse("ZWE"));
    }

    @Test
    @DisplayName("Keys shorter than the coarse length are rejected")
    void testShortKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> EntityKey.coarse("ZW"));
        assertThrows(NullPointerException.class, () -> EntityKey.coarse(null));
    }

    @Test
    @DisplayName("Only keys of at least coarse length carry a coarse prefix")
    void testHasCoarsePrefix() {
        assertTrue(EntityKey.hasCoarsePrefix("USA"));
        assertTrue(EntityKey.hasCoarsePrefix("USA.1"));
        assertFalse(EntityKey.hasCoarsePrefix("US"));
        assertFalse(EntityKey.hasCoarsePrefix(null));
    }
}
