package com.energyforecast.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeedSequenceTest {

    @Test
    void testDerivationIsDeterministic() {
        assertEquals(SeedSequence.derive(42L, "AEP"), SeedSequence.derive(42L, "AEP"));
    }

    @Test
    void testDifferentKeysAndSeedsGiveDifferentSeeds() {
        assertNotEquals(SeedSequence.derive(42L, "AEP"), SeedSequence.derive(42L, "COMED"));
        assertNotEquals(SeedSequence.derive(42L, "AEP"), SeedSequence.derive(43L, "AEP"));
    }
}
