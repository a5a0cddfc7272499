package com.lunarview.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PasswordHasherTest {

    // full-strength iterations only where the default itself is under test
    private final PasswordHasher hasher = new PasswordHasher(1_000);

    @Test
    public void hashIsDeterministicHex() {
        String first = hasher.hash("AB12", "123456789");
        String second = hasher.hash("AB12", "123456789");

        assertEquals(first, second);
        assertEquals(128, first.length());
        assertTrue(first.matches("[0-9a-f]+"));
    }

    @Test
    public void connectionIdSaltsTheHash() {
        assertNotEquals(hasher.hash("AB12", "123456789"), hasher.hash("AB12", "987654321"));
    }

    @Test
    public void matchesOnlyTheRightPassword() {
        String stored = hasher.hash("AB12", "123456789");

        assertTrue(hasher.matches("AB12", "123456789", stored));
        assertFalse(hasher.matches("WRONG", "123456789", stored));
        assertFalse(hasher.matches("ab12", "123456789", stored));
        assertFalse(hasher.matches(null, "123456789", stored));
        assertFalse(hasher.matches("AB12", "123456789", null));
    }

    @Test
    public void emptyPasswordHashesToEmpty() {
        assertEquals("", hasher.hash("", "123456789"));
        assertTrue(hasher.matches("", "123456789", ""));
        assertFalse(hasher.matches("x", "123456789", ""));
    }

    @Test
    public void defaultStrengthDiffersFromReducedStrength() {
        assertNotEquals(new PasswordHasher().hash("AB12", "1"), hasher.hash("AB12", "1"));
    }

    @Test
    public void rejectsNonPositiveIterations() {
        assertThrows(IllegalArgumentException.class, () -> new PasswordHasher(0));
    }
}
