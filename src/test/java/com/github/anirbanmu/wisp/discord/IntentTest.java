package com.github.anirbanmu.wisp.discord;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class IntentTest {

    @Test
    void valuesAreBitFlags() {
        assertEquals(1, Intent.GUILDS.value());
        assertEquals(512, Intent.GUILD_MESSAGES.value());
        assertEquals(1 << 15, Intent.MESSAGE_CONTENT.value());
        assertEquals(513, Intent.mask(List.of(Intent.GUILDS, Intent.GUILD_MESSAGES)));
    }

    @Test
    void defaultsLeaveOutPrivilegedIntents() {
        int defaults = Intent.defaults();

        assertEquals(0, defaults & Intent.GUILD_MEMBERS.value());
        assertEquals(0, defaults & Intent.GUILD_PRESENCES.value());
        assertEquals(0, defaults & Intent.MESSAGE_CONTENT.value());
        assertNotEquals(0, defaults & Intent.GUILDS.value());
        assertEquals(Intent.all(), defaults | Intent.GUILD_MEMBERS.value() | Intent.GUILD_PRESENCES.value()
            | Intent.MESSAGE_CONTENT.value());
    }

    @Test
    void fromStringIgnoresCase() {
        assertEquals(Intent.DIRECT_MESSAGES, Intent.fromString(" direct_messages "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Intent.fromString("GUILD_PIZZA"));
        assertEquals("Unknown intent: GUILD_PIZZA", e.getMessage());
    }
}
